package org.humanscript.ast;

import java.util.List;

public final class Program
{
	private final List<UseDeclaration> useDeclarations;
	private final List<Statement> statements;

	public Program(List<UseDeclaration> useDeclarations, List<Statement> statements)
	{
		this.useDeclarations = List.copyOf(useDeclarations);
		this.statements = List.copyOf(statements);
	}

	public List<UseDeclaration> getUseDeclarations()
	{
		return useDeclarations;
	}

	public List<Statement> getStatements()
	{
		return statements;
	}

	public boolean isEmpty()
	{
		return useDeclarations.isEmpty() && statements.isEmpty();
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		for (UseDeclaration use : useDeclarations)
		{
			sb.append(use).append('\n');
		}
		for (Statement statement : statements)
		{
			sb.append(statement).append('\n');
		}
		return sb.toString();
	}
}
