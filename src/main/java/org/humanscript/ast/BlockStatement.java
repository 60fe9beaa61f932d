package org.humanscript.ast;

import java.util.List;

/**
 * A braced statement list. Blocks group statements only; they do not open a scope.
 */
public final class BlockStatement extends Statement
{
	private final List<Statement> statements;

	public BlockStatement(List<Statement> statements, int line)
	{
		super(line);
		this.statements = List.copyOf(statements);
	}

	public List<Statement> getStatements()
	{
		return statements;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitBlockStatement(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("{\n");
		for (Statement statement : statements)
		{
			sb.append("  ").append(statement).append('\n');
		}
		return sb.append('}').toString();
	}
}
