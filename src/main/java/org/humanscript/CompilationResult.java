package org.humanscript;

import org.humanscript.ast.Program;
import org.humanscript.lexer.Token;
import org.humanscript.semantic.TypeAnnotations;
import org.humanscript.semantic.symbol.SymbolTable;

import java.util.List;

/**
 * Everything one compilation produced. {@code cppCode} is null for a check-only run.
 */
public final class CompilationResult
{
	private final List<Token> tokens;
	private final Program program;
	private final TypeAnnotations annotations;
	private final SymbolTable symbolTable;
	private final String cppCode;

	CompilationResult(List<Token> tokens, Program program, TypeAnnotations annotations, SymbolTable symbolTable, String cppCode)
	{
		this.tokens = tokens;
		this.program = program;
		this.annotations = annotations;
		this.symbolTable = symbolTable;
		this.cppCode = cppCode;
	}

	public List<Token> getTokens()
	{
		return tokens;
	}

	public Program getProgram()
	{
		return program;
	}

	public TypeAnnotations getAnnotations()
	{
		return annotations;
	}

	public SymbolTable getSymbolTable()
	{
		return symbolTable;
	}

	public String getCppCode()
	{
		return cppCode;
	}

	public boolean hasCode()
	{
		return cppCode != null;
	}
}
