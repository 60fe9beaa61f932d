package org.humanscript.parser;

import org.humanscript.lexer.Token;
import org.humanscript.util.CompilationException;

public class ParseException extends CompilationException
{
	private final String expected;
	private final Token actual;

	public ParseException(String message, String expected, Token actual)
	{
		super(Phase.SYNTAX, message, actual.getLine());
		this.expected = expected;
		this.actual = actual;
	}

	public String getExpected()
	{
		return expected;
	}

	public Token getActual()
	{
		return actual;
	}
}
