package org.humanscript.lexer;

import org.humanscript.util.CompilationException;

public class LexerException extends CompilationException
{
	private final String offendingText;

	public LexerException(String message, String offendingText, int line)
	{
		super(Phase.LEXICAL, message, line);
		this.offendingText = offendingText;
	}

	public String getOffendingText()
	{
		return offendingText;
	}
}
