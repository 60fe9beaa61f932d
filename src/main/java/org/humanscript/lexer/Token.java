package org.humanscript.lexer;

/**
 * A classified lexeme. {@code text} is the exact slice of source the token was read from;
 * {@code literal} holds the decoded value for literal tokens ({@link Integer}, {@link Long},
 * {@link Double}, {@link String} or {@link Boolean}) and is null otherwise.
 */
public final class Token
{
	private final TokenType type;
	private final String text;
	private final Object literal;
	private final int line;

	public Token(TokenType type, String text, Object literal, int line)
	{
		this.type = type;
		this.text = text;
		this.literal = literal;
		this.line = line;
	}

	public Token(TokenType type, String text, int line)
	{
		this(type, text, null, line);
	}

	public TokenType getType()
	{
		return type;
	}

	public String getText()
	{
		return text;
	}

	public Object getLiteral()
	{
		return literal;
	}

	public boolean hasLiteral()
	{
		return literal != null;
	}

	public int getLine()
	{
		return line;
	}

	/**
	 * Human readable form used in diagnostics, e.g. {@code IDENTIFIER 'x'} or {@code END_OF_FILE}.
	 */
	public String describe()
	{
		if (text == null || text.isEmpty())
		{
			return type.name();
		}
		return type.name() + " '" + text + "'";
	}

	@Override
	public String toString()
	{
		return type + " " + text + (literal != null ? " " + literal : "");
	}
}
