package org.humanscript.ast;

import org.humanscript.lexer.TokenType;

public enum BinaryOperator
{
	PLUS("+"),
	EQUALS("?=");

	private final String symbol;

	BinaryOperator(String symbol)
	{
		this.symbol = symbol;
	}

	public String getSymbol()
	{
		return symbol;
	}

	public static BinaryOperator fromTokenType(TokenType type)
	{
		return switch (type)
		{
			case PLUS -> PLUS;
			case QUESTION_EQUALS -> EQUALS;
			default -> throw new IllegalArgumentException("Not a binary operator token: " + type);
		};
	}
}
