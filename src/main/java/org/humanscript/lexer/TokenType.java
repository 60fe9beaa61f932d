package org.humanscript.lexer;

public enum TokenType
{
	// Type keywords
	KEYWORD_NUMBER,
	KEYWORD_LNUMBER,
	KEYWORD_TEXT,
	KEYWORD_LOGIC,
	KEYWORD_RIEL,

	KEYWORD_SAYS,
	KEYWORD_TRUE,
	KEYWORD_FALSE,
	KEYWORD_USE,
	KEYWORD_IF,
	KEYWORD_ELSE,

	IDENTIFIER,

	// Literals
	INTEGER_LITERAL,
	DOUBLE_LITERAL,
	STRING_LITERAL,

	// Operators
	COLON_EQUALS,    // :=
	QUESTION_EQUALS, // ?=
	PLUS,

	// Punctuation
	SEMICOLON,
	LPAREN,
	RPAREN,
	LBRACE,
	RBRACE,
	LT,
	GT,
	DOT,
	SLASH,

	END_OF_FILE,
	UNKNOWN;

	public boolean isTypeKeyword()
	{
		return this == KEYWORD_NUMBER || this == KEYWORD_LNUMBER || this == KEYWORD_TEXT
				|| this == KEYWORD_LOGIC || this == KEYWORD_RIEL;
	}

	/**
	 * @return true for the two tokens that end a token sequence.
	 */
	public boolean isTerminal()
	{
		return this == END_OF_FILE || this == UNKNOWN;
	}
}
