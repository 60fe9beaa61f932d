package org.humanscript.lexer;

import org.humanscript.util.Debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Hand written scanner for HumanScript. Reads the source left to right and produces a flat
 * token list that always ends with either {@link TokenType#END_OF_FILE} or, when an
 * unrecognized character is met, a single {@link TokenType#UNKNOWN} token.
 */
public class Lexer
{
	private static final Map<String, TokenType> KEYWORDS;

	static
	{
		Map<String, TokenType> map = new HashMap<>();
		map.put("number", TokenType.KEYWORD_NUMBER);
		map.put("lnumber", TokenType.KEYWORD_LNUMBER);
		map.put("text", TokenType.KEYWORD_TEXT);
		map.put("logic", TokenType.KEYWORD_LOGIC);
		map.put("riel", TokenType.KEYWORD_RIEL);
		map.put("says", TokenType.KEYWORD_SAYS);
		map.put("true", TokenType.KEYWORD_TRUE);
		map.put("false", TokenType.KEYWORD_FALSE);
		map.put("use", TokenType.KEYWORD_USE);
		map.put("if", TokenType.KEYWORD_IF);
		map.put("else", TokenType.KEYWORD_ELSE);
		KEYWORDS = Collections.unmodifiableMap(map);
	}

	private final String source;
	private int current = 0;
	private int start = 0;
	private int line = 1;

	public Lexer(String source)
	{
		this.source = source != null ? source : "";
	}

	public static List<Token> tokenize(String source)
	{
		return new Lexer(source).tokenize();
	}

	public List<Token> tokenize()
	{
		current = 0;
		line = 1;

		List<Token> tokens = new ArrayList<>();
		Token token = nextToken();
		while (!token.getType().isTerminal())
		{
			tokens.add(token);
			token = nextToken();
		}
		tokens.add(token);

		Debug.logDebug("Lexer: produced " + tokens.size() + " token(s), ending with " + token.getType());
		return tokens;
	}

	private boolean isAtEnd()
	{
		return current >= source.length();
	}

	private char peek()
	{
		if (isAtEnd())
		{
			return '\0';
		}
		return source.charAt(current);
	}

	private char peekNext()
	{
		if (current + 1 >= source.length())
		{
			return '\0';
		}
		return source.charAt(current + 1);
	}

	private char advance()
	{
		char c = source.charAt(current++);
		if (c == '\n')
		{
			line++;
		}
		return c;
	}

	private static boolean isAsciiLetter(char c)
	{
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isDigit(char c)
	{
		return c >= '0' && c <= '9';
	}

	private void skipWhitespaceAndComments()
	{
		while (!isAtEnd())
		{
			char c = peek();
			if (Character.isWhitespace(c))
			{
				advance();
			}
			else if (c == '/' && peekNext() == '/')
			{
				while (!isAtEnd() && peek() != '\n')
				{
					advance();
				}
			}
			else
			{
				break;
			}
		}
	}

	private Token nextToken()
	{
		skipWhitespaceAndComments();
		start = current;

		if (isAtEnd())
		{
			return new Token(TokenType.END_OF_FILE, "", line);
		}

		char c = peek();
		if (isAsciiLetter(c))
		{
			return identifierOrKeyword();
		}
		if (isDigit(c))
		{
			return number();
		}
		if (c == '"')
		{
			return string();
		}

		int tokenLine = line;
		switch (c)
		{
			case ':':
				if (peekNext() == '=')
				{
					current += 2;
					return new Token(TokenType.COLON_EQUALS, ":=", tokenLine);
				}
				break;
			case '?':
				if (peekNext() == '=')
				{
					current += 2;
					return new Token(TokenType.QUESTION_EQUALS, "?=", tokenLine);
				}
				break;
			case '+':
				return single(TokenType.PLUS);
			case ';':
				return single(TokenType.SEMICOLON);
			case '(':
				return single(TokenType.LPAREN);
			case ')':
				return single(TokenType.RPAREN);
			case '{':
				return single(TokenType.LBRACE);
			case '}':
				return single(TokenType.RBRACE);
			case '<':
				return single(TokenType.LT);
			case '>':
				return single(TokenType.GT);
			case '.':
				return single(TokenType.DOT);
			case '/':
				return single(TokenType.SLASH);
			default:
				break;
		}

		advance();
		Debug.logDebug("Lexer: unknown character '" + c + "' on line " + tokenLine);
		return new Token(TokenType.UNKNOWN, String.valueOf(c), tokenLine);
	}

	private Token single(TokenType type)
	{
		int tokenLine = line;
		char c = advance();
		return new Token(type, String.valueOf(c), tokenLine);
	}

	private Token identifierOrKeyword()
	{
		while (isAsciiLetter(peek()) || isDigit(peek()))
		{
			advance();
		}
		String text = source.substring(start, current);

		TokenType keyword = KEYWORDS.get(text);
		if (keyword == null)
		{
			return new Token(TokenType.IDENTIFIER, text, line);
		}
		if (keyword == TokenType.KEYWORD_TRUE)
		{
			return new Token(keyword, text, Boolean.TRUE, line);
		}
		if (keyword == TokenType.KEYWORD_FALSE)
		{
			return new Token(keyword, text, Boolean.FALSE, line);
		}
		return new Token(keyword, text, line);
	}

	private Token number()
	{
		boolean isDouble = false;
		while (isDigit(peek()))
		{
			advance();
		}
		// A single fractional part; "1." leaves the dot for the next token.
		if (peek() == '.' && isDigit(peekNext()))
		{
			isDouble = true;
			advance();
			while (isDigit(peek()))
			{
				advance();
			}
		}

		String text = source.substring(start, current);
		if (isDouble)
		{
			double value = Double.parseDouble(text);
			if (Double.isInfinite(value))
			{
				Debug.logWarning("Lexer Warning: Double literal '" + text + "' out of range on line " + line + ".");
				value = 0.0;
			}
			return new Token(TokenType.DOUBLE_LITERAL, text, value, line);
		}

		try
		{
			return new Token(TokenType.INTEGER_LITERAL, text, Integer.parseInt(text), line);
		}
		catch (NumberFormatException notAnInt)
		{
			try
			{
				return new Token(TokenType.INTEGER_LITERAL, text, Long.parseLong(text), line);
			}
			catch (NumberFormatException notALong)
			{
				Debug.logWarning("Lexer Warning: Integer literal '" + text + "' out of range for a 64-bit integer on line " + line + ".");
				return new Token(TokenType.INTEGER_LITERAL, text, 0L, line);
			}
		}
	}

	private Token string()
	{
		int tokenLine = line;
		advance(); // opening quote

		StringBuilder value = new StringBuilder();
		while (!isAtEnd() && peek() != '"')
		{
			char c = advance();
			if (c != '\\')
			{
				value.append(c);
				continue;
			}
			if (isAtEnd())
			{
				break;
			}
			char escaped = advance();
			switch (escaped)
			{
				case 'n' -> value.append('\n');
				case 't' -> value.append('\t');
				case '"' -> value.append('"');
				case '\\' -> value.append('\\');
				default -> value.append(escaped);
			}
		}

		if (isAtEnd())
		{
			throw new LexerException("Unterminated string literal starting on line " + tokenLine + ".",
					source.substring(start), tokenLine);
		}
		advance(); // closing quote

		return new Token(TokenType.STRING_LITERAL, source.substring(start, current), value.toString(), tokenLine);
	}
}
