package org.humanscript.parser;

import org.humanscript.ast.*;
import org.humanscript.lexer.Token;
import org.humanscript.lexer.TokenType;
import org.humanscript.semantic.type.PrimitiveType;
import org.humanscript.util.Debug;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser, one method per grammar rule:
 * <pre>
 * program     := use-decl* statement*
 * use-decl    := "use" "&lt;" header-path "&gt;" ";"
 * statement   := var-decl | says-stmt | if-stmt
 * var-decl    := type-keyword IDENTIFIER ":=" expression ";"
 * says-stmt   := "says" expression ";"
 * if-stmt     := "if" "(" expression ")" branch ("else" branch)?
 * branch      := block | statement
 * block       := "{" statement* "}"
 * expression  := comparison
 * comparison  := addition ("?=" addition)*
 * addition    := factor ("+" factor)*
 * factor      := INTEGER | DOUBLE | STRING | "true" | "false" | IDENTIFIER | "(" expression ")"
 * </pre>
 * The first grammar violation throws a {@link ParseException}; there is no recovery.
 */
public class Parser
{
	private final List<Token> tokens;
	private int current = 0;

	public Parser(List<Token> tokens)
	{
		this.tokens = tokens;
	}

	public static Program parse(List<Token> tokens)
	{
		return new Parser(tokens).parseProgram();
	}

	public Program parseProgram()
	{
		current = 0;
		List<UseDeclaration> uses = new ArrayList<>();
		List<Statement> statements = new ArrayList<>();

		while (check(TokenType.KEYWORD_USE))
		{
			uses.add(useDeclaration());
		}

		while (!peek().getType().isTerminal())
		{
			if (!startsStatement(peek().getType()))
			{
				throw new ParseException("Unexpected token '" + peek().getText() + "' at top level.",
						"a declaration, 'says' or 'if'", peek());
			}
			statements.add(statement());
		}

		if (check(TokenType.UNKNOWN))
		{
			throw new ParseException("Encountered UNKNOWN token '" + peek().getText() + "' from lexer.",
					"a valid token", peek());
		}

		Program program = new Program(uses, statements);
		Debug.logDebug("Parser: built program with " + uses.size() + " use declaration(s) and "
				+ statements.size() + " top-level statement(s):\n" + program);
		return program;
	}

	// --- Token helpers ---

	private Token peek()
	{
		if (current >= tokens.size())
		{
			int line = tokens.isEmpty() ? 1 : tokens.get(tokens.size() - 1).getLine();
			return new Token(TokenType.END_OF_FILE, "", line);
		}
		return tokens.get(current);
	}

	private Token advance()
	{
		Token token = peek();
		if (current < tokens.size())
		{
			current++;
		}
		return token;
	}

	private boolean check(TokenType type)
	{
		return peek().getType() == type;
	}

	private boolean match(TokenType type)
	{
		if (check(type))
		{
			advance();
			return true;
		}
		return false;
	}

	private Token consume(TokenType type, String message)
	{
		if (check(type))
		{
			return advance();
		}
		Token actual = peek();
		throw new ParseException(message + ". Got " + actual.describe() + " instead of expected " + type + ".",
				type.name(), actual);
	}

	private static boolean startsStatement(TokenType type)
	{
		return type.isTypeKeyword() || type == TokenType.KEYWORD_SAYS || type == TokenType.KEYWORD_IF;
	}

	// --- Declarations ---

	private UseDeclaration useDeclaration()
	{
		Token use = consume(TokenType.KEYWORD_USE, "Expected 'use' keyword");
		consume(TokenType.LT, "Expected '<' after 'use' keyword");
		String headerName = headerPath();
		consume(TokenType.GT, "Expected '>' after include path in 'use' statement");
		consume(TokenType.SEMICOLON, "Expected ';' after 'use' statement");
		return new UseDeclaration(headerName, use.getLine());
	}

	private String headerPath()
	{
		StringBuilder path = new StringBuilder();
		while (!check(TokenType.GT) && !peek().getType().isTerminal())
		{
			Token part = advance();
			switch (part.getType())
			{
				case IDENTIFIER, DOT, SLASH, INTEGER_LITERAL -> path.append(part.getText());
				default -> throw new ParseException("Invalid token '" + part.getText() + "' inside use <...> path.",
						"an identifier, '.', '/' or a number", part);
			}
		}
		if (path.length() == 0)
		{
			throw new ParseException("Empty path in use <...> statement.", "a header path", peek());
		}
		return path.toString();
	}

	// --- Statements ---

	private Statement statement()
	{
		TokenType type = peek().getType();
		if (type.isTypeKeyword())
		{
			return variableDeclaration();
		}
		if (type == TokenType.KEYWORD_SAYS)
		{
			return saysStatement();
		}
		if (type == TokenType.KEYWORD_IF)
		{
			return ifStatement();
		}
		throw new ParseException("Unexpected token '" + peek().getText() + "' at start of a statement.",
				"a declaration, 'says' or 'if'", peek());
	}

	private VariableDeclaration variableDeclaration()
	{
		Token typeToken = advance();
		PrimitiveType declaredType = PrimitiveType.fromKeyword(typeToken.getText())
				.orElseThrow(() -> new ParseException("Invalid type keyword '" + typeToken.getText() + "' in variable declaration.",
						"a type keyword", typeToken));

		Token name = consume(TokenType.IDENTIFIER, "Expected identifier name after type keyword");
		consume(TokenType.COLON_EQUALS, "Expected ':=' after identifier in variable declaration");
		Expression initializer = expression();
		consume(TokenType.SEMICOLON, "Expected ';' after variable declaration expression");

		return new VariableDeclaration(declaredType, name.getText(), initializer, typeToken.getLine());
	}

	private SaysStatement saysStatement()
	{
		Token says = consume(TokenType.KEYWORD_SAYS, "Expected 'says' keyword");
		Expression expression = expression();
		consume(TokenType.SEMICOLON, "Expected ';' after 'says' statement expression");
		return new SaysStatement(expression, says.getLine());
	}

	private IfStatement ifStatement()
	{
		Token ifToken = consume(TokenType.KEYWORD_IF, "Expected 'if' keyword");
		consume(TokenType.LPAREN, "Expected '(' after 'if'");
		Expression condition = expression();
		consume(TokenType.RPAREN, "Expected ')' after if condition");

		Statement thenBranch = branch();
		// Taking the else here binds it to the innermost open if.
		Statement elseBranch = match(TokenType.KEYWORD_ELSE) ? branch() : null;

		return new IfStatement(condition, thenBranch, elseBranch, ifToken.getLine());
	}

	private Statement branch()
	{
		if (check(TokenType.LBRACE))
		{
			return block();
		}
		return statement();
	}

	private BlockStatement block()
	{
		Token open = consume(TokenType.LBRACE, "Expected '{' to open a block");
		List<Statement> statements = new ArrayList<>();
		while (!check(TokenType.RBRACE) && !peek().getType().isTerminal())
		{
			statements.add(statement());
		}
		consume(TokenType.RBRACE, "Expected '}' to close block");
		return new BlockStatement(statements, open.getLine());
	}

	// --- Expressions ---

	private Expression expression()
	{
		return comparison();
	}

	private Expression comparison()
	{
		Expression left = addition();
		while (check(TokenType.QUESTION_EQUALS))
		{
			Token operator = advance();
			Expression right = addition();
			left = new BinaryExpression(left, BinaryOperator.fromTokenType(operator.getType()), right, operator.getLine());
		}
		return left;
	}

	private Expression addition()
	{
		Expression left = factor();
		while (check(TokenType.PLUS))
		{
			Token operator = advance();
			Expression right = factor();
			left = new BinaryExpression(left, BinaryOperator.fromTokenType(operator.getType()), right, operator.getLine());
		}
		return left;
	}

	private Expression factor()
	{
		Token token = peek();
		switch (token.getType())
		{
			case INTEGER_LITERAL:
				advance();
				return new IntegerLiteral(((Number) token.getLiteral()).longValue(), token.getLine());
			case DOUBLE_LITERAL:
				advance();
				return new DoubleLiteral((Double) token.getLiteral(), token.getLine());
			case STRING_LITERAL:
				advance();
				return new StringLiteral((String) token.getLiteral(), token.getLine());
			case KEYWORD_TRUE:
				advance();
				return new BooleanLiteral(true, token.getLine());
			case KEYWORD_FALSE:
				advance();
				return new BooleanLiteral(false, token.getLine());
			case IDENTIFIER:
				advance();
				return new Identifier(token.getText(), token.getLine());
			case LPAREN:
				advance();
				Expression grouped = expression();
				consume(TokenType.RPAREN, "Expected ')' after grouped expression");
				return grouped;
			default:
				throw new ParseException("Unexpected token '" + token.getText()
						+ "' when expecting a factor (literal, identifier, or parentheses).",
						"a literal, identifier or '('", token);
		}
	}
}
