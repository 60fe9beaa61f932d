package org.humanscript.parser;

import org.humanscript.ast.*;
import org.humanscript.lexer.Lexer;
import org.humanscript.lexer.TokenType;
import org.humanscript.semantic.type.PrimitiveType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParserTest
{
	private static Program parse(String source)
	{
		return Parser.parse(Lexer.tokenize(source));
	}

	private static Expression saysExpression(String source)
	{
		Program program = parse(source);
		return ((SaysStatement) program.getStatements().get(0)).getExpression();
	}

	@Test
	void emptyInputGivesEmptyProgram()
	{
		Program program = parse("");
		assertTrue(program.getUseDeclarations().isEmpty());
		assertTrue(program.getStatements().isEmpty());
		assertTrue(program.isEmpty());
	}

	@Test
	void parsesUseDeclarationsInOrder()
	{
		Program program = parse("use <iostream>;\nuse <sys/socket.h>;\nuse <linux/if_ether.h>;\nuse <cstdint>;");
		List<UseDeclaration> uses = program.getUseDeclarations();

		assertEquals(4, uses.size());
		assertEquals("iostream", uses.get(0).getHeaderName());
		assertEquals("sys/socket.h", uses.get(1).getHeaderName());
		assertEquals("linux/if_ether.h", uses.get(2).getHeaderName());
		assertEquals(2, uses.get(1).getLine());
	}

	@Test
	void headerPathMayContainNumbers()
	{
		Program program = parse("use <c2/v10.h>;");
		assertEquals("c2/v10.h", program.getUseDeclarations().get(0).getHeaderName());
	}

	@Test
	void emptyUsePathIsRejected()
	{
		ParseException e = assertThrows(ParseException.class, () -> parse("use <>;"));
		assertTrue(e.getMessage().contains("Empty path"));
	}

	@Test
	void invalidTokenInsideUsePathIsRejected()
	{
		assertThrows(ParseException.class, () -> parse("use <a+b>;"));
	}

	@Test
	void parsesVariableDeclarationForEveryTypeKeyword()
	{
		Program program = parse("number a := 1; lnumber b := 2; text c := \"x\"; logic d := true; riel e := 1.5;");
		List<Statement> statements = program.getStatements();

		assertEquals(PrimitiveType.NUMBER, ((VariableDeclaration) statements.get(0)).getDeclaredType());
		assertEquals(PrimitiveType.LNUMBER, ((VariableDeclaration) statements.get(1)).getDeclaredType());
		assertEquals(PrimitiveType.TEXT, ((VariableDeclaration) statements.get(2)).getDeclaredType());
		assertEquals(PrimitiveType.LOGIC, ((VariableDeclaration) statements.get(3)).getDeclaredType());
		assertEquals(PrimitiveType.RIEL, ((VariableDeclaration) statements.get(4)).getDeclaredType());

		VariableDeclaration c = (VariableDeclaration) statements.get(2);
		assertEquals("c", c.getName());
		assertEquals("x", ((StringLiteral) c.getInitializer()).getValue());
	}

	@Test
	void comparisonBindsWeakerThanAddition()
	{
		BinaryExpression root = (BinaryExpression) saysExpression("says a + b ?= c + d;");

		assertEquals(BinaryOperator.EQUALS, root.getOperator());
		assertEquals(BinaryOperator.PLUS, ((BinaryExpression) root.getLeft()).getOperator());
		assertEquals(BinaryOperator.PLUS, ((BinaryExpression) root.getRight()).getOperator());
		assertEquals("((a + b) ?= (c + d))", root.toString());
	}

	@Test
	void additionIsLeftAssociative()
	{
		BinaryExpression root = (BinaryExpression) saysExpression("says 1 + 2 + 3;");

		assertInstanceOf(BinaryExpression.class, root.getLeft());
		assertEquals(3L, ((IntegerLiteral) root.getRight()).getValue());
		assertEquals("((1 + 2) + 3)", root.toString());
	}

	@Test
	void comparisonIsLeftAssociativeAndChainable()
	{
		Expression root = saysExpression("says a ?= b ?= c;");
		assertEquals("((a ?= b) ?= c)", root.toString());
	}

	@Test
	void parenthesesOverridePrecedence()
	{
		Expression root = saysExpression("says 1 + (2 ?= 3);");
		assertEquals("(1 + (2 ?= 3))", root.toString());
	}

	@Test
	void parsesAllFactorKinds()
	{
		assertInstanceOf(IntegerLiteral.class, saysExpression("says 7;"));
		assertInstanceOf(DoubleLiteral.class, saysExpression("says 7.5;"));
		assertInstanceOf(StringLiteral.class, saysExpression("says \"s\";"));
		assertInstanceOf(BooleanLiteral.class, saysExpression("says false;"));
		assertInstanceOf(Identifier.class, saysExpression("says someName;"));
	}

	@Test
	void largeIntegerLiteralKeepsItsValue()
	{
		IntegerLiteral literal = (IntegerLiteral) saysExpression("says 3000000000;");
		assertEquals(3000000000L, literal.getValue());
	}

	@Test
	void ifWithBareStatementsAndElse()
	{
		Program program = parse("if (1 ?= 1) says \"yes\"; else says \"no\";");
		IfStatement ifStatement = (IfStatement) program.getStatements().get(0);

		assertInstanceOf(SaysStatement.class, ifStatement.getThenBranch());
		assertTrue(ifStatement.getElseBranch().isPresent());
		assertInstanceOf(SaysStatement.class, ifStatement.getElseBranch().get());
	}

	@Test
	void elseBindsToNearestIf()
	{
		Program program = parse("if (a) if (b) says 1; else says 2;");
		IfStatement outer = (IfStatement) program.getStatements().get(0);
		IfStatement inner = (IfStatement) outer.getThenBranch();

		assertTrue(outer.getElseBranch().isEmpty());
		assertTrue(inner.getElseBranch().isPresent());
	}

	@Test
	void ifWithBlocks()
	{
		Program program = parse("if (ok) { number x := 1; says x; } else { }");
		IfStatement ifStatement = (IfStatement) program.getStatements().get(0);

		BlockStatement then = (BlockStatement) ifStatement.getThenBranch();
		assertEquals(2, then.getStatements().size());
		assertTrue(((BlockStatement) ifStatement.getElseBranch().get()).getStatements().isEmpty());
	}

	@Test
	void unexpectedTokenAtTopLevel()
	{
		ParseException e = assertThrows(ParseException.class, () -> parse("x := 5;"));
		assertTrue(e.getMessage().contains("top level"));
		assertEquals(TokenType.IDENTIFIER, e.getActual().getType());
	}

	@Test
	void useAfterStatementsIsRejected()
	{
		assertThrows(ParseException.class, () -> parse("says 1;\nuse <cmath>;"));
	}

	@Test
	void missingSemicolonNamesExpectedAndActual()
	{
		ParseException e = assertThrows(ParseException.class, () -> parse("number x := 5"));
		assertEquals("SEMICOLON", e.getExpected());
		assertEquals(TokenType.END_OF_FILE, e.getActual().getType());
		assertTrue(e.getMessage().contains("Expected ';'"));
	}

	@Test
	void missingInitializerReportsFactor()
	{
		ParseException e = assertThrows(ParseException.class, () -> parse("number x := ;"));
		assertTrue(e.getMessage().contains("factor"));
	}

	@Test
	void unclosedBlockIsRejected()
	{
		assertThrows(ParseException.class, () -> parse("if (a) { says 1;"));
	}

	@Test
	void blockIsNotAStatementOnItsOwn()
	{
		assertThrows(ParseException.class, () -> parse("if (a) { { says 1; } }"));
	}

	@Test
	void unknownTokenFromLexerIsRejected()
	{
		ParseException e = assertThrows(ParseException.class, () -> parse("says 1; @"));
		assertEquals(TokenType.UNKNOWN, e.getActual().getType());
	}

	@Test
	void errorCarriesLine()
	{
		ParseException e = assertThrows(ParseException.class, () -> parse("says 1;\n\nsays ;"));
		assertEquals(3, e.getLine());
	}
}
