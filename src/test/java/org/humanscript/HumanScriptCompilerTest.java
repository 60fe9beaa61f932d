package org.humanscript;

import org.humanscript.lexer.LexerException;
import org.humanscript.parser.ParseException;
import org.humanscript.semantic.SemanticException;
import org.humanscript.semantic.type.PrimitiveType;
import org.humanscript.util.CompilationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HumanScriptCompilerTest
{
	private final HumanScriptCompiler compiler = new HumanScriptCompiler();

	@Test
	void compilesAWholeProgram()
	{
		String source = "use <cmath>;\n"
				+ "// greeting\n"
				+ "number count := 3;\n"
				+ "text label := \"count=\" + count;\n"
				+ "if (count ?= 3) {\n"
				+ "    says label;\n"
				+ "} else says false;\n";

		CompilationResult result = compiler.compile(source);

		assertTrue(result.hasCode());
		assertEquals(2, result.getSymbolTable().size());
		assertEquals(PrimitiveType.TEXT, result.getSymbolTable().resolve("label").orElseThrow().getType());

		String code = result.getCppCode();
		assertTrue(code.startsWith("// Generated by HumanScript Compiler\n\n#include <cmath>\n\n"), code);
		assertTrue(code.contains("    int count = 3LL;\n"));
		assertTrue(code.contains("    std::string label = (\"count=\" + std::to_string(count));\n"));
		assertTrue(code.contains("    if (count == 3LL) {\n        std::cout << (label) << std::endl;\n    } else {\n"));
		assertTrue(code.endsWith("    return 0;\n}\n"));
	}

	@Test
	void checkStopsBeforeCodeGeneration()
	{
		CompilationResult result = compiler.check("number x := 1;");

		assertFalse(result.hasCode());
		assertNull(result.getCppCode());
		assertEquals(1, result.getProgram().getStatements().size());
		assertFalse(result.getTokens().isEmpty());
	}

	@Test
	void compilingTwiceGivesTheSameCode()
	{
		String source = "text s := \"a\" + 1.5; says s ?= \"b\";";
		assertEquals(compiler.compile(source).getCppCode(), compiler.compile(source).getCppCode());
	}

	@Test
	void unknownCharacterIsALexicalError()
	{
		LexerException e = assertThrows(LexerException.class, () -> compiler.compile("number x := 1;\nsays x $ 2;"));

		assertEquals(CompilationException.Phase.LEXICAL, e.getPhase());
		assertEquals(2, e.getLine());
		assertTrue(e.getMessage().contains("'$'"));
	}

	@Test
	void eachStageReportsItsOwnPhase()
	{
		CompilationException syntax = assertThrows(ParseException.class, () -> compiler.compile("says 1"));
		assertEquals(CompilationException.Phase.SYNTAX, syntax.getPhase());

		CompilationException semantic = assertThrows(SemanticException.class, () -> compiler.compile("says missing;"));
		assertEquals(CompilationException.Phase.SEMANTIC, semantic.getPhase());
		assertEquals(1, semantic.getLine());
	}
}
