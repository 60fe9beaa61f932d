package org.humanscript.codegen;

import org.humanscript.ast.Program;
import org.humanscript.lexer.Lexer;
import org.humanscript.parser.Parser;
import org.humanscript.semantic.SemanticAnalyzer;
import org.humanscript.semantic.TypeAnnotations;
import org.humanscript.semantic.type.PrimitiveType;
import org.humanscript.semantic.type.UnknownType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CodeGeneratorTest
{
	private static String generate(String source)
	{
		Program program = Parser.parse(Lexer.tokenize(source));
		TypeAnnotations annotations = new SemanticAnalyzer().analyze(program);
		return new CodeGenerator(program, annotations).generate();
	}

	@Test
	void emptyProgramIsABareMain()
	{
		assertEquals("// Generated by HumanScript Compiler\n\nint main() {\n    return 0;\n}\n", generate(""));
	}

	@Test
	void helloWorld()
	{
		String expected = "// Generated by HumanScript Compiler\n"
				+ "\n"
				+ "#include <string> // Auto-included for text type or string operations\n"
				+ "#include <iostream> // Auto-included for 'says'\n"
				+ "#include <iomanip> // For std::boolalpha with 'says'\n"
				+ "\n"
				+ "int main() {\n"
				+ "    std::cout << std::boolalpha; // Print booleans as true/false\n"
				+ "    std::cout << (\"Hello, World!\") << std::endl;\n"
				+ "    return 0;\n"
				+ "}\n";

		assertEquals(expected, generate("says \"Hello, World!\";"));
	}

	@Test
	void declarationsWithoutPrintingNeedNoIncludes()
	{
		String expected = "// Generated by HumanScript Compiler\n"
				+ "\n"
				+ "int main() {\n"
				+ "    int x = 1LL;\n"
				+ "    long long y = 2LL;\n"
				+ "    bool b = false;\n"
				+ "    double r = 2.5;\n"
				+ "    return 0;\n"
				+ "}\n";

		assertEquals(expected, generate("number x := 1; lnumber y := 2; logic b := false; riel r := 2.5;"));
	}

	@Test
	void useHeadersComeBeforeAutoIncludes()
	{
		String code = generate("use <cmath>;\nuse <sys/types.h>;\nsays 1;");
		String expectedHead = "// Generated by HumanScript Compiler\n"
				+ "\n"
				+ "#include <cmath>\n"
				+ "#include <sys/types.h>\n"
				+ "\n"
				+ "#include <iostream> // Auto-included for 'says'\n"
				+ "#include <iomanip> // For std::boolalpha with 'says'\n"
				+ "#include <string> // For std::to_string with 'says'\n"
				+ "\n"
				+ "int main() {\n";

		assertTrue(code.startsWith(expectedHead), code);
	}

	@Test
	void requestedIostreamIsNotRepeatedButBoolalphaStays()
	{
		String code = generate("use <iostream>;\nsays true;");

		assertEquals(1, code.split("#include <iostream>", -1).length - 1);
		assertTrue(code.contains("    std::cout << std::boolalpha; // Print booleans as true/false\n"));
		assertTrue(code.contains("    std::cout << (true) << std::endl;\n"));
	}

	@Test
	void textConcatenationStringifiesNonTextOperands()
	{
		String code = generate("text greeting := \"Hi \" + 42; says greeting + true;");

		assertTrue(code.contains("    std::string greeting = (\"Hi \" + std::to_string(42LL));\n"), code);
		assertTrue(code.contains("    std::cout << ((greeting + std::to_string(true))) << std::endl;\n"), code);
	}

	@Test
	void numericAdditionIsPlain()
	{
		String code = generate("number a := 1; says a + 2.5;");
		assertTrue(code.contains("    std::cout << ((a + 2.5)) << std::endl;\n"), code);
		assertFalse(code.contains("std::to_string(a"));
	}

	@Test
	void equalityLowersToDoubleEquals()
	{
		String code = generate("says (1 ?= 2);");
		assertTrue(code.contains("    std::cout << ((1LL == 2LL)) << std::endl;\n"), code);
	}

	@Test
	void twoStringLiteralsAreWrapped()
	{
		String code = generate("says \"a\" + \"b\"; says \"x\" ?= \"y\";");

		assertTrue(code.contains("(std::string(\"a\") + \"b\")"), code);
		assertTrue(code.contains("(std::string(\"x\") == \"y\")"), code);
	}

	@Test
	void stringLiteralsAreReEscaped()
	{
		String code = generate("says \"a\\\"b\\n\\tc\\\\\";");
		assertTrue(code.contains("    std::cout << (\"a\\\"b\\n\\tc\\\\\") << std::endl;\n"), code);
	}

	@Test
	void rawCarriageReturnInLiteralIsEscaped()
	{
		String code = generate("says \"a\rb\";");

		assertTrue(code.contains("    std::cout << (\"a\\rb\") << std::endl;\n"), code);
		assertFalse(code.contains("a\rb"));
	}

	@Test
	void ifElseWithBareAndBlockBranches()
	{
		String code = generate("logic f := true;\nif (f) says 1; else { says 2; says 3; }");
		String expectedBody = "    bool f = true;\n"
				+ "    if (f) {\n"
				+ "        std::cout << (1LL) << std::endl;\n"
				+ "    } else {\n"
				+ "        std::cout << (2LL) << std::endl;\n"
				+ "        std::cout << (3LL) << std::endl;\n"
				+ "    }\n"
				+ "    return 0;\n";

		assertTrue(code.contains(expectedBody), code);
	}

	@Test
	void binaryConditionIsNotDoubleParenthesized()
	{
		String code = generate("if (1 ?= 1) { if (true) says 1; }");
		String expectedBody = "    if (1LL == 1LL) {\n"
				+ "        if (true) {\n"
				+ "            std::cout << (1LL) << std::endl;\n"
				+ "        }\n"
				+ "    }\n";

		assertTrue(code.contains(expectedBody), code);
	}

	@Test
	void largeIntegerLiteralKeepsItsDigits()
	{
		assertTrue(generate("lnumber big := 3000000000;").contains("    long long big = 3000000000LL;\n"));
	}

	@Test
	void typeConverterMapsEveryPrimitive()
	{
		assertEquals("int", TypeConverter.toCppType(PrimitiveType.NUMBER));
		assertEquals("long long", TypeConverter.toCppType(PrimitiveType.LNUMBER));
		assertEquals("std::string", TypeConverter.toCppType(PrimitiveType.TEXT));
		assertEquals("bool", TypeConverter.toCppType(PrimitiveType.LOGIC));
		assertEquals("double", TypeConverter.toCppType(PrimitiveType.RIEL));
		assertEquals("void", TypeConverter.toCppType(PrimitiveType.VOID));
	}

	@Test
	void typeConverterRejectsUnknown()
	{
		assertThrows(CodeGenerationException.class, () -> TypeConverter.toCppType(UnknownType.INSTANCE));
		assertFalse(TypeConverter.isDirectlyStreamable(UnknownType.INSTANCE));
		assertTrue(TypeConverter.isDirectlyStreamable(PrimitiveType.LOGIC));
	}
}
