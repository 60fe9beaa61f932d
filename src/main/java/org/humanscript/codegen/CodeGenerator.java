package org.humanscript.codegen;

import org.humanscript.ast.Program;
import org.humanscript.ast.Statement;
import org.humanscript.semantic.TypeAnnotations;
import org.humanscript.util.Debug;

/**
 * Lowers an analysed program to a single C++ translation unit with everything inside {@code main()}.
 */
public class CodeGenerator
{
	public static final String BANNER = "// Generated by HumanScript Compiler";

	private final Program program;
	private final TypeAnnotations annotations;

	public CodeGenerator(Program program, TypeAnnotations annotations)
	{
		this.program = program;
		this.annotations = annotations;
	}

	public String generate()
	{
		StringBuilder out = new StringBuilder();
		out.append(BANNER).append("\n\n");

		// 1. Includes
		IncludePlan includes = IncludeResolver.resolve(program, annotations);
		for (String header : includes.getUseHeaders())
		{
			out.append("#include <").append(header).append(">\n");
		}
		if (!includes.getUseHeaders().isEmpty())
		{
			out.append('\n');
		}
		for (IncludePlan.AutoInclude auto : includes.getAutoIncludes())
		{
			out.append("#include <").append(auto.getHeader()).append("> // ").append(auto.getReason()).append('\n');
		}
		if (!includes.getAutoIncludes().isEmpty())
		{
			out.append('\n');
		}

		// 2. Entry point
		out.append("int main() {\n");
		if (includes.isIoStreamIncluded())
		{
			out.append("    std::cout << std::boolalpha; // Print booleans as true/false\n");
		}

		CppVisitor visitor = new CppVisitor(annotations, out, 1);
		for (Statement statement : program.getStatements())
		{
			statement.accept(visitor);
		}

		out.append("    return 0;\n");
		out.append("}\n");

		Debug.logDebug("CodeGenerator: emitted " + out.length() + " characters of C++.");
		return out.toString();
	}
}
