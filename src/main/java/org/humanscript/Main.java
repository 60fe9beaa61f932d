package org.humanscript;

import org.humanscript.util.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line driver: reads a .hs file, writes the generated C++ and optionally builds and runs it.
 */
public class Main
{
	public static final String VERSION = "0.1.0";

	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	/**
	 * @return the process exit status: 0 on success, 1 on any failure, or the exit code of the
	 * compiled program when it was run.
	 */
	public static int run(String[] args)
	{
		try
		{
			CompilerArguments arguments = CompilerArguments.parse(args);

			if (arguments.isHelpFlag())
			{
				CompilerArguments.printUsage();
				return args.length == 0 ? 1 : 0;
			}
			if (arguments.isVersionFlag())
			{
				System.out.println("hsc (HumanScript Compiler) version " + VERSION);
				return 0;
			}

			if (arguments.getInputFile() == null)
			{
				throw new IllegalArgumentException("No input file provided. Use -h for help.");
			}

			Path input = arguments.getInputFile();
			if (!Files.exists(input))
			{
				Debug.logError("Error: Could not open input file '" + input + "'");
				return 1;
			}

			return compileFile(arguments, new ErrorHandler());
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError("Compiler initialization failed: " + e.getMessage());
		}
		catch (IOException e)
		{
			Debug.logError("Error accessing file: " + e.getMessage());
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			Debug.logError("Interrupted while waiting for the native toolchain.");
		}
		return 1;
	}

	private static int compileFile(CompilerArguments args, ErrorHandler errorHandler) throws IOException, InterruptedException
	{
		Path input = args.getInputFile();
		String source = FileUtils.readSource(input);
		if (source.isEmpty())
		{
			Debug.logWarning("Warning: Input file '" + input + "' is empty.");
		}

		Debug.log("Compiling HumanScript file: " + input);

		HumanScriptCompiler compiler = new HumanScriptCompiler();
		CompilationResult result;
		try
		{
			result = args.isCheckOnly() ? compiler.check(source) : compiler.compile(source);
		}
		catch (CompilationException e)
		{
			errorHandler.report(e);
			Debug.logError("Compilation failed.");
			return 1;
		}

		if (args.getSymbolsPath() != null)
		{
			SymbolDTOConverter.writeReport(
					SymbolDTOConverter.toReport(input.getFileName().toString(), result.getSymbolTable()),
					args.getSymbolsPath());
		}

		if (args.isCheckOnly())
		{
			Debug.logInfo("Semantic check passed. No output generated (-k flag).");
			return 0;
		}

		String baseName = FileUtils.getBaseName(input);
		Path cppFile = args.getOutputPath() != null ? args.getOutputPath() : Paths.get(baseName + "_hs_generated.cpp");
		FileUtils.writeText(cppFile, result.getCppCode());
		Debug.logInfo("Generated C++ code written to: " + cppFile);

		if (!args.isRunAfterCompile())
		{
			Debug.log("\nTo run the compiled C++ code, use a C++ compiler, e.g.:");
			Debug.log("  g++ -std=c++17 -O2 " + cppFile + " -o " + baseName + "_executable");
			Debug.log("  ./" + baseName + "_executable");
			return 0;
		}

		return buildAndRun(args, cppFile, baseName, errorHandler);
	}

	private static int buildAndRun(CompilerArguments args, Path cppFile, String baseName, ErrorHandler errorHandler) throws IOException, InterruptedException
	{
		Path executable = args.getExecutablePath();
		if (executable == null)
		{
			executable = Paths.get(baseName + "_hs_executable" + (NativeCompiler.isWindows() ? ".exe" : ""));
		}

		NativeCompiler nativeCompiler = new NativeCompiler();
		Debug.log("\nCompiling generated C++ code with " + nativeCompiler.getCompiler() + "...");
		try
		{
			nativeCompiler.compileExecutable(cppFile, executable);
		}
		catch (RuntimeException e)
		{
			errorHandler.logError("Error: C++ compilation failed. " + e.getMessage());
			return 1;
		}
		Debug.logInfo("C++ compilation successful. Executable: " + executable);

		Debug.log("\nRunning compiled HumanScript program...");
		Debug.log("----------------------------------------");
		int exitCode = nativeCompiler.run(executable);
		Debug.log("----------------------------------------");
		Debug.log("HumanScript program finished with exit code: " + exitCode);

		// Intermediates the user did not name are temporary.
		if (args.getOutputPath() == null)
		{
			Files.deleteIfExists(cppFile);
		}
		if (args.getExecutablePath() == null)
		{
			Files.deleteIfExists(executable);
		}
		return exitCode;
	}
}
