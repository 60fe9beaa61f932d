package org.humanscript.util;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Parses and holds all command-line arguments for the HumanScript compiler.
 */
public class CompilerArguments
{
	private Path inputFile = null;
	private Path outputPath = null;
	private Path executablePath = null;
	private Path symbolsPath = null;
	private boolean helpFlag = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private boolean checkOnly = false;
	private boolean runAfterCompile = false;

	// Private constructor, use parse()
	private CompilerArguments()
	{
	}

	public static CompilerArguments parse(String[] args)
	{
		CompilerArguments parsedArgs = new CompilerArguments();

		if (args.length < 1)
		{
			parsedArgs.helpFlag = true;
			return parsedArgs;
		}

		try
		{
			for (int i = 0; i < args.length; i++)
			{
				String arg = args[i];

				// --- Flags with no argument ---
				if (arg.equals("-h") || arg.equals("--help"))
				{
					parsedArgs.helpFlag = true;
					return parsedArgs;
				}
				if (arg.equals("--version"))
				{
					parsedArgs.versionFlag = true;
					return parsedArgs;
				}
				if (arg.equals("-v") || arg.equals("--verbose"))
				{
					parsedArgs.verboseFlag = true;
					Debug.ENABLE_DEBUG = true;
					continue;
				}
				if (arg.equals("-k") || arg.equals("--check"))
				{
					parsedArgs.checkOnly = true;
					continue;
				}
				if (arg.equals("-r") || arg.equals("--run") || arg.equals("-run"))
				{
					parsedArgs.runAfterCompile = true;
					continue;
				}

				// --- Flags with one argument ---
				if (arg.equals("-o") || arg.equals("--output") || arg.equals("-o_cpp"))
				{
					parsedArgs.outputPath = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}
				if (arg.equals("-x") || arg.equals("--executable") || arg.equals("-o_exe"))
				{
					parsedArgs.executablePath = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}
				if (arg.equals("-s") || arg.equals("--symbols"))
				{
					parsedArgs.symbolsPath = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}

				if (arg.startsWith("-"))
				{
					throw new IllegalArgumentException("Unknown option: " + arg);
				}

				if (parsedArgs.inputFile == null)
				{
					parsedArgs.inputFile = Paths.get(arg);
				}
				else
				{
					Debug.logWarning("Warning: Unrecognized or misplaced argument '" + arg + "'");
				}
			}
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError(e.getMessage());
			parsedArgs.helpFlag = true; // Show help on bad parse
		}

		return parsedArgs;
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	public static void printUsage()
	{
		System.out.println("OVERVIEW: Compiler for the HumanScript language (emits C++).");
		System.out.println("\nUSAGE: hsc [options] <input_file.hs>");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                 Show this help message and exit.");
		System.out.println("  --version                  Show compiler version and exit.");
		System.out.println("  -v, --verbose              Enable verbose debug logging.");
		System.out.println("  -k, --check                Run semantic analysis only; do not generate output.");
		System.out.println("  -o, --output <file>        Path of the generated C++ file.");
		System.out.println("  -x, --executable <file>    Path of the native executable built with --run.");
		System.out.println("  -r, --run                  Compile the generated C++ and run it.");
		System.out.println("  -s, --symbols <file>       Write the analysed symbol table as JSON.");
	}

	// --- Getters ---

	public Path getInputFile()
	{
		return inputFile;
	}

	public Path getOutputPath()
	{
		return outputPath;
	}

	public Path getExecutablePath()
	{
		return executablePath;
	}

	public Path getSymbolsPath()
	{
		return symbolsPath;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	public boolean isVersionFlag()
	{
		return versionFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public boolean isCheckOnly()
	{
		return checkOnly;
	}

	public boolean isRunAfterCompile()
	{
		return runAfterCompile;
	}
}
