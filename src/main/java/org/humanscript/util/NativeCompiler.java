package org.humanscript.util;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.humanscript.util.ProcessUtils.executeCommand;
import static org.humanscript.util.ProcessUtils.executeInteractive;

/**
 * Hands generated C++ to the host toolchain and runs the resulting executable.
 */
public class NativeCompiler
{
	private final String compiler;

	public NativeCompiler(String compiler)
	{
		this.compiler = compiler;
	}

	public NativeCompiler()
	{
		this(detectCompiler());
	}

	public static boolean isWindows()
	{
		return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
	}

	/**
	 * Picks the first working C++ compiler on the PATH.
	 *
	 * @return {@code clang++} or {@code g++} on Unix-like systems, {@code g++} or {@code cl} on Windows,
	 * and {@code g++} when nothing answers.
	 */
	public static String detectCompiler()
	{
		if (isWindows())
		{
			if (ProcessUtils.isCommandAvailable("g++", "--version"))
			{
				return "g++";
			}
			if (ProcessUtils.isCommandAvailable("cl", "/?"))
			{
				return "cl";
			}
			return "g++";
		}

		if (ProcessUtils.isCommandAvailable("clang++", "--version"))
		{
			return "clang++";
		}
		if (ProcessUtils.isCommandAvailable("g++", "--version"))
		{
			return "g++";
		}
		return "g++";
	}

	public String getCompiler()
	{
		return compiler;
	}

	public List<String> buildCompileCommand(Path cppFile, Path executableFile)
	{
		List<String> command = new ArrayList<>();
		command.add(compiler);
		if (compiler.equals("cl"))
		{
			command.add("/EHsc");
			command.add("/Fe" + executableFile);
			command.add(cppFile.toString());
			command.add("/std:c++17");
			command.add("/O2");
		}
		else
		{
			command.add("-std=c++17");
			command.add("-O2");
			command.add(cppFile.toString());
			command.add("-o");
			command.add(executableFile.toString());
		}
		return command;
	}

	public void compileExecutable(Path cppFile, Path executableFile) throws IOException, InterruptedException
	{
		List<String> command = buildCompileCommand(cppFile, executableFile);
		Debug.log("Executing: " + String.join(" ", command));
		executeCommand(new ProcessBuilder(command));
	}

	/**
	 * @return the exit code of the compiled program.
	 */
	public int run(Path executableFile) throws IOException, InterruptedException
	{
		return executeInteractive(new ProcessBuilder(executableFile.toAbsolutePath().toString()));
	}
}
