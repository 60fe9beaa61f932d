package org.humanscript.util;

/**
 * Console logging for the compiler. Normal progress and warnings go to standard output,
 * errors to standard error, each level in its own ANSI color. Pipeline tracing through
 * {@link #logDebug(String)} only appears when {@link #ENABLE_DEBUG} is set by {@code -v}.
 */
public class Debug
{
	// ANSI escape codes for colors
	public static final String ANSI_RESET = "\u001B[0m";
	public static final String ANSI_YELLOW = "\u001B[33m";
	public static final String ANSI_RED = "\u001B[31m";
	public static final String ANSI_GREEN = "\u001B[32m";

	// Toggled by -v / --verbose.
	public static boolean ENABLE_DEBUG = false;

	public static void log(String log)
	{
		System.out.println(log);
	}

	public static void logInfo(String log)
	{
		System.out.println(ANSI_GREEN + log + ANSI_RESET);
	}

	/**
	 * Stage tracing: token, tree and include dumps. Silent unless verbose.
	 */
	public static void logDebug(String log)
	{
		if (ENABLE_DEBUG)
		{
			System.out.println(log);
		}
	}

	public static void logWarning(String log)
	{
		System.out.println(ANSI_YELLOW + log + ANSI_RESET);
	}

	/**
	 * Compilation and toolchain failures; the only level written to standard error.
	 */
	public static void logError(String log)
	{
		System.err.println(ANSI_RED + log + ANSI_RESET);
	}
}
