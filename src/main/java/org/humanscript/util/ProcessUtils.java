package org.humanscript.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

public class ProcessUtils
{
	public static void executeCommand(ProcessBuilder pb) throws IOException, InterruptedException
	{
		Debug.logDebug("Executing: " + String.join(" ", pb.command()));
		pb.redirectErrorStream(true);
		Process process = pb.start();

		try (BufferedReader output = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8)))
		{
			String s;
			while ((s = output.readLine()) != null)
			{
				Debug.log(s);
			}
		}

		int exitCode = process.waitFor();
		if (exitCode != 0)
		{
			throw new RuntimeException("Command failed with exit code " + exitCode + " for: " + String.join(" ", pb.command()));
		}
	}

	/**
	 * Runs a command attached to this process' console and returns its exit code.
	 */
	public static int executeInteractive(ProcessBuilder pb) throws IOException, InterruptedException
	{
		Debug.logDebug("Running: " + String.join(" ", pb.command()));
		Process process = pb.inheritIO().start();
		return process.waitFor();
	}

	/**
	 * Probes whether a tool can be started at all, e.g. {@code clang++ --version}.
	 */
	public static boolean isCommandAvailable(String... command)
	{
		try
		{
			Process process = new ProcessBuilder(command)
					.redirectErrorStream(true)
					.redirectOutput(ProcessBuilder.Redirect.DISCARD)
					.start();
			return process.waitFor() == 0;
		}
		catch (IOException e)
		{
			Debug.logDebug("Command not available: " + String.join(" ", command) + " (" + e.getMessage() + ")");
			return false;
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			return false;
		}
	}
}
