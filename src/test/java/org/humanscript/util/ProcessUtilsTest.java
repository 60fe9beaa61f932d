package org.humanscript.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

class ProcessUtilsTest
{
	private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
	private PrintStream originalOut;

	@BeforeEach
	void captureOut()
	{
		assumeFalse(NativeCompiler.isWindows());
		originalOut = System.out;
		System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
	}

	@AfterEach
	void restoreOut()
	{
		if (originalOut != null)
		{
			System.setOut(originalOut);
		}
	}

	@Test
	void toolOutputIsDecodedAsUtf8() throws Exception
	{
		// Octal escapes keep the command line ASCII; the bytes written are UTF-8 for "ü".
		ProcessUtils.executeCommand(new ProcessBuilder("sh", "-c", "printf 'caf\\303\\274\\n'"));

		assertTrue(captured.toString(StandardCharsets.UTF_8).contains("cafü"), captured.toString(StandardCharsets.UTF_8));
	}

	@Test
	void nonZeroExitFails()
	{
		RuntimeException e = assertThrows(RuntimeException.class,
				() -> ProcessUtils.executeCommand(new ProcessBuilder("sh", "-c", "exit 3")));
		assertTrue(e.getMessage().contains("exit code 3"));
	}

	@Test
	void interactiveRunReturnsExitCode() throws Exception
	{
		assertEquals(5, ProcessUtils.executeInteractive(new ProcessBuilder("sh", "-c", "exit 5")));
	}
}
