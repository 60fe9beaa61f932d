package org.humanscript.util;

/**
 * Base failure of the HumanScript pipeline. Every stage throws a subclass tagged with
 * the {@link Phase} it belongs to; the first one thrown aborts the whole compilation.
 */
public class CompilationException extends RuntimeException
{
	public enum Phase
	{
		LEXICAL("Lexer"),
		SYNTAX("Syntax"),
		SEMANTIC("Semantic"),
		CODE_GENERATION("Code Generation");

		private final String label;

		Phase(String label)
		{
			this.label = label;
		}

		public String getLabel()
		{
			return label;
		}
	}

	private final Phase phase;
	private final int line;

	public CompilationException(Phase phase, String message, int line)
	{
		super(message);
		this.phase = phase;
		this.line = line;
	}

	public Phase getPhase()
	{
		return phase;
	}

	/**
	 * @return the 1-based source line, or 0 when the failure is not tied to a line.
	 */
	public int getLine()
	{
		return line;
	}
}
