package org.humanscript.util;

public class ErrorHandler
{
	private boolean hasErrors = false;

	public void report(CompilationException e)
	{
		String err;
		if (e.getLine() > 0)
		{
			err = String.format("[%s Error] line %d - %s", e.getPhase().getLabel(), e.getLine(), e.getMessage());
		}
		else
		{
			err = String.format("[%s Error] %s", e.getPhase().getLabel(), e.getMessage());
		}
		Debug.logError(err);
		hasErrors = true;
	}

	public void logError(String msg)
	{
		Debug.logError(msg);
		hasErrors = true;
	}

	public boolean hasErrors()
	{
		return hasErrors;
	}
}
