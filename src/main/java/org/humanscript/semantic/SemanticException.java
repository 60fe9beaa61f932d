package org.humanscript.semantic;

import org.humanscript.util.CompilationException;

public class SemanticException extends CompilationException
{
	public SemanticException(String message, int line)
	{
		super(Phase.SEMANTIC, message, line);
	}
}
