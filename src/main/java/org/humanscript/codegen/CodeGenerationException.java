package org.humanscript.codegen;

import org.humanscript.util.CompilationException;

/**
 * A construct the generator has no lowering for. Only reachable when code generation runs on a
 * tree the semantic pass did not accept.
 */
public class CodeGenerationException extends CompilationException
{
	public CodeGenerationException(String message, int line)
	{
		super(Phase.CODE_GENERATION, message, line);
	}

	public CodeGenerationException(String message)
	{
		this(message, 0);
	}
}
