package org.humanscript.ast;

/**
 * Base of all expression nodes. Dispatch goes through {@link ExpressionVisitor}, which has one
 * method per variant, so every pass handles the full set of expressions.
 * <p>
 * Nodes use identity equality; the semantic pass keys its type annotations on node identity.
 */
public abstract class Expression
{
	private final int line;

	protected Expression(int line)
	{
		this.line = line;
	}

	public int getLine()
	{
		return line;
	}

	public abstract <R> R accept(ExpressionVisitor<R> visitor);
}
