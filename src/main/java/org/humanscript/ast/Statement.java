package org.humanscript.ast;

public abstract class Statement
{
	private final int line;

	protected Statement(int line)
	{
		this.line = line;
	}

	public int getLine()
	{
		return line;
	}

	public abstract <R> R accept(StatementVisitor<R> visitor);
}
