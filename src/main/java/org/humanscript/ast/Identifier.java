package org.humanscript.ast;

public final class Identifier extends Expression
{
	private final String name;

	public Identifier(String name, int line)
	{
		super(line);
		this.name = name;
	}

	public String getName()
	{
		return name;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitIdentifier(this);
	}

	@Override
	public String toString()
	{
		return name;
	}
}
