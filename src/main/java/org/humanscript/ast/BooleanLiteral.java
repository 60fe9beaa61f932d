package org.humanscript.ast;

public final class BooleanLiteral extends Expression
{
	private final boolean value;

	public BooleanLiteral(boolean value, int line)
	{
		super(line);
		this.value = value;
	}

	public boolean getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitBooleanLiteral(this);
	}

	@Override
	public String toString()
	{
		return value ? "true" : "false";
	}
}
