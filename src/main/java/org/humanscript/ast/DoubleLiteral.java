package org.humanscript.ast;

public final class DoubleLiteral extends Expression
{
	private final double value;

	public DoubleLiteral(double value, int line)
	{
		super(line);
		this.value = value;
	}

	public double getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitDoubleLiteral(this);
	}

	@Override
	public String toString()
	{
		return Double.toString(value);
	}
}
