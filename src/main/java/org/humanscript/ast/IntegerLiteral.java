package org.humanscript.ast;

public final class IntegerLiteral extends Expression
{
	private final long value;

	public IntegerLiteral(long value, int line)
	{
		super(line);
		this.value = value;
	}

	public long getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitIntegerLiteral(this);
	}

	@Override
	public String toString()
	{
		return Long.toString(value);
	}
}
