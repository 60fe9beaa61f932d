package org.humanscript.ast;

public final class SaysStatement extends Statement
{
	private final Expression expression;

	public SaysStatement(Expression expression, int line)
	{
		super(line);
		this.expression = expression;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitSaysStatement(this);
	}

	@Override
	public String toString()
	{
		return "says " + expression + ";";
	}
}
