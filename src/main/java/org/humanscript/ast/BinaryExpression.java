package org.humanscript.ast;

public final class BinaryExpression extends Expression
{
	private final Expression left;
	private final BinaryOperator operator;
	private final Expression right;

	public BinaryExpression(Expression left, BinaryOperator operator, Expression right, int line)
	{
		super(line);
		this.left = left;
		this.operator = operator;
		this.right = right;
	}

	public Expression getLeft()
	{
		return left;
	}

	public BinaryOperator getOperator()
	{
		return operator;
	}

	public Expression getRight()
	{
		return right;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitBinaryExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + left + " " + operator.getSymbol() + " " + right + ")";
	}
}
