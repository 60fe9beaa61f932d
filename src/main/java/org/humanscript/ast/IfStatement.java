package org.humanscript.ast;

import java.util.Optional;

public final class IfStatement extends Statement
{
	private final Expression condition;
	private final Statement thenBranch;
	private final Statement elseBranch; // null when there is no else

	public IfStatement(Expression condition, Statement thenBranch, Statement elseBranch, int line)
	{
		super(line);
		this.condition = condition;
		this.thenBranch = thenBranch;
		this.elseBranch = elseBranch;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public Statement getThenBranch()
	{
		return thenBranch;
	}

	public Optional<Statement> getElseBranch()
	{
		return Optional.ofNullable(elseBranch);
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitIfStatement(this);
	}

	@Override
	public String toString()
	{
		String result = "if (" + condition + ") " + thenBranch;
		if (elseBranch != null)
		{
			result += " else " + elseBranch;
		}
		return result;
	}
}
