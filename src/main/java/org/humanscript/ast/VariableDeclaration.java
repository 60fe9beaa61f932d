package org.humanscript.ast;

import org.humanscript.semantic.type.PrimitiveType;

public final class VariableDeclaration extends Statement
{
	private final PrimitiveType declaredType;
	private final String name;
	private final Expression initializer;

	public VariableDeclaration(PrimitiveType declaredType, String name, Expression initializer, int line)
	{
		super(line);
		this.declaredType = declaredType;
		this.name = name;
		this.initializer = initializer;
	}

	public PrimitiveType getDeclaredType()
	{
		return declaredType;
	}

	public String getName()
	{
		return name;
	}

	public Expression getInitializer()
	{
		return initializer;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitVariableDeclaration(this);
	}

	@Override
	public String toString()
	{
		return declaredType.getName() + " " + name + " := " + initializer + ";";
	}
}
