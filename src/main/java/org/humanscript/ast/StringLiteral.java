package org.humanscript.ast;

public final class StringLiteral extends Expression
{
	// Decoded value, escapes already resolved by the lexer.
	private final String value;

	public StringLiteral(String value, int line)
	{
		super(line);
		this.value = value;
	}

	public String getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitStringLiteral(this);
	}

	@Override
	public String toString()
	{
		return "\"" + value + "\"";
	}
}
