package org.humanscript.semantic.type;

/**
 * The type of an expression the analyzer has not typed (or could not type).
 * Never present in a successfully analysed program.
 */
public final class UnknownType implements Type
{
	public static final UnknownType INSTANCE = new UnknownType();

	private UnknownType()
	{
	}

	@Override
	public String getName()
	{
		return "unknown";
	}

	@Override
	public boolean isAssignableTo(Type target)
	{
		return false;
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
