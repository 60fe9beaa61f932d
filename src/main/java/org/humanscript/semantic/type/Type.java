package org.humanscript.semantic.type;

public interface Type
{
	String getName();

	/**
	 * Whether a value of this type may initialize a variable of type {@code target}.
	 */
	boolean isAssignableTo(Type target);

	default boolean isNumeric()
	{
		return false;
	}

	default boolean isInteger()
	{
		return false;
	}

	default boolean isText()
	{
		return false;
	}

	default boolean isBoolean()
	{
		return false;
	}

	/**
	 * False for {@code void} and {@code unknown}: the types no value can have.
	 */
	default boolean isValueType()
	{
		return false;
	}

	static Type getWiderType(Type a, Type b)
	{
		return PrimitiveType.getWiderType(a, b);
	}
}
