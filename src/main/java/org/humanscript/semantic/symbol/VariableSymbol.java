package org.humanscript.semantic.symbol;

import org.humanscript.semantic.type.Type;

public class VariableSymbol implements Symbol
{
	private final String name;
	private final Type type;
	private final boolean initialized;

	public VariableSymbol(String name, Type type, boolean initialized)
	{
		this.name = name;
		this.type = type;
		this.initialized = initialized;
	}

	@Override
	public String getName()
	{
		return name;
	}

	/**
	 * The declared type, which may be wider than the initializer's own type.
	 */
	@Override
	public Type getType()
	{
		return type;
	}

	public boolean isInitialized()
	{
		return initialized;
	}
}
