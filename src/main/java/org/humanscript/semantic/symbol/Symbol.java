package org.humanscript.semantic.symbol;

import org.humanscript.semantic.type.Type;

public interface Symbol
{
	String getName();

	Type getType();
}
