package org.humanscript.semantic.symbol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * The single, flat variable namespace of a HumanScript program. Blocks and if branches
 * share it, so a name declared anywhere stays visible for the rest of the program.
 */
public class SymbolTable
{
	private final Map<String, Symbol> symbols = new LinkedHashMap<>();

	/**
	 * @throws IllegalStateException if the name is already defined; callers check {@link #contains} first.
	 */
	public void define(Symbol sym)
	{
		if (symbols.putIfAbsent(sym.getName(), sym) != null)
		{
			throw new IllegalStateException("Symbol already defined: " + sym.getName());
		}
	}

	public Optional<Symbol> resolve(String name)
	{
		return Optional.ofNullable(symbols.get(name));
	}

	public boolean contains(String name)
	{
		return symbols.containsKey(name);
	}

	public void clear()
	{
		symbols.clear();
	}

	public int size()
	{
		return symbols.size();
	}

	/**
	 * @return a read-only view in declaration order.
	 */
	public Map<String, Symbol> getSymbols()
	{
		return Collections.unmodifiableMap(symbols);
	}

	public void forEachSymbol(BiConsumer<String, Symbol> visitor)
	{
		symbols.forEach(visitor);
	}
}
