package org.humanscript.semantic.type;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class PrimitiveType implements Type
{
	// --- Canonical Type Instances ---
	public static final PrimitiveType NUMBER = new PrimitiveType("number");
	public static final PrimitiveType LNUMBER = new PrimitiveType("lnumber");
	public static final PrimitiveType TEXT = new PrimitiveType("text");
	public static final PrimitiveType LOGIC = new PrimitiveType("logic");
	public static final PrimitiveType RIEL = new PrimitiveType("riel");
	public static final PrimitiveType VOID = new PrimitiveType("void");

	private static final Map<String, PrimitiveType> KEYWORD_TO_TYPE_MAP;
	// value type -> declared types it may initialize besides its own
	private static final Map<PrimitiveType, Set<PrimitiveType>> ASSIGNABLE_MAP = new HashMap<>();

	static
	{
		Map<String, PrimitiveType> map = new LinkedHashMap<>();
		map.put("number", NUMBER);
		map.put("lnumber", LNUMBER);
		map.put("text", TEXT);
		map.put("logic", LOGIC);
		map.put("riel", RIEL);
		KEYWORD_TO_TYPE_MAP = Collections.unmodifiableMap(map);

		// Integer literals are lnumber, so lnumber has to fit a number slot as well.
		ASSIGNABLE_MAP.put(LNUMBER, Set.of(NUMBER, RIEL));
		ASSIGNABLE_MAP.put(NUMBER, Set.of(RIEL));
	}

	/**
	 * @return an unmodifiable map of every type keyword usable in a declaration.
	 */
	public static Map<String, PrimitiveType> getAllTypeKeywords()
	{
		return KEYWORD_TO_TYPE_MAP;
	}

	public static Optional<PrimitiveType> fromKeyword(String keyword)
	{
		return Optional.ofNullable(KEYWORD_TO_TYPE_MAP.get(keyword));
	}

	private final String name;

	private PrimitiveType(String name)
	{
		this.name = name;
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public boolean isAssignableTo(Type target)
	{
		if (this == VOID)
		{
			return false;
		}
		if (this.equals(target))
		{
			return true;
		}
		Set<PrimitiveType> allowed = ASSIGNABLE_MAP.get(this);
		return allowed != null && target instanceof PrimitiveType && allowed.contains(target);
	}

	@Override
	public boolean isNumeric()
	{
		return isInteger() || this == RIEL;
	}

	@Override
	public boolean isInteger()
	{
		return this == NUMBER || this == LNUMBER;
	}

	@Override
	public boolean isText()
	{
		return this == TEXT;
	}

	@Override
	public boolean isBoolean()
	{
		return this == LOGIC;
	}

	@Override
	public boolean isValueType()
	{
		return this != VOID;
	}

	/**
	 * Result type of numeric promotion: riel over lnumber over number.
	 *
	 * @return the wider of two numeric types, or {@link UnknownType#INSTANCE} when either side is not numeric.
	 */
	public static Type getWiderType(Type a, Type b)
	{
		if (!a.isNumeric() || !b.isNumeric())
		{
			return UnknownType.INSTANCE;
		}
		if (a == RIEL || b == RIEL)
		{
			return RIEL;
		}
		if (a == LNUMBER || b == LNUMBER)
		{
			return LNUMBER;
		}
		return NUMBER;
	}

	@Override
	public String toString()
	{
		return name;
	}
}
