package org.humanscript.codegen;

import org.humanscript.semantic.type.PrimitiveType;
import org.humanscript.semantic.type.Type;

import java.util.Map;

public class TypeConverter
{
	private static final Map<PrimitiveType, String> CPP_TYPES = Map.of(
			PrimitiveType.NUMBER, "int",
			PrimitiveType.LNUMBER, "long long",
			PrimitiveType.TEXT, "std::string",
			PrimitiveType.LOGIC, "bool",
			PrimitiveType.RIEL, "double",
			PrimitiveType.VOID, "void"
	);

	public static String toCppType(Type type)
	{
		String cppType = type instanceof PrimitiveType primitive ? CPP_TYPES.get(primitive) : null;
		if (cppType == null)
		{
			throw new CodeGenerationException("Cannot map type '" + type.getName() + "' to a C++ type.");
		}
		return cppType;
	}

	/**
	 * Types {@code std::cout} prints directly; anything else needs {@code std::to_string} first.
	 */
	public static boolean isDirectlyStreamable(Type type)
	{
		return type.isText() || type.isNumeric() || type.isBoolean();
	}
}
