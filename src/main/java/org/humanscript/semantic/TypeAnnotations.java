package org.humanscript.semantic;

import org.humanscript.ast.Expression;
import org.humanscript.semantic.type.Type;
import org.humanscript.semantic.type.UnknownType;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Resolved type of every expression node, keyed by node identity. Filled by the semantic pass
 * and read by code generation; the tree itself stays untouched.
 */
public class TypeAnnotations
{
	private final Map<Expression, Type> resolvedTypes = new IdentityHashMap<>();

	void note(Expression expression, Type type)
	{
		resolvedTypes.put(expression, type);
	}

	/**
	 * @return the annotated type, or {@link UnknownType#INSTANCE} for a node the analyzer never typed.
	 */
	public Type typeOf(Expression expression)
	{
		return resolvedTypes.getOrDefault(expression, UnknownType.INSTANCE);
	}

	public boolean isAnnotated(Expression expression)
	{
		return resolvedTypes.containsKey(expression);
	}

	public int size()
	{
		return resolvedTypes.size();
	}
}
