package org.humanscript.semantic;

import org.humanscript.ast.*;
import org.humanscript.semantic.symbol.Symbol;
import org.humanscript.semantic.symbol.SymbolTable;
import org.humanscript.semantic.symbol.VariableSymbol;
import org.humanscript.semantic.type.PrimitiveType;
import org.humanscript.semantic.type.Type;
import org.humanscript.semantic.type.UnknownType;
import org.humanscript.util.Debug;

import java.util.Optional;

/**
 * Walks statements top-down and types expressions bottom-up, recording every expression's type
 * in {@link TypeAnnotations}. The first violation throws a {@link SemanticException}.
 */
public class TypeCheckVisitor implements StatementVisitor<Void>, ExpressionVisitor<Type>
{
	private final SymbolTable symbolTable;
	private final TypeAnnotations annotations;

	public TypeCheckVisitor(SymbolTable symbolTable, TypeAnnotations annotations)
	{
		this.symbolTable = symbolTable;
		this.annotations = annotations;
	}

	/**
	 * Types an expression tree and records the result for the root and every sub-expression.
	 */
	public Type typeOf(Expression expression)
	{
		Type type = expression.accept(this);
		annotations.note(expression, type);
		return type;
	}

	public static boolean isAssignable(Type target, Type value)
	{
		return value.isAssignableTo(target);
	}

	/**
	 * Result type of a binary operation, {@link UnknownType#INSTANCE} when the operator is not defined
	 * for the operand pair.
	 */
	public static Type binaryResultType(Type left, Type right, BinaryOperator operator)
	{
		switch (operator)
		{
			case PLUS:
				if (left.isNumeric() && right.isNumeric())
				{
					return Type.getWiderType(left, right);
				}
				// Mixed text + value builds a string; the other side is stringified at code generation.
				if (left.isText() && right.isValueType())
				{
					return PrimitiveType.TEXT;
				}
				if (right.isText() && left.isValueType())
				{
					return PrimitiveType.TEXT;
				}
				return UnknownType.INSTANCE;
			case EQUALS:
				if (left.equals(right) && left.isValueType())
				{
					return PrimitiveType.LOGIC;
				}
				if (left.isNumeric() && right.isNumeric())
				{
					return PrimitiveType.LOGIC;
				}
				return UnknownType.INSTANCE;
			default:
				return UnknownType.INSTANCE;
		}
	}

	// --- Statements ---

	@Override
	public Void visitVariableDeclaration(VariableDeclaration node)
	{
		String name = node.getName();
		if (symbolTable.contains(name))
		{
			throw new SemanticException("Variable '" + name + "' already declared in this scope.", node.getLine());
		}

		Type initializerType = typeOf(node.getInitializer());
		PrimitiveType declaredType = node.getDeclaredType();
		if (!isAssignable(declaredType, initializerType))
		{
			throw new SemanticException("Type mismatch in variable declaration of '" + name + "'. Cannot assign type "
					+ initializerType.getName() + " to variable of type " + declaredType.getName() + ".", node.getLine());
		}

		symbolTable.define(new VariableSymbol(name, declaredType, true));
		Debug.logDebug("Semantic Info: Declared variable '" + name + "' of type " + declaredType.getName());
		return null;
	}

	@Override
	public Void visitSaysStatement(SaysStatement node)
	{
		Type type = typeOf(node.getExpression());
		if (!type.isValueType())
		{
			throw new SemanticException("'says' statement cannot print an expression of type " + type.getName() + ".", node.getLine());
		}
		Debug.logDebug("Semantic Info: 'says' statement with expression of type " + type.getName());
		return null;
	}

	@Override
	public Void visitIfStatement(IfStatement node)
	{
		Type conditionType = typeOf(node.getCondition());
		if (conditionType != PrimitiveType.LOGIC)
		{
			throw new SemanticException("If statement condition must be of type 'logic', got "
					+ conditionType.getName() + " instead.", node.getCondition().getLine());
		}

		node.getThenBranch().accept(this);
		node.getElseBranch().ifPresent(elseBranch -> elseBranch.accept(this));
		Debug.logDebug("Semantic Info: Processed if statement");
		return null;
	}

	@Override
	public Void visitBlockStatement(BlockStatement node)
	{
		// Same symbol table as the enclosing code: blocks do not scope.
		for (Statement statement : node.getStatements())
		{
			statement.accept(this);
		}
		Debug.logDebug("Semantic Info: Processed block statement");
		return null;
	}

	// --- Expressions ---

	@Override
	public Type visitIntegerLiteral(IntegerLiteral node)
	{
		return PrimitiveType.LNUMBER;
	}

	@Override
	public Type visitDoubleLiteral(DoubleLiteral node)
	{
		return PrimitiveType.RIEL;
	}

	@Override
	public Type visitStringLiteral(StringLiteral node)
	{
		return PrimitiveType.TEXT;
	}

	@Override
	public Type visitBooleanLiteral(BooleanLiteral node)
	{
		return PrimitiveType.LOGIC;
	}

	@Override
	public Type visitIdentifier(Identifier node)
	{
		Optional<Symbol> symbol = symbolTable.resolve(node.getName());
		if (symbol.isEmpty())
		{
			throw new SemanticException("Variable '" + node.getName() + "' used before declaration.", node.getLine());
		}
		return symbol.get().getType();
	}

	@Override
	public Type visitBinaryExpression(BinaryExpression node)
	{
		Type left = typeOf(node.getLeft());
		Type right = typeOf(node.getRight());

		Type result = binaryResultType(left, right, node.getOperator());
		if (result == UnknownType.INSTANCE)
		{
			throw new SemanticException("Invalid operands for binary operator '" + node.getOperator().getSymbol()
					+ "'. Left type: " + left.getName() + ", Right type: " + right.getName() + ".", node.getLine());
		}
		return result;
	}
}
