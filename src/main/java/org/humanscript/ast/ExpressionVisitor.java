package org.humanscript.ast;

public interface ExpressionVisitor<R>
{
	R visitIntegerLiteral(IntegerLiteral node);

	R visitDoubleLiteral(DoubleLiteral node);

	R visitStringLiteral(StringLiteral node);

	R visitBooleanLiteral(BooleanLiteral node);

	R visitIdentifier(Identifier node);

	R visitBinaryExpression(BinaryExpression node);
}
