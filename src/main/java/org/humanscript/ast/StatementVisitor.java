package org.humanscript.ast;

public interface StatementVisitor<R>
{
	R visitVariableDeclaration(VariableDeclaration node);

	R visitSaysStatement(SaysStatement node);

	R visitIfStatement(IfStatement node);

	R visitBlockStatement(BlockStatement node);
}
