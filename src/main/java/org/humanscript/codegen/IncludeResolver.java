package org.humanscript.codegen;

import org.humanscript.ast.*;
import org.humanscript.semantic.TypeAnnotations;
import org.humanscript.util.Debug;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides the include section from the analysed program before any code is rendered.
 * <p>
 * {@code <string>} is added when text is used, {@code <iostream>} when something is printed. Printing
 * also pulls in {@code <iomanip>} for {@code std::boolalpha} and {@code <string>} for
 * {@code std::to_string}. A header already named by a {@code use} declaration is never repeated.
 */
public final class IncludeResolver
{
	public static final String IOSTREAM = "iostream";
	public static final String STRING = "string";
	public static final String IOMANIP = "iomanip";

	private IncludeResolver()
	{
	}

	public static IncludePlan resolve(Program program, TypeAnnotations annotations)
	{
		List<String> useHeaders = new ArrayList<>();
		for (UseDeclaration use : program.getUseDeclarations())
		{
			useHeaders.add(use.getHeaderName());
		}

		UsageScan scan = new UsageScan(annotations);
		for (Statement statement : program.getStatements())
		{
			statement.accept(scan);
		}

		List<IncludePlan.AutoInclude> autoIncludes = new ArrayList<>();
		boolean ioStream = useHeaders.contains(IOSTREAM);
		boolean string = useHeaders.contains(STRING);

		if (scan.textUsed && !string)
		{
			autoIncludes.add(new IncludePlan.AutoInclude(STRING, "Auto-included for text type or string operations"));
			string = true;
		}

		if (scan.saysUsed)
		{
			if (!ioStream)
			{
				autoIncludes.add(new IncludePlan.AutoInclude(IOSTREAM, "Auto-included for 'says'"));
				ioStream = true;
			}
			if (!useHeaders.contains(IOMANIP))
			{
				autoIncludes.add(new IncludePlan.AutoInclude(IOMANIP, "For std::boolalpha with 'says'"));
			}
			if (!string)
			{
				autoIncludes.add(new IncludePlan.AutoInclude(STRING, "For std::to_string with 'says'"));
			}
		}

		Debug.logDebug("IncludeResolver: says used=" + scan.saysUsed + ", text used=" + scan.textUsed
				+ ", " + autoIncludes.size() + " auto include(s)");
		return new IncludePlan(useHeaders, autoIncludes, ioStream);
	}

	/**
	 * Single pass over the statements, descending into if branches and blocks.
	 */
	private static final class UsageScan implements StatementVisitor<Void>, ExpressionVisitor<Void>
	{
		private final TypeAnnotations annotations;
		private boolean saysUsed = false;
		private boolean textUsed = false;

		private UsageScan(TypeAnnotations annotations)
		{
			this.annotations = annotations;
		}

		private void scan(Expression expression)
		{
			if (annotations.typeOf(expression).isText())
			{
				textUsed = true;
			}
			expression.accept(this);
		}

		@Override
		public Void visitVariableDeclaration(VariableDeclaration node)
		{
			if (node.getDeclaredType().isText())
			{
				textUsed = true;
			}
			scan(node.getInitializer());
			return null;
		}

		@Override
		public Void visitSaysStatement(SaysStatement node)
		{
			saysUsed = true;
			scan(node.getExpression());
			return null;
		}

		@Override
		public Void visitIfStatement(IfStatement node)
		{
			scan(node.getCondition());
			node.getThenBranch().accept(this);
			node.getElseBranch().ifPresent(elseBranch -> elseBranch.accept(this));
			return null;
		}

		@Override
		public Void visitBlockStatement(BlockStatement node)
		{
			for (Statement statement : node.getStatements())
			{
				statement.accept(this);
			}
			return null;
		}

		@Override
		public Void visitIntegerLiteral(IntegerLiteral node)
		{
			return null;
		}

		@Override
		public Void visitDoubleLiteral(DoubleLiteral node)
		{
			return null;
		}

		@Override
		public Void visitStringLiteral(StringLiteral node)
		{
			return null;
		}

		@Override
		public Void visitBooleanLiteral(BooleanLiteral node)
		{
			return null;
		}

		@Override
		public Void visitIdentifier(Identifier node)
		{
			return null;
		}

		@Override
		public Void visitBinaryExpression(BinaryExpression node)
		{
			scan(node.getLeft());
			scan(node.getRight());
			return null;
		}
	}
}
