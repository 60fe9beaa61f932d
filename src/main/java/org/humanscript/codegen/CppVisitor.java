package org.humanscript.codegen;

import org.humanscript.ast.*;
import org.humanscript.semantic.TypeAnnotations;
import org.humanscript.semantic.type.Type;

/**
 * Renders statements as indented C++ lines and expressions as C++ expression text.
 * Trusts the annotations: nothing here re-checks types.
 */
public class CppVisitor implements StatementVisitor<Void>, ExpressionVisitor<String>
{
	private static final String INDENT = "    ";

	private final TypeAnnotations annotations;
	private final StringBuilder out;
	private int depth;

	public CppVisitor(TypeAnnotations annotations, StringBuilder out, int depth)
	{
		this.annotations = annotations;
		this.out = out;
		this.depth = depth;
	}

	private void line(String text)
	{
		out.append(INDENT.repeat(depth)).append(text).append('\n');
	}

	public String render(Expression expression)
	{
		return expression.accept(this);
	}

	private Type typeOf(Expression expression)
	{
		return annotations.typeOf(expression);
	}

	// --- Statements ---

	@Override
	public Void visitVariableDeclaration(VariableDeclaration node)
	{
		String cppType = TypeConverter.toCppType(node.getDeclaredType());
		line(cppType + " " + node.getName() + " = " + render(node.getInitializer()) + ";");
		return null;
	}

	@Override
	public Void visitSaysStatement(SaysStatement node)
	{
		Expression expression = node.getExpression();
		String code = render(expression);
		if (!TypeConverter.isDirectlyStreamable(typeOf(expression)))
		{
			code = "std::to_string(" + code + ")";
		}
		line("std::cout << (" + code + ") << std::endl;");
		return null;
	}

	@Override
	public Void visitIfStatement(IfStatement node)
	{
		String condition = render(node.getCondition());
		// Binary expressions already come parenthesized.
		if (!(node.getCondition() instanceof BinaryExpression))
		{
			condition = "(" + condition + ")";
		}

		line("if " + condition + " {");
		renderBranch(node.getThenBranch());
		if (node.getElseBranch().isPresent())
		{
			line("} else {");
			renderBranch(node.getElseBranch().get());
		}
		line("}");
		return null;
	}

	/**
	 * Emits the body of a braced branch: a block contributes its own statements, a bare statement
	 * gets braces synthesized around it by the caller.
	 */
	private void renderBranch(Statement branch)
	{
		depth++;
		if (branch instanceof BlockStatement block)
		{
			for (Statement statement : block.getStatements())
			{
				statement.accept(this);
			}
		}
		else
		{
			branch.accept(this);
		}
		depth--;
	}

	@Override
	public Void visitBlockStatement(BlockStatement node)
	{
		line("{");
		depth++;
		for (Statement statement : node.getStatements())
		{
			statement.accept(this);
		}
		depth--;
		line("}");
		return null;
	}

	// --- Expressions ---

	@Override
	public String visitIntegerLiteral(IntegerLiteral node)
	{
		return node.getValue() + "LL";
	}

	@Override
	public String visitDoubleLiteral(DoubleLiteral node)
	{
		String s = Double.toString(node.getValue());
		if (s.indexOf('.') < 0 && s.indexOf('e') < 0 && s.indexOf('E') < 0)
		{
			s += ".0";
		}
		return s;
	}

	@Override
	public String visitStringLiteral(StringLiteral node)
	{
		return escape(node.getValue());
	}

	public static String escape(String value)
	{
		StringBuilder sb = new StringBuilder("\"");
		for (char c : value.toCharArray())
		{
			switch (c)
			{
				case '"' -> sb.append("\\\"");
				case '\\' -> sb.append("\\\\");
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				default -> sb.append(c);
			}
		}
		return sb.append('"').toString();
	}

	@Override
	public String visitBooleanLiteral(BooleanLiteral node)
	{
		return node.getValue() ? "true" : "false";
	}

	@Override
	public String visitIdentifier(Identifier node)
	{
		return node.getName();
	}

	@Override
	public String visitBinaryExpression(BinaryExpression node)
	{
		String left = render(node.getLeft());
		String right = render(node.getRight());
		String op;

		switch (node.getOperator())
		{
			case PLUS:
				if (typeOf(node).isText())
				{
					if (!typeOf(node.getLeft()).isText())
					{
						left = "std::to_string(" + left + ")";
					}
					if (!typeOf(node.getRight()).isText())
					{
						right = "std::to_string(" + right + ")";
					}
				}
				op = "+";
				break;
			case EQUALS:
				op = "==";
				break;
			default:
				throw new CodeGenerationException("Unsupported binary operator for C++ code generation: "
						+ node.getOperator().getSymbol(), node.getLine());
		}

		// Two C string literals cannot be added or compared by value in C++.
		if (node.getLeft() instanceof StringLiteral && node.getRight() instanceof StringLiteral)
		{
			left = "std::string(" + left + ")";
		}
		return "(" + left + " " + op + " " + right + ")";
	}
}
