package org.humanscript.semantic;

import org.humanscript.ast.Program;
import org.humanscript.ast.Statement;
import org.humanscript.ast.UseDeclaration;
import org.humanscript.semantic.symbol.SymbolTable;
import org.humanscript.util.Debug;

public class SemanticAnalyzer
{
	private final SymbolTable symbolTable = new SymbolTable();

	/**
	 * Type checks a whole program. The symbol table is cleared first, so one analyzer can check
	 * several programs, or the same program twice, independently.
	 *
	 * @return the type of every expression in the program.
	 * @throws SemanticException on the first redeclaration, undeclared use, type mismatch,
	 *                           non-logic condition, invalid operands or unprintable value.
	 */
	public TypeAnnotations analyze(Program program)
	{
		symbolTable.clear();
		TypeAnnotations annotations = new TypeAnnotations();
		TypeCheckVisitor typeChecker = new TypeCheckVisitor(symbolTable, annotations);

		for (UseDeclaration use : program.getUseDeclarations())
		{
			Debug.logDebug("Semantic Info: Processing 'use <" + use.getHeaderName() + ">;' declaration.");
		}

		for (Statement statement : program.getStatements())
		{
			statement.accept(typeChecker);
		}

		Debug.logDebug("Semantic analysis completed: " + symbolTable.size() + " variable(s), "
				+ annotations.size() + " typed expression(s).");
		return annotations;
	}

	public SymbolTable getSymbolTable()
	{
		return symbolTable;
	}
}
