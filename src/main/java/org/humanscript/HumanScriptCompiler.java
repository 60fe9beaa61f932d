package org.humanscript;

import org.humanscript.ast.Program;
import org.humanscript.codegen.CodeGenerator;
import org.humanscript.lexer.Lexer;
import org.humanscript.lexer.LexerException;
import org.humanscript.lexer.Token;
import org.humanscript.lexer.TokenType;
import org.humanscript.parser.Parser;
import org.humanscript.semantic.SemanticAnalyzer;
import org.humanscript.semantic.TypeAnnotations;
import org.humanscript.util.Debug;

import java.util.List;

/**
 * Runs the whole front end on one in-memory source text:
 * tokens, then the tree, then type annotations, then C++.
 * Every stage fails by throwing a {@link org.humanscript.util.CompilationException}.
 */
public class HumanScriptCompiler
{
	public CompilationResult compile(String source)
	{
		return run(source, true);
	}

	/**
	 * Lexes, parses and analyses without generating code.
	 */
	public CompilationResult check(String source)
	{
		return run(source, false);
	}

	private CompilationResult run(String source, boolean generate)
	{
		Debug.logDebug("Lexing...");
		List<Token> tokens = Lexer.tokenize(source);
		Token last = tokens.get(tokens.size() - 1);
		if (last.getType() == TokenType.UNKNOWN)
		{
			throw new LexerException("Unknown character '" + last.getText() + "' on line " + last.getLine() + ".",
					last.getText(), last.getLine());
		}

		Debug.logDebug("Parsing...");
		Program program = Parser.parse(tokens);

		Debug.logDebug("Running semantic analysis...");
		SemanticAnalyzer analyzer = new SemanticAnalyzer();
		TypeAnnotations annotations = analyzer.analyze(program);

		String cppCode = null;
		if (generate)
		{
			Debug.logDebug("Generating C++...");
			cppCode = new CodeGenerator(program, annotations).generate();
		}
		return new CompilationResult(tokens, program, annotations, analyzer.getSymbolTable(), cppCode);
	}
}
