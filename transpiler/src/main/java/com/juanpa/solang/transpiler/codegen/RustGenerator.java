package com.juanpa.solang.transpiler.codegen;

import com.juanpa.solang.transpiler.ast.Program;
import com.juanpa.solang.transpiler.ast.declarations.FunctionDeclaration;
import com.juanpa.solang.transpiler.ast.statements.*;

/**
 * Generates plain Rust. Top-level functions are hoisted above {@code fn main()} and return
 * {@code i32}; everything else goes into {@code main}.
 * <p>
 * The Solana generators extend this class and reuse its statement lowering inside
 * instruction bodies.
 */
public class RustGenerator extends CodeGenerator
{
	public RustGenerator(GenerationContext context)
	{
		super(context);
	}

	@Override
	public String visitProgram(Program program)
	{
		for (Statement statement : program.getStatements())
		{
			if (statement instanceof FunctionDeclaration)
			{
				statement.accept(this);
			}
		}

		appendLine("fn main() {");
		indent();
		for (Statement statement : program.getStatements())
		{
			if (statement != null && !(statement instanceof FunctionDeclaration))
			{
				statement.accept(this);
			}
		}
		dedent();
		appendLine("}");
		return null;
	}

	@Override
	public String visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		GenerationContext.Scope previous = context.enterScope(GenerationContext.Scope.FUNCTION);
		appendLine("fn " + declaration.getName().getLexeme() + "() -> i32 {");
		emitBody(declaration.getBody());
		indent();
		appendLine("0");
		dedent();
		appendLine("}");
		appendBlankLine();
		context.restoreScope(previous);
		return null;
	}

	@Override
	public String visitVariableDeclarationStatement(VariableDeclarationStatement statement)
	{
		appendLine("let " + statement.getName().getLexeme() + " = " + expr(statement.getInitializer()) + ";");
		return null;
	}

	@Override
	public String visitPrintStatement(PrintStatement statement)
	{
		appendLine("println!(\"{}\", " + expr(statement.getValue()) + ");");
		return null;
	}

	/**
	 * {@code main} returns unit and an instruction returns {@code Result}, so only a function
	 * body keeps the returned value.
	 */
	@Override
	public String visitReturnStatement(ReturnStatement statement)
	{
		switch (context.getScope())
		{
			case FUNCTION:
				appendLine("return " + expr(statement.getValue()) + ";");
				break;
			case INSTRUCTION:
				appendLine("return Ok(());");
				break;
			default:
				appendLine("return;");
				break;
		}
		return null;
	}

	/**
	 * Escapes text for use inside a Rust format string literal.
	 */
	protected static String formatStringContent(String text)
	{
		return text.replace("\\", "\\\\")
				.replace("\"", "\\\"")
				.replace("{", "{{")
				.replace("}", "}}");
	}
}
