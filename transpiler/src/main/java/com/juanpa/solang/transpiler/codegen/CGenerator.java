package com.juanpa.solang.transpiler.codegen;

import com.juanpa.solang.transpiler.ast.Program;
import com.juanpa.solang.transpiler.ast.declarations.FunctionDeclaration;
import com.juanpa.solang.transpiler.ast.expressions.Expression;
import com.juanpa.solang.transpiler.ast.statements.*;

/**
 * Generates plain C.
 * Top-level functions are hoisted above {@code main}; every other top-level statement goes into
 * {@code main}. Values are {@code int}, except string literal initializers which become
 * {@code const char*}.
 */
public class CGenerator extends CodeGenerator
{
	public CGenerator(GenerationContext context)
	{
		super(context);
	}

	@Override
	public String visitProgram(Program program)
	{
		appendLine("#include <stdio.h>");
		appendLine("#include <stdlib.h>");
		appendLine("#include <string.h>");
		appendBlankLine();

		for (Statement statement : program.getStatements())
		{
			if (statement instanceof FunctionDeclaration)
			{
				statement.accept(this);
			}
		}

		appendLine("int main() {");
		indent();
		for (Statement statement : program.getStatements())
		{
			if (statement != null && !(statement instanceof FunctionDeclaration))
			{
				statement.accept(this);
			}
		}
		appendLine("return 0;");
		dedent();
		appendLine("}");
		return null;
	}

	@Override
	public String visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		appendLine("int " + declaration.getName().getLexeme() + "() {");
		emitBody(declaration.getBody());
		indent();
		appendLine("return 0;");
		dedent();
		appendLine("}");
		appendBlankLine();
		return null;
	}

	@Override
	public String visitVariableDeclarationStatement(VariableDeclarationStatement statement)
	{
		Expression initializer = statement.getInitializer();
		String type = isStringLiteral(initializer) ? "const char*" : "int";
		appendLine(type + " " + statement.getName().getLexeme() + " = " + expr(initializer) + ";");
		return null;
	}

	@Override
	public String visitPrintStatement(PrintStatement statement)
	{
		String format = isStringLiteral(statement.getValue()) ? "%s" : "%d";
		appendLine("printf(\"" + format + "\\n\", " + expr(statement.getValue()) + ");");
		return null;
	}

	@Override
	protected String formatCondition(Expression condition)
	{
		return "(" + expr(condition) + ")";
	}

	@Override
	public String visitReturnStatement(ReturnStatement statement)
	{
		appendLine("return " + expr(statement.getValue()) + ";");
		return null;
	}
}
