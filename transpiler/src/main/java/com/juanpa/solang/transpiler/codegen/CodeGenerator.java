// File: src/main/java/com/juanpa/solang/transpiler/codegen/CodeGenerator.java
package com.juanpa.solang.transpiler.codegen;

import com.juanpa.solang.transpiler.ast.ASTVisitor;
import com.juanpa.solang.transpiler.ast.Program;
import com.juanpa.solang.transpiler.ast.declarations.AccountDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.InstructionDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.ProgramDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.StateDeclaration;
import com.juanpa.solang.transpiler.ast.expressions.*;
import com.juanpa.solang.transpiler.ast.statements.*;

import java.util.List;

/**
 * Base class of the per-profile generators.
 * <p>
 * Generators traverse the AST once. Expression visits return the rendered expression text;
 * statement and declaration visits append complete lines to the output and return null.
 * A missing child never fails generation: it renders as {@code 0} (or nothing at all), so
 * incomplete input yields incomplete but deterministic output.
 * <p>
 * Domain nodes emit nothing here; the Solana generators override them.
 */
public abstract class CodeGenerator implements ASTVisitor<String>
{
	private static final String INDENT = "    ";

	protected final GenerationContext context;
	private final StringBuilder output = new StringBuilder();
	private int indentLevel = 0;

	protected CodeGenerator(GenerationContext context)
	{
		this.context = context;
	}

	/**
	 * Generates the full target source for a parsed unit.
	 */
	public String generate(Program program)
	{
		output.setLength(0);
		indentLevel = 0;
		program.accept(this);
		return output.toString();
	}

	// --- Output helpers ---

	protected void appendLine(String line)
	{
		if (line.isEmpty())
		{
			output.append("\n");
			return;
		}
		for (int i = 0; i < indentLevel; i++)
		{
			output.append(INDENT);
		}
		output.append(line).append("\n");
	}

	protected void appendBlankLine()
	{
		output.append("\n");
	}

	protected void indent()
	{
		indentLevel++;
	}

	protected void dedent()
	{
		if (indentLevel > 0)
		{
			indentLevel--;
		}
	}

	/**
	 * Renders an expression, using {@code 0} for a missing one.
	 */
	protected String expr(Expression expression)
	{
		if (expression == null)
		{
			return "0";
		}
		String text = expression.accept(this);
		return text != null ? text : "0";
	}

	/**
	 * Emits each statement of a list in order, skipping nulls.
	 */
	protected void emitStatements(List<Statement> statements)
	{
		for (Statement statement : statements)
		{
			if (statement != null)
			{
				statement.accept(this);
			}
		}
	}

	/**
	 * Emits the statements of a block one level deeper than the current line.
	 */
	protected void emitBody(BlockStatement block)
	{
		indent();
		if (block != null)
		{
			emitStatements(block.getStatements());
		}
		dedent();
	}

	protected static boolean isStringLiteral(Expression expression)
	{
		return expression instanceof LiteralExpression && ((LiteralExpression) expression).isString();
	}

	// --- Statements shared by every profile ---

	@Override
	public String visitBlockStatement(BlockStatement statement)
	{
		appendLine("{");
		emitBody(statement);
		appendLine("}");
		return null;
	}

	@Override
	public String visitExpressionStatement(ExpressionStatement statement)
	{
		appendLine(expr(statement.getExpression()) + ";");
		return null;
	}

	/**
	 * Emits an if/else chain. {@code else if} stays flat instead of nesting a block per level.
	 */
	@Override
	public String visitIfStatement(IfStatement statement)
	{
		appendLine("if " + formatCondition(statement.getCondition()) + " {");
		emitElseChain(statement);
		return null;
	}

	private void emitElseChain(IfStatement statement)
	{
		emitBody(statement.getThenBranch());
		Statement elseBranch = statement.getElseBranch();
		if (elseBranch instanceof IfStatement)
		{
			IfStatement elseIf = (IfStatement) elseBranch;
			appendLine("} else if " + formatCondition(elseIf.getCondition()) + " {");
			emitElseChain(elseIf);
			return;
		}
		if (elseBranch instanceof BlockStatement)
		{
			appendLine("} else {");
			emitBody((BlockStatement) elseBranch);
		}
		appendLine("}");
	}

	/**
	 * Renders the condition of an 'if'. Rust style by default, without parentheses.
	 */
	protected String formatCondition(Expression condition)
	{
		return expr(condition);
	}

	// --- Expressions, identical in C and Rust ---

	@Override
	public String visitBinaryExpression(BinaryExpression expression)
	{
		return expr(expression.getLeft()) + " " + expression.getOperator().getLexeme() + " " + expr(expression.getRight());
	}

	@Override
	public String visitIdentifierExpression(IdentifierExpression expression)
	{
		return expression.getName().getLexeme();
	}

	@Override
	public String visitLiteralExpression(LiteralExpression expression)
	{
		return expression.getSourceText();
	}

	@Override
	public String visitCallExpression(CallExpression expression)
	{
		return expression.getCallee().getLexeme() + "()";
	}

	@Override
	public String visitGroupingExpression(GroupingExpression expression)
	{
		return "(" + expr(expression.getExpression()) + ")";
	}

	// --- Domain nodes have no lowering outside the Solana profiles ---

	@Override
	public String visitProgramDeclaration(ProgramDeclaration declaration)
	{
		return null;
	}

	@Override
	public String visitInstructionDeclaration(InstructionDeclaration declaration)
	{
		return null;
	}

	@Override
	public String visitAccountDeclaration(AccountDeclaration declaration)
	{
		return null;
	}

	@Override
	public String visitStateDeclaration(StateDeclaration declaration)
	{
		return null;
	}

	@Override
	public String visitTransferStatement(TransferStatement statement)
	{
		return null;
	}

	@Override
	public String visitRequireStatement(RequireStatement statement)
	{
		return null;
	}

	@Override
	public String visitEmitStatement(EmitStatement statement)
	{
		return null;
	}
}
