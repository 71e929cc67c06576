// File: src/main/java/com/juanpa/solang/transpiler/analysis/DomainDetector.java

package com.juanpa.solang.transpiler.analysis;

import com.juanpa.solang.transpiler.ast.ASTVisitor;
import com.juanpa.solang.transpiler.ast.Program;
import com.juanpa.solang.transpiler.ast.declarations.AccountDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.FunctionDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.InstructionDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.ProgramDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.StateDeclaration;
import com.juanpa.solang.transpiler.ast.expressions.*;
import com.juanpa.solang.transpiler.ast.statements.*;
import com.juanpa.solang.transpiler.util.Debug;

import java.util.List;

/**
 * Read-only pass that decides whether a parsed unit is a Solana program.
 * <p>
 * The walk is depth-first over the whole tree. Meeting any domain node (program, instruction,
 * account, state, transfer, require or emit) sets the domain flag, which is never cleared.
 * The first program declaration met in document order supplies the unit's name and literal id.
 * The tree itself is never modified.
 */
public class DomainDetector implements ASTVisitor<Void>
{
	private boolean domain;
	private ProgramDeclaration firstProgram;

	/**
	 * Classifies a finished tree. Each call starts from a clean state.
	 */
	public UnitClassification classify(Program program)
	{
		domain = false;
		firstProgram = null;
		program.accept(this);

		UnitClassification classification = firstProgram == null
				? new UnitClassification(domain, null, null)
				: new UnitClassification(true, firstProgram.getName().getLexeme(), firstProgram.getProgramId());
		Debug.log("Unit classification: %s", classification);
		return classification;
	}

	private void visitAll(List<? extends Statement> statements)
	{
		for (Statement statement : statements)
		{
			if (statement != null)
			{
				statement.accept(this);
			}
		}
	}

	private void visitBlock(BlockStatement block)
	{
		if (block != null)
		{
			visitAll(block.getStatements());
		}
	}

	@Override
	public Void visitProgram(Program program)
	{
		visitAll(program.getStatements());
		return null;
	}

	@Override
	public Void visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		visitBlock(declaration.getBody());
		return null;
	}

	@Override
	public Void visitProgramDeclaration(ProgramDeclaration declaration)
	{
		domain = true;
		if (firstProgram == null)
		{
			firstProgram = declaration;
		}
		visitAll(declaration.getDeclarations());
		return null;
	}

	@Override
	public Void visitInstructionDeclaration(InstructionDeclaration declaration)
	{
		domain = true;
		visitBlock(declaration.getBody());
		return null;
	}

	@Override
	public Void visitAccountDeclaration(AccountDeclaration declaration)
	{
		domain = true;
		return null;
	}

	@Override
	public Void visitStateDeclaration(StateDeclaration declaration)
	{
		domain = true;
		return null;
	}

	@Override
	public Void visitBlockStatement(BlockStatement statement)
	{
		visitBlock(statement);
		return null;
	}

	@Override
	public Void visitVariableDeclarationStatement(VariableDeclarationStatement statement)
	{
		return null;
	}

	@Override
	public Void visitIfStatement(IfStatement statement)
	{
		visitBlock(statement.getThenBranch());
		if (statement.getElseBranch() != null)
		{
			statement.getElseBranch().accept(this);
		}
		return null;
	}

	@Override
	public Void visitReturnStatement(ReturnStatement statement)
	{
		return null;
	}

	@Override
	public Void visitPrintStatement(PrintStatement statement)
	{
		return null;
	}

	@Override
	public Void visitExpressionStatement(ExpressionStatement statement)
	{
		return null;
	}

	@Override
	public Void visitTransferStatement(TransferStatement statement)
	{
		domain = true;
		return null;
	}

	@Override
	public Void visitRequireStatement(RequireStatement statement)
	{
		domain = true;
		return null;
	}

	@Override
	public Void visitEmitStatement(EmitStatement statement)
	{
		domain = true;
		return null;
	}

	// Expressions never contain domain nodes.

	@Override
	public Void visitBinaryExpression(BinaryExpression expression)
	{
		return null;
	}

	@Override
	public Void visitIdentifierExpression(IdentifierExpression expression)
	{
		return null;
	}

	@Override
	public Void visitLiteralExpression(LiteralExpression expression)
	{
		return null;
	}

	@Override
	public Void visitCallExpression(CallExpression expression)
	{
		return null;
	}

	@Override
	public Void visitGroupingExpression(GroupingExpression expression)
	{
		return null;
	}
}
