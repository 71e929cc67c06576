package com.juanpa.solang.transpiler.ast.declarations;

import com.juanpa.solang.transpiler.ast.ASTVisitor;
import com.juanpa.solang.transpiler.ast.statements.BlockStatement;
import com.juanpa.solang.transpiler.ast.statements.Statement;
import com.juanpa.solang.transpiler.lexer.Token;

/**
 * AST node for {@code instruction NAME(...) { body }}.
 * The parameter list is skipped by the parser; generators rebuild parameters from context.
 */
public class InstructionDeclaration implements Statement
{
	private final Token name;
	private final BlockStatement body;

	public InstructionDeclaration(Token name, BlockStatement body)
	{
		this.name = name;
		this.body = body;
	}

	public Token getName()
	{
		return name;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitInstructionDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "Instruction " + name.getLexeme() + " " + body;
	}
}
