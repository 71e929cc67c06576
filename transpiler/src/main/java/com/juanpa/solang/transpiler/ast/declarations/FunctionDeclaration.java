package com.juanpa.solang.transpiler.ast.declarations;

import com.juanpa.solang.transpiler.ast.ASTVisitor;
import com.juanpa.solang.transpiler.ast.statements.BlockStatement;
import com.juanpa.solang.transpiler.ast.statements.Statement;
import com.juanpa.solang.transpiler.lexer.Token;

/**
 * AST node for {@code fn NAME(...) (-> TYPE)? { ... }}.
 * Parameters are not kept; the declared return type is informational only.
 */
public class FunctionDeclaration implements Statement
{
	private final Token name;
	private final Token returnType; // Null when no '->' clause was written
	private final BlockStatement body;

	public FunctionDeclaration(Token name, Token returnType, BlockStatement body)
	{
		this.name = name;
		this.returnType = returnType;
		this.body = body;
	}

	public Token getName()
	{
		return name;
	}

	public Token getReturnType()
	{
		return returnType;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFunctionDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "Fn " + name.getLexeme() + " " + body;
	}
}
