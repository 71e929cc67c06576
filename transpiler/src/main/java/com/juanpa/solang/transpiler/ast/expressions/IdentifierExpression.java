package com.juanpa.solang.transpiler.ast.expressions;

import com.juanpa.solang.transpiler.ast.ASTVisitor;
import com.juanpa.solang.transpiler.lexer.Token;

/**
 * AST node representing a reference to a name (variable, account, ...).
 */
public class IdentifierExpression implements Expression
{
	private final Token name;

	public IdentifierExpression(Token name)
	{
		this.name = name;
	}

	public Token getName()
	{
		return name;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIdentifierExpression(this);
	}

	@Override
	public String toString()
	{
		return name.getLexeme();
	}
}
