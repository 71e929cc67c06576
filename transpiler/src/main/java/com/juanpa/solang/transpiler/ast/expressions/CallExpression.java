package com.juanpa.solang.transpiler.ast.expressions;

import com.juanpa.solang.transpiler.ast.ASTVisitor;
import com.juanpa.solang.transpiler.lexer.Token;

/**
 * AST node representing a call such as {@code foo(...)}.
 * Arguments are not kept: the parser skips everything between the parentheses,
 * so generators always emit an empty argument list.
 */
public class CallExpression implements Expression
{
	private final Token callee;

	public CallExpression(Token callee)
	{
		this.callee = callee;
	}

	public Token getCallee()
	{
		return callee;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitCallExpression(this);
	}

	@Override
	public String toString()
	{
		return callee.getLexeme() + "()";
	}
}
