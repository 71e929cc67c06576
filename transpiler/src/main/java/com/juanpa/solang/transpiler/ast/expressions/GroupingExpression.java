package com.juanpa.solang.transpiler.ast.expressions;

import com.juanpa.solang.transpiler.ast.ASTVisitor;
import com.juanpa.solang.transpiler.lexer.Token;

/**
 * AST node representing a parenthesized expression.
 */
public class GroupingExpression implements Expression
{
	private final Token leftParen;
	private final Expression expression; // Null for "()"

	public GroupingExpression(Token leftParen, Expression expression)
	{
		this.leftParen = leftParen;
		this.expression = expression;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitGroupingExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + expression + ")";
	}
}
