package com.juanpa.solang.transpiler.ast.statements;

import com.juanpa.solang.transpiler.ast.ASTVisitor;
import com.juanpa.solang.transpiler.ast.expressions.Expression;

/**
 * AST node representing an expression used as a statement (e.g. a bare call).
 */
public class ExpressionStatement implements Statement
{
	private final Expression expression;

	public ExpressionStatement(Expression expression)
	{
		this.expression = expression;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitExpressionStatement(this);
	}

	@Override
	public String toString()
	{
		return String.valueOf(expression);
	}
}
