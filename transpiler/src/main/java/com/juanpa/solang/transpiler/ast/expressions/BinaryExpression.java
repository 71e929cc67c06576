// File: src/main/java/com/juanpa/solang/transpiler/ast/expressions/BinaryExpression.java

package com.juanpa.solang.transpiler.ast.expressions;

import com.juanpa.solang.transpiler.ast.ASTVisitor;
import com.juanpa.solang.transpiler.lexer.Token;

/**
 * AST node representing a binary operation (e.g., a + b, x == y).
 * The grammar is flat: an operand is never itself an unparenthesized binary expression.
 */
public class BinaryExpression implements Expression
{
	private final Expression left;
	private final Token operator; // One of + - * / == < >
	private final Expression right; // Null when the right operand was missing

	public BinaryExpression(Expression left, Token operator, Expression right)
	{
		this.left = left;
		this.operator = operator;
		this.right = right;
	}

	public Expression getLeft()
	{
		return left;
	}

	public Token getOperator()
	{
		return operator;
	}

	public Expression getRight()
	{
		return right;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBinaryExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + left + " " + operator.getLexeme() + " " + right + ")";
	}
}
