package com.juanpa.solang.transpiler.ast.statements;

import com.juanpa.solang.transpiler.ast.ASTVisitor;
import com.juanpa.solang.transpiler.ast.expressions.Expression;
import com.juanpa.solang.transpiler.lexer.Token;

/**
 * AST node representing a 'return' statement with an optional value.
 */
public class ReturnStatement implements Statement
{
	private final Token keyword;
	private final Expression value; // Null for a bare return

	public ReturnStatement(Token keyword, Expression value)
	{
		this.keyword = keyword;
		this.value = value;
	}

	public Token getKeyword()
	{
		return keyword;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitReturnStatement(this);
	}

	@Override
	public String toString()
	{
		return "Return" + (value != null ? " " + value : "");
	}
}
