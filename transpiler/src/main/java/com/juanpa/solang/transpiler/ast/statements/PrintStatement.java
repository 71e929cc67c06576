package com.juanpa.solang.transpiler.ast.statements;

import com.juanpa.solang.transpiler.ast.ASTVisitor;
import com.juanpa.solang.transpiler.ast.expressions.Expression;
import com.juanpa.solang.transpiler.lexer.Token;

/**
 * AST node for {@code print(expr)}.
 */
public class PrintStatement implements Statement
{
	private final Token keyword;
	private final Expression value;

	public PrintStatement(Token keyword, Expression value)
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
		return visitor.visitPrintStatement(this);
	}

	@Override
	public String toString()
	{
		return "Print(" + value + ")";
	}
}
