package com.juanpa.solang.transpiler.ast.statements;

import com.juanpa.solang.transpiler.ast.ASTVisitor;
import com.juanpa.solang.transpiler.ast.expressions.Expression;
import com.juanpa.solang.transpiler.lexer.Token;

/**
 * AST node for {@code transfer(from, to, amount?)}: moves funds between two accounts.
 */
public class TransferStatement implements Statement
{
	private final Token keyword;
	private final Expression from;
	private final Expression to;
	private final Expression amount; // Optional

	public TransferStatement(Token keyword, Expression from, Expression to, Expression amount)
	{
		this.keyword = keyword;
		this.from = from;
		this.to = to;
		this.amount = amount;
	}

	public Token getKeyword()
	{
		return keyword;
	}

	public Expression getFrom()
	{
		return from;
	}

	public Expression getTo()
	{
		return to;
	}

	public Expression getAmount()
	{
		return amount;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitTransferStatement(this);
	}

	@Override
	public String toString()
	{
		return "Transfer(" + from + ", " + to + ", " + amount + ")";
	}
}
