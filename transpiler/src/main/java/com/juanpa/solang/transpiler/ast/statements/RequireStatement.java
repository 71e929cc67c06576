package com.juanpa.solang.transpiler.ast.statements;

import com.juanpa.solang.transpiler.ast.ASTVisitor;
import com.juanpa.solang.transpiler.ast.expressions.Expression;
import com.juanpa.solang.transpiler.lexer.Token;

/**
 * AST node for {@code require(condition, "message"?)}: aborts the instruction when the
 * condition does not hold.
 */
public class RequireStatement implements Statement
{
	private final Token keyword;
	private final Expression condition;
	private final String message; // Decoded message text, null if absent

	public RequireStatement(Token keyword, Expression condition, String message)
	{
		this.keyword = keyword;
		this.condition = condition;
		this.message = message;
	}

	public Token getKeyword()
	{
		return keyword;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public String getMessage()
	{
		return message;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitRequireStatement(this);
	}

	@Override
	public String toString()
	{
		return "Require(" + condition + (message != null ? ", \"" + message + "\"" : "") + ")";
	}
}
