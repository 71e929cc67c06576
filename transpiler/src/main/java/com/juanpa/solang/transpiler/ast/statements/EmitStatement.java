package com.juanpa.solang.transpiler.ast.statements;

import com.juanpa.solang.transpiler.ast.ASTVisitor;
import com.juanpa.solang.transpiler.lexer.Token;

/**
 * AST node for {@code emit EventName(...)}. Event arguments are not kept.
 */
public class EmitStatement implements Statement
{
	private final Token keyword;
	private final Token eventName; // Null if the name was missing

	public EmitStatement(Token keyword, Token eventName)
	{
		this.keyword = keyword;
		this.eventName = eventName;
	}

	public Token getKeyword()
	{
		return keyword;
	}

	public Token getEventName()
	{
		return eventName;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitEmitStatement(this);
	}

	@Override
	public String toString()
	{
		return "Emit " + (eventName != null ? eventName.getLexeme() : "?");
	}
}
