package com.juanpa.solang.transpiler.ast.statements;

import com.juanpa.solang.transpiler.ast.ASTVisitor;
import com.juanpa.solang.transpiler.ast.expressions.Expression;
import com.juanpa.solang.transpiler.lexer.Token;

/**
 * AST node for {@code let NAME (= expr)?}.
 */
public class VariableDeclarationStatement implements Statement
{
	private final Token name;
	private final Expression initializer; // Null when there is no initializer

	public VariableDeclarationStatement(Token name, Expression initializer)
	{
		this.name = name;
		this.initializer = initializer;
	}

	public Token getName()
	{
		return name;
	}

	public Expression getInitializer()
	{
		return initializer;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitVariableDeclarationStatement(this);
	}

	@Override
	public String toString()
	{
		return "Let " + name.getLexeme() + (initializer != null ? " = " + initializer : "");
	}
}
