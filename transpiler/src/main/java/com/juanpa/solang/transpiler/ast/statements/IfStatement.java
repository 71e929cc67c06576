// File: src/main/java/com/juanpa/solang/transpiler/ast/statements/IfStatement.java
package com.juanpa.solang.transpiler.ast.statements;

import com.juanpa.solang.transpiler.ast.ASTVisitor;
import com.juanpa.solang.transpiler.ast.expressions.Expression;
import com.juanpa.solang.transpiler.lexer.Token;

/**
 * AST node representing an 'if-else' statement.
 * The 'then' branch is always a block; the optional 'else' branch is either a block or
 * another IfStatement for {@code else if} chains.
 */
public class IfStatement implements Statement
{
	private final Token ifKeyword;
	private final Expression condition;
	private final BlockStatement thenBranch;
	private final Statement elseBranch;

	/**
	 * @param ifKeyword  The 'if' keyword token.
	 * @param condition  The condition expression.
	 * @param thenBranch The block executed when the condition holds.
	 * @param elseBranch A block, a chained IfStatement, or null.
	 */
	public IfStatement(Token ifKeyword, Expression condition, BlockStatement thenBranch, Statement elseBranch)
	{
		this.ifKeyword = ifKeyword;
		this.condition = condition;
		this.thenBranch = thenBranch;
		this.elseBranch = elseBranch;
	}

	public Token getIfKeyword()
	{
		return ifKeyword;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public BlockStatement getThenBranch()
	{
		return thenBranch;
	}

	public Statement getElseBranch()
	{
		return elseBranch;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("If (").append(condition).append(") ").append(thenBranch);
		if(elseBranch != null)
		{
			sb.append(" Else ").append(elseBranch);
		}
		return sb.toString();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIfStatement(this);
	}
}
