// File: src/main/java/com/juanpa/solang/transpiler/ast/Program.java

package com.juanpa.solang.transpiler.ast;

import com.juanpa.solang.transpiler.ast.statements.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The root AST node representing one So Lang source file.
 * Contains the top-level statements in source order.
 */
public class Program implements ASTNode
{
	private final List<Statement> statements;

	public Program()
	{
		this.statements = new ArrayList<>();
	}

	public List<Statement> getStatements()
	{
		return Collections.unmodifiableList(statements);
	}

	public void addStatement(Statement statement)
	{
		this.statements.add(statement);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitProgram(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		for(Statement statement : statements)
		{
			sb.append(statement).append("\n");
		}
		return sb.toString();
	}
}
