// File: src/main/java/com/juanpa/solang/transpiler/ast/statements/BlockStatement.java
package com.juanpa.solang.transpiler.ast.statements;

import com.juanpa.solang.transpiler.ast.ASTVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * AST node representing a block of statements enclosed in curly braces {}.
 * Used for function, instruction and if/else bodies.
 */
public class BlockStatement implements Statement
{
	private final List<Statement> statements;

	public BlockStatement()
	{
		this.statements = new ArrayList<>();
	}

	public BlockStatement(List<Statement> statements)
	{
		this.statements = new ArrayList<>(statements);
	}

	public void addStatement(Statement statement)
	{
		this.statements.add(statement);
	}

	public List<Statement> getStatements()
	{
		return statements;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("{\n");
		for(Statement stmt : statements)
		{
			for(String line : String.valueOf(stmt).split("\n"))
			{
				sb.append("  ").append(line).append("\n");
			}
		}
		sb.append("}");
		return sb.toString();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBlockStatement(this);
	}
}
