// File: src/main/java/com/juanpa/solang/transpiler/ast/declarations/ProgramDeclaration.java

package com.juanpa.solang.transpiler.ast.declarations;

import com.juanpa.solang.transpiler.ast.ASTVisitor;
import com.juanpa.solang.transpiler.ast.statements.Statement;
import com.juanpa.solang.transpiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST node for {@code program NAME ("ID")? { declarations }}.
 * The body holds instructions, accounts and state declarations, but any statement
 * is accepted so that nothing the user wrote is lost.
 */
public class ProgramDeclaration implements Statement
{
	private final Token name;
	private final String programId; // Literal identifier from the source, null if absent
	private final List<Statement> declarations;

	public ProgramDeclaration(Token name, String programId, List<Statement> declarations)
	{
		this.name = name;
		this.programId = programId;
		this.declarations = new ArrayList<>(declarations);
	}

	public Token getName()
	{
		return name;
	}

	public String getProgramId()
	{
		return programId;
	}

	public List<Statement> getDeclarations()
	{
		return Collections.unmodifiableList(declarations);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitProgramDeclaration(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("Program ").append(name.getLexeme());
		if (programId != null)
		{
			sb.append(" (\"").append(programId).append("\")");
		}
		sb.append(" {\n");
		for (Statement declaration : declarations)
		{
			sb.append("  ").append(declaration).append("\n");
		}
		return sb.append("}").toString();
	}
}
