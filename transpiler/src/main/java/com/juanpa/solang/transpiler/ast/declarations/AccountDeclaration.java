// File: src/main/java/com/juanpa/solang/transpiler/ast/declarations/AccountDeclaration.java

package com.juanpa.solang.transpiler.ast.declarations;

import com.juanpa.solang.transpiler.ast.ASTVisitor;
import com.juanpa.solang.transpiler.ast.expressions.Expression;
import com.juanpa.solang.transpiler.ast.statements.Statement;
import com.juanpa.solang.transpiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST node for {@code account NAME(constraint, ...) (: TYPE)?}.
 * Constraints become flags and the optional PDA seeds/bump; the flags drive the
 * validation attributes emitted for the account.
 */
public class AccountDeclaration implements Statement
{
	private final Token name;
	private boolean signer;
	private boolean writable;
	private boolean init;
	private String typeName; // Null when no ': TYPE' was given
	private final List<Expression> seeds = new ArrayList<>();
	private boolean bump;
	private Integer bumpValue; // Only set for 'bump = N'

	public AccountDeclaration(Token name)
	{
		this.name = name;
	}

	public Token getName()
	{
		return name;
	}

	public boolean isSigner()
	{
		return signer;
	}

	public void setSigner(boolean signer)
	{
		this.signer = signer;
	}

	public boolean isWritable()
	{
		return writable;
	}

	public void setWritable(boolean writable)
	{
		this.writable = writable;
	}

	public boolean isInit()
	{
		return init;
	}

	public void setInit(boolean init)
	{
		this.init = init;
	}

	public String getTypeName()
	{
		return typeName;
	}

	public void setTypeName(String typeName)
	{
		this.typeName = typeName;
	}

	public List<Expression> getSeeds()
	{
		return Collections.unmodifiableList(seeds);
	}

	public void addSeed(Expression seed)
	{
		seeds.add(seed);
	}

	public boolean hasBump()
	{
		return bump;
	}

	public Integer getBumpValue()
	{
		return bumpValue;
	}

	public void setBump(Integer bumpValue)
	{
		this.bump = true;
		this.bumpValue = bumpValue;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAccountDeclaration(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("Account ").append(name.getLexeme()).append("(");
		List<String> flags = new ArrayList<>();
		if (signer) flags.add("signer");
		if (writable) flags.add("writable");
		if (init) flags.add("init");
		if (!seeds.isEmpty()) flags.add("seeds" + seeds);
		if (bump) flags.add(bumpValue != null ? "bump = " + bumpValue : "bump");
		sb.append(String.join(", ", flags)).append(")");
		if (typeName != null)
		{
			sb.append(": ").append(typeName);
		}
		return sb.toString();
	}
}
