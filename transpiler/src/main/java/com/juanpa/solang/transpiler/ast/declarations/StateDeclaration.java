package com.juanpa.solang.transpiler.ast.declarations;

import com.juanpa.solang.transpiler.ast.ASTVisitor;
import com.juanpa.solang.transpiler.ast.statements.Statement;
import com.juanpa.solang.transpiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST node for {@code state NAME { field: TYPE ... }}: the layout of an on-chain data account.
 */
public class StateDeclaration implements Statement
{
	/**
	 * One field of a state layout. The type is the source spelling (e.g. "pubkey", "u64").
	 */
	public record Field(Token name, String typeName)
	{
	}

	private final Token name;
	private final List<Field> fields = new ArrayList<>();

	public StateDeclaration(Token name)
	{
		this.name = name;
	}

	public Token getName()
	{
		return name;
	}

	public List<Field> getFields()
	{
		return Collections.unmodifiableList(fields);
	}

	public void addField(Token fieldName, String typeName)
	{
		fields.add(new Field(fieldName, typeName));
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitStateDeclaration(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("State ").append(name.getLexeme()).append(" {");
		for (Field field : fields)
		{
			sb.append(" ").append(field.name().getLexeme()).append(": ").append(field.typeName());
		}
		return sb.append(" }").toString();
	}
}
