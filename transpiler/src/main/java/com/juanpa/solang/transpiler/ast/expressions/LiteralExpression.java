// File: src/main/java/com/juanpa/solang/transpiler/ast/expressions/LiteralExpression.java

package com.juanpa.solang.transpiler.ast.expressions;

import com.juanpa.solang.transpiler.ast.ASTVisitor;
import com.juanpa.solang.transpiler.lexer.Token;
import com.juanpa.solang.transpiler.lexer.TokenType;

/**
 * AST node representing a number or string literal.
 * Holds the decoded value and the token it came from; generators emit the token's
 * lexeme so the source spelling (including string escapes) is preserved.
 */
public class LiteralExpression implements Expression
{
	private final Object value; // BigDecimal for numbers, String for strings
	private final Token literalToken;

	public LiteralExpression(Object value, Token literalToken)
	{
		this.value = value;
		this.literalToken = literalToken;
	}

	public Object getValue()
	{
		return value;
	}

	public Token getLiteralToken()
	{
		return literalToken;
	}

	public boolean isString()
	{
		return literalToken.getType() == TokenType.STRING;
	}

	/**
	 * @return The literal exactly as written in the source. An unterminated string gets its
	 * closing quote back so the emitted text stays balanced.
	 */
	public String getSourceText()
	{
		String lexeme = literalToken.getLexeme();
		if (!isString())
		{
			return lexeme;
		}
		for (int i = 1; i < lexeme.length(); i++)
		{
			char c = lexeme.charAt(i);
			if (c == '\\')
			{
				if (i == lexeme.length() - 1)
				{
					return lexeme + "\\\"";
				}
				i++;
			}
			else if (c == '"')
			{
				return lexeme;
			}
		}
		return lexeme + "\"";
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLiteralExpression(this);
	}

	@Override
	public String toString()
	{
		return literalToken.getLexeme();
	}
}
