package com.juanpa.solang.transpiler.lexer;

/**
 * One lexeme of So Lang source with its kind and where it starts.
 * String tokens keep their quotes in the lexeme; the decoded text is the literal.
 */
public class Token
{
	private final TokenType type;
	private final String lexeme;
	private final Object literal; // String or BigDecimal, null for everything else
	private final int line;
	private final int column;

	public Token(TokenType type, String lexeme, Object literal, int line, int column)
	{
		this.type = type;
		this.lexeme = lexeme;
		this.literal = literal;
		this.line = line;
		this.column = column;
	}

	public TokenType getType()
	{
		return type;
	}

	public String getLexeme()
	{
		return lexeme;
	}

	public Object getLiteral()
	{
		return literal;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	/**
	 * Debug form used by the token dump, e.g. {@code 3:5 IDENTIFIER x}. Newlines are shown escaped.
	 */
	@Override
	public String toString()
	{
		String shown = type == TokenType.NEWLINE ? "\\n" : lexeme;
		return line + ":" + column + " " + type + " " + shown;
	}
}
