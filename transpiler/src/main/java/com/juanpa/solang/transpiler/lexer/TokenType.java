// File: src/main/java/com/juanpa/solang/transpiler/lexer/TokenType.java

package com.juanpa.solang.transpiler.lexer;

/**
 * Enumerates every kind of token the So Lang lexer can produce.
 * The keyword groups mirror the two grammar layers: the generic language and the
 * Solana domain declarations built on top of it.
 */
public enum TokenType
{
	// Literals
	NUMBER,
	STRING,
	IDENTIFIER,

	// Generic keywords
	LET,
	FN,
	IF,
	ELSE,
	RETURN,
	PRINT,

	// Domain keywords
	PROGRAM,
	INSTRUCTION,
	ACCOUNT,
	STATE,
	PUBKEY,
	SIGNER,
	WRITABLE,
	INIT,
	SEEDS,
	BUMP,
	TRANSFER,
	REQUIRE,
	EMIT,

	// Operators
	ASSIGN,        // =
	EQUAL_EQUAL,   // ==
	PLUS,
	MINUS,
	STAR,
	SLASH,
	LESS,
	GREATER,
	ARROW,         // ->

	// Punctuation
	LEFT_PAREN,
	RIGHT_PAREN,
	LEFT_BRACE,
	RIGHT_BRACE,
	COMMA,
	SEMICOLON,
	COLON,         // separates an account or state field from its type
	AT,
	HASH,

	// Special
	NEWLINE,
	EOF;

	/**
	 * @return True if this token is one of the binary operators the expression grammar accepts.
	 */
	public boolean isBinaryOperator()
	{
		switch (this)
		{
			case PLUS:
			case MINUS:
			case STAR:
			case SLASH:
			case EQUAL_EQUAL:
			case LESS:
			case GREATER:
				return true;
			default:
				return false;
		}
	}
}
