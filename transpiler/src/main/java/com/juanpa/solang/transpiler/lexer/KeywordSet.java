package com.juanpa.solang.transpiler.lexer;

/**
 * Selects which keyword layers the lexer recognizes.
 */
public enum KeywordSet
{
	/** Only the generic language keywords; domain words lex as identifiers. */
	BASE,
	/** Generic keywords plus the Solana declaration keywords. */
	DOMAIN
}
