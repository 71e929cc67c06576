// File: src/main/java/com/juanpa/solang/transpiler/lexer/Lexer.java

package com.juanpa.solang.transpiler.lexer;

import com.juanpa.solang.transpiler.util.ErrorReporter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The Lexer is responsible for performing lexical analysis (scanning).
 * It reads raw So Lang source code and converts it into a stream of Tokens terminated by EOF.
 * Newlines are significant and produced as NEWLINE tokens; every other kind of whitespace is skipped.
 * Lexical errors are reported and the offending character is skipped, so ill-formed input still
 * yields a best-effort token stream.
 */
public class Lexer
{
	private final String source; // The raw source code string
	private final List<Token> tokens = new ArrayList<>(); // List to store generated tokens
	private final ErrorReporter errorReporter; // For reporting lexical errors
	private final KeywordSet keywordSet;
	private final int maxTokens; // 0 means no limit

	private int start = 0; // Current token's starting position in the source
	private int current = 0; // Current position in the source
	private int line = 1; // Current line number
	private int column = 1; // Column of the next character to be consumed

	private int startLine = 1;
	private int startColumn = 1;

	private boolean budgetExhausted = false;

	// Generic language keywords
	private static final Map<String, TokenType> keywords;
	// Keywords of the Solana declaration layer, checked after the generic ones
	private static final Map<String, TokenType> domainKeywords;

	static
	{
		keywords = new HashMap<>();
		keywords.put("let", TokenType.LET);
		keywords.put("fn", TokenType.FN);
		keywords.put("if", TokenType.IF);
		keywords.put("else", TokenType.ELSE);
		keywords.put("return", TokenType.RETURN);
		keywords.put("print", TokenType.PRINT);

		domainKeywords = new HashMap<>();
		domainKeywords.put("program", TokenType.PROGRAM);
		domainKeywords.put("instruction", TokenType.INSTRUCTION);
		domainKeywords.put("account", TokenType.ACCOUNT);
		domainKeywords.put("state", TokenType.STATE);
		domainKeywords.put("pubkey", TokenType.PUBKEY);
		domainKeywords.put("signer", TokenType.SIGNER);
		domainKeywords.put("writable", TokenType.WRITABLE);
		domainKeywords.put("init", TokenType.INIT);
		domainKeywords.put("seeds", TokenType.SEEDS);
		domainKeywords.put("bump", TokenType.BUMP);
		domainKeywords.put("transfer", TokenType.TRANSFER);
		domainKeywords.put("require", TokenType.REQUIRE);
		domainKeywords.put("emit", TokenType.EMIT);
	}

	/**
	 * Constructs a Lexer that recognizes both keyword layers and has no token budget.
	 *
	 * @param source        The source code string to tokenize.
	 * @param errorReporter An instance of ErrorReporter for logging errors.
	 */
	public Lexer(String source, ErrorReporter errorReporter)
	{
		this(source, errorReporter, KeywordSet.DOMAIN, 0);
	}

	/**
	 * @param source        The source code string to tokenize.
	 * @param errorReporter An instance of ErrorReporter for logging errors.
	 * @param keywordSet    Which keyword layers to recognize.
	 * @param maxTokens     Maximum number of tokens (excluding EOF) to produce, 0 for no limit.
	 */
	public Lexer(String source, ErrorReporter errorReporter, KeywordSet keywordSet, int maxTokens)
	{
		this.source = source;
		this.errorReporter = errorReporter;
		this.keywordSet = keywordSet;
		this.maxTokens = maxTokens;
	}

	/**
	 * Scans the entire source code and returns a list of tokens.
	 * The list always ends with an EOF token.
	 */
	public List<Token> scanTokens()
	{
		while (!isAtEnd() && !budgetExhausted)
		{
			start = current; // Mark the beginning of the current token
			startLine = line;
			startColumn = column;

			scanToken();
		}

		tokens.add(new Token(TokenType.EOF, "", null, line, column));
		return tokens;
	}

	/**
	 * Scans a single token from the source code.
	 */
	private void scanToken()
	{
		char c = advance();

		switch (c)
		{
			case '(':
				addToken(TokenType.LEFT_PAREN);
				break;
			case ')':
				addToken(TokenType.RIGHT_PAREN);
				break;
			case '{':
				addToken(TokenType.LEFT_BRACE);
				break;
			case '}':
				addToken(TokenType.RIGHT_BRACE);
				break;
			case ',':
				addToken(TokenType.COMMA);
				break;
			case ';':
				addToken(TokenType.SEMICOLON);
				break;
			case ':':
				addToken(TokenType.COLON);
				break;
			case '@':
				addToken(TokenType.AT);
				break;
			case '#':
				addToken(TokenType.HASH);
				break;
			case '+':
				addToken(TokenType.PLUS);
				break;
			case '*':
				addToken(TokenType.STAR);
				break;
			case '<':
				addToken(TokenType.LESS);
				break;
			case '>':
				addToken(TokenType.GREATER);
				break;
			case '-':
				addToken(match('>') ? TokenType.ARROW : TokenType.MINUS);
				break;
			case '=':
				addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.ASSIGN);
				break;
			case '/':
				if (match('/'))
				{
					// Comment runs to end of line; the newline itself is still tokenized
					while (peek() != '\n' && !isAtEnd())
					{
						advance();
					}
				}
				else
				{
					addToken(TokenType.SLASH);
				}
				break;

			case '"':
				scanStringLiteral();
				break;

			case ' ':
			case '\r':
			case '\t':
				break;
			case '\n':
				addToken(TokenType.NEWLINE);
				line++;
				column = 1;
				break;

			default:
				if (isDigit(c))
				{
					scanNumber();
				}
				else if (isAlpha(c))
				{
					scanIdentifier();
				}
				else
				{
					error("Unexpected character '" + c + "'.");
				}
				break;
		}
	}

	/**
	 * Scans a string literal. The opening quote has already been consumed.
	 * An unterminated literal runs to end of input without an error.
	 */
	private void scanStringLiteral()
	{
		StringBuilder value = new StringBuilder();
		while (peek() != '"' && !isAtEnd())
		{
			char c = advance();
			if (c == '\n')
			{
				line++;
				column = 1;
			}
			if (c == '\\' && !isAtEnd())
			{
				char escaped = advance();
				if (escaped == '\n')
				{
					line++;
					column = 1;
				}
				switch (escaped)
				{
					case 'n':
						value.append('\n');
						break;
					case 't':
						value.append('\t');
						break;
					case 'r':
						value.append('\r');
						break;
					default:
						// Covers \\ and \" as well as any unknown escape
						value.append(escaped);
						break;
				}
			}
			else
			{
				value.append(c);
			}
		}

		if (!isAtEnd())
		{
			advance(); // Closing quote
		}
		addToken(TokenType.STRING, value.toString());
	}

	/**
	 * Scans a number: a digit run with at most one decimal point.
	 */
	private void scanNumber()
	{
		boolean seenDot = false;
		while (isDigit(peek()) || (peek() == '.' && !seenDot))
		{
			if (peek() == '.')
			{
				seenDot = true;
			}
			advance();
		}

		String numberStr = source.substring(start, current);
		addToken(TokenType.NUMBER, new BigDecimal(numberStr));
	}

	private void scanIdentifier()
	{
		while (isAlphaNumeric(peek()))
		{
			advance();
		}

		String text = source.substring(start, current);
		TokenType type = keywords.get(text);
		if (type == null && keywordSet == KeywordSet.DOMAIN)
		{
			type = domainKeywords.get(text);
		}
		addToken(type != null ? type : TokenType.IDENTIFIER);
	}

	/**
	 * Consumes the current character and returns it, also updates the column.
	 */
	private char advance()
	{
		char c = source.charAt(current++);
		column++;
		return c;
	}

	private void addToken(TokenType type, Object literal)
	{
		if (maxTokens > 0 && tokens.size() >= maxTokens)
		{
			if (!budgetExhausted)
			{
				budgetExhausted = true;
				errorReporter.report(startLine, startColumn, "[Lexical Error] Too many tokens (limit is " + maxTokens + ").");
			}
			return;
		}
		String text = source.substring(start, current);
		tokens.add(new Token(type, text, literal, startLine, startColumn));
	}

	private void addToken(TokenType type)
	{
		addToken(type, null);
	}

	/**
	 * Checks if the current character matches the expected character and consumes it if so.
	 */
	private boolean match(char expected)
	{
		if (isAtEnd())
		{
			return false;
		}
		if (source.charAt(current) != expected)
		{
			return false;
		}

		current++;
		column++;
		return true;
	}

	/**
	 * @return The current character, or '\0' at the end of the source.
	 */
	private char peek()
	{
		if (isAtEnd())
		{
			return '\0';
		}
		return source.charAt(current);
	}

	private boolean isAtEnd()
	{
		return current >= source.length();
	}

	private static boolean isDigit(char c)
	{
		return c >= '0' && c <= '9';
	}

	private static boolean isAlpha(char c)
	{
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isAlphaNumeric(char c)
	{
		return isAlpha(c) || isDigit(c);
	}

	private void error(String message)
	{
		errorReporter.report(startLine, startColumn, "[Lexical Error] " + message);
	}
}
