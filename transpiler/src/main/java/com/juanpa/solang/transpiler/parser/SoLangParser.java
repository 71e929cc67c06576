// File: src/main/java/com/juanpa/solang/transpiler/parser/SoLangParser.java

package com.juanpa.solang.transpiler.parser;

import com.juanpa.solang.transpiler.ast.Program;
import com.juanpa.solang.transpiler.ast.declarations.FunctionDeclaration;
import com.juanpa.solang.transpiler.ast.expressions.*;
import com.juanpa.solang.transpiler.ast.statements.*;
import com.juanpa.solang.transpiler.lexer.Token;
import com.juanpa.solang.transpiler.lexer.TokenType;
import com.juanpa.solang.transpiler.util.Debug;
import com.juanpa.solang.transpiler.util.ErrorReporter;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the general-purpose So Lang grammar.
 * It takes a list of tokens from the Lexer and builds an Abstract Syntax Tree (AST).
 * <p>
 * Grammar, one token of lookahead and no backtracking:
 * <pre>
 * program    := (statement separator*)*
 * statement  := 'let' IDENTIFIER ('=' expression)?
 *             | 'print' '(' expression ')'
 *             | 'if' expression block ('else' (ifStatement | block))?
 *             | 'return' expression?
 *             | 'fn' IDENTIFIER '(' ... ')' ('->' TYPE)? block
 *             | expression
 * expression := primary (OPERATOR primary)?
 * primary    := NUMBER | STRING | IDENTIFIER ('(' ... ')')? | '(' expression ')'
 * </pre>
 * Binary expressions are a single level: {@code 1 + 2 + 3} parses {@code 1 + 2} and leaves
 * {@code + 3} to be reported as the next statement. Operator precedence is not part of the language.
 * <p>
 * Errors are reported through the ErrorReporter and parsing continues, so one run reports
 * every problem it can find.
 */
public class SoLangParser
{
	protected final List<Token> tokens;
	protected final ErrorReporter errorReporter;
	protected int current = 0;

	public SoLangParser(List<Token> tokens, ErrorReporter errorReporter)
	{
		this.tokens = tokens;
		this.errorReporter = errorReporter;
	}

	/**
	 * Parses the whole token stream.
	 *
	 * @return The root Program node. Never null; statements that failed to parse are left out.
	 */
	public Program parse()
	{
		Program program = new Program();
		skipSeparators();
		while (!isAtEnd())
		{
			int before = current;
			Statement statement = safeStatement();
			if (statement != null)
			{
				program.addStatement(statement);
			}
			skipSeparators();
			ensureProgress(before);
		}
		Debug.log("Parsed %d top-level statements", program.getStatements().size());
		return program;
	}

	/**
	 * Parses one statement, recovering from a syntax error by skipping to the next statement boundary.
	 *
	 * @return The statement, or null if it could not be built.
	 */
	protected Statement safeStatement()
	{
		try
		{
			return statement();
		}
		catch (SyntaxError e)
		{
			synchronize();
			return null;
		}
	}

	/**
	 * Dispatches on the leading keyword. Subclasses extend this to add their own statement forms.
	 */
	protected Statement statement() throws SyntaxError
	{
		if (match(TokenType.LET))
		{
			return variableDeclaration();
		}
		if (match(TokenType.PRINT))
		{
			return printStatement();
		}
		if (match(TokenType.IF))
		{
			return ifStatement();
		}
		if (match(TokenType.RETURN))
		{
			return returnStatement();
		}
		if (match(TokenType.FN))
		{
			return functionDeclaration();
		}
		Expression expression = expression();
		return expression != null ? new ExpressionStatement(expression) : null;
	}

	/**
	 * Grammar: {@code 'let' IDENTIFIER ('=' expression)?}
	 */
	private VariableDeclarationStatement variableDeclaration() throws SyntaxError
	{
		Token name = consume(TokenType.IDENTIFIER, "Expected variable name after 'let'.");
		Expression initializer = null;
		if (match(TokenType.ASSIGN))
		{
			initializer = expression();
		}
		return new VariableDeclarationStatement(name, initializer);
	}

	/**
	 * Grammar: {@code 'print' '(' expression ')'}
	 */
	private PrintStatement printStatement()
	{
		Token keyword = previous();
		Expression value = null;
		if (expect(TokenType.LEFT_PAREN, "Expected '(' after 'print'."))
		{
			value = expression();
			expect(TokenType.RIGHT_PAREN, "Expected ')' after print argument.");
		}
		return new PrintStatement(keyword, value);
	}

	/**
	 * Grammar: {@code 'if' expression block ('else' (ifStatement | block))?}
	 * The 'if' keyword has already been consumed.
	 */
	private IfStatement ifStatement()
	{
		Token ifKeyword = previous();
		Expression condition = expression();
		BlockStatement thenBranch = block("'if' condition");

		Statement elseBranch = null;
		if (checkAfterNewlines(TokenType.ELSE))
		{
			skipNewlines();
			advance(); // 'else'
			skipNewlines();
			if (match(TokenType.IF))
			{
				elseBranch = ifStatement();
			}
			else
			{
				elseBranch = block("'else'");
			}
		}
		return new IfStatement(ifKeyword, condition, thenBranch, elseBranch);
	}

	/**
	 * Grammar: {@code 'return' expression?}. The value is absent when the statement ends right away.
	 */
	private ReturnStatement returnStatement()
	{
		Token keyword = previous();
		Expression value = null;
		if (!check(TokenType.NEWLINE) && !check(TokenType.SEMICOLON) && !check(TokenType.RIGHT_BRACE) && !isAtEnd())
		{
			value = expression();
		}
		return new ReturnStatement(keyword, value);
	}

	/**
	 * Grammar: {@code 'fn' IDENTIFIER '(' ... ')' ('->' TYPE)? block}. Parameters are skipped.
	 */
	private FunctionDeclaration functionDeclaration() throws SyntaxError
	{
		Token name = consume(TokenType.IDENTIFIER, "Expected function name after 'fn'.");
		if (check(TokenType.LEFT_PAREN))
		{
			skipParenthesized();
		}
		else
		{
			error(peek(), "Expected '(' after function name.");
		}

		Token returnType = null;
		if (match(TokenType.ARROW))
		{
			if (check(TokenType.LEFT_BRACE) || check(TokenType.NEWLINE) || isAtEnd())
			{
				error(peek(), "Expected return type after '->'.");
			}
			else
			{
				returnType = advance();
			}
		}

		BlockStatement body = block("function '" + name.getLexeme() + "'");
		return new FunctionDeclaration(name, returnType, body);
	}

	/**
	 * Parses a brace-delimited block. A missing '{' yields an empty block, a missing '}' keeps
	 * whatever was parsed so far; both are reported.
	 *
	 * @param owner What the block belongs to, for error messages.
	 */
	protected BlockStatement block(String owner)
	{
		BlockStatement block = new BlockStatement();
		skipNewlines();
		if (!expect(TokenType.LEFT_BRACE, "Expected '{' to start body of " + owner + "."))
		{
			return block;
		}
		for (Statement statement : statementsUntilRightBrace())
		{
			block.addStatement(statement);
		}
		expect(TokenType.RIGHT_BRACE, "Expected '}' to close body of " + owner + ".");
		return block;
	}

	/**
	 * Parses statements until a '}' or the end of input, without consuming the '}'.
	 */
	protected List<Statement> statementsUntilRightBrace()
	{
		List<Statement> statements = new ArrayList<>();
		skipSeparators();
		while (!check(TokenType.RIGHT_BRACE) && !isAtEnd())
		{
			int before = current;
			Statement statement = safeStatement();
			if (statement != null)
			{
				statements.add(statement);
			}
			skipSeparators();
			ensureProgress(before);
		}
		return statements;
	}

	// --- Expressions ---

	/**
	 * Grammar: {@code primary (OPERATOR primary)?}
	 */
	protected Expression expression()
	{
		Expression left = primary();
		if (peek().getType().isBinaryOperator())
		{
			Token operator = advance();
			Expression right = primary();
			return new BinaryExpression(left, operator, right);
		}
		return left;
	}

	/**
	 * Grammar: {@code NUMBER | STRING | IDENTIFIER ('(' ... ')')? | '(' expression ')'}
	 *
	 * @return The expression, or null after reporting an error.
	 */
	protected Expression primary()
	{
		if (match(TokenType.NUMBER, TokenType.STRING))
		{
			Token literal = previous();
			return new LiteralExpression(literal.getLiteral(), literal);
		}

		if (match(TokenType.IDENTIFIER))
		{
			Token name = previous();
			if (check(TokenType.LEFT_PAREN))
			{
				skipParenthesized();
				return new CallExpression(name);
			}
			return new IdentifierExpression(name);
		}

		if (match(TokenType.LEFT_PAREN))
		{
			Token leftParen = previous();
			if (match(TokenType.RIGHT_PAREN))
			{
				error(leftParen, "Expected expression inside parentheses.");
				return new GroupingExpression(leftParen, null);
			}
			Expression inner = expression();
			expect(TokenType.RIGHT_PAREN, "Expected ')' after expression.");
			return new GroupingExpression(leftParen, inner);
		}

		error(peek(), "Expected expression.");
		// Tokens that close or separate an enclosing construct are left for it to consume
		if (!check(TokenType.LEFT_BRACE) && !check(TokenType.RIGHT_BRACE) && !check(TokenType.RIGHT_PAREN) && !check(TokenType.NEWLINE)
				&& !check(TokenType.SEMICOLON) && !check(TokenType.COMMA))
		{
			advance();
		}
		return null;
	}

	/**
	 * Skips a balanced parenthesized token run starting at the current '('.
	 * Used where the language accepts arguments or parameters but does not keep them.
	 */
	protected void skipParenthesized()
	{
		Token open = advance(); // '('
		int depth = 1;
		while (!isAtEnd())
		{
			Token token = advance();
			if (token.getType() == TokenType.LEFT_PAREN)
			{
				depth++;
			}
			else if (token.getType() == TokenType.RIGHT_PAREN && --depth == 0)
			{
				return;
			}
		}
		error(open, "Expected ')' to close '('.");
	}

	// --- Token helpers ---

	/**
	 * Consumes statement separators (newlines and semicolons).
	 */
	protected void skipSeparators()
	{
		while (match(TokenType.NEWLINE, TokenType.SEMICOLON))
		{
			// keep consuming
		}
	}

	protected void skipNewlines()
	{
		while (match(TokenType.NEWLINE))
		{
			// keep consuming
		}
	}

	/**
	 * Checks the first token after any newlines, without consuming anything.
	 */
	protected boolean checkAfterNewlines(TokenType type)
	{
		int index = current;
		while (index < tokens.size() && tokens.get(index).getType() == TokenType.NEWLINE)
		{
			index++;
		}
		return index < tokens.size() && tokens.get(index).getType() == type;
	}

	/**
	 * Advances past the current token if a statement loop made no progress, so a
	 * malformed token can never stall the parser.
	 */
	protected void ensureProgress(int before)
	{
		if (current == before && !isAtEnd())
		{
			advance();
		}
	}

	protected boolean match(TokenType... types)
	{
		for (TokenType type : types)
		{
			if (check(type))
			{
				advance();
				return true;
			}
		}
		return false;
	}

	/**
	 * Consumes a token of the expected type or throws after reporting the message.
	 * Used where the statement cannot be built without the token.
	 */
	protected Token consume(TokenType type, String message) throws SyntaxError
	{
		if (check(type))
		{
			return advance();
		}
		throw error(peek(), message);
	}

	/**
	 * Consumes a token of the expected type, or reports the message and carries on.
	 * Used where a partially built node is still worth keeping.
	 *
	 * @return True if the token was present.
	 */
	protected boolean expect(TokenType type, String message)
	{
		if (match(type))
		{
			return true;
		}
		error(peek(), message);
		return false;
	}

	protected boolean check(TokenType type)
	{
		if (isAtEnd())
		{
			return type == TokenType.EOF;
		}
		return peek().getType() == type;
	}

	protected Token advance()
	{
		if (!isAtEnd())
		{
			current++;
		}
		return previous();
	}

	protected Token peek()
	{
		return tokens.get(current);
	}

	protected Token previous()
	{
		return tokens.get(current - 1);
	}

	protected boolean isAtEnd()
	{
		return peek().getType() == TokenType.EOF;
	}

	protected SyntaxError error(Token token, String message)
	{
		String where = token.getType() == TokenType.EOF ? "end of input" : "'" + describe(token) + "'";
		errorReporter.report(token.getLine(), token.getColumn(), "[Syntax Error] " + message + " Found " + where + ".");
		return new SyntaxError();
	}

	private static String describe(Token token)
	{
		return token.getType() == TokenType.NEWLINE ? "newline" : token.getLexeme();
	}

	/**
	 * Skips tokens until the end of the current statement: a separator, which is consumed,
	 * or a '}' which is left for the enclosing block.
	 */
	protected void synchronize()
	{
		while (!isAtEnd())
		{
			if (match(TokenType.NEWLINE, TokenType.SEMICOLON))
			{
				return;
			}
			if (check(TokenType.RIGHT_BRACE))
			{
				return;
			}
			advance();
		}
	}

	/**
	 * Thrown after a syntax error has been reported, to unwind to the statement boundary.
	 */
	protected static class SyntaxError extends RuntimeException
	{
	}
}
