// File: src/main/java/com/juanpa/solang/transpiler/parser/SolanaParser.java

package com.juanpa.solang.transpiler.parser;

import com.juanpa.solang.transpiler.ast.declarations.AccountDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.InstructionDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.ProgramDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.StateDeclaration;
import com.juanpa.solang.transpiler.ast.expressions.Expression;
import com.juanpa.solang.transpiler.ast.statements.BlockStatement;
import com.juanpa.solang.transpiler.ast.statements.EmitStatement;
import com.juanpa.solang.transpiler.ast.statements.RequireStatement;
import com.juanpa.solang.transpiler.ast.statements.Statement;
import com.juanpa.solang.transpiler.ast.statements.TransferStatement;
import com.juanpa.solang.transpiler.lexer.Token;
import com.juanpa.solang.transpiler.lexer.TokenType;
import com.juanpa.solang.transpiler.util.ErrorReporter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Extends the base parser with the Solana declaration grammar:
 * <pre>
 * program     := 'program' IDENTIFIER ('(' STRING ')' | STRING)? '{' statement* '}'
 * instruction := 'instruction' IDENTIFIER '(' ... ')' block
 * account     := 'account' IDENTIFIER ('(' constraint (',' constraint)* ')')? (':' TYPE)?
 * constraint  := 'signer' | 'writable' | 'init' | 'seeds' '(' expression (',' expression)* ')' | 'bump' ('=' NUMBER)?
 * state       := 'state' IDENTIFIER '{' (IDENTIFIER ':' TYPE)* '}'
 * transfer    := 'transfer' '(' expression ',' expression (',' expression)? ')'
 * require     := 'require' '(' expression (',' STRING)? ')'
 * emit        := 'emit' IDENTIFIER ('(' ... ')')?
 * </pre>
 * A domain keyword may be written with a leading '@' or '#' attribute marker, which is ignored.
 * Everything else is delegated to {@link SoLangParser}.
 */
public class SolanaParser extends SoLangParser
{
	private static final Set<TokenType> DOMAIN_KEYWORDS = EnumSet.of(
			TokenType.PROGRAM, TokenType.INSTRUCTION, TokenType.ACCOUNT, TokenType.STATE,
			TokenType.TRANSFER, TokenType.REQUIRE, TokenType.EMIT);

	public SolanaParser(List<Token> tokens, ErrorReporter errorReporter)
	{
		super(tokens, errorReporter);
	}

	@Override
	protected Statement statement() throws SyntaxError
	{
		if ((check(TokenType.AT) || check(TokenType.HASH)) && current + 1 < tokens.size()
				&& DOMAIN_KEYWORDS.contains(tokens.get(current + 1).getType()))
		{
			advance(); // attribute marker
		}

		if (match(TokenType.PROGRAM))
		{
			return programDeclaration();
		}
		if (match(TokenType.INSTRUCTION))
		{
			return instructionDeclaration();
		}
		if (match(TokenType.ACCOUNT))
		{
			return accountDeclaration();
		}
		if (match(TokenType.STATE))
		{
			return stateDeclaration();
		}
		if (match(TokenType.TRANSFER))
		{
			return transferStatement();
		}
		if (match(TokenType.REQUIRE))
		{
			return requireStatement();
		}
		if (match(TokenType.EMIT))
		{
			return emitStatement();
		}
		return super.statement();
	}

	private ProgramDeclaration programDeclaration() throws SyntaxError
	{
		Token name = consume(TokenType.IDENTIFIER, "Expected program name after 'program'.");

		String programId = null;
		if (match(TokenType.LEFT_PAREN))
		{
			if (match(TokenType.STRING))
			{
				programId = (String) previous().getLiteral();
			}
			else
			{
				error(peek(), "Expected program id string.");
			}
			expect(TokenType.RIGHT_PAREN, "Expected ')' after program id.");
		}
		else if (match(TokenType.STRING))
		{
			programId = (String) previous().getLiteral();
		}
		if (programId != null && programId.isBlank())
		{
			programId = null;
		}

		List<Statement> declarations = new ArrayList<>();
		skipNewlines();
		String owner = "program '" + name.getLexeme() + "'";
		if (expect(TokenType.LEFT_BRACE, "Expected '{' to start body of " + owner + "."))
		{
			declarations = statementsUntilRightBrace();
			expect(TokenType.RIGHT_BRACE, "Expected '}' to close body of " + owner + ".");
		}
		return new ProgramDeclaration(name, programId, declarations);
	}

	private InstructionDeclaration instructionDeclaration() throws SyntaxError
	{
		Token name = consume(TokenType.IDENTIFIER, "Expected instruction name after 'instruction'.");
		if (check(TokenType.LEFT_PAREN))
		{
			skipParenthesized();
		}
		BlockStatement body = block("instruction '" + name.getLexeme() + "'");
		return new InstructionDeclaration(name, body);
	}

	private AccountDeclaration accountDeclaration() throws SyntaxError
	{
		Token name = consume(TokenType.IDENTIFIER, "Expected account name after 'account'.");
		AccountDeclaration account = new AccountDeclaration(name);

		if (match(TokenType.LEFT_PAREN))
		{
			while (!check(TokenType.RIGHT_PAREN) && !isAtEnd())
			{
				if (match(TokenType.SIGNER))
				{
					account.setSigner(true);
				}
				else if (match(TokenType.WRITABLE))
				{
					account.setWritable(true);
				}
				else if (match(TokenType.INIT))
				{
					account.setInit(true);
				}
				else if (match(TokenType.SEEDS))
				{
					seeds(account);
				}
				else if (match(TokenType.BUMP))
				{
					bump(account);
				}
				else
				{
					advance(); // Commas and unrecognized constraints
				}
			}
			expect(TokenType.RIGHT_PAREN, "Expected ')' after account constraints.");
		}

		if (match(TokenType.COLON))
		{
			if (match(TokenType.PUBKEY, TokenType.IDENTIFIER))
			{
				account.setTypeName(previous().getLexeme());
			}
			else
			{
				error(peek(), "Expected account type after ':'.");
			}
		}
		return account;
	}

	private void seeds(AccountDeclaration account)
	{
		if (!expect(TokenType.LEFT_PAREN, "Expected '(' after 'seeds'."))
		{
			return;
		}
		if (!check(TokenType.RIGHT_PAREN))
		{
			do
			{
				Expression seed = expression();
				if (seed != null)
				{
					account.addSeed(seed);
				}
			}
			while (match(TokenType.COMMA));
		}
		expect(TokenType.RIGHT_PAREN, "Expected ')' after seeds.");
	}

	private void bump(AccountDeclaration account)
	{
		if (!match(TokenType.ASSIGN))
		{
			account.setBump(null);
			return;
		}
		if (!match(TokenType.NUMBER))
		{
			error(peek(), "Expected bump value after 'bump ='.");
			account.setBump(null);
			return;
		}

		Token value = previous();
		Integer bump;
		try
		{
			bump = ((BigDecimal) value.getLiteral()).intValueExact();
		}
		catch (ArithmeticException e)
		{
			bump = null; // Fractional or out of int range
		}

		if (bump == null || bump < 0 || bump > 255)
		{
			error(value, "Bump must be an integer between 0 and 255.");
			account.setBump(null);
		}
		else
		{
			account.setBump(bump);
		}
	}

	private StateDeclaration stateDeclaration() throws SyntaxError
	{
		Token name = consume(TokenType.IDENTIFIER, "Expected state name after 'state'.");
		StateDeclaration state = new StateDeclaration(name);
		String owner = "state '" + name.getLexeme() + "'";

		skipNewlines();
		if (!expect(TokenType.LEFT_BRACE, "Expected '{' to start body of " + owner + "."))
		{
			return state;
		}

		skipFieldSeparators();
		while (!check(TokenType.RIGHT_BRACE) && !isAtEnd())
		{
			if (match(TokenType.IDENTIFIER))
			{
				Token field = previous();
				if (!match(TokenType.COLON))
				{
					error(peek(), "Expected ':' after field '" + field.getLexeme() + "'.");
				}
				else if (match(TokenType.PUBKEY, TokenType.IDENTIFIER))
				{
					state.addField(field, previous().getLexeme());
				}
				else
				{
					error(peek(), "Expected type for field '" + field.getLexeme() + "'.");
				}
			}
			else
			{
				error(peek(), "Expected field name in " + owner + ".");
				advance();
			}
			skipFieldSeparators();
		}
		expect(TokenType.RIGHT_BRACE, "Expected '}' to close body of " + owner + ".");
		return state;
	}

	private void skipFieldSeparators()
	{
		while (match(TokenType.NEWLINE, TokenType.COMMA, TokenType.SEMICOLON))
		{
			// keep consuming
		}
	}

	private TransferStatement transferStatement()
	{
		Token keyword = previous();
		Expression from = null;
		Expression to = null;
		Expression amount = null;
		if (expect(TokenType.LEFT_PAREN, "Expected '(' after 'transfer'."))
		{
			from = expression();
			if (expect(TokenType.COMMA, "Expected ',' after transfer source."))
			{
				to = expression();
				if (match(TokenType.COMMA))
				{
					amount = expression();
				}
			}
			expect(TokenType.RIGHT_PAREN, "Expected ')' after transfer arguments.");
		}
		return new TransferStatement(keyword, from, to, amount);
	}

	private RequireStatement requireStatement()
	{
		Token keyword = previous();
		Expression condition = null;
		String message = null;
		if (expect(TokenType.LEFT_PAREN, "Expected '(' after 'require'."))
		{
			condition = expression();
			if (match(TokenType.COMMA))
			{
				if (match(TokenType.STRING))
				{
					message = (String) previous().getLiteral();
				}
				else
				{
					error(peek(), "Expected message string in 'require'.");
				}
			}
			expect(TokenType.RIGHT_PAREN, "Expected ')' after require arguments.");
		}
		return new RequireStatement(keyword, condition, message);
	}

	private EmitStatement emitStatement() throws SyntaxError
	{
		Token keyword = previous();
		Token eventName = consume(TokenType.IDENTIFIER, "Expected event name after 'emit'.");
		if (check(TokenType.LEFT_PAREN))
		{
			skipParenthesized();
		}
		return new EmitStatement(keyword, eventName);
	}
}
