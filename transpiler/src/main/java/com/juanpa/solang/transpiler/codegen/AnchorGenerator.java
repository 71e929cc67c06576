// File: src/main/java/com/juanpa/solang/transpiler/codegen/AnchorGenerator.java
package com.juanpa.solang.transpiler.codegen;

import com.juanpa.solang.transpiler.ast.Program;
import com.juanpa.solang.transpiler.ast.declarations.AccountDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.FunctionDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.InstructionDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.StateDeclaration;
import com.juanpa.solang.transpiler.ast.expressions.Expression;
import com.juanpa.solang.transpiler.ast.expressions.IdentifierExpression;
import com.juanpa.solang.transpiler.ast.expressions.LiteralExpression;
import com.juanpa.solang.transpiler.ast.statements.*;
import com.juanpa.solang.transpiler.util.Debug;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates a program for the Anchor framework.
 * <p>
 * Layout: imports, {@code declare_id!}, the {@code #[program]} module with one handler per
 * instruction, one {@code #[derive(Accounts)]} struct per instruction and per helper that
 * transfers or requires, state accounts, events, the error enum and finally helper functions.
 */
public class AnchorGenerator extends SolanaGenerator
{
	public AnchorGenerator(GenerationContext context)
	{
		super(context);
	}

	@Override
	public String visitProgram(Program program)
	{
		collectModel(program);
		Debug.log("Anchor unit '%s': %d instruction(s), %d state(s)",
				model.getProgramName(), model.getInstructions().size(), model.getStates().size());

		appendLine("use anchor_lang::prelude::*;");
		appendLine("use anchor_spl::token::{self, Token, TokenAccount, Mint};");
		appendLine("use anchor_spl::associated_token::AssociatedToken;");
		appendBlankLine();
		emitDeclareId();

		appendLine("#[program]");
		appendLine("pub mod " + model.getProgramName() + " {");
		indent();
		appendLine("use super::*;");
		for (InstructionDeclaration instruction : model.getInstructions())
		{
			appendBlankLine();
			emitHandler(instruction);
		}
		dedent();
		appendLine("}");
		appendBlankLine();

		for (InstructionDeclaration instruction : model.getInstructions())
		{
			emitAccountsStruct(instruction.getName().getLexeme(), instruction.getBody());
		}
		for (FunctionDeclaration helper : model.getHelpers())
		{
			if (isAccountsHelper(helper))
			{
				emitAccountsStruct(helper.getName().getLexeme(), helper.getBody());
			}
		}
		for (StateDeclaration state : model.getStates())
		{
			appendLine("#[account]");
			emitStateStruct(state, "#[derive(Debug, PartialEq)]");
		}
		for (String event : model.getEvents())
		{
			appendLine("#[event]");
			appendLine("pub struct " + event + " {}");
			appendBlankLine();
		}

		String message = model.getFirstRequireMessage() != null ? model.getFirstRequireMessage() : "Custom error message";
		appendLine("#[error_code]");
		appendLine("pub enum ErrorCode {");
		indent();
		appendLine("#[msg(\"" + escapeString(message) + "\")]");
		appendLine("CustomError,");
		dedent();
		appendLine("}");

		if (!model.getHelpers().isEmpty())
		{
			appendBlankLine();
		}
		for (FunctionDeclaration helper : model.getHelpers())
		{
			helper.accept(this);
		}
		return null;
	}

	private void emitHandler(InstructionDeclaration instruction)
	{
		String name = instruction.getName().getLexeme();
		appendLine("pub fn " + name + "(ctx: Context<" + name + "Context>) -> Result<()> {");
		emitInstructionBody(instruction);
		indent();
		appendLine("Ok(())");
		dedent();
		appendLine("}");
	}

	// --- Accounts structs ---

	private void emitAccountsStruct(String owner, BlockStatement body)
	{
		Map<String, String> fields = new LinkedHashMap<>();
		List<AccountDeclaration> accounts = new ArrayList<>(DomainUnitModel.accountsIn(body));
		accounts.addAll(model.getSharedAccounts());

		boolean needsSystemProgram = false;
		for (AccountDeclaration account : accounts)
		{
			String name = account.getName().getLexeme();
			if (!fields.containsKey(name))
			{
				fields.put(name, accountField(account));
			}
			needsSystemProgram |= account.isInit();
		}

		String payer = context.getConfig().getAnchorPayer();
		if (needsSystemProgram)
		{
			fields.putIfAbsent(payer, "#[account(mut)]\npub " + payer + ": Signer<'info>,");
			fields.putIfAbsent("system_program", "pub system_program: Program<'info, System>,");
		}

		List<TransferStatement> transfers = DomainUnitModel.transfersIn(body);
		if (!transfers.isEmpty())
		{
			for (TransferStatement transfer : transfers)
			{
				String from = accountName(transfer.getFrom(), "from");
				String to = accountName(transfer.getTo(), "to");
				fields.putIfAbsent(from, uncheckedField(from));
				fields.putIfAbsent(to, uncheckedField(to));
			}
			String authority = authorityName(body);
			fields.putIfAbsent(authority, "pub " + authority + ": Signer<'info>,");
			fields.putIfAbsent("token_program", "pub token_program: Program<'info, Token>,");
		}

		String structName = owner + "Context";
		appendLine("#[derive(Accounts)]");
		if (fields.isEmpty())
		{
			appendLine("pub struct " + structName + " {}");
			appendBlankLine();
			return;
		}
		appendLine("pub struct " + structName + "<'info> {");
		indent();
		for (String field : fields.values())
		{
			for (String line : field.split("\n"))
			{
				appendLine(line);
			}
		}
		dedent();
		appendLine("}");
		appendBlankLine();
	}

	private String accountField(AccountDeclaration account)
	{
		List<String> constraints = new ArrayList<>();
		if (account.isSigner())
		{
			constraints.add("signer");
		}
		if (account.isWritable() && !account.isInit())
		{
			constraints.add("mut");
		}
		if (account.isInit())
		{
			constraints.add("init");
			constraints.add("payer = " + context.getConfig().getAnchorPayer());
			constraints.add("space = " + context.getConfig().getAnchorSpace());
		}
		if (!account.getSeeds().isEmpty())
		{
			List<String> seeds = new ArrayList<>();
			for (Expression seed : account.getSeeds())
			{
				seeds.add(seedExpression(seed));
			}
			constraints.add("seeds = [" + String.join(", ", seeds) + "]");
		}
		if (account.hasBump())
		{
			constraints.add(account.getBumpValue() != null ? "bump = " + account.getBumpValue() : "bump");
		}

		String name = account.getName().getLexeme();
		String type = account.getTypeName();
		StringBuilder field = new StringBuilder();
		if (!constraints.isEmpty())
		{
			field.append("#[account(").append(String.join(", ", constraints)).append(")]\n");
		}
		if (type != null && !"pubkey".equals(type))
		{
			field.append("pub ").append(name).append(": Account<'info, ").append(type).append(">,");
		}
		else if (account.isSigner())
		{
			field.append("pub ").append(name).append(": Signer<'info>,");
		}
		else
		{
			field.append("/// CHECK: declared without a data type\n");
			field.append("pub ").append(name).append(": UncheckedAccount<'info>,");
		}
		return field.toString();
	}

	private static String uncheckedField(String name)
	{
		return "#[account(mut)]\n"
				+ "/// CHECK: transfer endpoint\n"
				+ "pub " + name + ": UncheckedAccount<'info>,";
	}

	private String seedExpression(Expression seed)
	{
		if (seed instanceof LiteralExpression && ((LiteralExpression) seed).isString())
		{
			return "b" + ((LiteralExpression) seed).getSourceText();
		}
		if (seed instanceof IdentifierExpression)
		{
			return ((IdentifierExpression) seed).getName().getLexeme() + ".key().as_ref()";
		}
		return expr(seed) + ".to_le_bytes().as_ref()";
	}

	/**
	 * The first signer visible to a body, or {@code authority}. A null body sees only the shared
	 * accounts.
	 */
	private String authorityName(BlockStatement body)
	{
		for (AccountDeclaration account : DomainUnitModel.accountsIn(body))
		{
			if (account.isSigner())
			{
				return account.getName().getLexeme();
			}
		}
		for (AccountDeclaration account : model.getSharedAccounts())
		{
			if (account.isSigner())
			{
				return account.getName().getLexeme();
			}
		}
		return "authority";
	}

	@Override
	protected String accountsHelperSignature(String name)
	{
		return "fn " + name + "(ctx: &Context<" + name + "Context>) -> Result<()> {";
	}

	// --- Instruction statements ---

	@Override
	public String visitTransferStatement(TransferStatement statement)
	{
		String authority = authorityName(currentBody());
		appendLine("token::transfer(");
		indent();
		appendLine("CpiContext::new(");
		indent();
		appendLine("ctx.accounts.token_program.to_account_info(),");
		appendLine("token::Transfer {");
		indent();
		appendLine("from: ctx.accounts." + accountName(statement.getFrom(), "from") + ".to_account_info(),");
		appendLine("to: ctx.accounts." + accountName(statement.getTo(), "to") + ".to_account_info(),");
		appendLine("authority: ctx.accounts." + authority + ".to_account_info(),");
		dedent();
		appendLine("},");
		dedent();
		appendLine("),");
		appendLine(expr(statement.getAmount()) + ",");
		dedent();
		appendLine(")?;");
		return null;
	}

	@Override
	public String visitRequireStatement(RequireStatement statement)
	{
		appendLine("require!(" + expr(statement.getCondition()) + ", ErrorCode::CustomError);");
		return null;
	}

	@Override
	public String visitEmitStatement(EmitStatement statement)
	{
		appendLine("emit!(" + statement.getEventName().getLexeme() + " {});");
		return null;
	}
}
