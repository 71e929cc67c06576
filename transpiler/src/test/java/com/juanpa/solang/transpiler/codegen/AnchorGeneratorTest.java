package com.juanpa.solang.transpiler.codegen;

import com.juanpa.solang.transpiler.analysis.UnitClassification;
import com.juanpa.solang.transpiler.ast.Program;
import com.juanpa.solang.transpiler.util.CompilerConfig;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static com.juanpa.solang.transpiler.codegen.GeneratorTestSupport.generate;
import static com.juanpa.solang.transpiler.codegen.GeneratorTestSupport.parse;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the Anchor generator.
 */
class AnchorGeneratorTest
{
	private static int count(String text, String needle)
	{
		int count = 0;
		for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + needle.length()))
		{
			count++;
		}
		return count;
	}

	@Test
	void testSignerWritableAccountYieldsOneAccountsStruct()
	{
		String output = generate("program Vault {\n instruction deposit() {\n  account user(signer, writable)\n }\n}", EmissionProfile.ANCHOR);

		assertEquals(1, count(output, "#[derive(Accounts)]"));
		assertTrue(output.contains("#[derive(Accounts)]\n"
				+ "pub struct depositContext<'info> {\n"
				+ "    #[account(signer, mut)]\n"
				+ "    pub user: Signer<'info>,\n"
				+ "}\n"), output);
		assertTrue(output.contains("    pub fn deposit(ctx: Context<depositContext>) -> Result<()> {\n        Ok(())\n    }\n"));
	}

	@Test
	void testEmptyProgramShell()
	{
		String output = generate("program Foo {}", EmissionProfile.ANCHOR);

		assertTrue(output.startsWith("use anchor_lang::prelude::*;\n"
				+ "use anchor_spl::token::{self, Token, TokenAccount, Mint};\n"
				+ "use anchor_spl::associated_token::AssociatedToken;\n\n"));
		assertTrue(output.contains("#[program]\npub mod Foo {\n    use super::*;\n}\n"));
		assertFalse(output.contains("pub fn"));
		assertFalse(output.contains("#[derive(Accounts)]"));
		assertTrue(output.contains("#[error_code]\npub enum ErrorCode {\n    #[msg(\"Custom error message\")]\n    CustomError,\n}\n"));
		assertFalse(output.contains("declare_id!"));
	}

	@Test
	void testDeclareIdEmittedOnce()
	{
		String output = generate("program Foo \"Fg6PaFpoGXkYsidMpWTK6W2BeZ7FEfcYkg476zPFsLnS\" {}", EmissionProfile.ANCHOR);

		assertEquals(1, count(output, "declare_id!(\"Fg6PaFpoGXkYsidMpWTK6W2BeZ7FEfcYkg476zPFsLnS\");"));
		assertTrue(output.indexOf("declare_id!") < output.indexOf("#[program]"));
	}

	@Test
	void testRequireUsesFirstMessage()
	{
		String output = generate("program P {\n instruction check() {\n  require(x < 10, \"too big\")\n  require(y)\n }\n}", EmissionProfile.ANCHOR);

		assertTrue(output.contains("        require!(x < 10, ErrorCode::CustomError);\n"));
		assertTrue(output.contains("        require!(y, ErrorCode::CustomError);\n"));
		assertTrue(output.contains("    #[msg(\"too big\")]\n"));
	}

	@Test
	void testTransferAddsTokenProgramAndUsesFirstSigner()
	{
		String output = generate("program Pay {\n account boss(signer)\n instruction send() {\n  transfer(alice, bob, 5)\n }\n}", EmissionProfile.ANCHOR);

		assertTrue(output.contains("    #[account(signer)]\n    pub boss: Signer<'info>,\n"), output);
		assertTrue(output.contains("    #[account(mut)]\n    /// CHECK: transfer endpoint\n    pub alice: UncheckedAccount<'info>,\n"));
		assertTrue(output.contains("    pub token_program: Program<'info, Token>,\n"));
		assertTrue(output.contains("                    authority: ctx.accounts.boss.to_account_info(),\n"));
		assertTrue(output.contains("        token::transfer(\n"
				+ "            CpiContext::new(\n"
				+ "                ctx.accounts.token_program.to_account_info(),\n"
				+ "                token::Transfer {\n"
				+ "                    from: ctx.accounts.alice.to_account_info(),\n"
				+ "                    to: ctx.accounts.bob.to_account_info(),\n"
				+ "                    authority: ctx.accounts.boss.to_account_info(),\n"
				+ "                },\n"
				+ "            ),\n"
				+ "            5,\n"
				+ "        )?;\n"), output);
	}

	@Test
	void testTransferWithoutSignerFallsBackToAuthority()
	{
		String output = generate("program Pay {\n instruction send() {\n  transfer(a, b)\n }\n}", EmissionProfile.ANCHOR);

		assertTrue(output.contains("    pub authority: Signer<'info>,\n"));
		assertTrue(output.contains("authority: ctx.accounts.authority.to_account_info(),"));
		assertTrue(output.contains("            0,\n"));
	}

	@Test
	void testInitAccountWithSeedsAndBump()
	{
		String source = "program Bank {\n"
				+ " state Vault { balance: u64 }\n"
				+ " instruction open() {\n"
				+ "  account vault(init, writable, seeds(\"vault\", user), bump) : Vault\n"
				+ " }\n"
				+ "}";
		String output = generate(source, EmissionProfile.ANCHOR);

		assertTrue(output.contains("    #[account(init, payer = payer, space = 8 + 32, seeds = [b\"vault\", user.key().as_ref()], bump)]\n"
				+ "    pub vault: Account<'info, Vault>,\n"
				+ "    #[account(mut)]\n"
				+ "    pub payer: Signer<'info>,\n"
				+ "    pub system_program: Program<'info, System>,\n"), output);
	}

	@Test
	void testPayerAndSpaceComeFromConfig()
	{
		Properties props = new Properties();
		props.setProperty("codegen.anchor_payer", "funder");
		props.setProperty("codegen.anchor_space", "8 + 64");
		Program program = parse("program Bank {\n instruction open() {\n  account vault(init) : Vault\n }\n}");
		String output = GeneratorTestSupport.generate(program, EmissionProfile.ANCHOR,
				new UnitClassification(true, "Bank", null), new CompilerConfig(props));

		assertTrue(output.contains("#[account(init, payer = funder, space = 8 + 64)]"));
		assertTrue(output.contains("    pub funder: Signer<'info>,\n"));
	}

	@Test
	void testStateStructsAndTypeMapping()
	{
		String output = generate("state Data { count: u64, owner: pubkey, label: string, flag: bool, other: Custom, small: u32 }",
				EmissionProfile.ANCHOR);

		assertTrue(output.contains("#[account]\n"
				+ "#[derive(Debug, PartialEq)]\n"
				+ "pub struct Data {\n"
				+ "    pub count: u64,\n"
				+ "    pub owner: Pubkey,\n"
				+ "    pub label: String,\n"
				+ "    pub flag: bool,\n"
				+ "    pub other: Custom,\n"
				+ "    pub small: u32,\n"
				+ "}\n"), output);
	}

	@Test
	void testEventsAndEmit()
	{
		String output = generate("program E {\n instruction fire() {\n  emit Done(1)\n  emit Done\n }\n}", EmissionProfile.ANCHOR);

		assertEquals(2, count(output, "        emit!(Done {});\n"));
		assertEquals(1, count(output, "#[event]\npub struct Done {}\n"));
	}

	@Test
	void testLooseStatementsGoToExecuteInstruction()
	{
		String output = generate("program P {\n let a = 1\n print(\"hello {x}\")\n print(a + 1)\n}", EmissionProfile.ANCHOR);

		assertTrue(output.contains("    pub fn execute(ctx: Context<executeContext>) -> Result<()> {\n"
				+ "        let a = 1;\n"
				+ "        msg!(\"hello {{x}}\");\n"
				+ "        msg!(\"Debug: a + 1\");\n"
				+ "        Ok(())\n"
				+ "    }\n"), output);
		assertTrue(output.contains("#[derive(Accounts)]\npub struct executeContext {}\n"));
	}

	@Test
	void testReturnInsideInstructionAndHelperFunction()
	{
		String output = generate("program P {\n instruction stop() {\n  return\n }\n fn helper() {\n  return 1\n }\n}", EmissionProfile.ANCHOR);

		assertTrue(output.contains("        return Ok(());\n"));
		assertTrue(output.endsWith("fn helper() -> i32 {\n    return 1;\n    0\n}\n\n"), output);
		assertTrue(output.indexOf("fn helper()") > output.indexOf("pub enum ErrorCode"));
	}

	@Test
	void testHelperThatTransfersGetsContextAndAccountsStruct()
	{
		String source = "program P {\n"
				+ " account payer(signer)\n"
				+ " instruction pay() {\n"
				+ "  print(\"paying\")\n"
				+ " }\n"
				+ " fn move_funds() {\n"
				+ "  transfer(src, dst, 5)\n"
				+ "  require(ok == 1)\n"
				+ " }\n"
				+ "}";
		String output = generate(source, EmissionProfile.ANCHOR);

		assertTrue(output.contains("fn move_funds(ctx: &Context<move_fundsContext>) -> Result<()> {\n"
				+ "    token::transfer(\n"
				+ "        CpiContext::new(\n"
				+ "            ctx.accounts.token_program.to_account_info(),\n"
				+ "            token::Transfer {\n"
				+ "                from: ctx.accounts.src.to_account_info(),\n"
				+ "                to: ctx.accounts.dst.to_account_info(),\n"
				+ "                authority: ctx.accounts.payer.to_account_info(),\n"
				+ "            },\n"
				+ "        ),\n"
				+ "        5,\n"
				+ "    )?;\n"
				+ "    require!(ok == 1, ErrorCode::CustomError);\n"
				+ "    Ok(())\n"
				+ "}\n"), output);
		assertFalse(output.contains("-> i32"));
		assertTrue(output.contains("#[derive(Accounts)]\n"
				+ "pub struct move_fundsContext<'info> {\n"
				+ "    #[account(signer)]\n"
				+ "    pub payer: Signer<'info>,\n"
				+ "    #[account(mut)]\n"
				+ "    /// CHECK: transfer endpoint\n"
				+ "    pub src: UncheckedAccount<'info>,\n"
				+ "    #[account(mut)]\n"
				+ "    /// CHECK: transfer endpoint\n"
				+ "    pub dst: UncheckedAccount<'info>,\n"
				+ "    pub token_program: Program<'info, Token>,\n"
				+ "}\n"), output);

		int payStruct = output.indexOf("pub struct payContext");
		String payFields = output.substring(payStruct, output.indexOf("}\n", payStruct));
		assertFalse(payFields.contains("token_program"));
		assertEquals(2, count(output, "#[derive(Accounts)]"));
	}

	@Test
	void testFallbackProgramName()
	{
		Program program = parse("instruction go() {}");
		String output = GeneratorTestSupport.generate(program, EmissionProfile.ANCHOR,
				new UnitClassification(true, null, null), CompilerConfig.defaults());

		assertTrue(output.contains("pub mod program {"));
	}
}
