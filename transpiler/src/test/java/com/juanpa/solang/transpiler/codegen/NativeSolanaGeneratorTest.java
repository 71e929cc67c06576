package com.juanpa.solang.transpiler.codegen;

import org.junit.jupiter.api.Test;

import static com.juanpa.solang.transpiler.codegen.GeneratorTestSupport.generate;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the native Solana generator.
 */
class NativeSolanaGeneratorTest
{
	private static final String IMPORTS = "use solana_program::{\n"
			+ "    account_info::{next_account_info, AccountInfo},\n"
			+ "    entrypoint,\n"
			+ "    entrypoint::ProgramResult,\n"
			+ "    msg,\n"
			+ "    program_error::ProgramError,\n"
			+ "    pubkey::Pubkey,\n"
			+ "    system_instruction,\n"
			+ "    program::{invoke, invoke_signed},\n"
			+ "};\n\n";

	private static final String ENTRYPOINT_HEAD = "pub fn process_instruction(\n"
			+ "    program_id: &Pubkey,\n"
			+ "    accounts: &[AccountInfo],\n"
			+ "    instruction_data: &[u8],\n"
			+ ") -> ProgramResult {\n";

	@Test
	void testEmptyProgramShell()
	{
		String output = generate("program Foo {}", EmissionProfile.NATIVE);

		assertEquals(IMPORTS
				+ "entrypoint!(process_instruction);\n\n"
				+ ENTRYPOINT_HEAD
				+ "    Ok(())\n"
				+ "}\n", output);
	}

	@Test
	void testInstructionsBecomeNumberedArms()
	{
		String output = generate("program P {\n instruction first() {}\n instruction second() {\n  print(1)\n }\n}", EmissionProfile.NATIVE);

		assertTrue(output.contains(ENTRYPOINT_HEAD
				+ "    if instruction_data.is_empty() {\n"
				+ "        return Err(ProgramError::InvalidInstructionData);\n"
				+ "    }\n"
				+ "\n"
				+ "    match instruction_data[0] {\n"
				+ "        0 => {\n"
				+ "            msg!(\"Executing first\");\n"
				+ "        }\n"
				+ "        1 => {\n"
				+ "            msg!(\"Executing second\");\n"
				+ "            msg!(\"Debug: 1\");\n"
				+ "        }\n"
				+ "        _ => return Err(ProgramError::InvalidInstructionData),\n"
				+ "    }\n"
				+ "\n"
				+ "    Ok(())\n"
				+ "}\n"), output);
	}

	@Test
	void testRequireLowersToArgumentError()
	{
		String output = generate("program P {\n instruction check() {\n  require(x < 10, \"too big\")\n }\n}", EmissionProfile.NATIVE);

		assertTrue(output.contains("            if !(x < 10) {\n"
				+ "                return Err(ProgramError::InvalidArgument);\n"
				+ "            }\n"), output);
	}

	@Test
	void testTransferEmitAndReturn()
	{
		String output = generate("program P {\n instruction pay() {\n  transfer(alice, bob, 5)\n  emit Paid\n  return\n }\n}", EmissionProfile.NATIVE);

		assertTrue(output.contains("            let instruction = system_instruction::transfer(alice.key, bob.key, 5);\n"
				+ "            invoke(&instruction, &[alice.clone(), bob.clone()])?;\n"
				+ "            msg!(\"Event: Paid\");\n"
				+ "            return Ok(());\n"), output);
	}

	@Test
	void testStateStructsBeforeEntrypointFunction()
	{
		String output = generate("program P \"Fg6PaFpoGXkYsidMpWTK6W2BeZ7FEfcYkg476zPFsLnS\" {\n state Data { owner: pubkey }\n}", EmissionProfile.NATIVE);

		assertTrue(output.contains("entrypoint!(process_instruction);\n\n"
				+ "declare_id!(\"Fg6PaFpoGXkYsidMpWTK6W2BeZ7FEfcYkg476zPFsLnS\");\n\n"
				+ "#[derive(Clone, Debug, PartialEq)]\n"
				+ "pub struct Data {\n"
				+ "    pub owner: Pubkey,\n"
				+ "}\n\n"
				+ ENTRYPOINT_HEAD), output);
		assertFalse(output.contains("#[account]"));
	}

	@Test
	void testAccountsAreNotEmitted()
	{
		String output = generate("program P {\n account user(signer)\n instruction go() {\n  account other(writable)\n }\n}", EmissionProfile.NATIVE);

		assertFalse(output.contains("user"));
		assertFalse(output.contains("other"));
	}

	@Test
	void testHelpersFollowEntrypointFunction()
	{
		String output = generate("program P {\n fn helper() {\n  return 3\n }\n}", EmissionProfile.NATIVE);

		assertTrue(output.endsWith("    Ok(())\n}\n\nfn helper() -> i32 {\n    return 3;\n    0\n}\n\n"), output);
	}

	@Test
	void testHelperThatRequiresReturnsProgramResult()
	{
		String output = generate("program P {\n fn check() {\n  require(x < 1)\n }\n}", EmissionProfile.NATIVE);

		assertTrue(output.endsWith("fn check(accounts: &[AccountInfo]) -> ProgramResult {\n"
				+ "    if !(x < 1) {\n"
				+ "        return Err(ProgramError::InvalidArgument);\n"
				+ "    }\n"
				+ "    Ok(())\n"
				+ "}\n\n"), output);
	}
}
