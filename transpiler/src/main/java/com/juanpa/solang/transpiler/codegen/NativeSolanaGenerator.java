// File: src/main/java/com/juanpa/solang/transpiler/codegen/NativeSolanaGenerator.java
package com.juanpa.solang.transpiler.codegen;

import com.juanpa.solang.transpiler.ast.Program;
import com.juanpa.solang.transpiler.ast.declarations.FunctionDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.InstructionDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.StateDeclaration;
import com.juanpa.solang.transpiler.ast.statements.EmitStatement;
import com.juanpa.solang.transpiler.ast.statements.RequireStatement;
import com.juanpa.solang.transpiler.ast.statements.TransferStatement;
import com.juanpa.solang.transpiler.util.Debug;

import java.util.List;

/**
 * Generates a program against the bare {@code solana_program} crate.
 * Instructions become arms of a match on the first byte of the instruction data, numbered in
 * declaration order.
 */
public class NativeSolanaGenerator extends SolanaGenerator
{
	public NativeSolanaGenerator(GenerationContext context)
	{
		super(context);
	}

	@Override
	public String visitProgram(Program program)
	{
		collectModel(program);
		Debug.log("Native unit '%s': %d instruction(s)", model.getProgramName(), model.getInstructions().size());

		appendLine("use solana_program::{");
		indent();
		appendLine("account_info::{next_account_info, AccountInfo},");
		appendLine("entrypoint,");
		appendLine("entrypoint::ProgramResult,");
		appendLine("msg,");
		appendLine("program_error::ProgramError,");
		appendLine("pubkey::Pubkey,");
		appendLine("system_instruction,");
		appendLine("program::{invoke, invoke_signed},");
		dedent();
		appendLine("};");
		appendBlankLine();

		appendLine("entrypoint!(process_instruction);");
		appendBlankLine();
		emitDeclareId();

		for (StateDeclaration state : model.getStates())
		{
			emitStateStruct(state, "#[derive(Clone, Debug, PartialEq)]");
		}

		appendLine("pub fn process_instruction(");
		indent();
		appendLine("program_id: &Pubkey,");
		appendLine("accounts: &[AccountInfo],");
		appendLine("instruction_data: &[u8],");
		dedent();
		appendLine(") -> ProgramResult {");
		indent();
		List<InstructionDeclaration> instructions = model.getInstructions();
		if (!instructions.isEmpty())
		{
			emitDispatch(instructions);
		}
		appendLine("Ok(())");
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

	private void emitDispatch(List<InstructionDeclaration> instructions)
	{
		appendLine("if instruction_data.is_empty() {");
		indent();
		appendLine("return Err(ProgramError::InvalidInstructionData);");
		dedent();
		appendLine("}");
		appendBlankLine();

		appendLine("match instruction_data[0] {");
		indent();
		for (int i = 0; i < instructions.size(); i++)
		{
			InstructionDeclaration instruction = instructions.get(i);
			appendLine(i + " => {");
			indent();
			appendLine("msg!(\"Executing " + instruction.getName().getLexeme() + "\");");
			dedent();
			emitInstructionBody(instruction);
			appendLine("}");
		}
		appendLine("_ => return Err(ProgramError::InvalidInstructionData),");
		dedent();
		appendLine("}");
		appendBlankLine();
	}

	@Override
	protected String accountsHelperSignature(String name)
	{
		return "fn " + name + "(accounts: &[AccountInfo]) -> ProgramResult {";
	}

	@Override
	public String visitTransferStatement(TransferStatement statement)
	{
		String from = accountName(statement.getFrom(), "from");
		String to = accountName(statement.getTo(), "to");
		appendLine("let instruction = system_instruction::transfer(" + from + ".key, " + to + ".key, "
				+ expr(statement.getAmount()) + ");");
		appendLine("invoke(&instruction, &[" + from + ".clone(), " + to + ".clone()])?;");
		return null;
	}

	@Override
	public String visitRequireStatement(RequireStatement statement)
	{
		appendLine("if !(" + expr(statement.getCondition()) + ") {");
		indent();
		appendLine("return Err(ProgramError::InvalidArgument);");
		dedent();
		appendLine("}");
		return null;
	}

	@Override
	public String visitEmitStatement(EmitStatement statement)
	{
		appendLine("msg!(\"Event: " + statement.getEventName().getLexeme() + "\");");
		return null;
	}
}
