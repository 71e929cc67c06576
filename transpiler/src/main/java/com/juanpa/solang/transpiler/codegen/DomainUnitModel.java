package com.juanpa.solang.transpiler.codegen;

import com.juanpa.solang.transpiler.analysis.UnitClassification;
import com.juanpa.solang.transpiler.ast.Program;
import com.juanpa.solang.transpiler.ast.declarations.AccountDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.FunctionDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.InstructionDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.ProgramDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.StateDeclaration;
import com.juanpa.solang.transpiler.ast.statements.*;
import com.juanpa.solang.transpiler.lexer.Token;
import com.juanpa.solang.transpiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Flattened view of a domain unit, in the order the Solana generators emit it.
 * <p>
 * The contents of every program declaration are merged. Generic statements found directly in
 * a program body or at top level are gathered into a synthesized {@code execute} instruction.
 */
public final class DomainUnitModel
{
	static final String DEFAULT_PROGRAM_NAME = "program";
	static final String SYNTHESIZED_INSTRUCTION = "execute";

	private final String programName;
	private final String programId;
	private final List<InstructionDeclaration> instructions = new ArrayList<>();
	private final List<AccountDeclaration> sharedAccounts = new ArrayList<>();
	private final List<StateDeclaration> states = new ArrayList<>();
	private final List<FunctionDeclaration> helpers = new ArrayList<>();
	private final Set<String> events = new LinkedHashSet<>();
	private final List<Statement> looseStatements = new ArrayList<>();
	private String firstRequireMessage;

	private DomainUnitModel(UnitClassification classification)
	{
		this.programName = classification.programName() != null ? classification.programName() : DEFAULT_PROGRAM_NAME;
		this.programId = classification.programId();
	}

	public static DomainUnitModel collect(Program program, UnitClassification classification)
	{
		DomainUnitModel model = new DomainUnitModel(classification);
		model.collectMembers(program.getStatements());
		if (!model.looseStatements.isEmpty())
		{
			Token name = new Token(TokenType.IDENTIFIER, SYNTHESIZED_INSTRUCTION, null, 0, 0);
			model.instructions.add(new InstructionDeclaration(name, new BlockStatement(model.looseStatements)));
		}
		return model;
	}

	private void collectMembers(List<Statement> statements)
	{
		for (Statement statement : statements)
		{
			if (statement == null)
			{
				continue;
			}
			if (statement instanceof ProgramDeclaration)
			{
				collectMembers(((ProgramDeclaration) statement).getDeclarations());
			}
			else if (statement instanceof InstructionDeclaration)
			{
				InstructionDeclaration instruction = (InstructionDeclaration) statement;
				instructions.add(instruction);
				scanNested(instruction.getBody());
			}
			else if (statement instanceof AccountDeclaration)
			{
				sharedAccounts.add((AccountDeclaration) statement);
			}
			else if (statement instanceof StateDeclaration)
			{
				states.add((StateDeclaration) statement);
			}
			else if (statement instanceof FunctionDeclaration)
			{
				FunctionDeclaration function = (FunctionDeclaration) statement;
				helpers.add(function);
				scanNested(function.getBody());
			}
			else
			{
				looseStatements.add(statement);
				scanStatement(statement);
			}
		}
	}

	private void scanNested(BlockStatement block)
	{
		if (block == null)
		{
			return;
		}
		for (Statement statement : block.getStatements())
		{
			scanStatement(statement);
		}
	}

	// Picks up states, events and require messages wherever they appear.
	private void scanStatement(Statement statement)
	{
		if (statement instanceof StateDeclaration)
		{
			states.add((StateDeclaration) statement);
		}
		else if (statement instanceof EmitStatement)
		{
			events.add(((EmitStatement) statement).getEventName().getLexeme());
		}
		else if (statement instanceof RequireStatement)
		{
			String message = ((RequireStatement) statement).getMessage();
			if (firstRequireMessage == null && message != null)
			{
				firstRequireMessage = message;
			}
		}
		else if (statement instanceof BlockStatement)
		{
			scanNested((BlockStatement) statement);
		}
		else if (statement instanceof IfStatement)
		{
			IfStatement ifStatement = (IfStatement) statement;
			scanNested(ifStatement.getThenBranch());
			scanStatement(ifStatement.getElseBranch());
		}
		else if (statement instanceof FunctionDeclaration)
		{
			scanNested(((FunctionDeclaration) statement).getBody());
		}
		else if (statement instanceof InstructionDeclaration)
		{
			scanNested(((InstructionDeclaration) statement).getBody());
		}
	}

	/**
	 * Accounts declared anywhere inside an instruction body, in source order.
	 */
	static List<AccountDeclaration> accountsIn(BlockStatement body)
	{
		List<AccountDeclaration> accounts = new ArrayList<>();
		collectNodes(body, AccountDeclaration.class, accounts);
		return accounts;
	}

	/**
	 * Transfers anywhere inside a body, in source order.
	 */
	static List<TransferStatement> transfersIn(BlockStatement body)
	{
		List<TransferStatement> transfers = new ArrayList<>();
		collectNodes(body, TransferStatement.class, transfers);
		return transfers;
	}

	/**
	 * Requires anywhere inside a body, in source order.
	 */
	static List<RequireStatement> requiresIn(BlockStatement body)
	{
		List<RequireStatement> requires = new ArrayList<>();
		collectNodes(body, RequireStatement.class, requires);
		return requires;
	}

	private static <T> void collectNodes(Statement statement, Class<T> type, List<T> found)
	{
		if (statement == null)
		{
			return;
		}
		if (type.isInstance(statement))
		{
			found.add(type.cast(statement));
		}
		else if (statement instanceof BlockStatement)
		{
			for (Statement child : ((BlockStatement) statement).getStatements())
			{
				collectNodes(child, type, found);
			}
		}
		else if (statement instanceof IfStatement)
		{
			collectNodes(((IfStatement) statement).getThenBranch(), type, found);
			collectNodes(((IfStatement) statement).getElseBranch(), type, found);
		}
	}

	public String getProgramName()
	{
		return programName;
	}

	String getProgramId()
	{
		return programId;
	}

	public List<InstructionDeclaration> getInstructions()
	{
		return Collections.unmodifiableList(instructions);
	}

	List<AccountDeclaration> getSharedAccounts()
	{
		return Collections.unmodifiableList(sharedAccounts);
	}

	List<StateDeclaration> getStates()
	{
		return Collections.unmodifiableList(states);
	}

	List<FunctionDeclaration> getHelpers()
	{
		return Collections.unmodifiableList(helpers);
	}

	Set<String> getEvents()
	{
		return Collections.unmodifiableSet(events);
	}

	String getFirstRequireMessage()
	{
		return firstRequireMessage;
	}
}
