package com.juanpa.solang.transpiler.codegen;

import com.juanpa.solang.transpiler.ast.Program;
import com.juanpa.solang.transpiler.ast.declarations.FunctionDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.InstructionDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.StateDeclaration;
import com.juanpa.solang.transpiler.ast.expressions.Expression;
import com.juanpa.solang.transpiler.ast.expressions.IdentifierExpression;
import com.juanpa.solang.transpiler.ast.expressions.LiteralExpression;
import com.juanpa.solang.transpiler.ast.statements.BlockStatement;
import com.juanpa.solang.transpiler.ast.statements.PrintStatement;

import java.util.Locale;

/**
 * Shared lowering of the two Solana profiles. Generic statements inside instructions follow the
 * plain Rust rules; {@code print} becomes a {@code msg!} log line.
 */
public abstract class SolanaGenerator extends RustGenerator
{
	protected DomainUnitModel model;
	private BlockStatement currentBody;

	protected SolanaGenerator(GenerationContext context)
	{
		super(context);
	}

	protected void collectModel(Program program)
	{
		model = DomainUnitModel.collect(program, context.getClassification());
	}

	protected void emitDeclareId()
	{
		if (model.getProgramId() != null)
		{
			appendLine("declare_id!(\"" + escapeString(model.getProgramId()) + "\");");
			appendBlankLine();
		}
	}

	/**
	 * Emits the statements of an instruction one level deeper, in instruction scope.
	 */
	protected void emitInstructionBody(InstructionDeclaration instruction)
	{
		emitDomainBody(instruction.getBody());
	}

	/**
	 * Emits a body that sees the unit's accounts: an instruction, or a helper that transfers
	 * or requires.
	 */
	protected void emitDomainBody(BlockStatement body)
	{
		GenerationContext.Scope previous = context.enterScope(GenerationContext.Scope.INSTRUCTION);
		BlockStatement outer = currentBody;
		currentBody = body;
		emitBody(body);
		currentBody = outer;
		context.restoreScope(previous);
	}

	/**
	 * @return The instruction or helper body being emitted, or null outside of one.
	 */
	protected BlockStatement currentBody()
	{
		return currentBody;
	}

	/**
	 * True for a top-level helper whose body transfers or requires. Such a helper is emitted
	 * with access to the accounts and a result return type.
	 */
	protected boolean isAccountsHelper(FunctionDeclaration function)
	{
		if (model == null || !model.getHelpers().contains(function))
		{
			return false;
		}
		BlockStatement body = function.getBody();
		return !DomainUnitModel.transfersIn(body).isEmpty() || !DomainUnitModel.requiresIn(body).isEmpty();
	}

	/**
	 * The opening line of an accounts helper, up to and including the brace.
	 */
	protected abstract String accountsHelperSignature(String name);

	@Override
	public String visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		if (!isAccountsHelper(declaration))
		{
			return super.visitFunctionDeclaration(declaration);
		}
		appendLine(accountsHelperSignature(declaration.getName().getLexeme()));
		emitDomainBody(declaration.getBody());
		indent();
		appendLine("Ok(())");
		dedent();
		appendLine("}");
		appendBlankLine();
		return null;
	}

	protected void emitStateStruct(StateDeclaration state, String derive)
	{
		appendLine(derive);
		appendLine("pub struct " + state.getName().getLexeme() + " {");
		indent();
		for (StateDeclaration.Field field : state.getFields())
		{
			appendLine("pub " + field.name().getLexeme() + ": " + rustType(field.typeName()) + ",");
		}
		dedent();
		appendLine("}");
		appendBlankLine();
	}

	/**
	 * Maps a declared field type to its Rust type. Unknown names are assumed to be user types.
	 */
	static String rustType(String declared)
	{
		if (declared == null)
		{
			return "u64";
		}
		switch (declared.toLowerCase(Locale.ROOT))
		{
			case "pubkey":
				return "Pubkey";
			case "u64":
				return "u64";
			case "u32":
				return "u32";
			case "bool":
				return "bool";
			case "string":
				return "String";
			default:
				return declared;
		}
	}

	/**
	 * The account an expression names, or {@code fallback} when it is not a plain identifier.
	 */
	protected static String accountName(Expression expression, String fallback)
	{
		if (expression instanceof IdentifierExpression)
		{
			return ((IdentifierExpression) expression).getName().getLexeme();
		}
		return fallback;
	}

	/**
	 * Escapes decoded text for a Rust string literal.
	 */
	protected static String escapeString(String text)
	{
		return text.replace("\\", "\\\\")
				.replace("\"", "\\\"")
				.replace("\n", "\\n")
				.replace("\t", "\\t")
				.replace("\r", "\\r");
	}

	/**
	 * On-chain programs have no stdout. A string literal is logged as is; any other value is
	 * logged as its source text.
	 */
	@Override
	public String visitPrintStatement(PrintStatement statement)
	{
		Expression value = statement.getValue();
		if (isStringLiteral(value))
		{
			String source = ((LiteralExpression) value).getSourceText();
			String inner = source.substring(1, source.length() - 1);
			appendLine("msg!(\"" + inner.replace("{", "{{").replace("}", "}}") + "\");");
		}
		else
		{
			appendLine("msg!(\"Debug: " + formatStringContent(expr(value)) + "\");");
		}
		return null;
	}
}
