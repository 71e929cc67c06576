// File: src/main/java/com/juanpa/solang/transpiler/Transpiler.java

package com.juanpa.solang.transpiler;

import com.juanpa.solang.transpiler.analysis.DomainDetector;
import com.juanpa.solang.transpiler.analysis.UnitClassification;
import com.juanpa.solang.transpiler.ast.Program;
import com.juanpa.solang.transpiler.codegen.CodeGenerators;
import com.juanpa.solang.transpiler.codegen.DomainUnitModel;
import com.juanpa.solang.transpiler.codegen.EmissionProfile;
import com.juanpa.solang.transpiler.codegen.GenerationContext;
import com.juanpa.solang.transpiler.codegen.ProfileSelector;
import com.juanpa.solang.transpiler.identity.IdentityResolutionException;
import com.juanpa.solang.transpiler.identity.ProgramIdValidator;
import com.juanpa.solang.transpiler.identity.ProgramIdentityResolver;
import com.juanpa.solang.transpiler.lexer.KeywordSet;
import com.juanpa.solang.transpiler.lexer.Lexer;
import com.juanpa.solang.transpiler.lexer.Token;
import com.juanpa.solang.transpiler.parser.SolanaParser;
import com.juanpa.solang.transpiler.util.CompilerConfig;
import com.juanpa.solang.transpiler.util.Debug;
import com.juanpa.solang.transpiler.util.ErrorReporter;
import com.juanpa.solang.transpiler.util.TranspileOptions;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Runs one source unit through every phase: lexing, parsing, detection, profile selection,
 * identity resolution and generation.
 * <p>
 * Lexical and syntax errors stop the run after the phase that reported them. Identity problems
 * only produce warnings.
 */
public class Transpiler
{
	private final CompilerConfig config;
	private final ErrorReporter errorReporter;
	private final ProgramIdentityResolver identityResolver;

	public Transpiler(CompilerConfig config, ErrorReporter errorReporter, ProgramIdentityResolver identityResolver)
	{
		this.config = config;
		this.errorReporter = errorReporter;
		this.identityResolver = identityResolver;
	}

	/**
	 * @param source              Complete source text.
	 * @param fallbackProgramName Program name to use when the unit declares none, usually the
	 *                            input file name without extension. May be null.
	 * @param options             Flags of this run.
	 * @return The generated unit, or null if lexing or parsing reported errors.
	 */
	public TranspileResult compile(String source, String fallbackProgramName, TranspileOptions options)
	{
		Debug.setEnabled(options.isDebug() || config.isDebug());

		// --- Lexing ---
		Lexer lexer = new Lexer(source, errorReporter, KeywordSet.DOMAIN, config.getMaxTokens());
		List<Token> tokens = lexer.scanTokens();
		Debug.log("Lexed %d token(s)", tokens.size());
		for (Token token : tokens)
		{
			Debug.log("  %s", token);
		}
		if (errorReporter.hasErrors())
		{
			System.err.println("Lexing finished with errors.");
			return null;
		}

		// --- Parsing ---
		SolanaParser parser = new SolanaParser(tokens, errorReporter);
		Program program = parser.parse();
		if (errorReporter.hasErrors())
		{
			System.err.println("Parsing finished with errors.");
			return null;
		}

		// --- Detection and profile ---
		UnitClassification classification = new DomainDetector().classify(program);
		EmissionProfile profile = ProfileSelector.select(options, classification);
		Debug.log("Selected profile %s", profile);

		if (profile.isDomain())
		{
			if (classification.programName() == null)
			{
				classification = classification.withProgramName(toIdentifier(fallbackProgramName));
			}
			DomainUnitModel model = DomainUnitModel.collect(program, classification);
			if (model.getInstructions().isEmpty())
			{
				errorReporter.warn("Program '" + model.getProgramName() + "' declares no instructions.");
			}
			if (!classification.hasProgramId() && config.isIdentityEnabled() && options.isIdentityResolution())
			{
				classification = classification.withProgramId(resolveIdentity(model.getProgramName()));
			}
			else if (classification.hasProgramId())
			{
				ProgramIdValidator.validate(classification.programId()).forEach(errorReporter::warn);
			}
		}

		// --- Generation ---
		GenerationContext context = new GenerationContext(profile, classification, config);
		String output = CodeGenerators.create(context).generate(program);

		Path outputPath = options.getOutputPath() != null
				? options.getOutputPath()
				: Paths.get(profile.getDefaultOutputFile());
		return new TranspileResult(output, profile, classification, outputPath);
	}

	/**
	 * @return The resolved id, or null when resolution failed. A malformed id is kept with warnings.
	 */
	private String resolveIdentity(String programName)
	{
		try
		{
			String id = identityResolver.resolve(programName);
			ProgramIdValidator.validate(id).forEach(errorReporter::warn);
			System.out.println("Program id for '" + programName + "': " + id);
			return id;
		}
		catch (IdentityResolutionException e)
		{
			errorReporter.warn("Could not resolve a program id: " + e.getMessage() + " The program is emitted without one.");
			return null;
		}
	}

	/**
	 * Turns a file name into a usable Rust identifier, or null if nothing is left of it.
	 */
	static String toIdentifier(String name)
	{
		if (name == null)
		{
			return null;
		}
		StringBuilder sb = new StringBuilder();
		for (char c : name.toCharArray())
		{
			boolean ascii = c < 128;
			sb.append(ascii && (Character.isLetterOrDigit(c) || c == '_') ? c : '_');
		}
		if (sb.length() == 0)
		{
			return null;
		}
		if (Character.isDigit(sb.charAt(0)))
		{
			sb.insert(0, '_');
		}
		return sb.toString();
	}
}
