package com.juanpa.solang.transpiler.codegen;

import com.juanpa.solang.transpiler.analysis.UnitClassification;
import com.juanpa.solang.transpiler.util.CompilerConfig;

/**
 * Everything a generator needs to know besides the tree: the selected profile, the unit's
 * classification (program name and id), the configuration, and where the walk currently is.
 */
public class GenerationContext
{
	/**
	 * The kind of body the generator is currently emitting, which decides how 'return' lowers.
	 */
	public enum Scope
	{
		MAIN,
		FUNCTION,
		INSTRUCTION
	}

	private final EmissionProfile profile;
	private final UnitClassification classification;
	private final CompilerConfig config;
	private Scope scope = Scope.MAIN;

	public GenerationContext(EmissionProfile profile, UnitClassification classification, CompilerConfig config)
	{
		this.profile = profile;
		this.classification = classification;
		this.config = config;
	}

	public EmissionProfile getProfile()
	{
		return profile;
	}

	public UnitClassification getClassification()
	{
		return classification;
	}

	public CompilerConfig getConfig()
	{
		return config;
	}

	public Scope getScope()
	{
		return scope;
	}

	/**
	 * Switches scope and returns the previous one so the caller can restore it.
	 */
	public Scope enterScope(Scope newScope)
	{
		Scope previous = scope;
		scope = newScope;
		return previous;
	}

	public void restoreScope(Scope previous)
	{
		scope = previous;
	}
}
