package com.juanpa.solang.transpiler.codegen;

import com.juanpa.solang.transpiler.analysis.UnitClassification;
import com.juanpa.solang.transpiler.util.TranspileOptions;

/**
 * Maps the run options and the unit classification to an emission profile.
 * <p>
 * A unit is generated as a Solana program when it contains domain declarations or when a
 * Solana flag forces it; Anchor is used only when requested, native otherwise. Every other
 * unit goes to Rust when requested and to C by default.
 */
public final class ProfileSelector
{
	private ProfileSelector()
	{
	}

	public static EmissionProfile select(TranspileOptions options, UnitClassification classification)
	{
		boolean domain = options.isDomainForced() || classification.domain();
		if (domain)
		{
			return options.getFramework() == TranspileOptions.Framework.ANCHOR ? EmissionProfile.ANCHOR : EmissionProfile.NATIVE;
		}
		return options.isRustRequested() ? EmissionProfile.RUST : EmissionProfile.C;
	}
}
