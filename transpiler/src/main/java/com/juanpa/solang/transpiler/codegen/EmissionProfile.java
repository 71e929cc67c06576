package com.juanpa.solang.transpiler.codegen;

/**
 * The target dialect of one compilation run. Chosen once before generation and held for the whole pass.
 */
public enum EmissionProfile
{
	C("output.c", false),
	RUST("output.rs", false),
	ANCHOR("lib.rs", true),
	NATIVE("program.rs", true);

	private final String defaultOutputFile;
	private final boolean domain;

	EmissionProfile(String defaultOutputFile, boolean domain)
	{
		this.defaultOutputFile = defaultOutputFile;
		this.domain = domain;
	}

	/**
	 * @return The file name written when no explicit output path is given.
	 */
	public String getDefaultOutputFile()
	{
		return defaultOutputFile;
	}

	/**
	 * @return True for the Solana profiles, which lower program/instruction/account declarations.
	 */
	public boolean isDomain()
	{
		return domain;
	}
}
