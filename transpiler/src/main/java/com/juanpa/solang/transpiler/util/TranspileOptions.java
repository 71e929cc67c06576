package com.juanpa.solang.transpiler.util;

import java.nio.file.Path;

/**
 * Per-run options, usually filled from the command line.
 */
public class TranspileOptions
{
	/**
	 * Which Solana framework the domain profiles should target.
	 */
	public enum Framework
	{
		NATIVE,
		ANCHOR
	}

	private boolean rustRequested;
	private boolean domainForced;
	private Framework framework = Framework.NATIVE;
	private Path outputPath;
	private boolean identityResolution = true;
	private boolean debug;

	public boolean isRustRequested()
	{
		return rustRequested;
	}

	public TranspileOptions setRustRequested(boolean rustRequested)
	{
		this.rustRequested = rustRequested;
		return this;
	}

	/**
	 * @return True if a Solana profile was requested regardless of the unit's contents.
	 */
	public boolean isDomainForced()
	{
		return domainForced;
	}

	public TranspileOptions setDomainForced(boolean domainForced)
	{
		this.domainForced = domainForced;
		return this;
	}

	public Framework getFramework()
	{
		return framework;
	}

	public TranspileOptions setFramework(Framework framework)
	{
		this.framework = framework;
		return this;
	}

	/**
	 * @return The explicit output path, or null to use the profile's default file name.
	 */
	public Path getOutputPath()
	{
		return outputPath;
	}

	public TranspileOptions setOutputPath(Path outputPath)
	{
		this.outputPath = outputPath;
		return this;
	}

	public boolean isIdentityResolution()
	{
		return identityResolution;
	}

	public TranspileOptions setIdentityResolution(boolean identityResolution)
	{
		this.identityResolution = identityResolution;
		return this;
	}

	public boolean isDebug()
	{
		return debug;
	}

	public TranspileOptions setDebug(boolean debug)
	{
		this.debug = debug;
		return this;
	}
}
