package com.juanpa.solang.transpiler.util;

import java.util.Properties;

/**
 * Holds configuration settings for the So Lang transpiler, loaded from a properties file.
 * Provides sensible defaults if settings are not specified.
 */
public class CompilerConfig
{
	private final String keygenPath;
	private final String keypairDirectory;
	private final boolean identityEnabled;
	private final int maxTokens;
	private final String anchorPayer;
	private final String anchorSpace;
	private final boolean debug;

	public CompilerConfig(Properties props)
	{
		this.keygenPath = props.getProperty("identity.keygen_path", "solana-keygen");
		this.keypairDirectory = props.getProperty("identity.keypair_dir", "keypairs");
		this.identityEnabled = Boolean.parseBoolean(props.getProperty("identity.enabled", "true").trim());
		this.maxTokens = parseInt(props.getProperty("lexer.max_tokens", "0"));
		this.anchorPayer = props.getProperty("codegen.anchor_payer", "payer");
		this.anchorSpace = props.getProperty("codegen.anchor_space", "8 + 32");
		this.debug = Boolean.parseBoolean(props.getProperty("compiler.debug", "false").trim());
	}

	/**
	 * @return A configuration holding only the defaults.
	 */
	public static CompilerConfig defaults()
	{
		return new CompilerConfig(new Properties());
	}

	private static int parseInt(String value)
	{
		try
		{
			return Math.max(0, Integer.parseInt(value.trim()));
		}
		catch (NumberFormatException e)
		{
			System.err.println("Warning: Invalid lexer.max_tokens value '" + value + "'. Using no limit.");
			return 0;
		}
	}

	public String getKeygenPath()
	{
		return keygenPath;
	}

	public String getKeypairDirectory()
	{
		return keypairDirectory;
	}

	public boolean isIdentityEnabled()
	{
		return identityEnabled;
	}

	/**
	 * @return The token budget for one source file, 0 meaning unlimited.
	 */
	public int getMaxTokens()
	{
		return maxTokens;
	}

	public String getAnchorPayer()
	{
		return anchorPayer;
	}

	public String getAnchorSpace()
	{
		return anchorSpace;
	}

	public boolean isDebug()
	{
		return debug;
	}
}
