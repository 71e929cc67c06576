package com.juanpa.solang.transpiler.identity;

/**
 * Raised when a program id cannot be obtained from the key generation tool.
 */
public class IdentityResolutionException extends Exception
{
	public IdentityResolutionException(String message)
	{
		super(message);
	}

	public IdentityResolutionException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
