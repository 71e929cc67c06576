package com.juanpa.solang.transpiler.identity;

/**
 * Supplies the on-chain id of a program that does not declare one.
 */
public interface ProgramIdentityResolver
{
	/**
	 * @param programName Name of the program, used to key the generated keypair.
	 * @return The base58 public key of the program.
	 * @throws IdentityResolutionException If no id could be produced.
	 */
	String resolve(String programName) throws IdentityResolutionException;
}
