package com.juanpa.solang.transpiler.identity;

import java.util.ArrayList;
import java.util.List;

/**
 * Shape check for Solana program ids: 32 to 44 characters of the base58 alphabet.
 * Problems are returned as warning messages; an odd-looking id is still emitted.
 */
public final class ProgramIdValidator
{
	public static final String BASE58_ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";
	public static final int MIN_LENGTH = 32;
	public static final int MAX_LENGTH = 44;

	private ProgramIdValidator()
	{
	}

	public static List<String> validate(String programId)
	{
		List<String> problems = new ArrayList<>();
		if (programId == null)
		{
			return problems;
		}

		int length = programId.length();
		if (length < MIN_LENGTH || length > MAX_LENGTH)
		{
			problems.add("Program id '" + programId + "' has " + length + " characters, expected " + MIN_LENGTH + " to " + MAX_LENGTH + ".");
		}
		for (int i = 0; i < length; i++)
		{
			char c = programId.charAt(i);
			if (BASE58_ALPHABET.indexOf(c) < 0)
			{
				problems.add("Program id '" + programId + "' contains invalid base58 character '" + c + "' at position " + (i + 1) + ".");
				break;
			}
		}
		return problems;
	}
}
