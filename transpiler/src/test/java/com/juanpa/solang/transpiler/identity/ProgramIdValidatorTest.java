package com.juanpa.solang.transpiler.identity;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for program id shape checks.
 */
class ProgramIdValidatorTest
{
	@Test
	void testValidIds()
	{
		assertTrue(ProgramIdValidator.validate("Fg6PaFpoGXkYsidMpWTK6W2BeZ7FEfcYkg476zPFsLnS").isEmpty());
		assertTrue(ProgramIdValidator.validate("11111111111111111111111111111111").isEmpty());
		assertTrue(ProgramIdValidator.validate(null).isEmpty());
	}

	@Test
	void testLengthBounds()
	{
		List<String> tooShort = ProgramIdValidator.validate("abc");
		assertEquals(1, tooShort.size());
		assertTrue(tooShort.get(0).contains("has 3 characters, expected 32 to 44"));

		assertEquals(1, ProgramIdValidator.validate("1".repeat(45)).size());
		assertTrue(ProgramIdValidator.validate("1".repeat(44)).isEmpty());
	}

	@Test
	void testCharactersOutsideBase58()
	{
		for (char c : new char[]{'0', 'O', 'I', 'l', '-'})
		{
			String id = c + "1".repeat(40);
			List<String> problems = ProgramIdValidator.validate(id);
			assertEquals(1, problems.size(), id);
			assertTrue(problems.get(0).contains("invalid base58 character '" + c + "' at position 1"));
		}
	}
}
