package com.juanpa.solang.transpiler.codegen;

import com.juanpa.solang.transpiler.analysis.UnitClassification;
import com.juanpa.solang.transpiler.util.TranspileOptions;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for profile selection.
 */
class ProfileSelectorTest
{
	private static final UnitClassification DOMAIN = new UnitClassification(true, "Vault", null);

	@Test
	void testGenericUnitDefaultsToC()
	{
		assertEquals(EmissionProfile.C, ProfileSelector.select(new TranspileOptions(), UnitClassification.GENERIC));
	}

	@Test
	void testRustFlagSelectsRustForGenericUnit()
	{
		TranspileOptions options = new TranspileOptions().setRustRequested(true);

		assertEquals(EmissionProfile.RUST, ProfileSelector.select(options, UnitClassification.GENERIC));
	}

	@Test
	void testDetectedDomainUnitDefaultsToNative()
	{
		assertEquals(EmissionProfile.NATIVE, ProfileSelector.select(new TranspileOptions(), DOMAIN));
		assertEquals(EmissionProfile.NATIVE, ProfileSelector.select(new TranspileOptions().setRustRequested(true), DOMAIN));
	}

	@Test
	void testAnchorFramework()
	{
		TranspileOptions options = new TranspileOptions().setDomainForced(true).setFramework(TranspileOptions.Framework.ANCHOR);

		assertEquals(EmissionProfile.ANCHOR, ProfileSelector.select(options, DOMAIN));
		assertEquals(EmissionProfile.ANCHOR, ProfileSelector.select(options, UnitClassification.GENERIC));
	}

	@Test
	void testForcingMakesGenericUnitDomain()
	{
		TranspileOptions options = new TranspileOptions().setDomainForced(true);

		assertEquals(EmissionProfile.NATIVE, ProfileSelector.select(options, UnitClassification.GENERIC));
	}

	@Test
	void testDefaultOutputFiles()
	{
		assertEquals("output.c", EmissionProfile.C.getDefaultOutputFile());
		assertEquals("output.rs", EmissionProfile.RUST.getDefaultOutputFile());
		assertEquals("lib.rs", EmissionProfile.ANCHOR.getDefaultOutputFile());
		assertEquals("program.rs", EmissionProfile.NATIVE.getDefaultOutputFile());
		assertTrue(EmissionProfile.ANCHOR.isDomain());
		assertFalse(EmissionProfile.RUST.isDomain());
	}
}
