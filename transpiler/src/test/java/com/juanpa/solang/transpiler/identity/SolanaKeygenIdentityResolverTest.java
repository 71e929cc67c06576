package com.juanpa.solang.transpiler.identity;

import com.juanpa.solang.transpiler.util.CompilerConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the keygen-backed resolver that do not need the real tool installed.
 */
class SolanaKeygenIdentityResolverTest
{
	private static CompilerConfig config(String keygen, Path keypairs)
	{
		Properties props = new Properties();
		props.setProperty("identity.keygen_path", keygen);
		props.setProperty("identity.keypair_dir", keypairs.toString());
		return new CompilerConfig(props);
	}

	@Test
	void testKeypairFileNaming(@TempDir Path dir)
	{
		SolanaKeygenIdentityResolver resolver = new SolanaKeygenIdentityResolver(config("solana-keygen", dir));

		assertEquals(dir.resolve("vault-keypair.json"), resolver.keypairFileFor("vault"));
	}

	@Test
	void testMissingToolRaisesResolutionException(@TempDir Path dir)
	{
		String missingTool = dir.resolve("no-such-keygen-binary").toString();
		SolanaKeygenIdentityResolver resolver = new SolanaKeygenIdentityResolver(config(missingTool, dir.resolve("keys")));

		IdentityResolutionException e = assertThrows(IdentityResolutionException.class, () -> resolver.resolve("vault"));
		assertTrue(e.getMessage().contains("Could not run"), e.getMessage());
	}
}
