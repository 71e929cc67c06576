// File: src/main/java/com/juanpa/solang/transpiler/identity/SolanaKeygenIdentityResolver.java
package com.juanpa.solang.transpiler.identity;

import com.juanpa.solang.transpiler.util.CompilerConfig;
import com.juanpa.solang.transpiler.util.Debug;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves program ids with the {@code solana-keygen} tool.
 * <p>
 * Each program gets a keypair file {@code <keypair_dir>/<name>-keypair.json}. An existing file
 * is reused, so the id stays stable across runs. Results are cached per resolver instance.
 */
public class SolanaKeygenIdentityResolver implements ProgramIdentityResolver
{
	private final String keygenPath;
	private final Path keypairDirectory;
	private final Map<String, String> cache = new HashMap<>();

	public SolanaKeygenIdentityResolver(CompilerConfig config)
	{
		this.keygenPath = config.getKeygenPath();
		this.keypairDirectory = Paths.get(config.getKeypairDirectory());
	}

	@Override
	public String resolve(String programName) throws IdentityResolutionException
	{
		String cached = cache.get(programName);
		if (cached != null)
		{
			return cached;
		}

		Path keypairFile = keypairFileFor(programName);
		if (Files.exists(keypairFile))
		{
			Debug.log("Reusing keypair %s", keypairFile);
		}
		else
		{
			try
			{
				Files.createDirectories(keypairDirectory);
			}
			catch (IOException e)
			{
				throw new IdentityResolutionException("Cannot create keypair directory '" + keypairDirectory + "': " + e.getMessage(), e);
			}
			System.out.println("Generating keypair for program '" + programName + "'...");
			run(Arrays.asList(keygenPath, "new", "--no-passphrase", "--outfile", keypairFile.toString()));
		}

		List<String> output = run(Arrays.asList(keygenPath, "pubkey", keypairFile.toString()));
		String pubkey = output.isEmpty() ? "" : output.get(0).trim();
		if (pubkey.isEmpty())
		{
			throw new IdentityResolutionException("'" + keygenPath + " pubkey' printed no public key for " + keypairFile);
		}

		cache.put(programName, pubkey);
		return pubkey;
	}

	Path keypairFileFor(String programName)
	{
		return keypairDirectory.resolve(programName + "-keypair.json");
	}

	/**
	 * Runs the tool and returns its standard output lines. Standard error is echoed with a prefix.
	 */
	private List<String> run(List<String> command) throws IdentityResolutionException
	{
		Debug.log("Running: %s", String.join(" ", command));
		Process process;
		try
		{
			process = new ProcessBuilder(command).start();
		}
		catch (IOException e)
		{
			throw new IdentityResolutionException("Could not run '" + keygenPath + "': " + e.getMessage(), e);
		}

		List<String> stdout = Collections.synchronizedList(new ArrayList<>());
		Thread out = new Thread(new StreamGobbler(process.getInputStream(), null, stdout));
		Thread err = new Thread(new StreamGobbler(process.getErrorStream(), "[solana-keygen stderr]: ", null));
		out.start();
		err.start();

		try
		{
			int exitCode = process.waitFor();
			out.join();
			err.join();
			if (exitCode != 0)
			{
				throw new IdentityResolutionException("'" + String.join(" ", command) + "' exited with code " + exitCode);
			}
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			process.destroy();
			throw new IdentityResolutionException("Interrupted while waiting for '" + keygenPath + "'", e);
		}
		return new ArrayList<>(stdout);
	}

	/**
	 * Drains a process stream on its own thread so the child never blocks on a full pipe.
	 * Lines go into {@code sink} when one is given, otherwise they are echoed with {@code prefix}.
	 */
	private static class StreamGobbler implements Runnable
	{
		private final InputStream inputStream;
		private final String prefix;
		private final List<String> sink;

		public StreamGobbler(InputStream inputStream, String prefix, List<String> sink)
		{
			this.inputStream = inputStream;
			this.prefix = prefix;
			this.sink = sink;
		}

		@Override
		public void run()
		{
			try (BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8)))
			{
				String line;
				while ((line = reader.readLine()) != null)
				{
					if (sink != null)
					{
						sink.add(line);
					}
					else
					{
						System.err.println(prefix + line);
					}
				}
			}
			catch (IOException e)
			{
				System.err.println("Error reading process stream: " + e.getMessage());
			}
		}
	}
}
