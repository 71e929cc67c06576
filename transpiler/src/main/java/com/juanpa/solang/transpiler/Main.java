// File: src/main/java/com/juanpa/solang/transpiler/Main.java

package com.juanpa.solang.transpiler;

import com.juanpa.solang.transpiler.identity.SolanaKeygenIdentityResolver;
import com.juanpa.solang.transpiler.util.CompilerConfig;
import com.juanpa.solang.transpiler.util.ErrorReporter;
import com.juanpa.solang.transpiler.util.TranspileOptions;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Entry point for the So Lang transpiler.
 * <pre>
 * solang &lt;input.so&gt; [--rust] [--solana] [--anchor] [--native-solana] [--output PATH] [--no-keygen] [--debug]
 * </pre>
 * Exit codes: 0 on success, 1 on input, compile or output errors, 2 on usage errors.
 */
public class Main
{
	static final int EXIT_OK = 0;
	static final int EXIT_FAILURE = 1;
	static final int EXIT_USAGE = 2;

	// Sources are raw bytes. Latin-1 maps every byte to one char and back, so nothing is rejected.
	private static final Charset SOURCE_CHARSET = StandardCharsets.ISO_8859_1;

	private static final String USAGE =
			"Usage: solang <input.so> [--rust] [--solana] [--anchor] [--native-solana] [--output PATH] [--no-keygen] [--debug]";

	public static void main(String[] args)
	{
		int exitCode = run(args, loadConfiguration());
		if (exitCode != EXIT_OK)
		{
			System.exit(exitCode);
		}
	}

	static int run(String[] args, CompilerConfig config)
	{
		TranspileOptions options = new TranspileOptions();
		String input = null;

		for (int i = 0; i < args.length; i++)
		{
			String arg = args[i];
			switch (arg)
			{
				case "--rust":
					options.setRustRequested(true);
					break;
				case "--solana":
					options.setDomainForced(true);
					break;
				case "--anchor":
					options.setDomainForced(true).setFramework(TranspileOptions.Framework.ANCHOR);
					break;
				case "--native-solana":
					options.setDomainForced(true).setFramework(TranspileOptions.Framework.NATIVE);
					break;
				case "--no-keygen":
					options.setIdentityResolution(false);
					break;
				case "--debug":
					options.setDebug(true);
					break;
				case "--output":
					if (i + 1 >= args.length)
					{
						System.err.println("Error: --output requires a path.");
						System.err.println(USAGE);
						return EXIT_USAGE;
					}
					options.setOutputPath(Paths.get(args[++i]));
					break;
				default:
					if (arg.startsWith("--"))
					{
						System.err.println("Error: Unknown option: " + arg);
						System.err.println(USAGE);
						return EXIT_USAGE;
					}
					if (input != null)
					{
						System.err.println("Error: Only one input file is accepted.");
						System.err.println(USAGE);
						return EXIT_USAGE;
					}
					input = arg;
					break;
			}
		}

		if (input == null)
		{
			System.err.println(USAGE);
			return EXIT_USAGE;
		}

		Path inputFile = Paths.get(input);
		if (!Files.exists(inputFile))
		{
			System.err.println("Error: Input file not found: " + inputFile);
			return EXIT_FAILURE;
		}

		String source;
		try
		{
			source = new String(Files.readAllBytes(inputFile), SOURCE_CHARSET);
		}
		catch (IOException e)
		{
			System.err.println("Error: Could not read input file '" + inputFile + "': " + e.getMessage());
			return EXIT_FAILURE;
		}

		System.out.println("--- Compiling " + inputFile.getFileName() + " ---");
		ErrorReporter errorReporter = new ErrorReporter();
		Transpiler transpiler = new Transpiler(config, errorReporter, new SolanaKeygenIdentityResolver(config));
		TranspileResult result = transpiler.compile(source, fileStem(inputFile), options);
		if (result == null)
		{
			System.err.println("Build failed.");
			return EXIT_FAILURE;
		}

		System.out.println("--- Code Generation Phase (" + result.profile() + ") ---");
		if (!saveToFile(result.outputPath(), result.output()))
		{
			return EXIT_FAILURE;
		}
		if (errorReporter.getWarningCount() > 0)
		{
			System.out.println("--- Finished with " + errorReporter.getWarningCount() + " warning(s) ---");
		}
		else
		{
			System.out.println("--- Finished successfully ---");
		}
		return EXIT_OK;
	}

	// --- HELPER METHODS ---

	private static String fileStem(Path file)
	{
		String name = file.getFileName().toString();
		int dot = name.lastIndexOf('.');
		return dot > 0 ? name.substring(0, dot) : name;
	}

	private static boolean saveToFile(Path filePath, String content)
	{
		try
		{
			Path parent = filePath.toAbsolutePath().getParent();
			if (parent != null)
			{
				Files.createDirectories(parent);
			}
			Files.write(filePath, content.getBytes(SOURCE_CHARSET));
			System.out.println("Saved: " + filePath);
			return true;
		}
		catch (IOException e)
		{
			System.err.println("Error saving generated code to file '" + filePath + "': " + e.getMessage());
			return false;
		}
	}

	private static CompilerConfig loadConfiguration()
	{
		Properties props = new Properties();
		Path configPath = Paths.get(System.getProperty("user.home"), ".config", "solang", "solang.conf");

		if (Files.exists(configPath))
		{
			try (InputStream input = new FileInputStream(configPath.toFile()))
			{
				props.load(input);
				System.out.println("--- Loaded configuration from: " + configPath + " ---");
			}
			catch (IOException e)
			{
				System.err.println("Warning: Could not read config file at " + configPath + ". Using default settings.");
			}
		}
		return new CompilerConfig(props);
	}
}
