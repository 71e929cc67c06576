package com.juanpa.solang.transpiler.codegen;

/**
 * Picks the generator for an emission profile.
 */
public final class CodeGenerators
{
	private CodeGenerators()
	{
	}

	public static CodeGenerator create(GenerationContext context)
	{
		switch (context.getProfile())
		{
			case C:
				return new CGenerator(context);
			case RUST:
				return new RustGenerator(context);
			case ANCHOR:
				return new AnchorGenerator(context);
			case NATIVE:
				return new NativeSolanaGenerator(context);
			default:
				throw new IllegalArgumentException("Unknown emission profile: " + context.getProfile());
		}
	}
}
