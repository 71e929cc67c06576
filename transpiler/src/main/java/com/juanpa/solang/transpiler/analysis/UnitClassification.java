package com.juanpa.solang.transpiler.analysis;

/**
 * Result of the domain detection pass over one compilation unit.
 *
 * @param domain      True if any domain declaration occurs anywhere in the tree.
 * @param programName Name of the first (outermost) program declaration, or null.
 * @param programId   Program identifier, either written in the source or resolved later. May be null.
 */
public record UnitClassification(boolean domain, String programName, String programId)
{
	public static final UnitClassification GENERIC = new UnitClassification(false, null, null);

	public UnitClassification withProgramId(String id)
	{
		return new UnitClassification(domain, programName, id);
	}

	public UnitClassification withProgramName(String name)
	{
		return new UnitClassification(domain, name, programId);
	}

	public boolean hasProgramId()
	{
		return programId != null && !programId.isEmpty();
	}
}
