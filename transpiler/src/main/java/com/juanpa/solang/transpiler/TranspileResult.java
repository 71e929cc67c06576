package com.juanpa.solang.transpiler;

import com.juanpa.solang.transpiler.analysis.UnitClassification;
import com.juanpa.solang.transpiler.codegen.EmissionProfile;

import java.nio.file.Path;

/**
 * Outcome of a successful run: the generated text, the profile that produced it and the file
 * it should be written to.
 */
public record TranspileResult(String output, EmissionProfile profile, UnitClassification classification, Path outputPath)
{
}
