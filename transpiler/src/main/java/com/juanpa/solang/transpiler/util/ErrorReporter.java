package com.juanpa.solang.transpiler.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects diagnostics for a single compilation run.
 * One instance is created by the driver and passed to every phase; the driver checks
 * {@link #hasErrors()} between phases to decide whether to continue.
 */
public class ErrorReporter
{
	private boolean hasErrors = false; // Set by the first error, never cleared
	private int warningCount = 0;
	private final List<String> diagnostics = new ArrayList<>();

	/**
	 * Reports a transpilation error.
	 *
	 * @param line    The line number where the error occurred.
	 * @param column  The column number where the error occurred.
	 * @param message The error message.
	 */
	public void report(int line, int column, String message)
	{
		String diagnostic = "[Error] Line " + line + ", Column " + column + ": " + message;
		System.err.println(diagnostic);
		diagnostics.add(diagnostic);
		hasErrors = true;
	}

	/**
	 * Reports a warning that is not tied to a source position.
	 * Warnings never stop the pipeline.
	 *
	 * @param message The warning message.
	 */
	public void warn(String message)
	{
		String diagnostic = "[Warning] " + message;
		System.err.println(diagnostic);
		diagnostics.add(diagnostic);
		warningCount++;
	}

	/**
	 * Checks if any errors have been reported.
	 *
	 * @return True if errors exist, false otherwise.
	 */
	public boolean hasErrors()
	{
		return hasErrors;
	}

	public int getWarningCount()
	{
		return warningCount;
	}

	/**
	 * @return Every error and warning reported so far, in order.
	 */
	public List<String> getDiagnostics()
	{
		return Collections.unmodifiableList(diagnostics);
	}
}
