package com.juanpa.solang.transpiler.analysis;

import com.juanpa.solang.transpiler.ast.Program;
import com.juanpa.solang.transpiler.lexer.Lexer;
import com.juanpa.solang.transpiler.parser.SolanaParser;
import com.juanpa.solang.transpiler.util.ErrorReporter;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for domain detection.
 */
class DomainDetectorTest
{
	private static UnitClassification classify(String source)
	{
		ErrorReporter reporter = new ErrorReporter();
		Program program = new SolanaParser(new Lexer(source, reporter).scanTokens(), reporter).parse();
		assertFalse(reporter.hasErrors(), reporter.getDiagnostics().toString());
		return new DomainDetector().classify(program);
	}

	@Test
	void testGenericUnit()
	{
		UnitClassification classification = classify("let a = 1\nfn f() {\n if a > 0 {\n print(a)\n }\n}");

		assertFalse(classification.domain());
		assertNull(classification.programName());
		assertNull(classification.programId());
	}

	@Test
	void testProgramSuppliesNameAndId()
	{
		UnitClassification classification = classify("program Bank \"BankId\" {}\nprogram Other \"OtherId\" {}");

		assertTrue(classification.domain());
		assertEquals("Bank", classification.programName());
		assertEquals("BankId", classification.programId());
		assertTrue(classification.hasProgramId());
	}

	@Test
	void testDomainStatementNestedInFunctionIsFound()
	{
		UnitClassification classification = classify("fn pay() {\n if ok {\n } else {\n transfer(a, b, 1)\n }\n}");

		assertTrue(classification.domain());
		assertNull(classification.programName());
	}

	@Test
	void testEachDomainNodeKindMarksUnit()
	{
		assertTrue(classify("account a(signer)").domain());
		assertTrue(classify("state S { x: u64 }").domain());
		assertTrue(classify("instruction go() {}").domain());
		assertTrue(classify("require(a < b)").domain());
		assertTrue(classify("emit Done").domain());
	}

	@Test
	void testClassifyStartsFresh()
	{
		ErrorReporter reporter = new ErrorReporter();
		DomainDetector detector = new DomainDetector();
		Program domain = new SolanaParser(new Lexer("program P {}", reporter).scanTokens(), reporter).parse();
		Program generic = new SolanaParser(new Lexer("print(1)", reporter).scanTokens(), reporter).parse();

		assertTrue(detector.classify(domain).domain());
		assertFalse(detector.classify(generic).domain());
	}
}
