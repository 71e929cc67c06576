package com.juanpa.solang.transpiler.parser;

import com.juanpa.solang.transpiler.ast.Program;
import com.juanpa.solang.transpiler.ast.declarations.FunctionDeclaration;
import com.juanpa.solang.transpiler.ast.expressions.*;
import com.juanpa.solang.transpiler.ast.statements.*;
import com.juanpa.solang.transpiler.lexer.KeywordSet;
import com.juanpa.solang.transpiler.lexer.Lexer;
import com.juanpa.solang.transpiler.util.ErrorReporter;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the base grammar.
 */
class SoLangParserTest
{
	private static Program parse(String source, ErrorReporter reporter)
	{
		return new SoLangParser(new Lexer(source, reporter, KeywordSet.BASE, 0).scanTokens(), reporter).parse();
	}

	@Test
	void testLetWithBinaryInitializer()
	{
		ErrorReporter reporter = new ErrorReporter();
		Program program = parse("let x = a * 3", reporter);

		assertFalse(reporter.hasErrors());
		assertEquals(1, program.getStatements().size());
		VariableDeclarationStatement let = (VariableDeclarationStatement) program.getStatements().get(0);
		assertEquals("x", let.getName().getLexeme());
		BinaryExpression init = (BinaryExpression) let.getInitializer();
		assertEquals("*", init.getOperator().getLexeme());
		assertEquals("a", ((IdentifierExpression) init.getLeft()).getName().getLexeme());
		assertEquals("3", ((LiteralExpression) init.getRight()).getSourceText());
	}

	@Test
	void testLetWithoutInitializer()
	{
		ErrorReporter reporter = new ErrorReporter();
		Program program = parse("let y", reporter);

		assertFalse(reporter.hasErrors());
		assertNull(((VariableDeclarationStatement) program.getStatements().get(0)).getInitializer());
	}

	@Test
	void testBlankLinesAndSemicolonsSeparateStatements()
	{
		ErrorReporter reporter = new ErrorReporter();
		Program program = parse("\n\nlet a = 1; let b = 2\n\n\nprint(a)\n", reporter);

		assertFalse(reporter.hasErrors());
		assertEquals(3, program.getStatements().size());
		assertInstanceOf(PrintStatement.class, program.getStatements().get(2));
	}

	@Test
	void testChainedOperatorIsNotAccepted()
	{
		ErrorReporter reporter = new ErrorReporter();
		Program program = parse("let x = 1 + 2 + 3", reporter);

		assertTrue(reporter.hasErrors());
		VariableDeclarationStatement let = (VariableDeclarationStatement) program.getStatements().get(0);
		BinaryExpression init = (BinaryExpression) let.getInitializer();
		assertEquals("1", ((LiteralExpression) init.getLeft()).getSourceText());
		assertEquals("2", ((LiteralExpression) init.getRight()).getSourceText());
	}

	@Test
	void testGroupingAllowsNesting()
	{
		ErrorReporter reporter = new ErrorReporter();
		Program program = parse("let x = (1 + 2) * 3", reporter);

		assertFalse(reporter.hasErrors());
		BinaryExpression init = (BinaryExpression) ((VariableDeclarationStatement) program.getStatements().get(0)).getInitializer();
		assertInstanceOf(GroupingExpression.class, init.getLeft());
		assertEquals("*", init.getOperator().getLexeme());
	}

	@Test
	void testCallDiscardsArguments()
	{
		ErrorReporter reporter = new ErrorReporter();
		Program program = parse("compute(1, (2), x)", reporter);

		assertFalse(reporter.hasErrors());
		ExpressionStatement statement = (ExpressionStatement) program.getStatements().get(0);
		assertEquals("compute", ((CallExpression) statement.getExpression()).getCallee().getLexeme());
	}

	@Test
	void testIfElseIfElseChain()
	{
		ErrorReporter reporter = new ErrorReporter();
		Program program = parse("if a > 1 {\n print(1)\n}\nelse if a < 0 {\n print(2)\n} else {\n print(3)\n}", reporter);

		assertFalse(reporter.hasErrors());
		assertEquals(1, program.getStatements().size());
		IfStatement outer = (IfStatement) program.getStatements().get(0);
		assertEquals(1, outer.getThenBranch().getStatements().size());
		IfStatement elseIf = (IfStatement) outer.getElseBranch();
		assertEquals("<", ((BinaryExpression) elseIf.getCondition()).getOperator().getLexeme());
		assertInstanceOf(BlockStatement.class, elseIf.getElseBranch());
	}

	@Test
	void testFunctionDeclarationSkipsParametersAndKeepsReturnType()
	{
		ErrorReporter reporter = new ErrorReporter();
		Program program = parse("fn add(a, b) -> int {\n return a + b\n}", reporter);

		assertFalse(reporter.hasErrors());
		FunctionDeclaration function = (FunctionDeclaration) program.getStatements().get(0);
		assertEquals("add", function.getName().getLexeme());
		assertEquals("int", function.getReturnType().getLexeme());
		ReturnStatement ret = (ReturnStatement) function.getBody().getStatements().get(0);
		assertInstanceOf(BinaryExpression.class, ret.getValue());
	}

	@Test
	void testBareReturnHasNoValue()
	{
		ErrorReporter reporter = new ErrorReporter();
		Program program = parse("fn stop() {\n return\n}", reporter);

		assertFalse(reporter.hasErrors());
		FunctionDeclaration function = (FunctionDeclaration) program.getStatements().get(0);
		assertNull(((ReturnStatement) function.getBody().getStatements().get(0)).getValue());
	}

	@Test
	void testMissingClosingBraceKeepsPartialBlock()
	{
		ErrorReporter reporter = new ErrorReporter();
		Program program = parse("fn f() {\n print(1)\n", reporter);

		assertTrue(reporter.hasErrors());
		assertTrue(reporter.getDiagnostics().get(0).contains("Expected '}' to close body of function 'f'."));
		FunctionDeclaration function = (FunctionDeclaration) program.getStatements().get(0);
		assertEquals(1, function.getBody().getStatements().size());
	}

	@Test
	void testMissingParenIsReported()
	{
		ErrorReporter reporter = new ErrorReporter();
		Program program = parse("print 5", reporter);

		assertTrue(reporter.hasErrors());
		assertTrue(reporter.getDiagnostics().get(0).contains("Expected '(' after 'print'. Found '5'."));
		assertNull(((PrintStatement) program.getStatements().get(0)).getValue());
	}

	@Test
	void testErrorsAccumulateAcrossStatements()
	{
		ErrorReporter reporter = new ErrorReporter();
		Program program = parse("let = 1\nlet ok = 2\nfn (\nprint(ok)", reporter);

		assertTrue(reporter.getDiagnostics().size() >= 2);
		boolean printKept = false;
		for (Statement statement : program.getStatements())
		{
			printKept |= statement instanceof PrintStatement;
		}
		assertTrue(printKept);
	}

	@Test
	void testDomainWordsAreIdentifiersInBaseGrammar()
	{
		ErrorReporter reporter = new ErrorReporter();
		Program program = parse("let program = transfer", reporter);

		assertFalse(reporter.hasErrors());
		VariableDeclarationStatement let = (VariableDeclarationStatement) program.getStatements().get(0);
		assertEquals("program", let.getName().getLexeme());
	}
}
