// File: src/main/java/com/juanpa/solang/transpiler/ast/ASTVisitor.java

package com.juanpa.solang.transpiler.ast;

import com.juanpa.solang.transpiler.ast.declarations.AccountDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.FunctionDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.InstructionDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.ProgramDeclaration;
import com.juanpa.solang.transpiler.ast.declarations.StateDeclaration;
import com.juanpa.solang.transpiler.ast.expressions.*;
import com.juanpa.solang.transpiler.ast.statements.*;

/**
 * Interface for the Visitor pattern that allows AST traversal.
 * Each `visit` method corresponds to a specific AST node type.
 * Code generators use {@code ASTVisitor<String>}: expressions return their rendered text,
 * statements append to the generator's output and return null.
 */
public interface ASTVisitor<R>
{
	R visitProgram(Program program);

	// --- Declarations ---
	R visitFunctionDeclaration(FunctionDeclaration declaration);

	R visitProgramDeclaration(ProgramDeclaration declaration);

	R visitInstructionDeclaration(InstructionDeclaration declaration);

	R visitAccountDeclaration(AccountDeclaration declaration);

	R visitStateDeclaration(StateDeclaration declaration);

	// --- Statements ---
	R visitBlockStatement(BlockStatement statement);

	R visitVariableDeclarationStatement(VariableDeclarationStatement statement);

	R visitIfStatement(IfStatement statement);

	R visitReturnStatement(ReturnStatement statement);

	R visitPrintStatement(PrintStatement statement);

	R visitExpressionStatement(ExpressionStatement statement);

	R visitTransferStatement(TransferStatement statement);

	R visitRequireStatement(RequireStatement statement);

	R visitEmitStatement(EmitStatement statement);

	// --- Expressions ---
	R visitBinaryExpression(BinaryExpression expression);

	R visitIdentifierExpression(IdentifierExpression expression);

	R visitLiteralExpression(LiteralExpression expression);

	R visitCallExpression(CallExpression expression);

	R visitGroupingExpression(GroupingExpression expression);
}
