package com.juanpa.solang.transpiler.ast.expressions;

import com.juanpa.solang.transpiler.ast.ASTNode;

/**
 * Base interface for all expression nodes in the Abstract Syntax Tree (AST).
 * Expressions are parts of the program that produce a value.
 */
public interface Expression extends ASTNode
{
}
