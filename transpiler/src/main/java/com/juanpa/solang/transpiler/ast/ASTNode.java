package com.juanpa.solang.transpiler.ast;

/**
 * Base interface for all nodes in the Abstract Syntax Tree (AST).
 * Each node kind is its own class carrying only the fields it needs.
 */
public interface ASTNode
{
	/**
	 * Accepts an ASTVisitor to traverse this node.
	 *
	 * @param visitor The ASTVisitor instance.
	 * @param <R>     The return type of the visitor's visit methods.
	 * @return The result of the visitor's operation.
	 */
	<R> R accept(ASTVisitor<R> visitor);
}
