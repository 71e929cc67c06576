package com.juanpa.solang.transpiler.ast.statements;

import com.juanpa.solang.transpiler.ast.ASTNode;

/**
 * Base interface for all statement nodes, including the domain declarations
 * which appear wherever a statement may appear.
 */
public interface Statement extends ASTNode
{
}
