package com.pseudocode.transpiler.model;

/**
 * Base type for all syntax tree nodes. Nodes are immutable once built.
 */
public interface AstNode {

    <R> R accept(AstNodeVisitor<R> visitor);
}
