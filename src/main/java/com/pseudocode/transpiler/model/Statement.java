package com.pseudocode.transpiler.model;

/**
 * A statement or block.
 */
public interface Statement extends AstNode {
}
