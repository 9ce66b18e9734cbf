package com.pseudocode.transpiler.model;

/**
 * Any node that produces a value.
 */
public interface Expression extends AstNode {
}
