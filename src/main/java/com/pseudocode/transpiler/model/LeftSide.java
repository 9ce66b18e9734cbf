package com.pseudocode.transpiler.model;

/**
 * Target of an assignment: a variable ({@link ValueNode} holding a variable name) or an {@link ArrayAccessNode}.
 */
public interface LeftSide extends Expression {
}
