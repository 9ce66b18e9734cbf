package com.pseudocode.transpiler.parser.token;

/**
 * Boolean, integer, decimal or string literal.
 */
public interface LiteralToken extends ValueToken {
}
