package com.pseudocode.transpiler.parser.token;

/**
 * A token that can stand on its own as an expression: a literal or a variable name.
 */
public interface ValueToken extends Token {
}
