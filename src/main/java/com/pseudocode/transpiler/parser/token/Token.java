package com.pseudocode.transpiler.parser.token;

/**
 * A classified, indivisible lexical unit produced by the lexer.
 */
public interface Token {

    /**
     * Text shown for this token in diagnostics.
     */
    String describe();
}
