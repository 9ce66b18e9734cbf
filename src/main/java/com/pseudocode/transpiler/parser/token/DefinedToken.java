package com.pseudocode.transpiler.parser.token;

import lombok.Getter;

/**
 * All predefined tokens: keywords, command starters, punctuation and operators.
 * <p>
 * The lexer does not rely on the declaration order below; it matches against
 * {@link DefinedTokenTable#MATCH_ORDER}.
 */
@Getter
public enum DefinedToken implements Token {
    OUTPUT("output", Kind.COMMAND_START),
    INPUT("input", Kind.COMMAND_START),

    IF("if", Kind.COMMAND_START),
    ELSE("else", Kind.CONTROL),
    THEN("then", Kind.KEYWORD),

    LOOP("loop", Kind.COMMAND_START),
    WHILE("while", Kind.KEYWORD),
    UNTIL("until", Kind.KEYWORD),
    FROM("from", Kind.KEYWORD),
    TO("to", Kind.KEYWORD),

    METHOD("method", Kind.COMMAND_START),

    END("end", Kind.CONTROL),

    NEWLINE("\n", Kind.MISC),

    LEFT_PAREN("(", Kind.MISC),
    RIGHT_PAREN(")", Kind.MISC),
    LEFT_BRACKET("[", Kind.MISC),
    RIGHT_BRACKET("]", Kind.MISC),
    COMMA(",", Kind.MISC),
    MEMBER_INVOCATION(".", Kind.MISC),

    EQUAL("=", Kind.BINARY_OPERATOR),
    NOT_EQUAL("!=", Kind.BINARY_OPERATOR),
    GREATER_THAN_EQUAL(">=", Kind.BINARY_OPERATOR),
    LESS_THAN_EQUAL("<=", Kind.BINARY_OPERATOR),
    GREATER_THAN(">", Kind.BINARY_OPERATOR),
    LESS_THAN("<", Kind.BINARY_OPERATOR),

    LOGIC_NOT("NOT", Kind.UNARY_OPERATOR),
    LOGIC_AND("AND", Kind.BINARY_OPERATOR),
    LOGIC_OR("OR", Kind.BINARY_OPERATOR),

    PLUS("+", Kind.UNARY_AND_BINARY_OPERATOR),
    MINUS("-", Kind.UNARY_AND_BINARY_OPERATOR),
    MULTIPLY("*", Kind.BINARY_OPERATOR),
    DIVIDE("div", Kind.BINARY_OPERATOR),
    MODULUS("mod", Kind.BINARY_OPERATOR);

    private final String literal;
    private final Kind kind;

    DefinedToken(String literal, Kind kind) {
        this.literal = literal;
        this.kind = kind;
    }

    public boolean isUnaryOperator() {
        return kind == Kind.UNARY_OPERATOR || kind == Kind.UNARY_AND_BINARY_OPERATOR;
    }

    public boolean isBinaryOperator() {
        return kind == Kind.BINARY_OPERATOR || kind == Kind.UNARY_AND_BINARY_OPERATOR;
    }

    public boolean isCommandStart() {
        return kind == Kind.COMMAND_START;
    }

    @Override
    public String describe() {
        return this == NEWLINE ? "\\n" : literal;
    }

    /**
     * Static classification of a defined token.
     */
    public enum Kind {
        /**
         * Word used inside a command, e.g. {@code then} or {@code while}.
         */
        KEYWORD,

        /**
         * Token that opens a command: {@code output}, {@code input}, {@code if}, {@code loop}, {@code method}.
         */
        COMMAND_START,

        /**
         * Token that appears inside a block without starting one, e.g. {@code end} or {@code else}.
         */
        CONTROL,

        UNARY_OPERATOR,
        BINARY_OPERATOR,
        UNARY_AND_BINARY_OPERATOR,

        /**
         * Punctuation and newline.
         */
        MISC
    }
}
