package com.pseudocode.transpiler.parser.token;

import lombok.Value;

/**
 * A boolean literal, {@code true} or {@code false}.
 */
@Value
public class BoolLiteral implements LiteralToken {
    public static final String TRUE_LITERAL = "true";
    public static final String FALSE_LITERAL = "false";

    boolean value;

    public static BoolLiteral of(boolean value) {
        return new BoolLiteral(value);
    }

    /**
     * Returns the literal for {@code true}/{@code false} source text, or {@code null} for anything else.
     */
    public static BoolLiteral fromSource(String text) {
        if (TRUE_LITERAL.equals(text)) {
            return of(true);
        }
        if (FALSE_LITERAL.equals(text)) {
            return of(false);
        }
        return null;
    }

    @Override
    public String describe() {
        return value ? TRUE_LITERAL : FALSE_LITERAL;
    }
}
