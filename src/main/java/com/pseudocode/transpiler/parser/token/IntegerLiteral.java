package com.pseudocode.transpiler.parser.token;

import lombok.Value;

/**
 * An integer literal.
 */
@Value
public class IntegerLiteral implements LiteralToken {
    long value;

    @Override
    public String describe() {
        return Long.toString(value);
    }
}
