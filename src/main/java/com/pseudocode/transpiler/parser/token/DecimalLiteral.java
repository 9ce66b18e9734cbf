package com.pseudocode.transpiler.parser.token;

import lombok.Value;

/**
 * A decimal (floating point) literal such as {@code 12.5}.
 */
@Value
public class DecimalLiteral implements LiteralToken {
    public static final char DECIMAL_POINT = '.';

    double value;

    @Override
    public String describe() {
        return Double.toString(value);
    }
}
