package com.pseudocode.transpiler.parser;

import java.util.EnumMap;
import java.util.Map;

import com.pseudocode.transpiler.parser.token.DefinedToken;

/**
 * Binding strength of binary operators. Higher binds tighter.
 * <pre>
 * OR  &lt;  AND  &lt;  = !=  &lt;  &gt; &lt; &gt;= &lt;=  &lt;  + -  &lt;  * div mod
 * </pre>
 */
public final class OperatorPrecedence {

    private static final Map<DefinedToken, Integer> PRECEDENCE = new EnumMap<>(DefinedToken.class);

    static {
        PRECEDENCE.put(DefinedToken.LOGIC_OR, 1);
        PRECEDENCE.put(DefinedToken.LOGIC_AND, 2);
        PRECEDENCE.put(DefinedToken.EQUAL, 3);
        PRECEDENCE.put(DefinedToken.NOT_EQUAL, 3);
        PRECEDENCE.put(DefinedToken.GREATER_THAN, 4);
        PRECEDENCE.put(DefinedToken.LESS_THAN, 4);
        PRECEDENCE.put(DefinedToken.GREATER_THAN_EQUAL, 4);
        PRECEDENCE.put(DefinedToken.LESS_THAN_EQUAL, 4);
        PRECEDENCE.put(DefinedToken.PLUS, 5);
        PRECEDENCE.put(DefinedToken.MINUS, 5);
        PRECEDENCE.put(DefinedToken.MULTIPLY, 6);
        PRECEDENCE.put(DefinedToken.DIVIDE, 6);
        PRECEDENCE.put(DefinedToken.MODULUS, 6);
    }

    private OperatorPrecedence() {
        // Utility class
    }

    /**
     * Precedence of a binary operator.
     *
     * @throws IllegalArgumentException if {@code operator} is not a binary operator
     */
    public static int of(DefinedToken operator) {
        Integer precedence = PRECEDENCE.get(operator);
        if (precedence == null) {
            throw new IllegalArgumentException("Not a binary operator: " + operator);
        }
        return precedence;
    }
}
