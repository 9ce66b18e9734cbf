package com.pseudocode.transpiler.parser.token;

import java.util.Map;

import lombok.Value;

/**
 * A string literal. The content has its escape sequences already resolved.
 */
@Value
public class StringLiteral implements LiteralToken {
    public static final char BOUNDARY = '"';
    public static final char ESCAPE = '\\';

    /**
     * Escapes with a special meaning. Any other escaped character stands for itself.
     */
    public static final Map<Character, Character> ESCAPES = Map.of(
        '\\', '\\',
        'n', '\n',
        't', '\t'
    );

    String content;

    public static char unescape(char escaped) {
        return ESCAPES.getOrDefault(escaped, escaped);
    }

    @Override
    public String describe() {
        return BOUNDARY + content + BOUNDARY;
    }
}
