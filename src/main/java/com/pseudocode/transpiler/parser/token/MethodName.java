package com.pseudocode.transpiler.parser.token;

import java.util.regex.Pattern;

import lombok.Value;

/**
 * The name of a method, camelCase: {@code [_a-z][_0-9A-Za-z]*}.
 * <p>
 * One-word lower case names look the same as keywords, so any such word missing from
 * {@link DefinedToken} ends up here.
 */
@Value
public class MethodName implements Token {
    public static final Pattern PATTERN = Pattern.compile("[_a-z][_0-9A-Za-z]*");

    String name;

    public static boolean matches(String identifier) {
        return PATTERN.matcher(identifier).matches();
    }

    @Override
    public String describe() {
        return name;
    }
}
