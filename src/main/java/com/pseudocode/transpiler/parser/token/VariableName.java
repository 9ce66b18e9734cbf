package com.pseudocode.transpiler.parser.token;

import java.util.regex.Pattern;

import lombok.Value;

/**
 * The name of a variable. Variable names are upper case: {@code [_A-Z][_0-9A-Z]*}.
 */
@Value
public class VariableName implements ValueToken {
    public static final Pattern PATTERN = Pattern.compile("[_A-Z][_0-9A-Z]*");

    String name;

    public static boolean matches(String identifier) {
        return PATTERN.matcher(identifier).matches();
    }

    @Override
    public String describe() {
        return name;
    }
}
