package com.pseudocode.transpiler.parser.token;

import lombok.Value;

/**
 * Any letter-led identifier that is neither a variable nor a method name, e.g. {@code MyClass}.
 * No grammar rule consumes class names yet.
 */
@Value
public class ClassName implements Token {
    String name;

    @Override
    public String describe() {
        return name;
    }
}
