package com.pseudocode.transpiler.parser.token;

import lombok.Value;

/**
 * A token together with the source offset it starts at.
 */
@Value
public class PositionedToken {
    int offset;
    Token token;
}
