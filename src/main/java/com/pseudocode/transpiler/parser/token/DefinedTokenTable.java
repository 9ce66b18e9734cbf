package com.pseudocode.transpiler.parser.token;

import static com.pseudocode.transpiler.parser.token.DefinedToken.*;

import java.util.List;
import java.util.Optional;

/**
 * Ordered lookup table for {@link DefinedToken} literals.
 * <p>
 * The lexer tries {@link #MATCH_ORDER} front to back and takes the first literal that matches.
 * A literal that is a prefix of another one ({@code <} of {@code <=}, {@code >} of {@code >=})
 * must come after it.
 */
public final class DefinedTokenTable {

    public static final List<DefinedToken> MATCH_ORDER = List.of(
        OUTPUT, INPUT,
        IF, ELSE, THEN,
        LOOP, WHILE, UNTIL, FROM, TO,
        METHOD,
        END,
        NEWLINE,
        LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET, COMMA, MEMBER_INVOCATION,
        EQUAL, NOT_EQUAL, GREATER_THAN_EQUAL, LESS_THAN_EQUAL, GREATER_THAN, LESS_THAN,
        LOGIC_NOT, LOGIC_AND, LOGIC_OR,
        PLUS, MINUS, MULTIPLY, DIVIDE, MODULUS
    );

    private DefinedTokenTable() {
        // Utility class
    }

    /**
     * Finds the defined token whose literal is exactly {@code text}.
     */
    public static Optional<DefinedToken> exactMatch(String text) {
        for (DefinedToken token : MATCH_ORDER) {
            if (token.getLiteral().equals(text)) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }
}
