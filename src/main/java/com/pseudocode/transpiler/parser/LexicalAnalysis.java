package com.pseudocode.transpiler.parser;

import java.util.List;

import com.pseudocode.transpiler.parser.token.PositionedToken;
import com.pseudocode.transpiler.parser.token.Token;

import lombok.Value;

/**
 * Output of {@link PseudocodeLexer}.
 * <p>
 * When lexing fails, {@link #getTokens()} holds only the prefix that was recognized before
 * {@link #getFirstInvalidOffset()}.
 */
@Value
public class LexicalAnalysis {
    List<PositionedToken> tokens;
    int firstInvalidOffset;
    int sourceLength;
    List<String> warnings;

    public LexicalAnalysis(List<PositionedToken> tokens, int firstInvalidOffset, int sourceLength,
                           List<String> warnings) {
        this.tokens = List.copyOf(tokens);
        this.firstInvalidOffset = firstInvalidOffset;
        this.sourceLength = sourceLength;
        this.warnings = List.copyOf(warnings);
    }

    public boolean isSuccessful() {
        return firstInvalidOffset == sourceLength;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    /**
     * The tokens without their offsets.
     */
    public List<Token> tokenValues() {
        return tokens.stream().map(PositionedToken::getToken).toList();
    }
}
