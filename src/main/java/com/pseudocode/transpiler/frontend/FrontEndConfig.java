package com.pseudocode.transpiler.frontend;

import lombok.Builder;
import lombok.Data;

/**
 * Settings for a {@link PseudocodeFrontEnd} run.
 */
@Data
@Builder
public class FrontEndConfig {

    /**
     * Log every token at DEBUG level after lexing.
     */
    @Builder.Default
    private boolean traceTokens = false;

    /**
     * Log the rendered syntax tree at DEBUG level after a successful parse.
     */
    @Builder.Default
    private boolean traceAst = false;

    public static FrontEndConfig defaults() {
        return FrontEndConfig.builder().build();
    }
}
