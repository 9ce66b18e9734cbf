package com.pseudocode.transpiler.frontend;

import java.util.List;
import java.util.Optional;

import com.pseudocode.transpiler.model.Statement;
import com.pseudocode.transpiler.parser.LexicalAnalysis;

import lombok.Builder;
import lombok.Value;

/**
 * Result of running the lexer and the parser over one source text.
 */
@Value
@Builder
public class FrontEndResult {
    LexicalAnalysis lexicalAnalysis;

    /**
     * {@code null} when lexing or parsing failed.
     */
    List<Statement> statements;

    FrontEndDiagnostics diagnostics;

    public boolean isSuccess() {
        return statements != null;
    }

    public Optional<List<Statement>> getProgram() {
        return Optional.ofNullable(statements);
    }
}
