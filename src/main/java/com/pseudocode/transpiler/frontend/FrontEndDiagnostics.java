package com.pseudocode.transpiler.frontend;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Errors and warnings collected while lexing and parsing one source text.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class FrontEndDiagnostics {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
