package com.pseudocode.transpiler.cli.model;

import java.nio.charset.Charset;
import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps ParseCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedParseOptions {
    private Path sourcePath;
    private Charset charset;
}
