package com.pseudocode.transpiler;

import com.pseudocode.transpiler.cli.ParseCommand;

import picocli.CommandLine;

/**
 * Main entry point for the pseudocode transpiler front end.
 * Reads a pseudocode source file, lexes and parses it, and reports the syntax tree or the first error.
 */
public class TranspilerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ParseCommand()).execute(args);
        System.exit(exitCode);
    }
}
