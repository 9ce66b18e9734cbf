package com.pseudocode.transpiler.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "parse" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ParseOptions {

    @Parameters(index = "0", paramLabel = "SOURCE", description = "Pseudocode source file to parse")
    private Path source;

    @Option(names = { "--charset" }, defaultValue = "UTF-8", description = "Character set of the source file (default: UTF-8)")
    private String charset;

    @Option(names = { "--tokens", "-t" }, description = "Print the token stream")
    private boolean printTokens;

    @Option(names = { "--no-ast" }, description = "Do not print the syntax tree")
    private boolean suppressAst;

    @Option(names = { "--timing" }, description = "Print how long lexing and parsing took")
    private boolean timing;

    @Option(names = { "--trace" }, description = "Log tokens and the syntax tree at DEBUG level")
    private boolean trace;
}
