package com.pseudocode.transpiler.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests for the "parse" command, run in-process through picocli.
 */
class ParseCommandTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new ParseCommand());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void testPrintsSyntaxTree() throws IOException {
        Path source = write("prog.txt", "A = 1 + 2\n");

        int exitCode = commandLine.execute(source.toString());

        assertThat(exitCode).isEqualTo(ParseCommand.EXIT_OK);
        assertThat(out.toString()).isEqualTo("""
                Assignment
                  Value A
                  BinaryOperation +
                    Value 1
                    Value 2
                """);
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void testPrintsTokensWithPositions() throws IOException {
        Path source = write("prog.txt", "input X\n");

        int exitCode = commandLine.execute("--tokens", "--no-ast", source.toString());

        assertThat(exitCode).isEqualTo(ParseCommand.EXIT_OK);
        assertThat(out.toString())
                .contains("Tokens:")
                .contains("1:1  INPUT")
                .contains("1:7  VariableName(name=X)")
                .doesNotContain("Input X");
    }

    @Test
    void testTimingIsPrintedOnRequest() throws IOException {
        Path source = write("prog.txt", "output 1\n");

        int exitCode = commandLine.execute("--timing", "--no-ast", source.toString());

        assertThat(exitCode).isEqualTo(ParseCommand.EXIT_OK);
        assertThat(out.toString()).startsWith("Parsed in ").endsWith(" ms" + System.lineSeparator());
    }

    @Test
    void testTraceStillPrintsTree() throws IOException {
        Path source = write("prog.txt", "output 1\n");

        int exitCode = commandLine.execute("--trace", source.toString());

        assertThat(exitCode).isEqualTo(ParseCommand.EXIT_OK);
        assertThat(out.toString()).contains("Output");
    }

    @Test
    void testSyntaxErrorExitCode() throws IOException {
        Path source = write("prog.txt", "if A then\noutput 1\n");

        int exitCode = commandLine.execute(source.toString());

        assertThat(exitCode).isEqualTo(ParseCommand.EXIT_INVALID_SOURCE);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).contains("error: Syntax error at end of input");
    }

    @Test
    void testLexicalErrorExitCode() throws IOException {
        Path source = write("prog.txt", "A = 1 ? 2\n");

        int exitCode = commandLine.execute(source.toString());

        assertThat(exitCode).isEqualTo(ParseCommand.EXIT_INVALID_SOURCE);
        assertThat(err.toString()).contains("error: Unrecognized input at line 1, column 7");
    }

    @Test
    void testWarningsArePrinted() throws IOException {
        Path source = write("prog.txt", "output \"open");

        int exitCode = commandLine.execute(source.toString());

        assertThat(exitCode).isEqualTo(ParseCommand.EXIT_OK);
        assertThat(err.toString()).contains("warning: Unterminated string literal");
    }

    @Test
    void testMissingSourceFile() {
        int exitCode = commandLine.execute(tempDir.resolve("nope.txt").toString());

        assertThat(exitCode).isEqualTo(ParseCommand.EXIT_USAGE_ERROR);
        assertThat(err.toString()).contains("does not exist");
    }

    @Test
    void testMissingParameterIsAUsageError() {
        int exitCode = commandLine.execute();

        assertThat(exitCode).isEqualTo(ParseCommand.EXIT_USAGE_ERROR);
    }

    @Test
    void testUndecodableSourceIsAUsageError() throws IOException {
        Path source = tempDir.resolve("latin1.txt");
        Files.write(source, new byte[] { 'A', ' ', '=', ' ', '"', (byte) 0xE9, '"' });

        int exitCode = commandLine.execute(source.toString());

        assertThat(exitCode).isEqualTo(ParseCommand.EXIT_USAGE_ERROR);
        assertThat(err.toString()).contains("Could not read");
    }

    @Test
    void testCharsetOption() throws IOException {
        Path source = tempDir.resolve("latin1.txt");
        Files.write(source, new byte[] { 'A', ' ', '=', ' ', '"', (byte) 0xE9, '"' });

        int exitCode = commandLine.execute("--charset", "ISO-8859-1", source.toString());

        assertThat(exitCode).isEqualTo(ParseCommand.EXIT_OK);
        assertThat(out.toString()).contains("Value \"é\"");
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content, StandardCharsets.UTF_8);
    }
}
