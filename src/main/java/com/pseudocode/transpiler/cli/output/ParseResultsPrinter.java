package com.pseudocode.transpiler.cli.output;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.List;

import com.pseudocode.transpiler.frontend.AstPrinter;
import com.pseudocode.transpiler.frontend.FrontEndResult;
import com.pseudocode.transpiler.frontend.SourcePosition;
import com.pseudocode.transpiler.parser.token.PositionedToken;

/**
 * Responsible only for printing CLI output for the "parse" command.
 * No validation, no execution.
 */
public class ParseResultsPrinter {

    private final PrintWriter out;
    private final PrintWriter err;

    public ParseResultsPrinter(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
    }

    public void printTokens(String source, FrontEndResult result) {
        out.println("Tokens:");
        for (PositionedToken token : result.getLexicalAnalysis().getTokens()) {
            SourcePosition position = SourcePosition.of(source, token.getOffset());
            out.printf("  %d:%d  %s%n", position.line(), position.column(), token.getToken());
        }
        out.flush();
    }

    public void printAst(FrontEndResult result) {
        result.getProgram().ifPresent(statements -> {
            out.print(new AstPrinter().print(statements));
            out.flush();
        });
    }

    public void printDiagnostics(FrontEndResult result) {
        for (String warning : result.getDiagnostics().getWarnings()) {
            err.println("warning: " + warning);
        }
        for (String error : result.getDiagnostics().getErrors()) {
            err.println("error: " + error);
        }
        err.flush();
    }

    public void printTiming(Duration elapsed) {
        out.printf("Parsed in %.3f ms%n", elapsed.toNanos() / 1_000_000.0);
        out.flush();
    }

    public void printValidationErrors(List<String> errors) {
        for (String error : errors) {
            err.println("error: " + error);
        }
        err.flush();
    }
}
