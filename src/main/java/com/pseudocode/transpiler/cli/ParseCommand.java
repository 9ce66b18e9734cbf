package com.pseudocode.transpiler.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pseudocode.transpiler.cli.exception.OptionsValidationException;
import com.pseudocode.transpiler.cli.model.ParseOptions;
import com.pseudocode.transpiler.cli.model.ValidatedParseOptions;
import com.pseudocode.transpiler.cli.output.ParseResultsPrinter;
import com.pseudocode.transpiler.cli.validation.ParseOptionsValidator;
import com.pseudocode.transpiler.frontend.FrontEndConfig;
import com.pseudocode.transpiler.frontend.FrontEndResult;
import com.pseudocode.transpiler.frontend.PseudocodeFrontEnd;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command that lexes and parses one pseudocode source file.
 */
@Command(
        name = "parse",
        mixinStandardHelpOptions = true,
        version = "pseudocode-transpiler 1.0.0",
        description = "Lexes and parses a pseudocode source file and prints its syntax tree."
)
public class ParseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ParseCommand.class);

    private static final String BASE_PACKAGE = "com.pseudocode.transpiler";

    public static final int EXIT_OK = 0;
    public static final int EXIT_INVALID_SOURCE = 1;
    public static final int EXIT_USAGE_ERROR = 2;

    @Mixin
    private ParseOptions options = new ParseOptions();

    @Spec
    private CommandSpec spec;

    private final ParseOptionsValidator validator = new ParseOptionsValidator();

    @Override
    public Integer call() {
        ParseResultsPrinter printer = new ParseResultsPrinter(spec.commandLine().getOut(), spec.commandLine().getErr());

        ValidatedParseOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e.getErrors());
            return EXIT_USAGE_ERROR;
        }

        String source;
        try {
            source = Files.readString(validated.getSourcePath(), validated.getCharset());
        } catch (IOException e) {
            log.error("Failed to read source file {}", validated.getSourcePath(), e);
            printer.printValidationErrors(List.of("Could not read " + validated.getSourcePath() + ": " + e.getMessage()));
            return EXIT_USAGE_ERROR;
        }

        if (options.isTrace()) {
            enableDebugLogging();
        }

        FrontEndConfig config = FrontEndConfig.builder()
                .traceTokens(options.isTrace())
                .traceAst(options.isTrace())
                .build();

        long start = System.nanoTime();
        FrontEndResult result = new PseudocodeFrontEnd(config).parse(source);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        log.debug("Parsed {} in {} ms, success={}", validated.getSourcePath(), elapsed.toMillis(), result.isSuccess());

        if (options.isPrintTokens()) {
            printer.printTokens(source, result);
        }
        if (!options.isSuppressAst()) {
            printer.printAst(result);
        }
        printer.printDiagnostics(result);
        if (options.isTiming()) {
            printer.printTiming(elapsed);
        }

        return result.isSuccess() ? EXIT_OK : EXIT_INVALID_SOURCE;
    }

    private static void enableDebugLogging() {
        if (LoggerFactory.getLogger(BASE_PACKAGE) instanceof ch.qos.logback.classic.Logger logger) {
            logger.setLevel(Level.DEBUG);
        }
    }
}
