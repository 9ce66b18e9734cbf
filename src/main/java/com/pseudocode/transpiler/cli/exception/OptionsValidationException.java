package com.pseudocode.transpiler.cli.exception;

import java.util.List;

import com.pseudocode.transpiler.cli.validation.ParseOptionsValidator;

/**
 * Raised by {@link ParseOptionsValidator} when the {@code parse} command cannot run with the
 * options it was given, such as a missing source file or an unknown charset.
 * <p>
 * Holds every problem found in one validation pass. With a single problem the message is that
 * problem; otherwise the message is a count followed by one problem per line.
 */
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super(summarize(errors));
        this.errors = List.copyOf(errors);
    }

    /**
     * The individual problems, in the order they were found.
     */
    public List<String> getErrors() {
        return errors;
    }

    private static String summarize(List<String> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("A validation failure needs at least one error");
        }
        if (errors.size() == 1) {
            return errors.get(0);
        }
        return errors.size() + " problems with the parse options:" + System.lineSeparator()
                + String.join(System.lineSeparator(), errors);
    }
}
