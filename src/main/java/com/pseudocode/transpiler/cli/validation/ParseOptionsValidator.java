package com.pseudocode.transpiler.cli.validation;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.pseudocode.transpiler.cli.exception.OptionsValidationException;
import com.pseudocode.transpiler.cli.model.ParseOptions;
import com.pseudocode.transpiler.cli.model.ValidatedParseOptions;

public class ParseOptionsValidator {

    public ValidatedParseOptions validate(ParseOptions o) {
        List<String> errors = new ArrayList<>();

        Path source = o.getSource();
        if (source == null) {
            errors.add("A source file is required.");
        } else if (!Files.exists(source)) {
            errors.add("Source file does not exist: " + source);
        } else if (!Files.isRegularFile(source)) {
            errors.add("Source path is not a regular file: " + source);
        } else if (!Files.isReadable(source)) {
            errors.add("Source file is not readable: " + source);
        }

        Charset charset = parseCharset(o.getCharset(), errors);

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        return new ValidatedParseOptions(source.toAbsolutePath().normalize(), charset);
    }

    private static Charset parseCharset(String name, List<String> errors) {
        if (name == null || name.isBlank()) {
            errors.add("Charset must not be blank.");
            return null;
        }
        try {
            if (!Charset.isSupported(name)) {
                errors.add("Unsupported charset: " + name);
                return null;
            }
            return Charset.forName(name);
        } catch (IllegalCharsetNameException e) {
            errors.add("Illegal charset name: " + name);
            return null;
        }
    }
}
