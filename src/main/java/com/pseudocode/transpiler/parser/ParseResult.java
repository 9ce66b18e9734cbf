package com.pseudocode.transpiler.parser;

import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a single grammar rule: a value on success, nothing on failure.
 * <p>
 * Failures are ordinary return values. They carry no message; the parser tracks the furthest
 * failure position separately.
 */
public final class ParseResult<T> {
    private static final ParseResult<?> FAILURE = new ParseResult<>(null, false);

    private final T value;
    private final boolean success;

    private ParseResult(T value, boolean success) {
        this.value = value;
        this.success = success;
    }

    public static <T> ParseResult<T> success(T value) {
        return new ParseResult<>(value, true);
    }

    @SuppressWarnings("unchecked")
    public static <T> ParseResult<T> failure() {
        return (ParseResult<T>) FAILURE;
    }

    /**
     * Views a result of a subtype as a result of its supertype. Safe because results are immutable.
     */
    @SuppressWarnings("unchecked")
    public static <T> ParseResult<T> widen(ParseResult<? extends T> result) {
        return (ParseResult<T>) result;
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public T getValue() {
        if (!success) {
            throw new IllegalStateException("No value on a failed parse result");
        }
        return value;
    }

    public <U> ParseResult<U> map(Function<? super T, ? extends U> mapper) {
        return success ? success(mapper.apply(value)) : failure();
    }

    public Optional<T> toOptional() {
        return success ? Optional.ofNullable(value) : Optional.empty();
    }

    @Override
    public String toString() {
        return success ? "Success(" + value + ")" : "Failure";
    }
}
