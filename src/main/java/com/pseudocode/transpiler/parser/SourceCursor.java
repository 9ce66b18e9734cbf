package com.pseudocode.transpiler.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;

/**
 * Position-tracking reader over source text.
 * <p>
 * Every lexical rule is built from {@link #peekIf(Predicate)}: read one character, decide, and
 * give it back if it is not wanted.
 */
public class SourceCursor {

    private final String source;
    private int offset = 0;

    public SourceCursor(String source) {
        this.source = source;
    }

    public int getOffset() {
        return offset;
    }

    public boolean atEnd() {
        return offset >= source.length();
    }

    /**
     * Returns the character at the current offset and advances, or {@code null} at end of input.
     */
    public Character next() {
        if (atEnd()) {
            return null;
        }
        return source.charAt(offset++);
    }

    /**
     * Moves back one character. Only valid after a successful {@link #next()}.
     */
    public void stepBack() {
        if (offset == 0) {
            throw new IllegalStateException("Cannot step back before the start of the source");
        }
        offset--;
    }

    /**
     * Moves back to an offset this cursor has already passed.
     */
    public void rewind(int target) {
        if (target < 0 || target > offset) {
            throw new IllegalArgumentException("Cannot rewind from offset " + offset + " to " + target);
        }
        offset = target;
    }

    /**
     * Consumes {@code literal} if the source continues with it. Otherwise leaves the offset untouched.
     */
    public boolean tryLiteral(String literal) {
        if (source.startsWith(literal, offset)) {
            offset += literal.length();
            return true;
        }
        return false;
    }

    /**
     * Reads one character and hands it to {@code predicate}, which receives {@code null} at end of input.
     * The character stays consumed only if the predicate returns {@code true}.
     */
    public boolean peekIf(Predicate<Character> predicate) {
        Character c = next();
        boolean accepted = predicate.test(c);
        if (!accepted && c != null) {
            stepBack();
        }
        return accepted;
    }

    /**
     * Repeats {@code step} until the end of input is reached or the step returns {@code false}.
     */
    public void whileNotAtEnd(BooleanSupplier step) {
        while (!atEnd()) {
            if (!step.getAsBoolean()) {
                break;
            }
        }
    }

    /**
     * Consumes consecutive digits in {@code base} and returns their values, most significant first.
     * Returns an empty list if the next character is not a digit.
     */
    public List<Integer> digitSequence(int base) {
        List<Integer> digits = new ArrayList<>();
        whileNotAtEnd(() -> peekIf(c -> {
            int digit = Character.digit(c, base);
            if (digit < 0) {
                return false;
            }
            digits.add(digit);
            return true;
        }));
        return digits;
    }

    /**
     * The text between {@code start} and the current offset.
     */
    public String textSince(int start) {
        return source.substring(start, offset);
    }
}
