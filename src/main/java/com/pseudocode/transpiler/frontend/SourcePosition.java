package com.pseudocode.transpiler.frontend;

/**
 * A 1-based line and column in source text.
 */
public record SourcePosition(int line, int column) {

    /**
     * Converts a character offset into a line and column. Offsets past the end map to the position
     * just after the last character.
     */
    public static SourcePosition of(String source, int offset) {
        int end = Math.min(Math.max(offset, 0), source.length());
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < end; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new SourcePosition(line, end - lineStart + 1);
    }

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
