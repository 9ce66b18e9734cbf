package com.pseudocode.transpiler.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pseudocode.transpiler.parser.token.BoolLiteral;
import com.pseudocode.transpiler.parser.token.ClassName;
import com.pseudocode.transpiler.parser.token.DecimalLiteral;
import com.pseudocode.transpiler.parser.token.DefinedToken;
import com.pseudocode.transpiler.parser.token.DefinedTokenTable;
import com.pseudocode.transpiler.parser.token.IntegerLiteral;
import com.pseudocode.transpiler.parser.token.MethodName;
import com.pseudocode.transpiler.parser.token.PositionedToken;
import com.pseudocode.transpiler.parser.token.StringLiteral;
import com.pseudocode.transpiler.parser.token.Token;
import com.pseudocode.transpiler.parser.token.VariableName;

/**
 * Lexer for pseudocode source text.
 * <p>
 * The lexer stops at the first character run it cannot recognize and does not try to lex the rest.
 * Bad input never raises an exception: the result reports where recognition stopped.
 *
 * <ul>
 * <li>Variable names are upper case letters, digits and underscores, starting with a letter or underscore.
 * So {@code MY_METHOD} is a variable name even when it is only ever called as a method.</li>
 * <li>Method names are camelCase and may not start with a digit.</li>
 * <li>Class names are any other letter-led identifier. An all upper case class name reads as a variable.</li>
 * <li>Strings may span lines. {@code \n}, {@code \t} and {@code \\} are the only escapes with a meaning;
 * any other escaped character stands for itself.</li>
 * </ul>
 */
public class PseudocodeLexer {
    private static final Logger log = LoggerFactory.getLogger(PseudocodeLexer.class);

    public static final String COMMENT_BEGIN = "//";
    public static final char NEWLINE_CHAR = '\n';

    private final String source;

    public PseudocodeLexer(String source) {
        this.source = source;
    }

    /**
     * Tokenize the entire source.
     */
    public LexicalAnalysis tokenize() {
        SourceCursor cursor = new SourceCursor(source);
        List<PositionedToken> tokens = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        cursor.whileNotAtEnd(() -> {
            if (cursor.peekIf(PseudocodeLexer::isWhitespace)) {
                return true;
            }

            int start = cursor.getOffset();
            Optional<Token> token = readIdentifierOrKeyword(cursor)
                    .or(() -> readNumber(cursor))
                    .or(() -> readDefinedToken(cursor));

            if (token.isPresent()) {
                tokens.add(new PositionedToken(start, token.get()));
                return true;
            }

            if (cursor.tryLiteral(COMMENT_BEGIN)) {
                skipComment(cursor);
                return true;
            }

            if (cursor.peekIf(c -> c == StringLiteral.BOUNDARY)) {
                tokens.add(new PositionedToken(start, readStringLiteral(cursor, start, warnings)));
                return true;
            }

            return false;
        });

        LexicalAnalysis result = new LexicalAnalysis(tokens, cursor.getOffset(), source.length(), warnings);
        if (result.isSuccessful()) {
            log.debug("Lexed {} tokens from {} characters", tokens.size(), source.length());
        } else {
            log.debug("Lexing stopped at offset {} after {} tokens", result.getFirstInvalidOffset(), tokens.size());
        }
        return result;
    }

    private static boolean isWhitespace(Character c) {
        return c != null && (c == ' ' || c == '\t');
    }

    private Optional<Token> readIdentifierOrKeyword(SourceCursor cursor) {
        int start = cursor.getOffset();
        boolean identifierStart = cursor.peekIf(c -> c != null && (Character.isLetter(c) || c == '_'));
        if (!identifierStart) {
            return Optional.empty();
        }
        cursor.whileNotAtEnd(() -> cursor.peekIf(c -> Character.isLetterOrDigit(c) || c == '_'));

        String name = cursor.textSince(start);

        // Keywords and boolean literals look like identifiers
        Optional<DefinedToken> keyword = DefinedTokenTable.exactMatch(name);
        if (keyword.isPresent()) {
            return Optional.of(keyword.get());
        }
        BoolLiteral bool = BoolLiteral.fromSource(name);
        if (bool != null) {
            return Optional.of(bool);
        }

        if (VariableName.matches(name)) {
            return Optional.of(new VariableName(name));
        }
        if (MethodName.matches(name)) {
            return Optional.of(new MethodName(name));
        }
        return Optional.of(new ClassName(name));
    }

    /**
     * Reads an integer or decimal literal. An integer literal that does not fit in a {@code long}
     * is not a token: the cursor is put back at its first digit so lexing stops there.
     */
    private Optional<Token> readNumber(SourceCursor cursor) {
        int start = cursor.getOffset();
        List<Integer> integerDigits = cursor.digitSequence(10);
        if (integerDigits.isEmpty()) {
            return Optional.empty();
        }

        if (cursor.peekIf(c -> c != null && c == DecimalLiteral.DECIMAL_POINT)) {
            double integerPart = 0;
            for (int digit : integerDigits) {
                integerPart = integerPart * 10 + digit;
            }
            List<Integer> fractionDigits = cursor.digitSequence(10);
            double fraction = 0;
            for (int i = 0; i < fractionDigits.size(); i++) {
                fraction += fractionDigits.get(i) * Math.pow(10, -(i + 1));
            }
            return Optional.of(new DecimalLiteral(integerPart + fraction));
        }

        try {
            long value = 0;
            for (int digit : integerDigits) {
                value = Math.addExact(Math.multiplyExact(value, 10L), digit);
            }
            return Optional.of(new IntegerLiteral(value));
        } catch (ArithmeticException e) {
            log.debug("Integer literal at offset {} is out of range: {}", start, cursor.textSince(start));
            cursor.rewind(start);
            return Optional.empty();
        }
    }

    private Optional<Token> readDefinedToken(SourceCursor cursor) {
        for (DefinedToken token : DefinedTokenTable.MATCH_ORDER) {
            if (cursor.tryLiteral(token.getLiteral())) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }

    /**
     * Skips to the end of the line. The terminating newline is left in place so it is lexed as a
     * {@link DefinedToken#NEWLINE} like any other line end.
     */
    private void skipComment(SourceCursor cursor) {
        cursor.whileNotAtEnd(() -> cursor.peekIf(c -> c != NEWLINE_CHAR));
    }

    private StringLiteral readStringLiteral(SourceCursor cursor, int start, List<String> warnings) {
        StringBuilder sb = new StringBuilder();
        boolean escaped = false;
        boolean closed = false;

        while (!cursor.atEnd()) {
            char c = cursor.next();
            if (escaped) {
                sb.append(StringLiteral.unescape(c));
                escaped = false;
            } else if (c == StringLiteral.ESCAPE) {
                escaped = true;
            } else if (c == StringLiteral.BOUNDARY) {
                closed = true;
                break;
            } else {
                sb.append(c);
            }
        }

        // Accepted for compatibility: the string runs to the end of the source
        if (!closed) {
            warnings.add("Unterminated string literal starting at offset " + start);
        }
        return new StringLiteral(sb.toString());
    }
}
