package com.pseudocode.transpiler.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SourceCursorTest {

    @Test
    void testNextReturnsNullAtEnd() {
        SourceCursor cursor = new SourceCursor("a");

        assertThat(cursor.next()).isEqualTo('a');
        assertThat(cursor.atEnd()).isTrue();
        assertThat(cursor.next()).isNull();
        assertThat(cursor.getOffset()).isEqualTo(1);
    }

    @Test
    void testTryLiteralRestoresOffsetOnMismatch() {
        SourceCursor cursor = new SourceCursor("<=>");

        assertThat(cursor.tryLiteral("<>")).isFalse();
        assertThat(cursor.getOffset()).isZero();
        assertThat(cursor.tryLiteral("<=")).isTrue();
        assertThat(cursor.getOffset()).isEqualTo(2);
    }

    @Test
    void testTryLiteralLongerThanRemainingInput() {
        SourceCursor cursor = new SourceCursor("ou");

        assertThat(cursor.tryLiteral("output")).isFalse();
        assertThat(cursor.getOffset()).isZero();
    }

    @Test
    void testPeekIfStepsBackWhenRejected() {
        SourceCursor cursor = new SourceCursor("ab");

        assertThat(cursor.peekIf(c -> c == 'b')).isFalse();
        assertThat(cursor.getOffset()).isZero();
        assertThat(cursor.peekIf(c -> c == 'a')).isTrue();
        assertThat(cursor.getOffset()).isEqualTo(1);
    }

    @Test
    void testPeekIfAtEndSeesNullAndDoesNotMove() {
        SourceCursor cursor = new SourceCursor("x");
        cursor.next();

        assertThat(cursor.peekIf(c -> c != null)).isFalse();
        assertThat(cursor.getOffset()).isEqualTo(1);
    }

    @Test
    void testStepBackAtStartThrows() {
        SourceCursor cursor = new SourceCursor("x");

        assertThatThrownBy(cursor::stepBack).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testDigitSequenceStopsAtFirstNonDigit() {
        SourceCursor cursor = new SourceCursor("1207x");

        assertThat(cursor.digitSequence(10)).containsExactly(1, 2, 0, 7);
        assertThat(cursor.getOffset()).isEqualTo(4);
        assertThat(cursor.digitSequence(10)).isEmpty();
    }

    @Test
    void testDigitSequenceHonoursBase() {
        SourceCursor cursor = new SourceCursor("1f2g");

        assertThat(cursor.digitSequence(16)).containsExactly(1, 15, 2);
    }

    @Test
    void testWhileNotAtEndStopsWhenStepFails() {
        SourceCursor cursor = new SourceCursor("aab");

        cursor.whileNotAtEnd(() -> cursor.peekIf(c -> c == 'a'));

        assertThat(cursor.getOffset()).isEqualTo(2);
        assertThat(cursor.textSince(0)).isEqualTo("aa");
    }

    @Test
    void testRewindToEarlierOffset() {
        SourceCursor cursor = new SourceCursor("12345");
        cursor.digitSequence(10);

        cursor.rewind(2);

        assertThat(cursor.getOffset()).isEqualTo(2);
        assertThat(cursor.next()).isEqualTo('3');
    }

    @Test
    void testRewindForwardIsRejected() {
        SourceCursor cursor = new SourceCursor("abc");
        cursor.next();

        assertThatThrownBy(() -> cursor.rewind(2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cursor.rewind(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
