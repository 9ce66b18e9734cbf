package com.pseudocode.transpiler.parser.token;

import java.util.EnumSet;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class DefinedTokenTableTest {

    @Test
    void testMatchOrderCoversEveryTokenOnce() {
        assertThat(DefinedTokenTable.MATCH_ORDER)
                .doesNotHaveDuplicates()
                .containsExactlyInAnyOrderElementsOf(EnumSet.allOf(DefinedToken.class));
    }

    @Test
    void testLongerLiteralsComeBeforeTheirPrefixes() {
        List<DefinedToken> order = DefinedTokenTable.MATCH_ORDER;

        for (int i = 0; i < order.size(); i++) {
            for (int j = i + 1; j < order.size(); j++) {
                String earlier = order.get(i).getLiteral();
                String later = order.get(j).getLiteral();
                assertThat(later.startsWith(earlier) && !later.equals(earlier))
                        .as("%s is a prefix of %s but is matched first", earlier, later)
                        .isFalse();
            }
        }
    }

    @ParameterizedTest
    @CsvSource({
        "output, OUTPUT",
        "mod,    MODULUS",
        "NOT,    LOGIC_NOT",
        "'<=',   LESS_THAN_EQUAL",
        "'!=',   NOT_EQUAL"
    })
    void testExactMatch(String literal, DefinedToken expected) {
        assertThat(DefinedTokenTable.exactMatch(literal)).contains(expected);
    }

    @Test
    void testExactMatchRejectsPartialText() {
        assertThat(DefinedTokenTable.exactMatch("outputs")).isEmpty();
        assertThat(DefinedTokenTable.exactMatch("not")).isEmpty();
        assertThat(DefinedTokenTable.exactMatch("")).isEmpty();
    }

    @Test
    void testOperatorClassification() {
        assertThat(DefinedToken.PLUS.isUnaryOperator()).isTrue();
        assertThat(DefinedToken.PLUS.isBinaryOperator()).isTrue();
        assertThat(DefinedToken.LOGIC_NOT.isUnaryOperator()).isTrue();
        assertThat(DefinedToken.LOGIC_NOT.isBinaryOperator()).isFalse();
        assertThat(DefinedToken.MULTIPLY.isUnaryOperator()).isFalse();
        assertThat(DefinedToken.COMMA.isBinaryOperator()).isFalse();
    }

    @Test
    void testCommandStarters() {
        assertThat(EnumSet.allOf(DefinedToken.class))
                .filteredOn(DefinedToken::isCommandStart)
                .containsExactlyInAnyOrder(
                        DefinedToken.OUTPUT, DefinedToken.INPUT, DefinedToken.IF,
                        DefinedToken.LOOP, DefinedToken.METHOD);
    }

    @Test
    void testElseAndEndAreControlTokens() {
        assertThat(DefinedToken.ELSE.getKind()).isEqualTo(DefinedToken.Kind.CONTROL);
        assertThat(DefinedToken.END.getKind()).isEqualTo(DefinedToken.Kind.CONTROL);
        assertThat(DefinedToken.ELSE.isCommandStart()).isFalse();
        assertThat(DefinedToken.END.isCommandStart()).isFalse();
    }

    @Test
    void testNewlineDescription() {
        assertThat(DefinedToken.NEWLINE.describe()).isEqualTo("\\n");
        assertThat(DefinedToken.DIVIDE.describe()).isEqualTo("div");
    }
}
