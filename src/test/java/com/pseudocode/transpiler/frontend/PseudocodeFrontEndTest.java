package com.pseudocode.transpiler.frontend;

import org.junit.jupiter.api.Test;

import com.pseudocode.transpiler.model.AssignmentNode;
import com.pseudocode.transpiler.model.OutputNode;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the lexer and parser run together through PseudocodeFrontEnd.
 */
class PseudocodeFrontEndTest {

    private final PseudocodeFrontEnd frontEnd = new PseudocodeFrontEnd();

    @Test
    void testValidProgram() {
        FrontEndResult result = frontEnd.parse("""
                TOTAL = 0
                loop I from 1 to 3
                    TOTAL = TOTAL + I
                end loop
                output "Total", TOTAL
                """);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStatements()).hasSize(3);
        assertThat(result.getStatements().get(0)).isInstanceOf(AssignmentNode.class);
        assertThat(result.getStatements().get(2)).isInstanceOf(OutputNode.class);
        assertThat(result.getDiagnostics().hasErrors()).isFalse();
        assertThat(result.getDiagnostics().hasWarnings()).isFalse();
    }

    @Test
    void testLexicalErrorReportsPosition() {
        FrontEndResult result = frontEnd.parse("A = 1\nB = 2 $ 3");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getProgram()).isEmpty();
        assertThat(result.getLexicalAnalysis().isSuccessful()).isFalse();
        assertThat(result.getDiagnostics().getErrors())
                .containsExactly("Unrecognized input at line 2, column 7");
    }

    @Test
    void testSyntaxErrorReportsFurthestToken() {
        FrontEndResult result = frontEnd.parse("A = 1\nB = * 2");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getLexicalAnalysis().isSuccessful()).isTrue();
        assertThat(result.getDiagnostics().getErrors())
                .containsExactly("Syntax error at line 2, column 5 near '*'");
    }

    @Test
    void testSyntaxErrorAtEndOfInput() {
        FrontEndResult result = frontEnd.parse("if A then\noutput 1\n");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getDiagnostics().getErrors()).containsExactly("Syntax error at end of input");
    }

    @Test
    void testIntegerOutOfRangeIsALexicalError() {
        FrontEndResult result = frontEnd.parse("X = 99999999999999999999");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getDiagnostics().getErrors())
                .containsExactly("Unrecognized input at line 1, column 5");
    }

    @Test
    void testDeepNestingIsASyntaxErrorNotACrash() {
        String source = "X = " + "(".repeat(5000) + "1" + ")".repeat(5000);

        FrontEndResult result = frontEnd.parse(source);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getDiagnostics().getErrors()).hasSize(1);
        assertThat(result.getDiagnostics().getErrors().get(0)).startsWith("Syntax error at line 1, column ");
    }

    @Test
    void testUnterminatedStringIsAWarning() {
        FrontEndResult result = frontEnd.parse("output \"unfinished");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getDiagnostics().getWarnings())
                .containsExactly("Unterminated string literal starting at offset 7");
    }

    @Test
    void testTracingDoesNotChangeResult() {
        FrontEndConfig config = FrontEndConfig.builder().traceTokens(true).traceAst(true).build();

        FrontEndResult traced = new PseudocodeFrontEnd(config).parse("A = [1, 2]\noutput A[0]");
        FrontEndResult plain = frontEnd.parse("A = [1, 2]\noutput A[0]");

        assertThat(traced.getStatements()).isEqualTo(plain.getStatements());
    }

    @Test
    void testDefaultConfig() {
        FrontEndConfig config = FrontEndConfig.defaults();

        assertThat(config.isTraceTokens()).isFalse();
        assertThat(config.isTraceAst()).isFalse();
    }
}
