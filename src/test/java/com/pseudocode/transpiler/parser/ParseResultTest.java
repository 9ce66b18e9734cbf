package com.pseudocode.transpiler.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ParseResultTest {

    @Test
    void testSuccessCarriesValue() {
        ParseResult<String> result = ParseResult.success("A");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue()).isEqualTo("A");
        assertThat(result.map(String::length).getValue()).isEqualTo(1);
        assertThat(result.toOptional()).contains("A");
    }

    @Test
    void testFailureHasNoValue() {
        ParseResult<String> result = ParseResult.failure();

        assertThat(result.isFailure()).isTrue();
        assertThat(result.map(String::length).isFailure()).isTrue();
        assertThat(result.toOptional()).isEmpty();
        assertThatThrownBy(result::getValue).isInstanceOf(IllegalStateException.class);
    }
}
