package com.finpal.assistant.security;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class IdentifierMaskerTest {

    @Test
    void keepsOnlyLastFourCharacters() {
        assertThat(IdentifierMasker.mask(" 9823533097 ")).isEqualTo("******3097");
    }

    @Test
    void shortAndBlankIdentifiers() {
        assertThat(IdentifierMasker.mask("123")).isEqualTo("***");
        assertThat(IdentifierMasker.mask("")).isEqualTo("<none>");
        assertThat(IdentifierMasker.mask(null)).isEqualTo("<none>");
    }
}
