/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.api.model;

import com.lexigraph.api.exceptions.InvalidInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatternTest {

    private static final Alphabet ENGLISH = Alphabet.of("english", "abcdefghijklmnopqrstuvwxyz");

    @Test
    @DisplayName("Should parse open and fixed slots")
    void parsesSlots() {
        Pattern pattern = Pattern.parse("?A_.", ENGLISH);

        assertThat(pattern.length()).isEqualTo(4);
        assertThat(pattern.isOpen(0)).isTrue();
        assertThat(pattern.isOpen(1)).isFalse();
        assertThat(pattern.letterAt(1)).isEqualTo('a');
        assertThat(pattern.openSlots()).isEqualTo(3);
        assertThat(pattern).hasToString("?a??");
    }

    @Test
    void builderMatchesParsedForm() {
        Pattern built = Pattern.builder(ENGLISH).open().letter('a').open().build();

        assertThat(built).isEqualTo(Pattern.parse("?a?", ENGLISH));
        assertThat(Pattern.open(3)).isEqualTo(Pattern.parse("...", ENGLISH));
    }

    @Test
    @DisplayName("Should reject empty patterns and foreign characters")
    void rejectsInvalidPatterns() {
        assertThatThrownBy(() -> Pattern.parse("", ENGLISH))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> Pattern.open(0))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> Pattern.parse("c?t!", ENGLISH))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("position 3");
    }
}
