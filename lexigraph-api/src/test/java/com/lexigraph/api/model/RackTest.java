/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.api.model;

import com.lexigraph.api.exceptions.InvalidRackException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RackTest {

    private static final Alphabet ENGLISH = Alphabet.of("english", "abcdefghijklmnopqrstuvwxyz");

    @Test
    @DisplayName("Should count letters and wildcards")
    void parsesLettersAndWildcards() {
        Rack rack = Rack.parse(" BaA?_ ", ENGLISH);

        assertThat(rack.count('a')).isEqualTo(2);
        assertThat(rack.count('b')).isEqualTo(1);
        assertThat(rack.count('z')).isZero();
        assertThat(rack.wildcards()).isEqualTo(2);
        assertThat(rack.size()).isEqualTo(5);
        assertThat(rack.letters()).isEqualTo("aab");
        assertThat(rack).hasToString("aab??");
    }

    @Test
    @DisplayName("Racks with the same tiles are equal regardless of order")
    void equalityIgnoresTileOrder() {
        assertThat(Rack.parse("ba*", ENGLISH)).isEqualTo(Rack.parse("?ab", ENGLISH));
        assertThat(Rack.parse("ba*", ENGLISH).hashCode()).isEqualTo(Rack.parse("?ab", ENGLISH).hashCode());
        assertThat(Rack.parse("ab", ENGLISH)).isNotEqualTo(Rack.parse("ab?", ENGLISH));
    }

    @Test
    @DisplayName("Empty input yields an empty rack")
    void emptyInput() {
        assertThat(Rack.parse("", ENGLISH).isEmpty()).isTrue();
        assertThat(Rack.parse("   ", ENGLISH)).isEqualTo(Rack.empty(ENGLISH));
    }

    @Test
    @DisplayName("Should reject symbols outside the alphabet")
    void rejectsForeignSymbols() {
        assertThatThrownBy(() -> Rack.parse("ab1", ENGLISH))
                .isInstanceOf(InvalidRackException.class)
                .hasMessageContaining("'1'");
        assertThatThrownBy(() -> Rack.parse(null, ENGLISH))
                .isInstanceOf(InvalidRackException.class);
    }

    @Test
    @DisplayName("Should enforce size and wildcard limits")
    void enforcesLimits() {
        assertThatThrownBy(() -> Rack.parse("abcdefgh", ENGLISH, 7, 2))
                .isInstanceOf(InvalidRackException.class)
                .hasMessageContaining("at most 7");
        assertThatThrownBy(() -> Rack.parse("ab???", ENGLISH, 7, 2))
                .isInstanceOf(InvalidRackException.class)
                .hasMessageContaining("3 wildcards");
        assertThat(Rack.parse("abcdef?", ENGLISH, 7, 2).size()).isEqualTo(7);
    }

    @Test
    void extraWildcardLeavesOriginalUntouched() {
        Rack rack = Rack.parse("ab", ENGLISH);
        Rack extended = rack.withExtraWildcard();

        assertThat(extended.wildcards()).isEqualTo(1);
        assertThat(extended.size()).isEqualTo(3);
        assertThat(rack.wildcards()).isZero();
    }

    @Test
    void copyCountsIsDefensive() {
        Rack rack = Rack.parse("a", ENGLISH);
        rack.copyCounts()[0] = 9;

        assertThat(rack.count('a')).isEqualTo(1);
    }
}
