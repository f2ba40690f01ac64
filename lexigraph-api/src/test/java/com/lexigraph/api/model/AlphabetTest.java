/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlphabetTest {

    private static final Alphabet ICELANDIC = Alphabet.of("icelandic", "aábdðeéfghiíjklmnoóprstuúvxyýþæö");

    @Test
    @DisplayName("Rank follows declaration order")
    void rankFollowsDeclarationOrder() {
        assertThat(ICELANDIC.rank('a')).isZero();
        assertThat(ICELANDIC.rank('á')).isEqualTo(1);
        assertThat(ICELANDIC.rank('ö')).isEqualTo(ICELANDIC.size() - 1);
        assertThat(ICELANDIC.rank('c')).isEqualTo(-1);
        assertThat(ICELANDIC.letterAt(4)).isEqualTo('ð');
    }

    @Test
    @DisplayName("Accented letters sort right after their base letter")
    void collatesByRankNotCodePoint() {
        List<String> words = new ArrayList<>(List.of("öl", "bað", "ás", "ala", "eða", "ég"));
        words.sort(ICELANDIC.collator());

        assertThat(words).containsExactly("ala", "ás", "bað", "eða", "ég", "öl");
    }

    @Test
    @DisplayName("A proper prefix sorts before its extensions")
    void prefixSortsFirst() {
        Alphabet english = Alphabet.of("english", "abcdefghijklmnopqrstuvwxyz");

        assertThat(english.compare("car", "cart")).isNegative();
        assertThat(english.compare("cart", "car")).isPositive();
        assertThat(english.compare("car", "car")).isZero();
    }

    @Test
    @DisplayName("Should report the first foreign character")
    void reportsForeignCharacter() {
        Alphabet english = Alphabet.of("english", "abcdefghijklmnopqrstuvwxyz");

        assertThat(english.indexOfForeign("hello")).isEqualTo(-1);
        assertThat(english.indexOfForeign("héllo")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject invalid letter declarations")
    void rejectsInvalidDeclarations() {
        assertThatThrownBy(() -> Alphabet.of("x", ""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("declares no letters");
        assertThatThrownBy(() -> Alphabet.of("x", "abca"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("repeats letter 'a'");
        assertThatThrownBy(() -> Alphabet.of("x", "abC"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lower case");
        assertThatThrownBy(() -> Alphabet.of("x", "ab1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("non-letter");
        assertThatThrownBy(() -> Alphabet.of("bad name", "ab"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void equalityUsesNameAndLetters() {
        assertThat(Alphabet.of("abc", "abc")).isEqualTo(Alphabet.of("abc", "abc"));
        assertThat(Alphabet.of("abc", "abc")).isNotEqualTo(Alphabet.of("abc", "acb"));
    }
}
