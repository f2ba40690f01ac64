/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.api.model;

import com.lexigraph.api.exceptions.InvalidInputException;

import java.util.Arrays;
import java.util.Objects;

/**
 * A fixed-length template of letter slots.
 *
 * <p>Each slot either requires a specific letter (a tile already on the board)
 * or is open and must be filled from the rack. A word matches a pattern only
 * if it has exactly {@link #length()} letters.
 */
public final class Pattern {

    private static final char OPEN = '\0';

    private final char[] slots;

    private Pattern(char[] slots) {
        this.slots = slots;
    }

    /**
     * Parses a pattern such as {@code "?a?"}.
     *
     * <p>{@code ?}, {@code _} and {@code .} mark open slots; every other
     * character must be a letter of the alphabet (case-insensitive).
     *
     * @throws InvalidInputException if the pattern is empty or contains a
     *                               foreign character
     */
    public static Pattern parse(String pattern, Alphabet alphabet) {
        Objects.requireNonNull(alphabet, "alphabet must not be null");
        if (pattern == null || pattern.isBlank()) {
            throw new InvalidInputException("Pattern must contain at least one slot");
        }
        String normalized = alphabet.normalize(pattern.strip());
        char[] slots = new char[normalized.length()];
        for (int i = 0; i < slots.length; i++) {
            char c = normalized.charAt(i);
            if (c == Alphabet.WILDCARD || c == '_' || c == '.') {
                slots[i] = OPEN;
            } else if (alphabet.contains(c)) {
                slots[i] = c;
            } else {
                throw new InvalidInputException("Pattern '" + pattern + "' contains '" + c
                        + "' at position " + i + ", which is not a letter of alphabet '" + alphabet.name() + "'");
            }
        }
        return new Pattern(slots);
    }

    /**
     * @return a pattern of {@code length} open slots
     */
    public static Pattern open(int length) {
        if (length <= 0) {
            throw new InvalidInputException("Pattern must contain at least one slot");
        }
        return new Pattern(new char[length]);
    }

    public static Builder builder(Alphabet alphabet) {
        return new Builder(alphabet);
    }

    public int length() {
        return slots.length;
    }

    public boolean isOpen(int position) {
        return slots[position] == OPEN;
    }

    /**
     * @return the required letter at the position, or {@code '\0'} for an open slot
     */
    public char letterAt(int position) {
        return slots[position];
    }

    public int openSlots() {
        int open = 0;
        for (char slot : slots) {
            if (slot == OPEN) open++;
        }
        return open;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(slots.length);
        for (char slot : slots) {
            sb.append(slot == OPEN ? Alphabet.WILDCARD : slot);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pattern)) return false;
        return Arrays.equals(slots, ((Pattern) o).slots);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(slots);
    }

    /**
     * Builds a pattern slot by slot.
     */
    public static final class Builder {
        private final Alphabet alphabet;
        private final StringBuilder slots = new StringBuilder();

        private Builder(Alphabet alphabet) {
            this.alphabet = Objects.requireNonNull(alphabet, "alphabet must not be null");
        }

        public Builder open() {
            slots.append(Alphabet.WILDCARD);
            return this;
        }

        public Builder letter(char letter) {
            slots.append(letter);
            return this;
        }

        public Pattern build() {
            return parse(slots.toString(), alphabet);
        }
    }
}
