/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.api.model;

import com.lexigraph.api.exceptions.InvalidRackException;

import java.util.Arrays;
import java.util.Objects;

/**
 * A multiset of letter tiles plus a number of wildcard (blank) tiles.
 *
 * <p>Racks are small, immutable value objects created per query. Searches copy
 * the counts into their own working state, so a rack can be shared freely
 * between threads.
 */
public final class Rack {

    private final Alphabet alphabet;
    private final int[] counts; // indexed by letter rank
    private final int wildcards;
    private final int size;

    private Rack(Alphabet alphabet, int[] counts, int wildcards) {
        this.alphabet = alphabet;
        this.counts = counts;
        this.wildcards = wildcards;
        int total = wildcards;
        for (int count : counts) {
            total += count;
        }
        this.size = total;
    }

    /**
     * Parses a rack without size limits.
     *
     * @see #parse(String, Alphabet, int, int)
     */
    public static Rack parse(String tiles, Alphabet alphabet) {
        return parse(tiles, alphabet, Integer.MAX_VALUE, Integer.MAX_VALUE);
    }

    /**
     * Parses a rack such as {@code "aab?"}.
     *
     * <p>Letters are case-insensitive. {@code ?}, {@code _} and {@code *} denote
     * wildcard tiles. Surrounding whitespace is ignored; an empty string yields
     * an empty rack.
     *
     * @param tiles        the tiles, one character per tile
     * @param alphabet     the alphabet the letters must belong to
     * @param maxSize      maximum number of tiles
     * @param maxWildcards maximum number of wildcard tiles
     * @return the rack
     * @throws InvalidRackException on a foreign symbol or a rack over the limits
     */
    public static Rack parse(String tiles, Alphabet alphabet, int maxSize, int maxWildcards) {
        Objects.requireNonNull(alphabet, "alphabet must not be null");
        if (tiles == null) {
            throw new InvalidRackException("Rack must not be null");
        }
        String normalized = alphabet.normalize(tiles.strip());
        int[] counts = new int[alphabet.size()];
        int wildcards = 0;
        for (int i = 0; i < normalized.length(); i++) {
            char c = normalized.charAt(i);
            if (Alphabet.isWildcard(c)) {
                wildcards++;
                continue;
            }
            int rank = alphabet.rank(c);
            if (rank < 0) {
                throw new InvalidRackException("Rack '" + tiles + "' contains '" + c
                        + "', which is neither a letter of alphabet '" + alphabet.name() + "' nor a wildcard");
            }
            counts[rank]++;
        }
        if (normalized.length() > maxSize) {
            throw new InvalidRackException("Rack '" + tiles + "' has " + normalized.length()
                    + " tiles; at most " + maxSize + " are allowed");
        }
        if (wildcards > maxWildcards) {
            throw new InvalidRackException("Rack '" + tiles + "' has " + wildcards
                    + " wildcards; at most " + maxWildcards + " are allowed");
        }
        return new Rack(alphabet, counts, wildcards);
    }

    /**
     * @return an empty rack over the given alphabet
     */
    public static Rack empty(Alphabet alphabet) {
        return new Rack(alphabet, new int[alphabet.size()], 0);
    }

    /**
     * @return a copy of this rack holding one additional wildcard tile
     */
    public Rack withExtraWildcard() {
        return new Rack(alphabet, counts.clone(), wildcards + 1);
    }

    public Alphabet alphabet() {
        return alphabet;
    }

    /**
     * @return number of exact tiles for the letter (0 for foreign characters)
     */
    public int count(char letter) {
        int rank = alphabet.rank(letter);
        return rank < 0 ? 0 : counts[rank];
    }

    public int wildcards() {
        return wildcards;
    }

    /**
     * @return total number of tiles, wildcards included
     */
    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * @return a fresh copy of the per-rank letter counts
     */
    public int[] copyCounts() {
        return counts.clone();
    }

    /**
     * @return the letters (without wildcards) in collation order
     */
    public String letters() {
        StringBuilder sb = new StringBuilder(size);
        for (int rank = 0; rank < counts.length; rank++) {
            for (int n = 0; n < counts[rank]; n++) {
                sb.append(alphabet.letterAt(rank));
            }
        }
        return sb.toString();
    }

    /**
     * Canonical form: letters in collation order followed by one {@code ?} per
     * wildcard. Two racks holding the same tiles have the same string.
     */
    @Override
    public String toString() {
        return letters() + String.valueOf(Alphabet.WILDCARD).repeat(wildcards);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Rack)) return false;
        Rack other = (Rack) o;
        return wildcards == other.wildcards
                && alphabet.equals(other.alphabet)
                && Arrays.equals(counts, other.counts);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * alphabet.hashCode() + Arrays.hashCode(counts)) + wildcards;
    }
}
