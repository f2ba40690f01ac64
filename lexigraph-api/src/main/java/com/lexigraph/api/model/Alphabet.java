/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.api.model;

import it.unimi.dsi.fastutil.chars.Char2IntMap;
import it.unimi.dsi.fastutil.chars.Char2IntOpenHashMap;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/**
 * An ordered set of letters that words are built from.
 *
 * <p>The declaration order is the collation: a letter's <em>rank</em> is its
 * index in {@link #letters()}. Word sorting during the build and sibling-edge
 * ordering in the automaton both use ranks, never raw code points, so an
 * alphabet such as Icelandic ({@code aábdðeéf...}) sorts accented letters
 * directly after their base letter.
 *
 * <p>Letters are single BMP characters stored in lower case. A small set of
 * punctuation is reserved for wildcards, pattern slots and the serialized
 * file format, and can never be a letter.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class Alphabet {

    /** Canonical wildcard (blank tile) marker. */
    public static final char WILDCARD = '?';

    /** Characters that may never be declared as letters. */
    public static final String RESERVED = "?_*.,:;[]#|";

    private final String name;
    private final String letters;
    private final Char2IntMap ranks;
    private final Comparator<String> collator;

    private Alphabet(String name, String letters) {
        this.name = name;
        this.letters = letters;
        this.ranks = new Char2IntOpenHashMap(letters.length() * 2);
        this.ranks.defaultReturnValue(-1);
        for (int i = 0; i < letters.length(); i++) {
            ranks.put(letters.charAt(i), i);
        }
        this.collator = this::compare;
    }

    /**
     * Declares an alphabet.
     *
     * @param name    short identifier written into serialized automata
     * @param letters the letters in collation order
     * @return the alphabet
     * @throws IllegalArgumentException if the letters are empty, repeated,
     *                                  reserved, upper case or not letters
     */
    public static Alphabet of(String name, String letters) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(letters, "letters must not be null");
        if (name.isBlank() || !name.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '-')) {
            throw new IllegalArgumentException("Alphabet name must be a non-empty identifier: '" + name + "'");
        }
        if (letters.isEmpty()) {
            throw new IllegalArgumentException("Alphabet '" + name + "' declares no letters");
        }
        for (int i = 0; i < letters.length(); i++) {
            char c = letters.charAt(i);
            if (Character.isSurrogate(c) || !Character.isLetter(c)) {
                throw new IllegalArgumentException("Alphabet '" + name + "' contains a non-letter: '" + c + "'");
            }
            if (RESERVED.indexOf(c) >= 0) {
                throw new IllegalArgumentException("Alphabet '" + name + "' contains a reserved character: '" + c + "'");
            }
            if (Character.toLowerCase(c) != c) {
                throw new IllegalArgumentException("Alphabet '" + name + "' letters must be lower case: '" + c + "'");
            }
            if (letters.indexOf(c) != i) {
                throw new IllegalArgumentException("Alphabet '" + name + "' repeats letter '" + c + "'");
            }
        }
        return new Alphabet(name, letters);
    }

    /**
     * @return true for every character accepted as a wildcard tile in a rack
     */
    public static boolean isWildcard(char c) {
        return c == WILDCARD || c == '_' || c == '*';
    }

    public String name() {
        return name;
    }

    /**
     * @return all letters in collation order
     */
    public String letters() {
        return letters;
    }

    public int size() {
        return letters.length();
    }

    /**
     * @return the collation rank of the letter, or -1 if it is not part of
     *         this alphabet
     */
    public int rank(char c) {
        return ranks.get(c);
    }

    public boolean contains(char c) {
        return ranks.containsKey(c);
    }

    public char letterAt(int rank) {
        return letters.charAt(rank);
    }

    /**
     * Lower-cases a word the way all input is normalized.
     */
    public String normalize(String word) {
        return word.toLowerCase(Locale.ROOT);
    }

    /**
     * @return the index of the first character outside this alphabet, or -1
     *         if every character is a letter
     */
    public int indexOfForeign(CharSequence word) {
        for (int i = 0; i < word.length(); i++) {
            if (!contains(word.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Compares two words by letter rank; a proper prefix sorts first.
     * Characters outside the alphabet sort after all letters, by code point.
     */
    public int compare(String a, String b) {
        int n = Math.min(a.length(), b.length());
        for (int i = 0; i < n; i++) {
            char ca = a.charAt(i);
            char cb = b.charAt(i);
            if (ca != cb) {
                return Integer.compare(sortKey(ca), sortKey(cb));
            }
        }
        return Integer.compare(a.length(), b.length());
    }

    /**
     * @return a comparator implementing {@link #compare(String, String)}
     */
    public Comparator<String> collator() {
        return collator;
    }

    private int sortKey(char c) {
        int rank = ranks.get(c);
        return rank >= 0 ? rank : letters.length() + c;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Alphabet)) return false;
        Alphabet other = (Alphabet) o;
        return name.equals(other.name) && letters.equals(other.letters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, letters);
    }

    @Override
    public String toString() {
        return name + "[" + letters + "]";
    }
}
