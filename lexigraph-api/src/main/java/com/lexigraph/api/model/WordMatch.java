/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.api.model;

/**
 * A word produced by a rack expansion.
 *
 * @param word      the dictionary word
 * @param tilesUsed the rack tiles consumed, in word order: the letter itself for
 *                  an exact tile, {@code ?} for a wildcard tile. Positions taken
 *                  from the pattern consume no tile and are not listed.
 */
public record WordMatch(String word, String tilesUsed) {

    public int length() {
        return word.length();
    }

    public int tileCount() {
        return tilesUsed.length();
    }

    public int wildcardCount() {
        int n = 0;
        for (int i = 0; i < tilesUsed.length(); i++) {
            if (tilesUsed.charAt(i) == Alphabet.WILDCARD) n++;
        }
        return n;
    }

    public boolean usesWildcard() {
        return tilesUsed.indexOf(Alphabet.WILDCARD) >= 0;
    }
}
