/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.runtime.context;

import com.lexigraph.api.model.Alphabet;
import com.lexigraph.api.model.Pattern;
import com.lexigraph.api.model.Rack;
import com.lexigraph.api.model.WordMatch;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one rack search.
 *
 * THREAD SAFETY: Allocated per call and confined to the calling thread.
 * Tile counts are decremented on descent and restored on backtrack, so after
 * the search completes they equal the rack's counts again.
 */
public final class SearchContext {

    /** Wildcard count that never runs out; used for pattern-only matching. */
    public static final int UNLIMITED = Integer.MAX_VALUE;

    private static final char PATTERN_SLOT = '\0';

    private final Alphabet alphabet;
    private final int[] counts; // indexed by letter rank
    private int wildcards;
    private final Pattern pattern;
    private final int minLength;

    private final StringBuilder word = new StringBuilder(16);
    /** Tile consumed per word position, or PATTERN_SLOT where the pattern supplied the letter. */
    private final StringBuilder tiles = new StringBuilder(16);
    private final List<WordMatch> results = new ArrayList<>();
    private int tilesLeft;
    private long nodesVisited;

    public SearchContext(Rack rack, Pattern pattern, int minLength) {
        this(rack.alphabet(), rack.copyCounts(), rack.wildcards(), rack.size(), pattern, minLength);
    }

    private SearchContext(Alphabet alphabet, int[] counts, int wildcards, int tilesLeft,
                          Pattern pattern, int minLength) {
        this.alphabet = alphabet;
        this.counts = counts;
        this.wildcards = wildcards;
        this.tilesLeft = tilesLeft;
        this.pattern = pattern;
        this.minLength = Math.max(1, minLength);
    }

    /**
     * A context in which every open pattern slot can be filled by any letter.
     */
    public static SearchContext forPattern(Alphabet alphabet, Pattern pattern) {
        return new SearchContext(alphabet, new int[alphabet.size()], UNLIMITED, UNLIMITED, pattern, 1);
    }

    public Pattern pattern() {
        return pattern;
    }

    /**
     * @return current word length, which is also the pattern position of the next letter
     */
    public int depth() {
        return word.length();
    }

    /**
     * @return true if a letter placed at the current depth must come from the rack
     */
    public boolean needsTile() {
        return pattern == null || pattern.isOpen(word.length());
    }

    public boolean hasTiles() {
        return tilesLeft > 0;
    }

    /**
     * Places a letter at the current depth, consuming an exact tile if one is
     * left, else a wildcard.
     *
     * @return false if the rack cannot supply the letter; nothing is changed then
     */
    public boolean placeFromRack(char letter) {
        int rank = alphabet.rank(letter);
        if (rank >= 0 && counts[rank] > 0) {
            counts[rank]--;
            tiles.append(letter);
        } else if (wildcards > 0) {
            if (wildcards != UNLIMITED) {
                wildcards--;
            }
            tiles.append(Alphabet.WILDCARD);
        } else {
            return false;
        }
        if (tilesLeft != UNLIMITED) {
            tilesLeft--;
        }
        word.append(letter);
        return true;
    }

    /**
     * Places a letter taken from the pattern; no tile is consumed.
     */
    public void placeFromPattern(char letter) {
        tiles.append(PATTERN_SLOT);
        word.append(letter);
    }

    /**
     * Removes the last placed letter and returns its tile, if any, to the rack.
     */
    public void removeLast() {
        int last = word.length() - 1;
        char letter = word.charAt(last);
        char tile = tiles.charAt(last);
        word.setLength(last);
        tiles.setLength(last);
        if (tile == PATTERN_SLOT) {
            return;
        }
        if (tile == Alphabet.WILDCARD) {
            if (wildcards != UNLIMITED) {
                wildcards++;
            }
        } else {
            counts[alphabet.rank(letter)]++;
        }
        if (tilesLeft != UNLIMITED) {
            tilesLeft++;
        }
    }

    /**
     * Emits the current word if it satisfies the length constraints.
     */
    public void emitIfComplete() {
        int length = word.length();
        if (length < minLength) {
            return;
        }
        if (pattern != null && length != pattern.length()) {
            return;
        }
        StringBuilder used = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            char tile = tiles.charAt(i);
            if (tile != PATTERN_SLOT) {
                used.append(tile);
            }
        }
        results.add(new WordMatch(word.toString(), used.toString()));
    }

    public void visitNode() {
        nodesVisited++;
    }

    public long getNodesVisited() {
        return nodesVisited;
    }

    public List<WordMatch> getResults() {
        return results;
    }
}
