/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.api;

import com.lexigraph.api.model.Alphabet;
import com.lexigraph.api.model.Pattern;
import com.lexigraph.api.model.Rack;
import com.lexigraph.api.model.RackAnalysis;
import com.lexigraph.api.model.WordMatch;

import java.util.List;

/**
 * Contract for querying a compiled dictionary.
 *
 * <p>This is the primary interface for dictionary consumers such as move
 * generators and word-check endpoints.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IWordFinder finder = new QueryEngine(automaton);
 *
 * finder.lookup("quartz");                           // true
 *
 * Rack rack = Rack.parse("aert?s", finder.alphabet());
 * List<WordMatch> words = finder.expand(rack);       // longest first
 *
 * Pattern pattern = Pattern.parse("?a??", finder.alphabet());
 * List<WordMatch> fits = finder.expand(rack, pattern);
 * }</pre>
 *
 * <h2>Result Ordering</h2>
 * <p>Every list-returning query orders words longest first, then by the
 * collation of the alphabet. A word appears at most once per result.
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations must be thread-safe. The same finder instance can be
 * used concurrently from multiple threads.
 */
public interface IWordFinder {

    /**
     * @return the alphabet racks and patterns must be parsed against
     */
    Alphabet alphabet();

    /**
     * Checks whether the word is in the dictionary.
     *
     * @param word the candidate word (case-insensitive)
     * @return true if accepted; false for empty or non-alphabet input
     */
    boolean lookup(String word);

    /**
     * Enumerates every dictionary word that can be spelled with tiles from
     * the rack.
     */
    default List<WordMatch> expand(Rack rack) {
        return expand(rack, null);
    }

    /**
     * Enumerates the words spelled with tiles from the rack that fit the
     * pattern.
     *
     * <p>With a pattern of length L only words of exactly L letters are
     * returned; required letters in the pattern consume no tile, open slots
     * consume one tile each.
     *
     * @param rack    the tiles (an empty rack yields an empty result)
     * @param pattern the pattern, or null for no positional constraint
     * @return the matching words
     */
    default List<WordMatch> expand(Rack rack, Pattern pattern) {
        return expand(rack, pattern, 1);
    }

    /**
     * Same as {@link #expand(Rack, Pattern)}, dropping words shorter than
     * {@code minLength}.
     */
    List<WordMatch> expand(Rack rack, Pattern pattern, int minLength);

    /**
     * Parses a rack against this finder's alphabet and rack limits.
     *
     * @throws com.lexigraph.api.exceptions.InvalidRackException on a foreign
     *         symbol or a rack over the limits
     */
    default Rack parseRack(String tiles) {
        return Rack.parse(tiles, alphabet());
    }

    /**
     * Parses the rack and pattern strings before expanding.
     *
     * @throws com.lexigraph.api.exceptions.InvalidRackException on a bad rack
     */
    default List<WordMatch> expand(String rack, String pattern) {
        Rack parsed = parseRack(rack);
        return expand(parsed, pattern == null ? null : Pattern.parse(pattern, alphabet()));
    }

    /**
     * Enumerates every word matching the pattern, as if the open slots could
     * be filled with any letter.
     */
    List<String> match(Pattern pattern);

    /**
     * Reports everything a rack can spell on its own.
     *
     * @see RackAnalysis
     */
    RackAnalysis analyze(Rack rack);
}
