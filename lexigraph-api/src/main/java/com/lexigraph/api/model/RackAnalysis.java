/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.api.model;

import java.util.List;
import java.util.Map;

/**
 * Summary of what a rack can form on its own.
 *
 * @param rack              canonical form of the analyzed rack
 * @param permutations      every word of two or more letters formable from the rack,
 *                          longest first, then in collation order
 * @param fullRackWords     words that use every tile of the rack
 * @param oneLetterExtensions words that use every rack tile plus exactly one more
 *                          letter, keyed by that letter in collation order. Empty for
 *                          racks holding wildcards.
 */
public record RackAnalysis(
        String rack,
        List<WordMatch> permutations,
        List<String> fullRackWords,
        Map<Character, List<String>> oneLetterExtensions) {

    public int permutationCount() {
        return permutations.size();
    }

    public List<String> permutationWords() {
        return permutations.stream().map(WordMatch::word).toList();
    }
}
