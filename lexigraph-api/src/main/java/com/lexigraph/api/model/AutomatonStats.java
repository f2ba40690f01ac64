/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.api.model;

/**
 * Structural statistics of an automaton.
 *
 * @param nodeCount     number of nodes, root included
 * @param edgeCount     number of edges
 * @param labelChars    total number of letters over all edge labels
 * @param wordCount     number of words accepted by the automaton
 * @param maxWordLength length of the longest accepted word (0 if none)
 */
public record AutomatonStats(
        int nodeCount,
        int edgeCount,
        long labelChars,
        long wordCount,
        int maxWordLength) {
}
