/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.runtime.evaluation;

import com.lexigraph.api.model.Pattern;
import com.lexigraph.runtime.context.SearchContext;
import com.lexigraph.runtime.model.Automaton;

/**
 * Depth-first backtracking over an automaton, spelling words with the tiles
 * held by a {@link SearchContext}.
 *
 * <p>Each letter of an edge label is placed separately. An open position takes
 * an exact tile for the letter when one is left and a wildcard otherwise, which
 * uses the fewest wildcards any spelling of the word can. A position fixed by
 * the pattern must carry the pattern's letter and takes no tile. Because the
 * automaton is deterministic every word is reached along exactly one path, so
 * no word is emitted twice.
 */
final class WordSearch {

    private final Automaton automaton;

    WordSearch(Automaton automaton) {
        this.automaton = automaton;
    }

    void run(SearchContext context) {
        visit(Automaton.ROOT, context);
    }

    // Recursion depth is bounded by the longest word in the automaton.
    private void visit(int node, SearchContext context) {
        context.visitNode();
        if (automaton.isFinal(node)) {
            context.emitIfComplete();
        }

        Pattern pattern = context.pattern();
        int depth = context.depth();
        if (pattern != null && depth >= pattern.length()) {
            return;
        }
        if (context.needsTile() && !context.hasTiles()) {
            return;
        }

        if (pattern != null && !pattern.isOpen(depth)) {
            int edge = automaton.findEdge(node, pattern.letterAt(depth));
            if (edge >= 0) {
                follow(edge, context);
            }
            return;
        }
        for (int edge = automaton.firstEdge(node); edge < automaton.endEdge(node); edge++) {
            follow(edge, context);
        }
    }

    private void follow(int edge, SearchContext context) {
        String label = automaton.label(edge);
        Pattern pattern = context.pattern();
        int placed = 0;
        boolean complete = true;
        for (int i = 0; i < label.length(); i++) {
            char letter = label.charAt(i);
            int depth = context.depth();
            if (pattern != null && depth >= pattern.length()) {
                complete = false;
                break;
            }
            if (context.needsTile()) {
                if (!context.placeFromRack(letter)) {
                    complete = false;
                    break;
                }
            } else if (pattern.letterAt(depth) == letter) {
                context.placeFromPattern(letter);
            } else {
                complete = false;
                break;
            }
            placed++;
        }

        if (complete) {
            visit(automaton.target(edge), context);
        }
        for (int i = 0; i < placed; i++) {
            context.removeLast();
        }
    }
}
