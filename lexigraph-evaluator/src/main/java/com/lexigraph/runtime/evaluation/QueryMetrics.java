/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.runtime.evaluation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters for dictionary queries.
 *
 * Lock-free (LongAdder) so that concurrent queries on a shared engine never
 * contend on metrics.
 */
public final class QueryMetrics {

    private final LongAdder lookups = new LongAdder();
    private final LongAdder lookupHits = new LongAdder();
    private final LongAdder totalLookupTimeNanos = new LongAdder();

    private final LongAdder expansions = new LongAdder();
    private final LongAdder totalExpansionTimeNanos = new LongAdder();
    private final LongAdder totalWordsFound = new LongAdder();
    private final LongAdder totalNodesVisited = new LongAdder();

    private final LongAdder patternMatches = new LongAdder();
    private final LongAdder rackAnalyses = new LongAdder();

    public void recordLookup(long timeNanos, boolean hit) {
        lookups.increment();
        totalLookupTimeNanos.add(timeNanos);
        if (hit) {
            lookupHits.increment();
        }
    }

    /**
     * Record a completed search; pattern-only matches count as searches too.
     */
    public void recordExpansion(long timeNanos, int wordsFound, long nodesVisited) {
        expansions.increment();
        totalExpansionTimeNanos.add(timeNanos);
        totalWordsFound.add(wordsFound);
        totalNodesVisited.add(nodesVisited);
    }

    public void recordPatternMatch() {
        patternMatches.increment();
    }

    public void recordRackAnalysis() {
        rackAnalyses.increment();
    }

    public long getLookups() {
        return lookups.sum();
    }

    public long getExpansions() {
        return expansions.sum();
    }

    /**
     * Creates a new map on every call; safe to hand to other threads.
     */
    public Map<String, Object> getSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();

        long lookupCount = lookups.sum();
        long hits = lookupHits.sum();
        snapshot.put("lookups", lookupCount);
        snapshot.put("lookupHitRate", lookupCount > 0 ? (double) hits / lookupCount * 100.0 : 0.0);
        snapshot.put("avgLookupTimeNanos", lookupCount > 0 ? totalLookupTimeNanos.sum() / lookupCount : 0);

        long expansionCount = expansions.sum();
        snapshot.put("expansions", expansionCount);
        snapshot.put("avgExpansionTimeNanos", expansionCount > 0 ? totalExpansionTimeNanos.sum() / expansionCount : 0);
        snapshot.put("avgWordsPerExpansion", expansionCount > 0 ? (double) totalWordsFound.sum() / expansionCount : 0.0);
        snapshot.put("avgNodesVisitedPerExpansion",
                expansionCount > 0 ? (double) totalNodesVisited.sum() / expansionCount : 0.0);

        snapshot.put("patternMatches", patternMatches.sum());
        snapshot.put("rackAnalyses", rackAnalyses.sum());
        return snapshot;
    }
}
