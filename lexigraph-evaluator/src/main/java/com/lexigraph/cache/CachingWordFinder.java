/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.lexigraph.api.IWordFinder;
import com.lexigraph.api.model.Alphabet;
import com.lexigraph.api.model.Pattern;
import com.lexigraph.api.model.Rack;
import com.lexigraph.api.model.RackAnalysis;
import com.lexigraph.api.model.WordMatch;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Memoizes expansion and pattern results of a single word finder.
 *
 * <p>Results depend only on the query and the dictionary, so a cache must
 * never outlive the dictionary it was filled from. Wrap one engine per
 * automaton; {@code ManagedWordFinder} does this on every reload.
 *
 * <p>Lookups and rack analyses are passed through uncached.
 */
public final class CachingWordFinder implements IWordFinder {
    private static final Logger logger = Logger.getLogger(CachingWordFinder.class.getName());

    private final IWordFinder delegate;
    private final Cache<ExpansionKey, List<WordMatch>> expansions;
    private final Cache<Pattern, List<String>> matches;
    private final long maxSize;

    /**
     * @param delegate the finder to memoize
     * @param maxSize  maximum cached entries per query kind
     */
    public CachingWordFinder(IWordFinder delegate, long maxSize) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.expansions = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .recordStats()
                .build();
        this.matches = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .recordStats()
                .build();
        logger.fine("Query cache enabled, max " + maxSize + " entries");
    }

    /** Racks are value objects, so the same tiles typed in any order share an entry. */
    record ExpansionKey(Rack rack, Pattern pattern, int minLength) {
    }

    @Override
    public Alphabet alphabet() {
        return delegate.alphabet();
    }

    @Override
    public boolean lookup(String word) {
        return delegate.lookup(word);
    }

    @Override
    public Rack parseRack(String tiles) {
        return delegate.parseRack(tiles);
    }

    @Override
    public List<WordMatch> expand(Rack rack, Pattern pattern, int minLength) {
        return expansions.get(new ExpansionKey(rack, pattern, Math.max(1, minLength)),
                key -> delegate.expand(key.rack(), key.pattern(), key.minLength()));
    }

    @Override
    public List<String> match(Pattern pattern) {
        return matches.get(pattern, delegate::match);
    }

    @Override
    public RackAnalysis analyze(Rack rack) {
        return delegate.analyze(rack);
    }

    public IWordFinder getDelegate() {
        return delegate;
    }

    public void invalidateAll() {
        expansions.invalidateAll();
        matches.invalidateAll();
    }

    public Map<String, Object> getStats() {
        CacheStats expansionStats = expansions.stats();
        CacheStats matchStats = matches.stats();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("maxSize", maxSize);
        stats.put("expansionEntries", expansions.estimatedSize());
        stats.put("expansionHits", expansionStats.hitCount());
        stats.put("expansionMisses", expansionStats.missCount());
        stats.put("expansionHitRate", expansionStats.hitRate() * 100.0);
        stats.put("matchEntries", matches.estimatedSize());
        stats.put("matchHits", matchStats.hitCount());
        stats.put("matchMisses", matchStats.missCount());
        return stats;
    }
}
