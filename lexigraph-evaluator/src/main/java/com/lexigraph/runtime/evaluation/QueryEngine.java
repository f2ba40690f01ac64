/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.runtime.evaluation;

import com.lexigraph.api.IWordFinder;
import com.lexigraph.api.exceptions.InvalidRackException;
import com.lexigraph.api.model.Alphabet;
import com.lexigraph.api.model.Pattern;
import com.lexigraph.api.model.Rack;
import com.lexigraph.api.model.RackAnalysis;
import com.lexigraph.api.model.WordMatch;
import com.lexigraph.infra.config.LexiconConfig;
import com.lexigraph.infra.telemetry.TracingService;
import com.lexigraph.runtime.context.SearchContext;
import com.lexigraph.runtime.model.Automaton;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Answers dictionary queries against one immutable automaton.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Fully thread-safe without locks. All per-query state lives in a
 * {@link SearchContext} allocated for the call; the automaton is never
 * modified.
 *
 * <h2>Rack Limits</h2>
 * <p>
 * Racks larger than the configured maximum size, or holding more wildcards
 * than allowed, are rejected with {@link InvalidRackException}. Without a
 * limit a rack full of wildcards would enumerate the whole dictionary.
 */
public final class QueryEngine implements IWordFinder {
    private static final Logger logger = Logger.getLogger(QueryEngine.class.getName());

    private final Automaton automaton;
    private final Alphabet alphabet;
    private final Tracer tracer;
    private final QueryMetrics metrics;
    private final WordSearch search;
    private final int maxRackSize;
    private final int maxWildcards;
    private final Comparator<WordMatch> resultOrder;

    /**
     * Creates an engine with explicit rack limits.
     *
     * @param automaton    the dictionary
     * @param tracer       OpenTelemetry tracer for observability
     * @param maxRackSize  maximum tiles per rack
     * @param maxWildcards maximum wildcard tiles per rack
     */
    public QueryEngine(Automaton automaton, Tracer tracer, int maxRackSize, int maxWildcards) {
        this.automaton = Objects.requireNonNull(automaton, "automaton must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        if (maxRackSize <= 0 || maxWildcards < 0) {
            throw new IllegalArgumentException("Invalid rack limits: size " + maxRackSize
                    + ", wildcards " + maxWildcards);
        }
        this.alphabet = automaton.getAlphabet();
        this.maxRackSize = maxRackSize;
        this.maxWildcards = maxWildcards;
        this.metrics = new QueryMetrics();
        this.search = new WordSearch(automaton);
        this.resultOrder = Comparator.comparingInt(WordMatch::length).reversed()
                .thenComparing(WordMatch::word, alphabet.collator());
        logger.fine(() -> String.format("QueryEngine initialized: %,d words, rack limit %d/%d",
                automaton.getStats().wordCount(), maxRackSize, maxWildcards));
    }

    /**
     * Creates an engine with the rack limits of the configuration.
     */
    public QueryEngine(Automaton automaton, LexiconConfig config, Tracer tracer) {
        this(automaton, tracer, config.getMaxRackSize(), config.getMaxWildcards());
    }

    /**
     * Creates an engine with default limits and a no-op tracer.
     */
    public QueryEngine(Automaton automaton) {
        this(automaton, LexiconConfig.defaults().build(), OpenTelemetry.noop().getTracer("lexigraph-evaluator"));
    }

    @Override
    public Alphabet alphabet() {
        return alphabet;
    }

    @Override
    public boolean lookup(String word) {
        long start = System.nanoTime();
        boolean found = word != null && !word.isEmpty() && automaton.contains(alphabet.normalize(word));
        metrics.recordLookup(System.nanoTime() - start, found);
        return found;
    }

    @Override
    public Rack parseRack(String tiles) {
        return Rack.parse(tiles, alphabet, maxRackSize, maxWildcards);
    }

    @Override
    public List<WordMatch> expand(Rack rack, Pattern pattern, int minLength) {
        checkRack(rack);
        Span span = tracer.spanBuilder(TracingService.EXPAND_SPAN).startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("rack", rack.toString());
            if (pattern != null) {
                span.setAttribute("pattern", pattern.toString());
            }
            List<WordMatch> results = searchRack(rack, pattern, minLength);
            span.setAttribute("wordsFound", results.size());
            return results;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public List<String> match(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        Span span = tracer.spanBuilder(TracingService.MATCH_SPAN).startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("pattern", pattern.toString());
            metrics.recordPatternMatch();
            List<WordMatch> results = run(SearchContext.forPattern(alphabet, pattern));
            List<String> words = new ArrayList<>(results.size());
            for (WordMatch match : results) {
                words.add(match.word());
            }
            span.setAttribute("wordsFound", words.size());
            return words;
        } finally {
            span.end();
        }
    }

    /**
     * Reports the permutations of the rack, the words using all of its tiles
     * and, for racks without wildcards, the words one extra letter would add.
     */
    @Override
    public RackAnalysis analyze(Rack rack) {
        checkRack(rack);
        Span span = tracer.spanBuilder(TracingService.ANALYZE_SPAN).startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("rack", rack.toString());
            metrics.recordRackAnalysis();

            List<WordMatch> all = searchRack(rack, null, 1);
            List<WordMatch> permutations = new ArrayList<>();
            List<String> fullRackWords = new ArrayList<>();
            for (WordMatch match : all) {
                if (match.length() >= 2) {
                    permutations.add(match);
                }
                if (match.tileCount() == rack.size()) {
                    fullRackWords.add(match.word());
                }
            }

            Map<Character, List<String>> extensions = rack.wildcards() == 0 && !rack.isEmpty()
                    ? oneLetterExtensions(rack)
                    : Map.of();

            span.setAttribute("permutations", permutations.size());
            span.setAttribute("fullRackWords", fullRackWords.size());
            return new RackAnalysis(rack.toString(), List.copyOf(permutations), List.copyOf(fullRackWords),
                    extensions);
        } finally {
            span.end();
        }
    }

    public Automaton getAutomaton() {
        return automaton;
    }

    public QueryMetrics getMetrics() {
        return metrics;
    }

    public Map<String, Object> getDetailedMetrics() {
        Map<String, Object> detailed = new LinkedHashMap<>(metrics.getSnapshot());
        detailed.put("wordCount", automaton.getStats().wordCount());
        detailed.put("nodeCount", automaton.nodeCount());
        detailed.put("maxRackSize", maxRackSize);
        detailed.put("maxWildcards", maxWildcards);
        return detailed;
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // SEARCH
    // ════════════════════════════════════════════════════════════════════════════════

    /**
     * Words of rack size + 1 that use every tile plus one letter not on the
     * rack, grouped by that letter in collation order.
     */
    private Map<Character, List<String>> oneLetterExtensions(Rack rack) {
        Pattern fullLength = Pattern.open(rack.size() + 1);
        Map<Character, List<String>> byLetter = new TreeMap<>(Comparator.comparingInt(alphabet::rank));
        for (WordMatch match : searchRack(rack.withExtraWildcard(), fullLength, 1)) {
            // every slot is open, so tiles line up with letters
            int position = match.tilesUsed().indexOf(Alphabet.WILDCARD);
            char added = match.word().charAt(position);
            byLetter.computeIfAbsent(added, letter -> new ArrayList<>()).add(match.word());
        }
        Map<Character, List<String>> result = new LinkedHashMap<>();
        byLetter.forEach((letter, words) -> result.put(letter, List.copyOf(words)));
        return result;
    }

    private List<WordMatch> searchRack(Rack rack, Pattern pattern, int minLength) {
        if (rack.isEmpty()) {
            return List.of();
        }
        return run(new SearchContext(rack, pattern, minLength));
    }

    private List<WordMatch> run(SearchContext context) {
        long start = System.nanoTime();
        search.run(context);
        List<WordMatch> results = context.getResults();
        results.sort(resultOrder);
        metrics.recordExpansion(System.nanoTime() - start, results.size(), context.getNodesVisited());
        return List.copyOf(results);
    }

    private void checkRack(Rack rack) {
        Objects.requireNonNull(rack, "rack must not be null");
        if (!alphabet.equals(rack.alphabet())) {
            throw new InvalidRackException("Rack uses alphabet '" + rack.alphabet().name()
                    + "' but the dictionary uses '" + alphabet.name() + "'");
        }
        if (rack.size() > maxRackSize) {
            throw new InvalidRackException("Rack '" + rack + "' has " + rack.size()
                    + " tiles; at most " + maxRackSize + " are allowed");
        }
        if (rack.wildcards() > maxWildcards) {
            throw new InvalidRackException("Rack '" + rack + "' has " + rack.wildcards()
                    + " wildcards; at most " + maxWildcards + " are allowed");
        }
    }
}
