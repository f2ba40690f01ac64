/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.runtime.evaluation;

import com.lexigraph.api.IWordFinder;
import com.lexigraph.api.model.Alphabet;
import com.lexigraph.api.model.Pattern;
import com.lexigraph.api.model.Rack;
import com.lexigraph.api.model.RackAnalysis;
import com.lexigraph.api.model.WordMatch;
import com.lexigraph.cache.CachingWordFinder;
import com.lexigraph.infra.config.LexiconConfig;
import com.lexigraph.runtime.model.Automaton;
import io.opentelemetry.api.trace.Tracer;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Word finder over a dictionary that may be replaced while the process runs.
 *
 * <p>Every call reads the current automaton from the supplier (normally an
 * {@code AutomatonManager}). When it differs from the one the active finder was
 * built for, a new finder is built and published; queries already running
 * finish on the finder they started with.
 *
 * <pre>{@code
 * AutomatonManager manager = new AutomatonManager(config, tracer, new AutomatonCodec());
 * manager.start();
 * IWordFinder finder = ManagedWordFinder.create(manager, config, tracer);
 * }</pre>
 */
public final class ManagedWordFinder implements IWordFinder {
    private static final Logger logger = Logger.getLogger(ManagedWordFinder.class.getName());

    private final Supplier<Automaton> automatonSource;
    private final Function<Automaton, IWordFinder> finderFactory;
    private final AtomicReference<ActiveFinder> active = new AtomicReference<>();

    private record ActiveFinder(Automaton automaton, IWordFinder finder) {
    }

    public ManagedWordFinder(Supplier<Automaton> automatonSource, Function<Automaton, IWordFinder> finderFactory) {
        this.automatonSource = Objects.requireNonNull(automatonSource, "automatonSource must not be null");
        this.finderFactory = Objects.requireNonNull(finderFactory, "finderFactory must not be null");
    }

    /**
     * Builds engines with the configured rack limits, cached when the
     * configured cache size is positive.
     */
    public static ManagedWordFinder create(Supplier<Automaton> automatonSource, LexiconConfig config, Tracer tracer) {
        return new ManagedWordFinder(automatonSource, automaton -> {
            QueryEngine engine = new QueryEngine(automaton, config, tracer);
            return config.isQueryCacheEnabled()
                    ? new CachingWordFinder(engine, config.getQueryCacheSize())
                    : engine;
        });
    }

    /**
     * @return the finder for the automaton currently supplied
     */
    public IWordFinder current() {
        Automaton automaton = automatonSource.get();
        ActiveFinder current = active.get();
        if (current != null && current.automaton() == automaton) {
            return current.finder();
        }
        ActiveFinder replacement = new ActiveFinder(automaton, finderFactory.apply(automaton));
        if (active.compareAndSet(current, replacement)) {
            if (current != null) {
                logger.info(String.format("Switched to new dictionary: %,d words",
                        automaton.getStats().wordCount()));
            }
            return replacement.finder();
        }
        // Another thread published first; use whichever finder is now active if it matches.
        ActiveFinder winner = active.get();
        return winner != null && winner.automaton() == automaton ? winner.finder() : replacement.finder();
    }

    @Override
    public Alphabet alphabet() {
        return current().alphabet();
    }

    @Override
    public boolean lookup(String word) {
        return current().lookup(word);
    }

    @Override
    public Rack parseRack(String tiles) {
        return current().parseRack(tiles);
    }

    @Override
    public List<WordMatch> expand(Rack rack, Pattern pattern, int minLength) {
        return current().expand(rack, pattern, minLength);
    }

    @Override
    public List<String> match(Pattern pattern) {
        return current().match(pattern);
    }

    @Override
    public RackAnalysis analyze(Rack rack) {
        return current().analyze(rack);
    }
}
