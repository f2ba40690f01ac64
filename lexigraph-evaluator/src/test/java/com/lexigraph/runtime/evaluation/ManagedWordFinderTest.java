/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.runtime.evaluation;

import com.lexigraph.api.IWordFinder;
import com.lexigraph.api.model.Alphabet;
import com.lexigraph.api.model.WordMatch;
import com.lexigraph.cache.CachingWordFinder;
import com.lexigraph.compiler.DawgBuilder;
import com.lexigraph.infra.config.LexiconConfig;
import com.lexigraph.infra.management.AutomatonManager;
import com.lexigraph.infra.serialization.AutomatonCodec;
import com.lexigraph.runtime.model.Automaton;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ManagedWordFinderTest {

    private static final Alphabet ENGLISH = Alphabet.of("english", "abcdefghijklmnopqrstuvwxyz");
    private static final Tracer TRACER = OpenTelemetry.noop().getTracer("test");

    @TempDir
    Path tempDir;

    private static Automaton build(String... words) {
        return new DawgBuilder(ENGLISH, TRACER).build(List.of(words));
    }

    @Test
    void reusesFinderUntilAutomatonChanges() {
        AtomicReference<Automaton> source = new AtomicReference<>(build("cat"));
        AtomicInteger created = new AtomicInteger();
        ManagedWordFinder finder = new ManagedWordFinder(source::get, automaton -> {
            created.incrementAndGet();
            return new QueryEngine(automaton);
        });

        assertThat(finder.lookup("cat")).isTrue();
        assertThat(finder.lookup("dog")).isFalse();
        IWordFinder first = finder.current();
        assertThat(created).hasValue(1);

        source.set(build("cat", "dog"));

        assertThat(finder.lookup("dog")).isTrue();
        assertThat(finder.current()).isNotSameAs(first);
        assertThat(created).hasValue(2);
    }

    @Test
    void createWrapsEnginesInCacheWhenEnabled() {
        Automaton automaton = build("tab", "bat");
        LexiconConfig cached = LexiconConfig.defaults().queryCacheSize(10).build();
        LexiconConfig uncached = LexiconConfig.defaults().queryCacheSize(0).build();

        IWordFinder wrapped = ManagedWordFinder.create(() -> automaton, cached, TRACER).current();
        assertThat(wrapped).isInstanceOf(CachingWordFinder.class);
        assertThat(((CachingWordFinder) wrapped).getDelegate()).isInstanceOf(QueryEngine.class);
        assertThat(ManagedWordFinder.create(() -> automaton, uncached, TRACER).current())
                .isInstanceOf(QueryEngine.class);
    }

    @Test
    void followsReloadsOfAutomatonManager() throws Exception {
        AutomatonCodec codec = new AutomatonCodec();
        Path dawg = tempDir.resolve("lexicon.dawg");
        codec.write(build("one"), dawg);
        AutomatonManager manager = new AutomatonManager(dawg, TRACER, codec);
        try {
            ManagedWordFinder finder = ManagedWordFinder.create(manager,
                    LexiconConfig.defaults().dawgPath(dawg).build(), TRACER);
            assertThat(finder.expand("eno", null)).extracting(WordMatch::word).containsExactly("one");

            codec.write(build("one", "neon"), dawg);
            manager.reload();

            assertThat(finder.expand("noen", null)).extracting(WordMatch::word).containsExactly("neon", "one");
        } finally {
            manager.shutdown();
        }
    }
}
