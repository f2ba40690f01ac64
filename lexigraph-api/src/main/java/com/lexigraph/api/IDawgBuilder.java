/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.api;

import com.lexigraph.runtime.model.Automaton;

import io.opentelemetry.api.trace.Tracer;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

/**
 * Contract for compiling word lists into a minimal, edge-compacted automaton.
 *
 * <p>Builders accept words in any order and with duplicates; the result
 * depends only on the set of accepted words.
 */
public interface IDawgBuilder {

    /**
     * Builds an automaton from an in-memory word list.
     *
     * @param words words to include
     * @return the frozen automaton
     * @throws com.lexigraph.api.exceptions.InvalidInputException if a word
     *         contains a character outside the alphabet
     */
    Automaton build(Collection<String> words);

    /**
     * Builds an automaton from one or more UTF-8 word-list files, merged into
     * a single word set.
     *
     * @param wordLists word-list files, one word per line
     * @return the frozen automaton
     * @throws IOException if a file cannot be read
     */
    Automaton build(List<Path> wordLists) throws IOException;

    /**
     * Builds an automaton from a single word-list file.
     */
    default Automaton build(Path wordList) throws IOException {
        return build(List.of(wordList));
    }

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a listener for tracking build progress.
     *
     * @param listener the build listener (null to disable)
     */
    default void setBuildListener(BuildListener listener) {
    }
}
