/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.api;

import com.lexigraph.runtime.model.Automaton;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Loads a previously built automaton from storage.
 */
@FunctionalInterface
public interface IAutomatonLoader {

    /**
     * @param path the serialized automaton
     * @return the automaton
     * @throws IOException if the file cannot be read
     * @throws com.lexigraph.api.exceptions.FormatException if the file is
     *         malformed or inconsistent
     */
    Automaton load(Path path) throws IOException;
}
