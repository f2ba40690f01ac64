/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.api.exceptions;

/**
 * Thrown when a rack contains a symbol that is neither an alphabet letter nor
 * a wildcard, or exceeds the configured rack limits.
 *
 * <p>An empty rack is not malformed.
 */
public class InvalidRackException extends LexiconException {

    public InvalidRackException(String message) {
        super(message);
    }
}
