/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.api.exceptions;

/**
 * Base class for all errors raised by the dictionary engine.
 *
 * <p>This is a RuntimeException so that callers are not forced to handle
 * input validation failures at every call site. The enclosing application is
 * expected to recover at its request boundary; none of these errors is fatal
 * to the process.
 */
public class LexiconException extends RuntimeException {

    public LexiconException(String message) {
        super(message);
    }

    public LexiconException(String message, Throwable cause) {
        super(message, cause);
    }
}
