/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.api.exceptions;

/**
 * Thrown when a word list or a pattern contains a character outside the
 * declared alphabet.
 */
public class InvalidInputException extends LexiconException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
