/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.api.exceptions;

/**
 * Thrown when a serialized automaton cannot be decoded: a malformed record,
 * a dangling node reference, or a structure that violates the automaton
 * invariants (for example a cycle).
 *
 * <p>Fatal to the load that raised it, never to the process.
 */
public class FormatException extends LexiconException {

    private final int lineNumber;

    public FormatException(String message) {
        this(message, -1);
    }

    public FormatException(String message, int lineNumber) {
        super(lineNumber > 0 ? "line " + lineNumber + ": " + message : message);
        this.lineNumber = lineNumber;
    }

    public FormatException(String message, int lineNumber, Throwable cause) {
        super(lineNumber > 0 ? "line " + lineNumber + ": " + message : message, cause);
        this.lineNumber = lineNumber;
    }

    /**
     * @return 1-based line number of the offending record, or -1 if the error
     *         is not tied to a single line
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
