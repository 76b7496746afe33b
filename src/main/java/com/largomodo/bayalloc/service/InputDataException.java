package com.largomodo.bayalloc.service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when a required input file cannot be used at all: missing, empty, not tokenizable as
 * delimited text, or lacking a required column. Individual malformed rows never raise this; they
 * are skipped.
 */
public class InputDataException extends IOException {

    private final Path source;

    public InputDataException(Path source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public InputDataException(Path source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}
