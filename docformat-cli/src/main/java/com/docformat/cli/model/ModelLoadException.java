package com.docformat.cli.model;

/**
 * Thrown when a documentation model file cannot be read or understood.
 */
public class ModelLoadException extends RuntimeException {

    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
