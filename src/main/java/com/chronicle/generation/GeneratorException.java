package com.chronicle.generation;

/**
 * Thrown when a generator call fails or is cancelled.
 */
public class GeneratorException extends RuntimeException {

    public GeneratorException(String message) {
        super(message);
    }

    public GeneratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
