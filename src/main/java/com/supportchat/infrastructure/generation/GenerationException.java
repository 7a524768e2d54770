package com.supportchat.infrastructure.generation;

/**
 * Raised when the language model call fails.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
