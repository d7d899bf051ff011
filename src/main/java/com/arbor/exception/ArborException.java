package com.arbor.exception;

/**
 * Base exception for the Arbor decision engine.
 */
public class ArborException extends RuntimeException {

    public ArborException(String message) {
        super(message);
    }

    public ArborException(String message, Throwable cause) {
        super(message, cause);
    }
}
