package com.arbor.exception;

/**
 * Exception thrown when a decision tree or the operator registry is set up incorrectly:
 * an unregistered operator symbol, a malformed node, or an unreadable tree file.
 * Indicates a defect in authoring, never bad end-user input.
 */
public class AuthoringException extends ArborException {

    public AuthoringException(String message) {
        super(message);
    }

    public AuthoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
