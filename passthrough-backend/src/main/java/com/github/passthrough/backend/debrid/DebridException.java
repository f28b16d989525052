package com.github.passthrough.backend.debrid;

/**
 * Exception indicating that the debrid provider didn't behave according to its protocol.
 */
public class DebridException extends RuntimeException {
    public DebridException(String message) {
        super(message);
    }

    public DebridException(String message, Throwable cause) {
        super(message, cause);
    }
}
