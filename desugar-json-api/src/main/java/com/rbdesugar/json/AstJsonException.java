package com.rbdesugar.json;

/**
 * Thrown when a tree cannot be read from or written to JSON.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
