package com.jsdesugar.json;

/**
 * Thrown when an AST cannot be written to or read from JSON.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
