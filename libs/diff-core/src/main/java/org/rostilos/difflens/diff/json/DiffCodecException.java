package org.rostilos.difflens.diff.json;

/**
 * Exception thrown when parsed diff structures cannot be written to or read from JSON.
 */
public class DiffCodecException extends RuntimeException {

    public DiffCodecException(String message) {
        super(message);
    }

    public DiffCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
