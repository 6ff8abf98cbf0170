package deckhand.engine.source;

/**
 * Thrown when a code bundle cannot be fetched.
 */
public class SourceException extends RuntimeException {

    public SourceException(String message) {
        super(message);
    }

    public SourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
