package deckhand.engine.translate;

/**
 * Thrown when a stage configuration cannot be turned into cluster resources.
 * The stage fails at submission without creating anything.
 */
public class TranslationException extends RuntimeException {

    private final String stageName;

    public TranslationException(String stageName, String message) {
        super("stage " + stageName + ": " + message);
        this.stageName = stageName;
    }

    public String stageName() {
        return stageName;
    }
}
