package deckhand.engine.model;

/**
 * Batch stage parameters.
 *
 * @param maxCompletionTimeSeconds deadline for a single attempt
 * @param retries                  extra attempts after the first failure
 */
public record BatchParams(int maxCompletionTimeSeconds, int retries) {

    /** Total number of attempts the engine will make. */
    public int maxAttempts() {
        return retries + 1;
    }
}
