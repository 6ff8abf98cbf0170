package deckhand.cluster;

/**
 * Error returned by the orchestration API.
 * Status code 0 means the request never got a response.
 */
public class OrchestrationApiException extends RuntimeException {

    private final int statusCode;

    public OrchestrationApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public OrchestrationApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public boolean isConflict() {
        return statusCode == 409;
    }

    /** Network errors, throttling and server-side errors may succeed on retry. */
    public boolean isRetryable() {
        return statusCode == 0 || statusCode == 429 || statusCode >= 500;
    }
}
