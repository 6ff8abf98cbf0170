package deckhand.engine.workflow;

/**
 * Thrown when a workflow cannot be set up, before any stage is submitted.
 */
public class WorkflowException extends RuntimeException {

    public enum Reason {
        /** Code bundle could not be fetched */
        SOURCE_UNAVAILABLE,
        /** Target namespace does not exist */
        NAMESPACE_NOT_FOUND,
        /** Cluster could not be reached during setup */
        CLUSTER_UNAVAILABLE
    }

    private final Reason reason;

    public WorkflowException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public WorkflowException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
