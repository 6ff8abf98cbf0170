package deckhand.engine.model;

/**
 * Lifecycle state of a single stage run.
 */
public enum StageState {
    /** Not yet submitted */
    PENDING,
    /** Resources created, not yet observed */
    SUBMITTED,
    /** Waiting for the workload to finish or become ready */
    POLLING,
    /** Job completed or all replicas ready */
    SUCCEEDED,
    /** Retries exhausted, startup timed out on create, or submission failed */
    FAILED,
    /** Update did not become ready and the previous revision was restored */
    ROLLED_BACK;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == ROLLED_BACK;
    }

    /** ROLLED_BACK counts as a failure for the step. */
    public boolean isFailure() {
        return this == FAILED || this == ROLLED_BACK;
    }
}
