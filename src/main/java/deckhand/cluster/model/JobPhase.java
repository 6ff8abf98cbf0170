package deckhand.cluster.model;

/**
 * Observed phase of a job.
 */
public enum JobPhase {
    /** Pods still running or pending */
    ACTIVE,
    /** Completed successfully */
    SUCCEEDED,
    /** At least one pod failed and the job gave up */
    FAILED,
    /** No job with that name */
    NOT_FOUND
}
