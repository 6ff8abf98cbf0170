package deckhand.engine.model;

/**
 * Kind of workload a stage deploys.
 */
public enum StageKind {
    /** Run-to-completion job, retried on failure */
    BATCH,
    /** Long-running replicated deployment behind an endpoint */
    SERVICE
}
