package deckhand.engine.model;

/**
 * Overall state of a workflow run.
 */
public enum WorkflowState {
    RUNNING,
    SUCCEEDED,
    FAILED
}
