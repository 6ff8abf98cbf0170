package deckhand.engine.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable snapshot of a stage run once it reached a terminal state.
 *
 * @param stageName          stage name
 * @param kind               stage kind
 * @param state              terminal state
 * @param attempts           number of submissions made
 * @param message            failure reason, null on success
 * @param lastObservedStatus last status string read from the cluster
 * @param submittedAt        first submission time, null if never submitted
 * @param finishedAt         time the terminal state was reached
 */
public record StageOutcome(
        String stageName,
        StageKind kind,
        StageState state,
        int attempts,
        String message,
        String lastObservedStatus,
        Instant submittedAt,
        Instant finishedAt) {

    public StageOutcome {
        if (state == null || !state.isTerminal()) {
            throw new IllegalArgumentException("outcome state must be terminal, got " + state);
        }
    }

    public boolean succeeded() {
        return state == StageState.SUCCEEDED;
    }

    public boolean failed() {
        return state.isFailure();
    }

    public Duration elapsed() {
        if (submittedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(submittedAt, finishedAt);
    }
}
