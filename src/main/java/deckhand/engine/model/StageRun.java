package deckhand.engine.model;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Mutable record of one stage's progress.
 * Owned by a single executor thread; the controller only sees the
 * {@link StageOutcome} produced by {@link #toOutcome()}.
 */
public final class StageRun {
    private final String stageName;
    private final StageKind kind;
    private final Clock clock;

    private int attemptNumber;
    private Instant submittedAt;
    private Instant finishedAt;
    private StageState state = StageState.PENDING;
    private String lastObservedStatus;
    private String message;

    public StageRun(String stageName, StageKind kind, Clock clock) {
        this.stageName = Objects.requireNonNull(stageName, "stageName");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.clock = clock;
    }

    public String stageName() {
        return stageName;
    }

    public StageKind kind() {
        return kind;
    }

    public int attemptNumber() {
        return attemptNumber;
    }

    public Instant submittedAt() {
        return submittedAt;
    }

    public StageState state() {
        return state;
    }

    public String lastObservedStatus() {
        return lastObservedStatus;
    }

    public String message() {
        return message;
    }

    /** Record a new submission and return its attempt number. */
    public int submitted() {
        requireActive();
        attemptNumber++;
        if (submittedAt == null) {
            submittedAt = clock.instant();
        }
        state = StageState.SUBMITTED;
        return attemptNumber;
    }

    public void polling(String observedStatus) {
        requireActive();
        state = StageState.POLLING;
        lastObservedStatus = observedStatus;
    }

    public void observed(String observedStatus) {
        lastObservedStatus = observedStatus;
    }

    public void succeeded() {
        finish(StageState.SUCCEEDED, null);
    }

    public void failed(String reason) {
        finish(StageState.FAILED, reason);
    }

    public void rolledBack(String reason) {
        finish(StageState.ROLLED_BACK, reason);
    }

    public StageOutcome toOutcome() {
        if (!state.isTerminal()) {
            throw new IllegalStateException("stage " + stageName + " is still " + state);
        }
        return new StageOutcome(stageName, kind, state, attemptNumber, message,
                lastObservedStatus, submittedAt, finishedAt);
    }

    private void finish(StageState terminal, String reason) {
        requireActive();
        state = terminal;
        message = reason;
        finishedAt = clock.instant();
    }

    private void requireActive() {
        if (state.isTerminal()) {
            throw new IllegalStateException("stage " + stageName + " already finished as " + state);
        }
    }
}
