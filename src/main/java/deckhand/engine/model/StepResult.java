package deckhand.engine.model;

import java.util.List;
import java.util.Optional;

/**
 * Outcomes of every stage in one step, in completion order.
 */
public record StepResult(ExecutionStep step, List<StageOutcome> outcomes) {

    public StepResult {
        outcomes = List.copyOf(outcomes);
    }

    public boolean failed() {
        return outcomes.stream().anyMatch(StageOutcome::failed);
    }

    /** First stage to finish in a failed state. */
    public Optional<StageOutcome> firstFailure() {
        return outcomes.stream().filter(StageOutcome::failed).findFirst();
    }
}
