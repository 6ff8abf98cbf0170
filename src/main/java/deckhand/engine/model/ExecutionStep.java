package deckhand.engine.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One step of an execution plan: stages that may run concurrently.
 *
 * @param index  0-based position in the plan
 * @param stages stage names in declaration order
 */
public record ExecutionStep(int index, Set<String> stages) {

    public ExecutionStep {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("stages must not be empty");
        }
        stages = Collections.unmodifiableSet(new LinkedHashSet<>(stages));
    }

    public int size() {
        return stages.size();
    }

    @Override
    public String toString() {
        return "step " + (index + 1) + " " + stages;
    }
}
