package deckhand.cluster.model;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time view of a job.
 */
public record JobObservation(
        String name,
        JobPhase phase,
        int active,
        int succeeded,
        int failed,
        Map<String, String> labels,
        Instant startTime,
        Instant completionTime) {

    public JobObservation {
        labels = labels != null ? Map.copyOf(labels) : Map.of();
    }

    public static JobObservation notFound(String name) {
        return new JobObservation(name, JobPhase.NOT_FOUND, 0, 0, 0, Map.of(), null, null);
    }

    public boolean isFinished() {
        return phase == JobPhase.SUCCEEDED || phase == JobPhase.FAILED;
    }

    /** Short status string used in logs and stage run records. */
    public String describe() {
        return phase + " (active=" + active + ", succeeded=" + succeeded + ", failed=" + failed + ")";
    }
}
