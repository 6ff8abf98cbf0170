package deckhand.cluster.model;

import java.time.Instant;

/**
 * Registered workflow schedule.
 */
public record CronJobInfo(
        String name,
        String schedule,
        Instant lastScheduleTime,
        String repoUrl,
        String branch) {
}
