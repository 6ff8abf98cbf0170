package deckhand.engine.execution;

import deckhand.cluster.OrchestrationApi;
import deckhand.cluster.OrchestrationApiException;
import deckhand.cluster.model.JobObservation;
import deckhand.cluster.model.JobPhase;
import deckhand.cluster.spec.JobSpec;
import deckhand.engine.model.BatchParams;
import deckhand.engine.model.StageConfig;
import deckhand.engine.model.StageKind;
import deckhand.engine.model.StageOutcome;
import deckhand.engine.model.StageRun;
import deckhand.engine.model.StageState;
import deckhand.engine.translate.PipelineContext;
import deckhand.engine.translate.ResourceTranslator;
import deckhand.engine.translate.TranslationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Drives a batch stage: submit a job, poll it to completion, and on failure
 * or timeout delete it and submit a fresh attempt until retries run out.
 *
 * <p>
 * A stage with {@code retries = r} makes at most {@code r + 1} attempts.
 * Attempt {@code k + 1} is only submitted after the delete of attempt
 * {@code k} returned. A successful job is left in place for log retrieval.
 */
public class BatchLifecycle {

    private static final Logger log = LoggerFactory.getLogger(BatchLifecycle.class);

    private final OrchestrationApi api;
    private final ResourceTranslator translator;
    private final PodLogRelay logRelay;
    private final Duration pollInterval;
    private final Duration timeoutGrace;
    private final Clock clock;

    public BatchLifecycle(OrchestrationApi api, ResourceTranslator translator, PodLogRelay logRelay,
            Duration pollInterval, Duration timeoutGrace, Clock clock) {
        this.api = api;
        this.translator = translator;
        this.logRelay = logRelay;
        this.pollInterval = pollInterval;
        this.timeoutGrace = timeoutGrace;
        this.clock = clock;
    }

    public StageOutcome run(StageConfig stage, PipelineContext context, CancellationToken token) {
        StageRun run = new StageRun(stage.name(), StageKind.BATCH, clock);
        BatchParams params = stage.batch();
        Duration timeout = Duration.ofSeconds(params.maxCompletionTimeSeconds()).plus(timeoutGrace);
        StatusPoller poller = new StatusPoller(pollInterval, clock, token);

        while (true) {
            if (token.isCancelled()) {
                run.failed("cancelled");
                return run.toOutcome();
            }

            JobSpec job;
            try {
                job = translator.translate(stage, context, run.attemptNumber() + 1).job();
            } catch (TranslationException e) {
                log.error("Stage {} cannot be submitted: {}", stage.name(), e.getMessage());
                run.failed(e.getMessage());
                return run.toOutcome();
            }

            try {
                api.createJob(job);
            } catch (OrchestrationApiException e) {
                log.error("Stage {} failed to submit job {}: {}", stage.name(), job.name(), e.getMessage());
                run.failed("failed to submit job " + job.name() + ": " + e.getMessage());
                return run.toOutcome();
            }
            int attempt = run.submitted();
            log.info("Stage {} SUBMITTED: attempt {}/{} as job {}",
                    stage.name(), attempt, params.maxAttempts(), job.name());

            StatusPoller.Result<JobObservation> result = poller.poll(
                    "job " + job.name(),
                    timeout,
                    () -> api.readJob(job.namespace(), job.name()),
                    obs -> obs.phase() != JobPhase.ACTIVE,
                    obs -> observe(run, obs));

            String title = "stage " + stage.name() + " (attempt " + attempt + ")";
            String reason;
            switch (result.outcome()) {
                case CANCELLED -> {
                    deleteQuietly(job);
                    log.warn("Stage {} cancelled during attempt {}", stage.name(), attempt);
                    run.failed("cancelled");
                    return run.toOutcome();
                }
                case DONE -> {
                    logRelay.relay(job.namespace(), job.labels(), title);
                    if (result.lastObservation().phase() == JobPhase.SUCCEEDED) {
                        run.succeeded();
                        log.info("Stage {} SUCCEEDED on attempt {}", stage.name(), attempt);
                        return run.toOutcome();
                    }
                    reason = result.lastObservation().phase() == JobPhase.NOT_FOUND
                            ? "job " + job.name() + " disappeared"
                            : "job " + job.name() + " failed";
                }
                default -> {
                    logRelay.relay(job.namespace(), job.labels(), title);
                    reason = "job " + job.name() + " did not complete within " + timeout.toSeconds() + "s";
                }
            }

            try {
                api.deleteJob(job.namespace(), job.name());
            } catch (OrchestrationApiException e) {
                log.error("Stage {} failed to delete job {}: {}", stage.name(), job.name(), e.getMessage());
                run.failed(reason + "; cleanup failed: " + e.getMessage());
                return run.toOutcome();
            }

            if (attempt <= params.retries()) {
                log.warn("Stage {} attempt {}/{} failed ({}), retrying",
                        stage.name(), attempt, params.maxAttempts(), reason);
                continue;
            }

            run.failed(reason + " (" + attempt + " attempt" + (attempt == 1 ? "" : "s") + ")");
            log.error("Stage {} FAILED: {}", stage.name(), run.message());
            return run.toOutcome();
        }
    }

    private void observe(StageRun run, JobObservation obs) {
        String status = obs.describe();
        if (!status.equals(run.lastObservedStatus())) {
            log.debug("Stage {} job status: {}", run.stageName(), status);
        }
        if (run.state() == StageState.SUBMITTED) {
            run.polling(status);
            log.info("Stage {} POLLING", run.stageName());
        } else {
            run.observed(status);
        }
    }

    private void deleteQuietly(JobSpec job) {
        try {
            api.deleteJob(job.namespace(), job.name());
        } catch (OrchestrationApiException e) {
            log.warn("Failed to delete job {} after cancellation: {}", job.name(), e.getMessage());
        }
    }
}
