package deckhand.engine.schedule;

import deckhand.cluster.OrchestrationApi;
import deckhand.cluster.OrchestrationApiException;
import deckhand.cluster.model.JobObservation;
import deckhand.engine.translate.ResourceNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deletes finished batch jobs left behind by earlier runs of a pipeline.
 * Successful jobs are kept after a run so their logs stay readable; they are
 * reaped here when the next run of the same pipeline starts.
 */
public class RunArtifactReaper {

    private static final Logger log = LoggerFactory.getLogger(RunArtifactReaper.class);

    private final OrchestrationApi api;

    public RunArtifactReaper(OrchestrationApi api) {
        this.api = api;
    }

    /**
     * Delete finished jobs of the pipeline that do not belong to the current
     * run. Failures are logged and skipped.
     *
     * @return number of jobs deleted
     */
    public int reap(String namespace, String project, String currentRunId) {
        int reaped = 0;
        try {
            for (JobObservation job : api.listJobs(namespace, ResourceNames.pipelineSelector(project))) {
                String runId = job.labels().get(ResourceNames.RUN_ID_LABEL);
                if (!job.isFinished() || currentRunId.equals(runId)) {
                    continue;
                }
                try {
                    api.deleteJob(namespace, job.name());
                    reaped++;
                } catch (OrchestrationApiException e) {
                    log.warn("Failed to reap job {}: {}", job.name(), e.getMessage());
                }
            }
        } catch (OrchestrationApiException e) {
            log.warn("Failed to list jobs of pipeline {} for reaping: {}", project, e.getMessage());
        }
        if (reaped > 0) {
            log.info("Reaped {} finished job(s) from earlier runs of {}", reaped, project);
        }
        return reaped;
    }
}
