package deckhand.engine.repository;

import deckhand.engine.model.WorkflowRun;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for workflow run history.
 */
public interface RunRepository {

    /**
     * Save a finished run together with its stage outcomes.
     *
     * @param run the run to save
     */
    void save(WorkflowRun run);

    /**
     * Find a run by ID.
     *
     * @param runId the run ID
     * @return the run if found
     */
    Optional<WorkflowRun> findById(String runId);

    /**
     * Get recent runs ordered by start time, newest first.
     *
     * @param limit maximum results
     * @return list of runs
     */
    List<WorkflowRun> findRecent(int limit);

    /**
     * Get recent runs of one pipeline, newest first.
     *
     * @param project pipeline name
     * @param limit   maximum results
     * @return list of runs
     */
    List<WorkflowRun> findByProject(String project, int limit);

    /**
     * Delete a run and its stage outcomes.
     *
     * @param runId the run ID
     * @return true if deleted
     */
    boolean delete(String runId);
}
