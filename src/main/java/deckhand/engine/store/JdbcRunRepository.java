package deckhand.engine.store;

import deckhand.engine.model.ExecutionStep;
import deckhand.engine.model.StageKind;
import deckhand.engine.model.StageOutcome;
import deckhand.engine.model.StageState;
import deckhand.engine.model.StepResult;
import deckhand.engine.model.WorkflowRun;
import deckhand.engine.model.WorkflowState;
import deckhand.engine.repository.RunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC implementation of RunRepository.
 * Stage outcomes are stored in completion order; the on-failure stage is
 * stored with step index -1.
 */
public class JdbcRunRepository implements RunRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcRunRepository.class);

    private static final int FAILURE_HANDLER_STEP = -1;

    private final Database db;

    public JdbcRunRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(WorkflowRun run) {
        String runSql = """
                    INSERT INTO workflow_runs (id, project, namespace, repo_url, branch, state,
                                               failed_stage, failed_step, cancelled, started_at, finished_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        String stageSql = """
                    INSERT INTO stage_runs (run_id, seq, step_index, stage_name, kind, state, attempts,
                                            message, last_status, submitted_at, finished_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(runSql)) {
                ps.setString(1, run.runId());
                ps.setString(2, run.project());
                ps.setString(3, run.namespace());
                ps.setString(4, run.repoUrl());
                ps.setString(5, run.branch());
                ps.setString(6, run.state().name());
                ps.setString(7, run.failedStage().orElse(null));
                setIntOrNull(ps, 8, run.failedStep().orElse(null));
                ps.setBoolean(9, run.cancelled());
                setTimestamp(ps, 10, run.startedAt());
                setTimestamp(ps, 11, run.finishedAt());
                ps.executeUpdate();
            }

            try (PreparedStatement ps = conn.prepareStatement(stageSql)) {
                int seq = 0;
                for (StepResult step : run.steps()) {
                    for (StageOutcome outcome : step.outcomes()) {
                        bindStage(ps, run.runId(), seq++, step.step().index(), outcome);
                        ps.addBatch();
                    }
                }
                if (run.failureHandler().isPresent()) {
                    bindStage(ps, run.runId(), seq, FAILURE_HANDLER_STEP, run.failureHandler().get());
                    ps.addBatch();
                }
                ps.executeBatch();
            }

            conn.commit();
            log.debug("Saved run: {}", run.runId());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save run: " + run.runId(), e);
        }
    }

    @Override
    public Optional<WorkflowRun> findById(String runId) {
        String sql = "SELECT * FROM workflow_runs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            List<WorkflowRun> runs = executeQuery(conn, ps);
            return runs.isEmpty() ? Optional.empty() : Optional.of(runs.get(0));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find run: " + runId, e);
        }
    }

    @Override
    public List<WorkflowRun> findRecent(int limit) {
        String sql = "SELECT * FROM workflow_runs ORDER BY started_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(conn, ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent runs", e);
        }
    }

    @Override
    public List<WorkflowRun> findByProject(String project, int limit) {
        String sql = "SELECT * FROM workflow_runs WHERE project = ? ORDER BY started_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, project);
            ps.setInt(2, limit);
            return executeQuery(conn, ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find runs of project: " + project, e);
        }
    }

    @Override
    public boolean delete(String runId) {
        // First delete stage rows, then the run
        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM stage_runs WHERE run_id = ?")) {
                ps.setString(1, runId);
                ps.executeUpdate();
            }

            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM workflow_runs WHERE id = ?")) {
                ps.setString(1, runId);
                int deleted = ps.executeUpdate();
                conn.commit();
                return deleted > 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete run: " + runId, e);
        }
    }

    // --- Helpers ---

    private void bindStage(PreparedStatement ps, String runId, int seq, int stepIndex, StageOutcome outcome)
            throws SQLException {
        ps.setString(1, runId);
        ps.setInt(2, seq);
        ps.setInt(3, stepIndex);
        ps.setString(4, outcome.stageName());
        ps.setString(5, outcome.kind().name());
        ps.setString(6, outcome.state().name());
        ps.setInt(7, outcome.attempts());
        ps.setString(8, truncate(outcome.message(), 2048));
        ps.setString(9, truncate(outcome.lastObservedStatus(), 512));
        setTimestamp(ps, 10, outcome.submittedAt());
        setTimestamp(ps, 11, outcome.finishedAt());
    }

    private List<WorkflowRun> executeQuery(Connection conn, PreparedStatement ps) throws SQLException {
        List<WorkflowRun.Builder> builders = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                builders.add(mapRow(rs));
            }
        }

        List<WorkflowRun> runs = new ArrayList<>();
        for (WorkflowRun.Builder builder : builders) {
            WorkflowRun partial = builder.build();
            loadStages(conn, partial.runId(), builder);
            runs.add(builder.build());
        }
        return runs;
    }

    private void loadStages(Connection conn, String runId, WorkflowRun.Builder builder) throws SQLException {
        String sql = "SELECT * FROM stage_runs WHERE run_id = ? ORDER BY seq";
        Map<Integer, List<StageOutcome>> byStep = new LinkedHashMap<>();

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    int stepIndex = rs.getInt("step_index");
                    StageOutcome outcome = new StageOutcome(
                            rs.getString("stage_name"),
                            StageKind.valueOf(rs.getString("kind")),
                            StageState.valueOf(rs.getString("state")),
                            rs.getInt("attempts"),
                            rs.getString("message"),
                            rs.getString("last_status"),
                            toInstant(rs.getTimestamp("submitted_at")),
                            toInstant(rs.getTimestamp("finished_at")));
                    if (stepIndex == FAILURE_HANDLER_STEP) {
                        builder.failureHandler(outcome);
                    } else {
                        byStep.computeIfAbsent(stepIndex, k -> new ArrayList<>()).add(outcome);
                    }
                }
            }
        }

        List<StepResult> steps = new ArrayList<>();
        byStep.forEach((index, outcomes) -> {
            Set<String> names = new LinkedHashSet<>();
            outcomes.forEach(o -> names.add(o.stageName()));
            steps.add(new StepResult(new ExecutionStep(index, names), outcomes));
        });
        builder.steps(steps);
    }

    private WorkflowRun.Builder mapRow(ResultSet rs) throws SQLException {
        Integer failedStep = rs.getInt("failed_step");
        if (rs.wasNull()) {
            failedStep = null;
        }
        return WorkflowRun.builder()
                .runId(rs.getString("id"))
                .project(rs.getString("project"))
                .namespace(rs.getString("namespace"))
                .repoUrl(rs.getString("repo_url"))
                .branch(rs.getString("branch"))
                .state(WorkflowState.valueOf(rs.getString("state")))
                .failedStage(rs.getString("failed_stage"))
                .failedStep(failedStep)
                .cancelled(rs.getBoolean("cancelled"))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .finishedAt(toInstant(rs.getTimestamp("finished_at")));
    }

    private void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    private void setIntOrNull(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(index, value);
        } else {
            ps.setNull(index, Types.INTEGER);
        }
    }

    private Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static String truncate(String value, int max) {
        return value != null && value.length() > max ? value.substring(0, max) : value;
    }
}
