package deckhand.engine.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable result of one workflow execution.
 * Returned to the caller and optionally stored in the run history.
 */
public final class WorkflowRun {
    private final String runId;
    private final String project;
    private final String namespace;
    private final String repoUrl;
    private final String branch;
    private final WorkflowState state;
    private final List<StepResult> steps;
    private final String failedStage;
    private final Integer failedStep; // 0-based step index
    private final StageOutcome failureHandler;
    private final boolean cancelled;
    private final Instant startedAt;
    private final Instant finishedAt;

    private WorkflowRun(Builder builder) {
        this.runId = Objects.requireNonNull(builder.runId, "runId is required");
        this.project = Objects.requireNonNull(builder.project, "project is required");
        this.namespace = Objects.requireNonNull(builder.namespace, "namespace is required");
        this.repoUrl = builder.repoUrl;
        this.branch = builder.branch;
        this.state = Objects.requireNonNull(builder.state, "state is required");
        this.steps = Collections.unmodifiableList(new ArrayList<>(builder.steps));
        this.failedStage = builder.failedStage;
        this.failedStep = builder.failedStep;
        this.failureHandler = builder.failureHandler;
        this.cancelled = builder.cancelled;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
    }

    public String runId() {
        return runId;
    }

    public String project() {
        return project;
    }

    public String namespace() {
        return namespace;
    }

    public String repoUrl() {
        return repoUrl;
    }

    public String branch() {
        return branch;
    }

    public WorkflowState state() {
        return state;
    }

    public List<StepResult> steps() {
        return steps;
    }

    public Optional<String> failedStage() {
        return Optional.ofNullable(failedStage);
    }

    public Optional<Integer> failedStep() {
        return Optional.ofNullable(failedStep);
    }

    /** Outcome of the on-failure stage, if one ran. */
    public Optional<StageOutcome> failureHandler() {
        return Optional.ofNullable(failureHandler);
    }

    public boolean cancelled() {
        return cancelled;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public boolean succeeded() {
        return state == WorkflowState.SUCCEEDED;
    }

    /** All stage outcomes in step order. */
    public List<StageOutcome> outcomes() {
        List<StageOutcome> all = new ArrayList<>();
        for (StepResult step : steps) {
            all.addAll(step.outcomes());
        }
        return all;
    }

    public Optional<StageOutcome> outcome(String stageName) {
        return outcomes().stream().filter(o -> o.stageName().equals(stageName)).findFirst();
    }

    public Builder toBuilder() {
        return new Builder()
                .runId(runId)
                .project(project)
                .namespace(namespace)
                .repoUrl(repoUrl)
                .branch(branch)
                .state(state)
                .steps(steps)
                .failedStage(failedStage)
                .failedStep(failedStep)
                .failureHandler(failureHandler)
                .cancelled(cancelled)
                .startedAt(startedAt)
                .finishedAt(finishedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "WorkflowRun{" +
                "runId='" + runId + '\'' +
                ", project='" + project + '\'' +
                ", state=" + state +
                ", failedStage=" + failedStage +
                ", failedStep=" + failedStep +
                '}';
    }

    public static final class Builder {
        private String runId;
        private String project;
        private String namespace;
        private String repoUrl;
        private String branch;
        private WorkflowState state = WorkflowState.RUNNING;
        private List<StepResult> steps = List.of();
        private String failedStage;
        private Integer failedStep;
        private StageOutcome failureHandler;
        private boolean cancelled;
        private Instant startedAt;
        private Instant finishedAt;

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder project(String project) {
            this.project = project;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder repoUrl(String repoUrl) {
            this.repoUrl = repoUrl;
            return this;
        }

        public Builder branch(String branch) {
            this.branch = branch;
            return this;
        }

        public Builder state(WorkflowState state) {
            this.state = state;
            return this;
        }

        public Builder steps(List<StepResult> steps) {
            this.steps = steps;
            return this;
        }

        public Builder failedStage(String failedStage) {
            this.failedStage = failedStage;
            return this;
        }

        public Builder failedStep(Integer failedStep) {
            this.failedStep = failedStep;
            return this;
        }

        public Builder failureHandler(StageOutcome failureHandler) {
            this.failureHandler = failureHandler;
            return this;
        }

        public Builder cancelled(boolean cancelled) {
            this.cancelled = cancelled;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public WorkflowRun build() {
            return new WorkflowRun(this);
        }
    }
}
