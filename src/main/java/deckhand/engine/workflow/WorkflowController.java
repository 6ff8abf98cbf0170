package deckhand.engine.workflow;

import deckhand.engine.execution.CancellationToken;
import deckhand.engine.execution.StageExecutor;
import deckhand.engine.model.ExecutionStep;
import deckhand.engine.model.PipelineDescriptor;
import deckhand.engine.model.StageConfig;
import deckhand.engine.model.StageOutcome;
import deckhand.engine.model.StageRun;
import deckhand.engine.model.StepResult;
import deckhand.engine.model.WorkflowRun;
import deckhand.engine.model.WorkflowState;
import deckhand.engine.translate.PipelineContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes a resolved plan step by step.
 *
 * <p>
 * Stages of a step run concurrently on a bounded pool and the step ends when
 * all of them are terminal. The first step with a failed or rolled-back stage
 * ends the run: later steps are never submitted and earlier steps are not
 * compensated. One instance drives one run; {@link #cancel()} may be called
 * from any thread.
 */
public class WorkflowController {

    private static final Logger log = LoggerFactory.getLogger(WorkflowController.class);

    private final StageExecutor executor;
    private final int maxParallelStages;
    private final Clock clock;
    private final CancellationToken token = new CancellationToken();

    public WorkflowController(StageExecutor executor, int maxParallelStages) {
        this(executor, maxParallelStages, Clock.systemUTC());
    }

    public WorkflowController(StageExecutor executor, int maxParallelStages, Clock clock) {
        if (maxParallelStages < 1) {
            throw new IllegalArgumentException("maxParallelStages must be >= 1");
        }
        this.executor = executor;
        this.maxParallelStages = maxParallelStages;
        this.clock = clock;
    }

    /**
     * Run every step of the plan.
     *
     * @param descriptor the pipeline
     * @param plan       steps from {@link deckhand.engine.graph.GraphResolver}
     * @param context    run-wide values
     * @return the finished run, never in RUNNING state
     */
    public WorkflowRun run(PipelineDescriptor descriptor, List<ExecutionStep> plan, PipelineContext context) {
        Instant startedAt = clock.instant();
        WorkflowRun.Builder result = WorkflowRun.builder()
                .runId(context.runId())
                .project(descriptor.name())
                .namespace(context.namespace())
                .repoUrl(context.repoUrl())
                .branch(context.branch())
                .startedAt(startedAt);

        log.info("Workflow {} run {} starting in namespace {}: {} step(s)",
                descriptor.name(), context.runId(), context.namespace(), plan.size());

        int poolSize = Math.min(maxParallelStages,
                plan.stream().mapToInt(ExecutionStep::size).max().orElse(1));
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, daemonThreads(context.runId()));

        List<StepResult> steps = new ArrayList<>();
        StageOutcome failure = null;
        int failedStep = -1;
        try {
            for (ExecutionStep step : plan) {
                if (token.isCancelled()) {
                    log.warn("Workflow {} cancelled before {}", descriptor.name(), step);
                    break;
                }
                log.info("Starting {} of {}: {}", step.index() + 1, plan.size(), step.stages());
                StepResult stepResult = runStep(pool, descriptor, step, context);
                steps.add(stepResult);

                if (stepResult.failed()) {
                    failure = stepResult.firstFailure().orElseThrow();
                    failedStep = step.index();
                    log.error("{} failed: stage {} ended {}", step, failure.stageName(), failure.state());
                    break;
                }
                log.info("Completed {} of {}", step.index() + 1, plan.size());
            }
        } finally {
            shutdown(pool);
        }

        boolean cancelled = token.isCancelled();
        boolean succeeded = failure == null && !cancelled && steps.size() == plan.size();
        result.steps(steps)
                .cancelled(cancelled)
                .state(succeeded ? WorkflowState.SUCCEEDED : WorkflowState.FAILED);
        if (failure != null) {
            result.failedStage(failure.stageName()).failedStep(failedStep);
        }

        if (!succeeded && !cancelled) {
            descriptor.runOnFailure()
                    .flatMap(descriptor::stage)
                    .ifPresent(stage -> result.failureHandler(runFailureHandler(stage, context)));
        }

        WorkflowRun run = result.finishedAt(clock.instant()).build();
        logSummary(run, failure);
        return run;
    }

    /**
     * Stop the run: pending polls wake up, in-flight stages clean up and end
     * FAILED, and no further step is started.
     */
    public void cancel() {
        log.warn("Cancellation requested");
        token.cancel();
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    private StepResult runStep(ExecutorService pool, PipelineDescriptor descriptor, ExecutionStep step,
            PipelineContext context) {
        CompletionService<StageOutcome> completion = new ExecutorCompletionService<>(pool);
        List<Future<StageOutcome>> futures = new ArrayList<>();
        for (String name : step.stages()) {
            StageConfig stage = descriptor.stage(name).orElseThrow(
                    () -> new IllegalStateException("plan references undeclared stage " + name));
            futures.add(completion.submit(() -> executeSafely(stage, context)));
        }

        // Join: collect every outcome of the step in completion order
        List<StageOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            outcomes.add(take(completion));
        }
        return new StepResult(step, outcomes);
    }

    private StageOutcome executeSafely(StageConfig stage, PipelineContext context) {
        try {
            return executor.execute(stage, context, token);
        } catch (RuntimeException e) {
            log.error("Stage {} failed with an unexpected error", stage.name(), e);
            StageRun run = new StageRun(stage.name(), stage.kind(), clock);
            run.failed("unexpected error: " + e.getMessage());
            return run.toOutcome();
        }
    }

    private StageOutcome take(CompletionService<StageOutcome> completion) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return completion.take().get();
                } catch (InterruptedException e) {
                    // Keep joining: executors observe the token and finish promptly
                    interrupted = true;
                    token.cancel();
                } catch (ExecutionException e) {
                    throw new IllegalStateException("stage task failed", e.getCause());
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private StageOutcome runFailureHandler(StageConfig stage, PipelineContext context) {
        log.warn("Running on-failure stage {}", stage.name());
        StageOutcome outcome = executeSafely(stage, context);
        if (outcome.succeeded()) {
            log.info("On-failure stage {} completed", stage.name());
        } else {
            log.error("On-failure stage {} ended {}: {}", stage.name(), outcome.state(), outcome.message());
        }
        return outcome;
    }

    private void logSummary(WorkflowRun run, StageOutcome failure) {
        Duration elapsed = Duration.between(run.startedAt(), run.finishedAt());
        int stages = run.outcomes().size();
        if (run.succeeded()) {
            log.info("Workflow {} run {} SUCCEEDED in {}s: {} stage(s) across {} step(s)",
                    run.project(), run.runId(), elapsed.toSeconds(), stages, run.steps().size());
        } else if (failure != null) {
            log.error("Workflow {} run {} FAILED in {}s at step {} stage {}: {}",
                    run.project(), run.runId(), elapsed.toSeconds(), run.failedStep().orElse(-1) + 1,
                    failure.stageName(), failure.message());
        } else {
            log.error("Workflow {} run {} FAILED in {}s: cancelled", run.project(), run.runId(), elapsed.toSeconds());
        }
    }

    private static ThreadFactory daemonThreads(String runId) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "deckhand-stage-" + runId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private void shutdown(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
                log.warn("Stage pool forcefully stopped");
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
