package deckhand.engine.workflow;

import deckhand.cluster.OrchestrationApi;
import deckhand.cluster.OrchestrationApiException;
import deckhand.engine.config.EngineConfig;
import deckhand.engine.config.LogLevels;
import deckhand.engine.descriptor.DescriptorLoader;
import deckhand.engine.descriptor.DescriptorValidator;
import deckhand.engine.execution.StageExecutor;
import deckhand.engine.model.ExecutionStep;
import deckhand.engine.model.PipelineDescriptor;
import deckhand.engine.model.WorkflowRun;
import deckhand.engine.repository.RunRepository;
import deckhand.engine.schedule.RunArtifactReaper;
import deckhand.engine.source.FetchedSource;
import deckhand.engine.source.ProjectSource;
import deckhand.engine.source.SourceException;
import deckhand.engine.translate.PipelineContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.UUID;

/**
 * One-shot workflow entry point: fetch the code bundle, load and validate
 * its descriptor, check the namespace, reap artifacts of earlier runs, run
 * the plan and record the result.
 *
 * <p>
 * Descriptor and graph errors surface as
 * {@link deckhand.engine.descriptor.DescriptorException} and
 * {@link deckhand.engine.graph.GraphException}, setup problems as
 * {@link WorkflowException}; all of them are thrown before any stage is
 * submitted. Stage failures are reported through the returned run.
 */
public class WorkflowRunner {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRunner.class);

    private final ProjectSource source;
    private final DescriptorLoader loader;
    private final OrchestrationApi api;
    private final StageExecutor executor;
    private final RunArtifactReaper reaper;
    private final RunRepository history; // null when history is disabled
    private final EngineConfig config;

    private volatile WorkflowController current;
    private volatile boolean cancelRequested;

    public WorkflowRunner(ProjectSource source, OrchestrationApi api, StageExecutor executor,
            RunRepository history, EngineConfig config) {
        this.source = source;
        this.loader = new DescriptorLoader();
        this.api = api;
        this.executor = executor;
        this.reaper = new RunArtifactReaper(api);
        this.history = history;
        this.config = config;
    }

    /**
     * Fetch a code bundle and run its pipeline.
     *
     * @param imageOverride image to use instead of the descriptor's, or null
     */
    public WorkflowRun run(String namespace, String repoUrl, String branch, String imageOverride) {
        FetchedSource fetched;
        try {
            fetched = source.fetch(repoUrl, branch);
        } catch (SourceException e) {
            throw new WorkflowException(WorkflowException.Reason.SOURCE_UNAVAILABLE,
                    "Failed to fetch " + repoUrl + ": " + e.getMessage(), e);
        }
        try (fetched) {
            PipelineDescriptor descriptor = loader.loadFromBundle(fetched.directory());
            return run(descriptor, namespace, repoUrl, branch, imageOverride, fetched.commitHash());
        }
    }

    /**
     * Run an already loaded pipeline.
     */
    public WorkflowRun run(PipelineDescriptor descriptor, String namespace, String repoUrl, String branch,
            String imageOverride, String gitCommit) {
        LogLevels.apply(config.logLevel() != null ? config.logLevel() : descriptor.logLevel());
        log.info("Loaded pipeline {} (version {}): DAG '{}'",
                descriptor.name(), descriptor.version(), descriptor.dagExpression());

        List<ExecutionStep> plan = DescriptorValidator.validate(descriptor);
        checkNamespace(namespace);

        String runId = newRunId();
        PipelineContext context = PipelineContext.of(descriptor, namespace, repoUrl, branch, runId,
                imageOverride, gitCommit);
        reaper.reap(namespace, descriptor.name(), runId);

        WorkflowController controller = new WorkflowController(executor, config.maxParallelStages());
        current = controller;
        if (cancelRequested) {
            controller.cancel();
        }
        WorkflowRun run;
        try {
            run = controller.run(descriptor, plan, context);
        } finally {
            current = null;
        }

        record(run);
        return run;
    }

    /**
     * Cancel the run in progress, or the next one if none has started yet.
     */
    public void cancel() {
        cancelRequested = true;
        WorkflowController controller = current;
        if (controller != null) {
            controller.cancel();
        }
    }

    private void checkNamespace(String namespace) {
        boolean exists;
        try {
            exists = api.namespaceExists(namespace);
        } catch (OrchestrationApiException e) {
            throw new WorkflowException(WorkflowException.Reason.CLUSTER_UNAVAILABLE,
                    "Failed to check namespace " + namespace + ": " + e.getMessage(), e);
        }
        if (!exists) {
            throw new WorkflowException(WorkflowException.Reason.NAMESPACE_NOT_FOUND,
                    "namespace " + namespace + " does not exist; run setup-namespace first");
        }
    }

    private void record(WorkflowRun run) {
        if (history == null) {
            return;
        }
        try {
            history.save(run);
        } catch (RuntimeException e) {
            log.warn("Failed to record run {} in history: {}", run.runId(), e.getMessage());
        }
    }

    private static String newRunId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
