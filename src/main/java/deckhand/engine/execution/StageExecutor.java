package deckhand.engine.execution;

import deckhand.cluster.OrchestrationApi;
import deckhand.cluster.OrchestrationApiException;
import deckhand.engine.config.EngineConfig;
import deckhand.engine.model.StageConfig;
import deckhand.engine.model.StageOutcome;
import deckhand.engine.model.StageRun;
import deckhand.engine.translate.PipelineContext;
import deckhand.engine.translate.ResourceNames;
import deckhand.engine.translate.ResourceTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one stage to a terminal state, dispatching on the stage kind.
 * Safe to share between threads: every call owns its own {@link StageRun}.
 */
public class StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(StageExecutor.class);

    private final OrchestrationApi api;
    private final BatchLifecycle batch;
    private final ServiceLifecycle service;
    private final boolean verifySecrets;
    private final Clock clock;

    public StageExecutor(OrchestrationApi api, EngineConfig config) {
        this(api, config, Clock.systemUTC());
    }

    public StageExecutor(OrchestrationApi api, EngineConfig config, Clock clock) {
        ResourceTranslator translator = new ResourceTranslator(config.stageServiceAccount());
        PodLogRelay relay = new PodLogRelay(api);
        this.api = api;
        this.batch = new BatchLifecycle(api, translator, relay, config.pollInterval(), config.timeoutGrace(), clock);
        this.service = new ServiceLifecycle(api, translator, relay, config.pollInterval(), config.timeoutGrace(), clock);
        this.verifySecrets = config.verifySecrets();
        this.clock = clock;
    }

    /**
     * Execute a stage. Never throws for stage-level problems; they are
     * reported through the outcome.
     */
    public StageOutcome execute(StageConfig stage, PipelineContext context, CancellationToken token) {
        log.info("Stage {} PENDING ({}, namespace {})", stage.name(), stage.kind(), context.namespace());

        if (verifySecrets && !stage.secrets().isEmpty()) {
            List<String> missing = missingSecrets(stage, context);
            if (!missing.isEmpty()) {
                StageRun run = new StageRun(stage.name(), stage.kind(), clock);
                run.failed("secrets not found in namespace " + context.namespace() + ": " + missing);
                log.error("Stage {} FAILED: {}", stage.name(), run.message());
                return run.toOutcome();
            }
        }

        return switch (stage.kind()) {
            case BATCH -> batch.run(stage, context, token);
            case SERVICE -> service.run(stage, context, token);
        };
    }

    private List<String> missingSecrets(StageConfig stage, PipelineContext context) {
        List<String> missing = new ArrayList<>();
        for (String secret : stage.secrets().values()) {
            String name = ResourceNames.secretName(context.secretsGroup(), secret);
            if (missing.contains(name)) {
                continue;
            }
            try {
                if (!api.secretExists(context.namespace(), name)) {
                    missing.add(name);
                }
            } catch (OrchestrationApiException e) {
                log.warn("Could not verify secret {} for stage {}, continuing: {}", name, stage.name(), e.getMessage());
            }
        }
        return missing;
    }
}
