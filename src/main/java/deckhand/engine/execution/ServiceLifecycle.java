package deckhand.engine.execution;

import deckhand.cluster.OrchestrationApi;
import deckhand.cluster.OrchestrationApiException;
import deckhand.cluster.model.DeploymentObservation;
import deckhand.cluster.spec.DeploymentSpec;
import deckhand.cluster.spec.EndpointSpec;
import deckhand.engine.model.ServiceParams;
import deckhand.engine.model.StageConfig;
import deckhand.engine.model.StageKind;
import deckhand.engine.model.StageOutcome;
import deckhand.engine.model.StageRun;
import deckhand.engine.model.StageState;
import deckhand.engine.translate.PipelineContext;
import deckhand.engine.translate.ResourceNames;
import deckhand.engine.translate.ResourceTranslator;
import deckhand.engine.translate.StageResources;
import deckhand.engine.translate.TranslationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Drives a service stage: create or update the deployment in place, make
 * sure its endpoint exists and wait for every replica to become ready.
 *
 * <p>
 * If an update does not become ready in time the previous revision is
 * restored and the stage ends ROLLED_BACK. A fresh deployment that does not
 * become ready ends FAILED and is left in place for inspection. Service
 * stages are never retried.
 */
public class ServiceLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ServiceLifecycle.class);

    private final OrchestrationApi api;
    private final ResourceTranslator translator;
    private final PodLogRelay logRelay;
    private final Duration pollInterval;
    private final Duration timeoutGrace;
    private final Clock clock;

    public ServiceLifecycle(OrchestrationApi api, ResourceTranslator translator, PodLogRelay logRelay,
            Duration pollInterval, Duration timeoutGrace, Clock clock) {
        this.api = api;
        this.translator = translator;
        this.logRelay = logRelay;
        this.pollInterval = pollInterval;
        this.timeoutGrace = timeoutGrace;
        this.clock = clock;
    }

    public StageOutcome run(StageConfig stage, PipelineContext context, CancellationToken token) {
        StageRun run = new StageRun(stage.name(), StageKind.SERVICE, clock);
        ServiceParams params = stage.service();

        StageResources resources;
        try {
            resources = translator.translate(stage, context, 1);
        } catch (TranslationException e) {
            log.error("Stage {} cannot be submitted: {}", stage.name(), e.getMessage());
            run.failed(e.getMessage());
            return run.toOutcome();
        }
        DeploymentSpec deployment = resources.deployment();
        String namespace = deployment.namespace();
        String name = deployment.name();

        Optional<DeploymentObservation> existing;
        try {
            existing = api.readDeployment(namespace, name);
        } catch (OrchestrationApiException e) {
            run.failed("could not check for existing deployment " + name + ": " + e.getMessage());
            log.error("Stage {} FAILED: {}", stage.name(), run.message());
            return run.toOutcome();
        }

        if (token.isCancelled()) {
            run.failed("cancelled");
            return run.toOutcome();
        }

        boolean update = existing.isPresent();
        long priorRevision = existing.map(DeploymentObservation::revision).orElse(0L);
        try {
            if (update) {
                api.updateDeployment(deployment);
            } else {
                api.createDeployment(deployment);
            }
        } catch (OrchestrationApiException e) {
            run.failed("failed to " + (update ? "update" : "create") + " deployment " + name + ": " + e.getMessage());
            log.error("Stage {} FAILED: {}", stage.name(), run.message());
            return run.toOutcome();
        }
        run.submitted();
        if (update) {
            log.info("Stage {} SUBMITTED: updating deployment {} (current revision {})",
                    stage.name(), name, priorRevision);
        } else {
            log.info("Stage {} SUBMITTED: creating deployment {}", stage.name(), name);
        }

        try {
            ensureEndpoint(resources.endpoint());
        } catch (OrchestrationApiException e) {
            run.failed("failed to create endpoint " + name + ": " + e.getMessage());
            log.error("Stage {} FAILED: {}", stage.name(), run.message());
            return run.toOutcome();
        }

        Duration timeout = Duration.ofSeconds(params.maxStartupTimeSeconds()).plus(timeoutGrace);
        StatusPoller.Result<DeploymentObservation> result = new StatusPoller(pollInterval, clock, token).poll(
                "deployment " + name,
                timeout,
                () -> api.readDeployment(namespace, name).orElse(null),
                obs -> obs != null && obs.isRolledOut(params.replicas()),
                obs -> observe(run, obs));

        switch (result.outcome()) {
            case DONE -> {
                try {
                    reconcileIngress(resources, params);
                } catch (OrchestrationApiException e) {
                    run.failed("deployment ready but ingress update failed: " + e.getMessage());
                    log.error("Stage {} FAILED: {}", stage.name(), run.message());
                    return run.toOutcome();
                }
                run.succeeded();
                log.info("Stage {} SUCCEEDED: {} replica(s) ready at {}", stage.name(), params.replicas(),
                        ResourceNames.clusterUrl(namespace, name, params.port()));
            }
            case CANCELLED -> {
                if (!update) {
                    deleteQuietly(namespace, name);
                }
                log.warn("Stage {} cancelled while waiting for deployment {}", stage.name(), name);
                run.failed("cancelled");
            }
            default -> {
                String reason = "deployment " + name + " did not become ready within " + timeout.toSeconds() + "s";
                logRelay.relay(namespace, deployment.selector(), "stage " + stage.name());
                if (update) {
                    rollback(run, namespace, name, priorRevision, reason);
                } else {
                    run.failed(reason);
                    log.error("Stage {} FAILED: {}; deployment left in place for inspection", stage.name(), reason);
                }
            }
        }
        return run.toOutcome();
    }

    private void rollback(StageRun run, String namespace, String name, long revision, String reason) {
        log.warn("Stage {}: {}, rolling back to revision {}", run.stageName(), reason, revision);
        try {
            api.rollbackDeployment(namespace, name, revision);
            run.rolledBack(reason + "; rolled back to revision " + revision);
            log.error("Stage {} ROLLED_BACK to revision {}", run.stageName(), revision);
        } catch (OrchestrationApiException e) {
            run.failed(reason + "; rollback to revision " + revision + " failed: " + e.getMessage());
            log.error("Stage {} FAILED: {}", run.stageName(), run.message());
        }
    }

    private void ensureEndpoint(EndpointSpec endpoint) {
        if (!api.endpointExists(endpoint.namespace(), endpoint.name())) {
            api.createEndpoint(endpoint);
            log.info("Created endpoint {} on port {}", endpoint.name(), endpoint.port());
        }
    }

    private void reconcileIngress(StageResources resources, ServiceParams params) {
        String namespace = resources.deployment().namespace();
        String name = resources.deployment().name();
        boolean exists = api.ingressExists(namespace, name);
        if (params.exposeExternally() && !exists) {
            api.createIngress(resources.ingress());
            log.info("Created ingress {} at {}", name, resources.ingress().path());
        } else if (!params.exposeExternally() && exists) {
            api.deleteIngress(namespace, name);
            log.info("Deleted ingress {}", name);
        }
    }

    private void observe(StageRun run, DeploymentObservation obs) {
        String status = obs != null ? obs.describe() : "NOT_FOUND";
        if (!status.equals(run.lastObservedStatus())) {
            log.debug("Stage {} deployment status: {}", run.stageName(), status);
        }
        if (run.state() == StageState.SUBMITTED) {
            run.polling(status);
            log.info("Stage {} POLLING", run.stageName());
        } else {
            run.observed(status);
        }
    }

    private void deleteQuietly(String namespace, String name) {
        try {
            api.deleteDeployment(namespace, name);
        } catch (OrchestrationApiException e) {
            log.warn("Failed to delete deployment {} after cancellation: {}", name, e.getMessage());
        }
    }
}
