package deckhand.engine.translate;

import deckhand.cluster.spec.ContainerSpec;
import deckhand.cluster.spec.DeploymentSpec;
import deckhand.cluster.spec.EndpointSpec;
import deckhand.cluster.spec.EnvVarSpec;
import deckhand.cluster.spec.IngressSpec;
import deckhand.cluster.spec.JobSpec;
import deckhand.cluster.spec.ResourceRequests;
import deckhand.engine.model.BatchParams;
import deckhand.engine.model.ServiceParams;
import deckhand.engine.model.StageConfig;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates a stage configuration into cluster resource specs.
 * Pure: the same inputs always produce the same specs.
 */
public final class ResourceTranslator {

    public static final String CONTAINER_NAME = "deckhand";
    public static final List<String> STAGE_COMMAND = List.of("deckhand", "stage");

    private final String serviceAccount;

    public ResourceTranslator(String serviceAccount) {
        this.serviceAccount = serviceAccount;
    }

    /**
     * Build the resources for one submission of a stage.
     *
     * @param stage   the stage
     * @param context run-wide values
     * @param attempt 1-based attempt number, only used for batch stages
     * @throws TranslationException if a parameter is out of range
     */
    public StageResources translate(StageConfig stage, PipelineContext context, int attempt) {
        if (context.image().isBlank()) {
            throw new TranslationException(stage.name(), "container image is empty");
        }
        return switch (stage.kind()) {
            case BATCH -> StageResources.batch(batchJob(stage, context, attempt));
            case SERVICE -> serviceResources(stage, context);
        };
    }

    private JobSpec batchJob(StageConfig stage, PipelineContext context, int attempt) {
        BatchParams params = stage.batch();
        if (params.retries() < 0) {
            throw new TranslationException(stage.name(), "retries must be >= 0, got " + params.retries());
        }
        if (params.maxCompletionTimeSeconds() < 1) {
            throw new TranslationException(stage.name(),
                    "max completion time must be >= 1s, got " + params.maxCompletionTimeSeconds());
        }
        if (attempt < 1) {
            throw new TranslationException(stage.name(), "attempt must be >= 1, got " + attempt);
        }

        Map<String, String> labels = runLabels(stage, context);
        labels.put(ResourceNames.ATTEMPT_LABEL, String.valueOf(attempt));

        return new JobSpec(
                context.namespace(),
                ResourceNames.jobName(context.project(), stage.name(), context.runId(), attempt),
                labels,
                container(stage, context, null),
                serviceAccount,
                "Never",
                0);
    }

    private StageResources serviceResources(StageConfig stage, PipelineContext context) {
        ServiceParams params = stage.service();
        if (params.replicas() < 1) {
            throw new TranslationException(stage.name(), "replicas must be >= 1, got " + params.replicas());
        }
        if (params.port() < 1 || params.port() > 65535) {
            throw new TranslationException(stage.name(), "port must be between 1 and 65535, got " + params.port());
        }
        if (params.maxStartupTimeSeconds() < 1) {
            throw new TranslationException(stage.name(),
                    "max startup time must be >= 1s, got " + params.maxStartupTimeSeconds());
        }

        String name = ResourceNames.serviceName(context.project(), stage.name());
        Map<String, String> selector = ResourceNames.stageSelector(context.project(), stage.name());

        DeploymentSpec deployment = new DeploymentSpec(
                context.namespace(),
                name,
                selector,
                runLabels(stage, context),
                params.replicas(),
                container(stage, context, params.port()),
                serviceAccount);

        EndpointSpec endpoint = new EndpointSpec(context.namespace(), name, selector, selector, params.port());

        IngressSpec ingress = params.exposeExternally()
                ? new IngressSpec(context.namespace(), name, selector, name, params.port(),
                        ResourceNames.ingressRoute(context.namespace(), name) + "(/|$)(.*)")
                : null;

        return StageResources.service(deployment, endpoint, ingress);
    }

    private ContainerSpec container(StageConfig stage, PipelineContext context, Integer port) {
        List<String> args = new ArrayList<>();
        args.add(context.repoUrl() != null ? context.repoUrl() : "");
        args.add(stage.name());
        if (context.branch() != null && !context.branch().isBlank()) {
            args.add("--branch=" + context.branch());
        }

        List<EnvVarSpec> env = new ArrayList<>();
        stage.secrets().forEach((envVar, secret) -> env.add(EnvVarSpec.fromSecret(
                envVar, ResourceNames.secretName(context.secretsGroup(), secret), envVar)));

        return new ContainerSpec(CONTAINER_NAME, context.image(), STAGE_COMMAND, args, env,
                requests(stage), port);
    }

    static ResourceRequests requests(StageConfig stage) {
        String cpu = stage.cpuRequest() != null
                ? BigDecimal.valueOf(stage.cpuRequest()).stripTrailingZeros().toPlainString()
                : null;
        String memory = stage.memoryRequestMB() != null ? stage.memoryRequestMB() + "M" : null;
        return new ResourceRequests(cpu, memory);
    }

    private static Map<String, String> runLabels(StageConfig stage, PipelineContext context) {
        Map<String, String> labels = new LinkedHashMap<>(
                ResourceNames.stageSelector(context.project(), stage.name()));
        labels.put(ResourceNames.RUN_ID_LABEL, context.runId());
        if (context.gitCommit() != null && !context.gitCommit().isBlank()) {
            labels.put(ResourceNames.GIT_COMMIT_LABEL, context.gitCommit());
        }
        return labels;
    }
}
