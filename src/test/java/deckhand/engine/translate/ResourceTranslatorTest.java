package deckhand.engine.translate;

import deckhand.cluster.spec.ContainerSpec;
import deckhand.cluster.spec.EnvVarSpec;
import deckhand.cluster.spec.JobSpec;
import deckhand.engine.model.BatchParams;
import deckhand.engine.model.ServiceParams;
import deckhand.engine.model.StageConfig;
import deckhand.engine.model.StageKind;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static deckhand.engine.PipelineFixtures.NAMESPACE;
import static deckhand.engine.PipelineFixtures.batch;
import static deckhand.engine.PipelineFixtures.context;
import static deckhand.engine.PipelineFixtures.service;
import static org.junit.jupiter.api.Assertions.*;

class ResourceTranslatorTest {

    private final ResourceTranslator translator = new ResourceTranslator("deckhand-workflow");

    @Test
    void batchStageBecomesJob() {
        StageResources resources = translator.translate(batch("train", 60, 2), context("r1"), 2);

        assertEquals(StageKind.BATCH, resources.kind());
        JobSpec job = resources.job();
        assertNotNull(job);
        assertNull(resources.deployment());
        assertEquals(NAMESPACE, job.namespace());
        assertEquals("demo--train-r1-2", job.name());
        assertEquals("Never", job.restartPolicy());
        assertEquals(0, job.backoffLimit());
        assertEquals("deckhand-workflow", job.serviceAccount());
        assertEquals("2", job.labels().get(ResourceNames.ATTEMPT_LABEL));
        assertEquals("r1", job.labels().get(ResourceNames.RUN_ID_LABEL));
        assertEquals("abc123", job.labels().get(ResourceNames.GIT_COMMIT_LABEL));
        assertEquals("train", job.labels().get(ResourceNames.STAGE_LABEL));
    }

    @Test
    void containerRunsStageCommand() {
        ContainerSpec container = translator.translate(batch("train", 60, 0), context("r1"), 1).job().container();

        assertEquals(ResourceTranslator.STAGE_COMMAND, container.command());
        assertEquals(List.of("https://git.example.com/demo.git", "train", "--branch=main"), container.args());
        assertNull(container.containerPort());
        assertTrue(container.resources().isEmpty());
    }

    @Test
    void secretsBecomeSecretReferences() {
        StageConfig stage = batch("train", 60, 0).toBuilder()
                .secrets(Map.of("API_TOKEN", "model-registry"))
                .build();
        PipelineContext grouped = new PipelineContext(NAMESPACE, "demo", "img:1", "repo", "main", "r1", "dev", null);

        ContainerSpec container = translator.translate(stage, grouped, 1).job().container();

        assertEquals(1, container.env().size());
        EnvVarSpec env = container.env().get(0);
        assertEquals("API_TOKEN", env.name());
        assertNull(env.value());
        assertEquals("dev-model-registry", env.secretRef().secretName());
        assertEquals("API_TOKEN", env.secretRef().key());
    }

    @Test
    void resourceRequestsUseQuantityNotation() {
        StageConfig half = batch("a", 10, 0).toBuilder().cpuRequest(0.5).memoryRequestMB(250).build();
        StageConfig whole = batch("b", 10, 0).toBuilder().cpuRequest(1.0).build();

        assertEquals("0.5", ResourceTranslator.requests(half).cpu());
        assertEquals("250M", ResourceTranslator.requests(half).memory());
        assertEquals("1", ResourceTranslator.requests(whole).cpu());
        assertNull(ResourceTranslator.requests(whole).memory());
    }

    @Test
    void serviceStageBecomesDeploymentAndEndpoint() {
        StageResources resources = translator.translate(service("serve", 30, 2, 5000, false), context("r1"), 1);

        assertEquals(StageKind.SERVICE, resources.kind());
        assertEquals("demo--serve", resources.deployment().name());
        assertEquals(2, resources.deployment().replicas());
        assertEquals(5000, resources.deployment().container().containerPort());
        assertEquals("demo--serve", resources.endpoint().name());
        assertEquals(5000, resources.endpoint().port());
        assertEquals(resources.deployment().selector(), resources.endpoint().selector());
        assertFalse(resources.deployment().selector().containsKey(ResourceNames.RUN_ID_LABEL));
        assertEquals("r1", resources.deployment().podLabels().get(ResourceNames.RUN_ID_LABEL));
        assertTrue(resources.ingressIfExposed().isEmpty());
    }

    @Test
    void exposedServiceGetsIngress() {
        StageResources resources = translator.translate(service("serve", 30, 1, 5000, true), context("r1"), 1);

        var ingress = resources.ingressIfExposed().orElseThrow();
        assertEquals("demo--serve", ingress.serviceName());
        assertEquals("/ml/demo--serve(/|$)(.*)", ingress.path());
    }

    @Test
    void sameInputsGiveSameResources() {
        StageConfig stage = service("serve", 30, 1, 5000, true);
        assertEquals(translator.translate(stage, context("r1"), 1), translator.translate(stage, context("r1"), 1));
    }

    @Test
    void rejectsOutOfRangeParameters() {
        StageConfig noReplicas = StageConfig.builder().name("s").entryPoint("s.sh")
                .service(new ServiceParams(10, 0, 80, false)).build();
        StageConfig badPort = StageConfig.builder().name("s").entryPoint("s.sh")
                .service(new ServiceParams(10, 1, 0, false)).build();
        StageConfig noTime = StageConfig.builder().name("b").entryPoint("b.sh")
                .batch(new BatchParams(0, 0)).build();

        TranslationException e = assertThrows(TranslationException.class,
                () -> translator.translate(noReplicas, context("r1"), 1));
        assertEquals("s", e.stageName());
        assertThrows(TranslationException.class, () -> translator.translate(badPort, context("r1"), 1));
        assertThrows(TranslationException.class, () -> translator.translate(noTime, context("r1"), 1));
        assertThrows(TranslationException.class,
                () -> translator.translate(batch("b", 10, 0), context("r1"), 0));
    }
}
