package deckhand.engine.descriptor;

import deckhand.engine.model.PipelineDescriptor;
import deckhand.engine.model.StageConfig;
import deckhand.engine.model.StageKind;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DescriptorLoaderTest {

    private final DescriptorLoader loader = new DescriptorLoader();

    private static final String MINIMAL = """
            version: "1.0"
            project:
              name: minimal
              docker_image: example/minimal:1
              DAG: only
            stages:
              only:
                executable_module_path: only.sh
                batch:
                  max_completion_time_seconds: 10
                  retries: 0
            """;

    @Test
    void loadsFullDescriptor() throws Exception {
        Path file = Path.of(getClass().getResource("/pipeline.yaml").toURI());

        PipelineDescriptor d = loader.load(file);

        assertEquals("1.1", d.version());
        assertEquals("demo-pipeline", d.name());
        assertEquals("registry.example.com/demo:1.4", d.containerImage());
        assertEquals("prepare >> train, validate >> serve", d.dagExpression());
        assertEquals("dev", d.secretsGroup().orElseThrow());
        assertEquals("notify", d.runOnFailure().orElseThrow());
        assertEquals("WARN", d.logLevel());
        assertEquals(List.of("prepare", "train", "validate", "serve", "notify"), List.copyOf(d.stages().keySet()));

        StageConfig prepare = d.stage("prepare").orElseThrow();
        assertEquals(StageKind.BATCH, prepare.kind());
        assertEquals("stages/prepare.sh", prepare.entryPoint());
        assertEquals(List.of("--rows", "1000"), prepare.args());
        assertEquals(0.5, prepare.cpuRequest());
        assertEquals(250, prepare.memoryRequestMB());
        assertEquals(60, prepare.batch().maxCompletionTimeSeconds());
        assertEquals(2, prepare.batch().retries());
        assertEquals(3, prepare.batch().maxAttempts());

        StageConfig train = d.stage("train").orElseThrow();
        assertEquals(Map.of("API_TOKEN", "model-registry"), train.secrets());
        assertEquals(List.of("numpy==1.26.4"), train.requirements());

        StageConfig serve = d.stage("serve").orElseThrow();
        assertEquals(StageKind.SERVICE, serve.kind());
        assertEquals(2, serve.service().replicas());
        assertEquals(5000, serve.service().port());
        assertTrue(serve.service().exposeExternally());
        assertThrows(IllegalStateException.class, serve::batch);
    }

    @Test
    void loadsFromBundleRoot() throws Exception {
        Path bundle = Path.of(getClass().getResource("/bundles/simple").toURI());

        PipelineDescriptor d = loader.loadFromBundle(bundle);

        assertEquals("simple", d.name());
        assertEquals("INFO", d.logLevel());
        assertTrue(d.secretsGroup().isEmpty());
        assertTrue(d.runOnFailure().isEmpty());
    }

    @Test
    void missingFileIsNotFound() {
        DescriptorException e = assertThrows(DescriptorException.class,
                () -> loader.load(Path.of("does-not-exist", "deckhand.yaml")));
        assertEquals(DescriptorException.Reason.NOT_FOUND, e.reason());
    }

    @Test
    void malformedYaml() {
        DescriptorException e = assertThrows(DescriptorException.class,
                () -> loader.parse("project: [unclosed"));
        assertEquals(DescriptorException.Reason.MALFORMED, e.reason());

        e = assertThrows(DescriptorException.class, () -> loader.parse("- just\n- a list\n"));
        assertEquals(DescriptorException.Reason.MALFORMED, e.reason());
    }

    @Test
    @DisplayName("every problem is reported, not just the first")
    void collectsAllProblems() {
        String text = """
                project:
                  name: broken
                  DAG: a >> b
                stages:
                  a:
                    batch:
                      max_completion_time_seconds: 0
                      retries: -1
                  b:
                    executable_module_path: b.sh
                    batch:
                      max_completion_time_seconds: 10
                      retries: 0
                    service:
                      max_startup_time_seconds: 10
                      replicas: 1
                      port: 80
                """;

        DescriptorException e = assertThrows(DescriptorException.class, () -> loader.parse(text));

        assertEquals(DescriptorException.Reason.INVALID, e.reason());
        List<String> problems = e.problems();
        assertTrue(problems.contains("version is missing"), problems.toString());
        assertTrue(problems.contains("project.docker_image is missing"), problems.toString());
        assertTrue(problems.contains("stages.a.executable_module_path is missing"), problems.toString());
        assertTrue(problems.contains("stages.a.batch.max_completion_time_seconds must be >= 1"), problems.toString());
        assertTrue(problems.contains("stages.a.batch.retries must be >= 0"), problems.toString());
        assertTrue(problems.contains("stages.b cannot declare both batch and service"), problems.toString());
    }

    @Test
    void rejectsInvalidServiceParameters() {
        String text = MINIMAL.replace("""
                    batch:
                      max_completion_time_seconds: 10
                      retries: 0
                """, """
                    service:
                      max_startup_time_seconds: 10
                      replicas: 0
                      port: 70000
                      ingress: "yes"
                """);

        DescriptorException e = assertThrows(DescriptorException.class, () -> loader.parse(text));

        assertTrue(e.problems().contains("stages.only.service.replicas must be >= 1"), e.problems().toString());
        assertTrue(e.problems().contains("stages.only.service.port must be between 1 and 65535"),
                e.problems().toString());
        assertTrue(e.problems().contains("stages.only.service.ingress must be true or false"),
                e.problems().toString());
    }

    @Test
    void rejectsInvalidSecretBindings() {
        String text = MINIMAL.replace("executable_module_path: only.sh", """
                executable_module_path: only.sh
                    secrets:
                      1BAD: some-secret""");

        DescriptorException e = assertThrows(DescriptorException.class, () -> loader.parse(text));

        assertTrue(e.problems().contains("stages.only.secrets.1BAD is not a valid environment variable name"),
                e.problems().toString());
    }

    @Test
    void rejectsUnknownLogLevel() {
        String text = MINIMAL + "logging:\n  log_level: LOUD\n";

        DescriptorException e = assertThrows(DescriptorException.class, () -> loader.parse(text));

        assertEquals(1, e.problems().size());
        assertTrue(e.problems().get(0).startsWith("logging.log_level must be one of"));
    }

    @Test
    void normalizesLogLevels() {
        assertEquals("WARN", DescriptorLoader.normalizeLogLevel("warning"));
        assertEquals("ERROR", DescriptorLoader.normalizeLogLevel("CRITICAL"));
        assertEquals("DEBUG", DescriptorLoader.normalizeLogLevel(" debug "));
        assertNull(DescriptorLoader.normalizeLogLevel("verbose"));
    }

    @Test
    void parsesMinimalDescriptor() {
        PipelineDescriptor d = loader.parse(MINIMAL);

        assertEquals("minimal", d.name());
        assertTrue(d.stage("only").orElseThrow().args().isEmpty());
        assertNull(d.stage("only").orElseThrow().cpuRequest());
    }

    @Test
    void descriptorFileNameIsFixed(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve(DescriptorLoader.DESCRIPTOR_FILENAME), MINIMAL);

        assertEquals("minimal", loader.loadFromBundle(dir).name());
    }
}
