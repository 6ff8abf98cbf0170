package deckhand.engine;

import deckhand.engine.config.EngineConfig;
import deckhand.engine.model.BatchParams;
import deckhand.engine.model.PipelineDescriptor;
import deckhand.engine.model.ServiceParams;
import deckhand.engine.model.StageConfig;
import deckhand.engine.translate.PipelineContext;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Builders shared by engine tests.
 */
public final class PipelineFixtures {

    public static final String NAMESPACE = "ml";
    public static final String PROJECT = "demo";
    public static final String IMAGE = "registry.example.com/demo:1.0";

    private PipelineFixtures() {
    }

    public static StageConfig batch(String name, int maxSeconds, int retries) {
        return StageConfig.builder()
                .name(name)
                .entryPoint(name + ".sh")
                .batch(new BatchParams(maxSeconds, retries))
                .build();
    }

    public static StageConfig service(String name, int maxSeconds, int replicas, int port, boolean ingress) {
        return StageConfig.builder()
                .name(name)
                .entryPoint(name + ".sh")
                .service(new ServiceParams(maxSeconds, replicas, port, ingress))
                .build();
    }

    public static PipelineDescriptor.Builder descriptor(String dag) {
        return PipelineDescriptor.builder()
                .version("1.0")
                .name(PROJECT)
                .containerImage(IMAGE)
                .dagExpression(dag);
    }

    public static PipelineContext context(String runId) {
        return new PipelineContext(NAMESPACE, PROJECT, IMAGE, "https://git.example.com/demo.git", "main",
                runId, null, "abc123");
    }

    /** Fast polling, no secret checks, no history. */
    public static EngineConfig fastConfig() {
        return EngineConfig.defaults()
                .withPollInterval(Duration.ofMillis(5))
                .withVerifySecrets(false)
                .withHistoryEnabled(false);
    }

    /** Directory of a test bundle under {@code src/test/resources/bundles}. */
    public static Path bundle(String name) {
        try {
            return Path.of(PipelineFixtures.class.getResource("/bundles/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
