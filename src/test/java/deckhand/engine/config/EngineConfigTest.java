package deckhand.engine.config;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @TempDir
    Path dir;

    private File ini(String text) throws Exception {
        Path file = dir.resolve("deckhand.ini");
        Files.writeString(file, text);
        return file.toFile();
    }

    @Test
    void defaults() {
        EngineConfig config = EngineConfig.defaults();

        assertNull(config.apiServer());
        assertEquals(Duration.ofSeconds(2), config.pollInterval());
        assertEquals(Duration.ZERO, config.timeoutGrace());
        assertEquals(16, config.maxParallelStages());
        assertTrue(config.verifySecrets());
        assertTrue(config.historyEnabled());
        assertNull(config.logLevel());
        assertTrue(config.kubeconfig().endsWith("/.kube/config"));
    }

    @Test
    void readsIniSections() throws Exception {
        File file = ini("""
                [cluster]
                api_server = https://10.0.0.1:6443
                token_file = /etc/deckhand/token
                request_timeout_seconds = 10

                [engine]
                poll_interval_ms = 250
                timeout_grace_seconds = 5
                max_parallel_stages = 3
                verify_secrets = false
                stage_service_account = runner
                log_level = DEBUG

                [history]
                enabled = false
                pool_size = 2
                """);

        EngineConfig config = EngineConfig.defaults().applyIni(file);

        assertEquals("https://10.0.0.1:6443", config.apiServer());
        assertEquals("/etc/deckhand/token", config.tokenFile());
        assertEquals(Duration.ofSeconds(10), config.requestTimeout());
        assertEquals(Duration.ofMillis(250), config.pollInterval());
        assertEquals(Duration.ofSeconds(5), config.timeoutGrace());
        assertEquals(3, config.maxParallelStages());
        assertFalse(config.verifySecrets());
        assertEquals("runner", config.stageServiceAccount());
        assertEquals("DEBUG", config.logLevel());
        assertFalse(config.historyEnabled());
        assertEquals(2, config.databasePoolSize());
    }

    @Test
    void missingKeysKeepDefaults() throws Exception {
        EngineConfig config = EngineConfig.defaults().applyIni(ini("""
                [engine]
                max_parallel_stages = 4
                """));

        assertEquals(4, config.maxParallelStages());
        assertEquals(Duration.ofSeconds(2), config.pollInterval());
        assertEquals("deckhand-workflow-controller", config.workflowServiceAccount());
    }

    @Test
    void expandsHomeInKubeconfig() throws Exception {
        EngineConfig config = EngineConfig.defaults().applyIni(ini("""
                [cluster]
                kubeconfig = ~/clusters/dev.yaml
                """));

        assertEquals(System.getProperty("user.home") + "/clusters/dev.yaml", config.kubeconfig());
    }

    @Test
    void malformedNumberIsRejected() throws Exception {
        File file = ini("""
                [engine]
                poll_interval_ms = soon
                """);

        assertThrows(IllegalArgumentException.class, () -> EngineConfig.defaults().applyIni(file));
    }

    @Test
    void environmentOverridesIni() throws Exception {
        EngineConfig config = EngineConfig.defaults()
                .applyIni(ini("""
                        [engine]
                        poll_interval_ms = 250
                        controller_image = ini/image:1
                        """))
                .applyEnv(Map.of(
                        "DECKHAND_POLL_INTERVAL_MS", "100",
                        "DECKHAND_CONTROLLER_IMAGE", "env/image:2",
                        "DECKHAND_HISTORY_ENABLED", "false",
                        "KUBECONFIG", "/tmp/kubeconfig"));

        assertEquals(Duration.ofMillis(100), config.pollInterval());
        assertEquals("env/image:2", config.controllerImage());
        assertFalse(config.historyEnabled());
        assertEquals("/tmp/kubeconfig", config.kubeconfig());
    }

    @Test
    void blankEnvironmentValuesAreIgnored() {
        EngineConfig config = EngineConfig.defaults().applyEnv(Map.of("DECKHAND_API_SERVER", " "));

        assertNull(config.apiServer());
    }

    @Test
    void loadToleratesMissingFile() {
        EngineConfig config = EngineConfig.load(dir.resolve("absent.ini").toFile());

        assertNotNull(config);
        assertEquals(16, config.maxParallelStages());
    }
}
