package deckhand.engine.service;

import deckhand.cluster.OrchestrationApiException;
import deckhand.cluster.model.SecretInfo;
import deckhand.cluster.simulation.SimulatedCluster;
import deckhand.cluster.spec.SecretSpec;
import deckhand.engine.translate.ResourceNames;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SecretServiceTest {

    private SimulatedCluster cluster;
    private SecretService secrets;

    @BeforeEach
    void setUp() {
        cluster = new SimulatedCluster().withNamespace("ml");
        secrets = new SecretService(cluster);
    }

    @Test
    void groupedSecretMatchesStageResolution() {
        String name = secrets.create("ml", "dev", "model-registry", Map.of("API_TOKEN", "s3cr3t"));

        assertEquals(ResourceNames.secretName("dev", "model-registry"), name);
        SecretSpec spec = cluster.secret("ml", name).orElseThrow();
        assertEquals("s3cr3t", spec.data().get("API_TOKEN"));
        assertEquals("dev", spec.labels().get(ResourceNames.SECRET_GROUP_LABEL));
        assertFalse(spec.toString().contains("s3cr3t"));
    }

    @Test
    void createReplacesExistingSecret() {
        secrets.create("ml", null, "db", Map.of("PASSWORD", "one"));
        secrets.create("ml", null, "db", Map.of("PASSWORD", "two"));

        assertEquals("two", cluster.secret("ml", "db").orElseThrow().data().get("PASSWORD"));
    }

    @Test
    void rejectsBadData() {
        assertThrows(IllegalArgumentException.class, () -> secrets.create("ml", null, "db", Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> secrets.create("ml", null, "db", Map.of("1PASSWORD", "x")));
        assertThrows(IllegalArgumentException.class,
                () -> secrets.create("ml", null, "db", Map.of("PASS-WORD", "x")));
    }

    @Test
    void listFiltersByGroup() {
        secrets.create("ml", "dev", "registry", Map.of("TOKEN", "a"));
        secrets.create("ml", "prod", "registry", Map.of("TOKEN", "b", "USER", "c"));
        secrets.create("ml", null, "plain", Map.of("KEY", "d"));

        assertEquals(3, secrets.list("ml", null).size());
        List<SecretInfo> prod = secrets.list("ml", "prod");
        assertEquals(1, prod.size());
        assertEquals("prod-registry", prod.get(0).name());
        assertEquals(List.of("TOKEN", "USER"), prod.get(0).keys());
    }

    @Test
    void deleteResolvesGroupedName() {
        secrets.create("ml", "dev", "registry", Map.of("TOKEN", "a"));

        secrets.delete("ml", "dev", "registry");

        assertTrue(cluster.secret("ml", "dev-registry").isEmpty());
        assertThrows(OrchestrationApiException.class, () -> secrets.delete("ml", "dev", "registry"));
    }
}
