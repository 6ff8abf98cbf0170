package deckhand.engine.service;

import deckhand.cluster.simulation.SimulatedCluster;
import deckhand.engine.config.EngineConfig;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

class NamespaceServiceTest {

    @Test
    void setupCreatesNamespaceAndAccounts() {
        SimulatedCluster cluster = new SimulatedCluster();
        NamespaceService service = new NamespaceService(cluster, EngineConfig.defaults());

        assertFalse(service.exists("ml"));
        assertTrue(service.setup("ml"));

        assertTrue(service.exists("ml"));
        assertTrue(cluster.serviceAccountExists("ml", "deckhand-stage"));
        assertTrue(cluster.serviceAccountExists("ml", "deckhand-workflow-controller"));
        assertTrue(cluster.roleBindingExists("ml", "deckhand-workflow-controller"));
        assertTrue(cluster.calls().contains("ensureRoleBinding ml/deckhand-workflow-controller edit"));
    }

    @Test
    void setupIsRepeatable() {
        SimulatedCluster cluster = new SimulatedCluster().withNamespace("ml");
        NamespaceService service = new NamespaceService(cluster, EngineConfig.defaults());

        assertFalse(service.setup("ml"));
        assertFalse(service.setup("ml"));
        assertFalse(cluster.calls().contains("createNamespace ml"));
        assertTrue(cluster.serviceAccountExists("ml", "deckhand-stage"));
    }
}
