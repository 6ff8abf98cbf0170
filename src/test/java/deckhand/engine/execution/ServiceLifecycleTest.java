package deckhand.engine.execution;

import deckhand.cluster.simulation.SimulatedCluster;
import deckhand.cluster.simulation.SimulatedCluster.RolloutScript;
import deckhand.engine.model.StageOutcome;
import deckhand.engine.model.StageState;
import org.junit.jupiter.api.*;

import static deckhand.engine.PipelineFixtures.NAMESPACE;
import static deckhand.engine.PipelineFixtures.context;
import static deckhand.engine.PipelineFixtures.fastConfig;
import static deckhand.engine.PipelineFixtures.service;
import static org.junit.jupiter.api.Assertions.*;

class ServiceLifecycleTest {

    private static final String NAME = "demo--serve";

    private SimulatedCluster cluster;
    private StageExecutor executor;

    @BeforeEach
    void setUp() {
        cluster = new SimulatedCluster().withNamespace(NAMESPACE);
        executor = new StageExecutor(cluster, fastConfig());
    }

    private StageOutcome deploy(int maxSeconds, boolean ingress) {
        return executor.execute(service("serve", maxSeconds, 2, 5000, ingress), context("r1"),
                new CancellationToken());
    }

    @Test
    void freshDeploymentBecomesReady() {
        StageOutcome outcome = deploy(5, false);

        assertEquals(StageState.SUCCEEDED, outcome.state());
        assertEquals(1, outcome.attempts());
        assertTrue(cluster.deploymentSpec(NAMESPACE, NAME).isPresent());
        assertTrue(cluster.endpointExists(NAMESPACE, NAME));
        assertFalse(cluster.ingressExists(NAMESPACE, NAME));
    }

    @Test
    void exposedServiceGetsIngress() {
        deploy(5, true);

        assertTrue(cluster.ingress(NAMESPACE, NAME).isPresent());
    }

    @Test
    void ingressRemovedWhenNoLongerExposed() {
        deploy(5, true);
        StageOutcome outcome = deploy(5, false);

        assertEquals(StageState.SUCCEEDED, outcome.state());
        assertFalse(cluster.ingressExists(NAMESPACE, NAME));
    }

    @Test
    void redeployUpdatesInPlace() {
        deploy(5, false);
        StageOutcome outcome = deploy(5, false);

        assertEquals(StageState.SUCCEEDED, outcome.state());
        assertTrue(cluster.calls().contains("updateDeployment " + NAMESPACE + "/" + NAME));
        assertEquals(1, cluster.calls().stream().filter(c -> c.startsWith("createEndpoint")).count());
    }

    @Test
    @DisplayName("an update that never becomes ready is rolled back")
    void failedUpdateRollsBack() {
        deploy(5, false);
        cluster.scriptRollout("serve", RolloutScript.never());

        StageOutcome outcome = deploy(1, false);

        assertEquals(StageState.ROLLED_BACK, outcome.state());
        assertTrue(outcome.failed());
        assertEquals(1, cluster.rollbacks().size());
        assertEquals(new SimulatedCluster.Rollback(NAMESPACE, NAME, 1), cluster.rollbacks().get(0));
        assertTrue(outcome.message().contains("rolled back to revision 1"), outcome.message());
    }

    @Test
    @DisplayName("an update is not ready while an old pod still makes up the ready count")
    void surgeRolloutWithUnreadyNewPodRollsBack() {
        deploy(5, false);
        cluster.scriptRollout("serve", RolloutScript.stuckWithOldPodServing());

        StageOutcome outcome = deploy(1, false);

        assertEquals(StageState.ROLLED_BACK, outcome.state());
        assertEquals(new SimulatedCluster.Rollback(NAMESPACE, NAME, 1), cluster.rollbacks().get(0));
    }

    @Test
    void freshDeploymentThatNeverBecomesReadyFails() {
        cluster.scriptRollout("serve", RolloutScript.never());

        StageOutcome outcome = deploy(1, false);

        assertEquals(StageState.FAILED, outcome.state());
        assertTrue(cluster.rollbacks().isEmpty());
        assertTrue(cluster.deploymentSpec(NAMESPACE, NAME).isPresent(), "left in place for inspection");
    }

    @Test
    void cancelledBeforeSubmissionCreatesNothing() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        StageOutcome outcome = executor.execute(service("serve", 5, 1, 5000, false), context("r1"), token);

        assertEquals(StageState.FAILED, outcome.state());
        assertTrue(cluster.deploymentSpec(NAMESPACE, NAME).isEmpty());
    }
}
