package deckhand.engine.execution;

import deckhand.cluster.simulation.SimulatedCluster;
import deckhand.cluster.simulation.SimulatedCluster.JobScript;
import deckhand.engine.translate.ResourceNames;
import org.junit.jupiter.api.*;

import static deckhand.engine.PipelineFixtures.NAMESPACE;
import static deckhand.engine.PipelineFixtures.PROJECT;
import static deckhand.engine.PipelineFixtures.batch;
import static deckhand.engine.PipelineFixtures.context;
import static deckhand.engine.PipelineFixtures.fastConfig;
import static org.junit.jupiter.api.Assertions.*;

class PodLogRelayTest {

    @Test
    void relaysLatestPodLog() {
        SimulatedCluster cluster = new SimulatedCluster().withNamespace(NAMESPACE)
                .scriptJob("train", JobScript.succeedAfter(1).withLog("epoch 1\nepoch 2"));
        new StageExecutor(cluster, fastConfig()).execute(batch("train", 10, 0), context("r1"), new CancellationToken());

        boolean relayed = new PodLogRelay(cluster).relay(NAMESPACE,
                ResourceNames.stageSelector(PROJECT, "train"), "stage train");

        assertTrue(relayed);
    }

    @Test
    void missingPodIsNotAnError() {
        SimulatedCluster cluster = new SimulatedCluster().withNamespace(NAMESPACE);

        assertFalse(new PodLogRelay(cluster).relay(NAMESPACE,
                ResourceNames.stageSelector(PROJECT, "train"), "stage train"));
    }
}
