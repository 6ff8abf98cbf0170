package deckhand.engine.execution;

import deckhand.cluster.simulation.SimulatedCluster;
import deckhand.cluster.simulation.SimulatedCluster.JobScript;
import deckhand.engine.model.StageConfig;
import deckhand.engine.model.StageOutcome;
import deckhand.engine.model.StageState;
import deckhand.engine.translate.ResourceNames;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static deckhand.engine.PipelineFixtures.NAMESPACE;
import static deckhand.engine.PipelineFixtures.PROJECT;
import static deckhand.engine.PipelineFixtures.batch;
import static deckhand.engine.PipelineFixtures.context;
import static deckhand.engine.PipelineFixtures.fastConfig;
import static org.junit.jupiter.api.Assertions.*;

class BatchLifecycleTest {

    private SimulatedCluster cluster;
    private StageExecutor executor;

    @BeforeEach
    void setUp() {
        cluster = new SimulatedCluster().withNamespace(NAMESPACE);
        executor = new StageExecutor(cluster, fastConfig());
    }

    private static String job(String stage, int attempt) {
        return ResourceNames.jobName(PROJECT, stage, "r1", attempt);
    }

    @Test
    void succeedsOnFirstAttempt() {
        StageOutcome outcome = executor.execute(batch("train", 10, 2), context("r1"), new CancellationToken());

        assertEquals(StageState.SUCCEEDED, outcome.state());
        assertEquals(1, outcome.attempts());
        assertNull(outcome.message());
        assertTrue(cluster.jobExists(NAMESPACE, job("train", 1)), "successful job is kept");
    }

    @Test
    @DisplayName("r retries give exactly r + 1 attempts")
    void exhaustsRetries() {
        cluster.scriptJob("train", JobScript.failAfter(1));

        StageOutcome outcome = executor.execute(batch("train", 10, 2), context("r1"), new CancellationToken());

        assertEquals(StageState.FAILED, outcome.state());
        assertEquals(3, outcome.attempts());
        assertEquals(3, cluster.createdJobs().size());
        assertTrue(outcome.message().contains("3 attempts"), outcome.message());
        for (int attempt = 1; attempt <= 3; attempt++) {
            assertFalse(cluster.jobExists(NAMESPACE, job("train", attempt)));
        }
    }

    @Test
    void stopsAtFirstSuccess() {
        cluster.scriptJob("train", 1, JobScript.failAfter(1))
                .scriptJob("train", 2, JobScript.succeedAfter(2));

        StageOutcome outcome = executor.execute(batch("train", 10, 4), context("r1"), new CancellationToken());

        assertEquals(StageState.SUCCEEDED, outcome.state());
        assertEquals(2, outcome.attempts());
        assertEquals(2, cluster.createdJobs().size());
        assertFalse(cluster.jobExists(NAMESPACE, job("train", 1)));
        assertTrue(cluster.jobExists(NAMESPACE, job("train", 2)));
    }

    @Test
    void deletesFailedAttemptBeforeNextSubmission() {
        cluster.scriptJob("train", 1, JobScript.failAfter(1));

        executor.execute(batch("train", 10, 1), context("r1"), new CancellationToken());

        List<String> calls = cluster.calls();
        int delete = calls.indexOf("deleteJob " + NAMESPACE + "/" + job("train", 1));
        int second = calls.indexOf("createJob " + NAMESPACE + "/" + job("train", 2));
        assertTrue(delete >= 0 && second > delete, calls.toString());
    }

    @Test
    void attemptsCarryAttemptLabel() {
        cluster.scriptJob("train", 1, JobScript.failAfter(1));

        executor.execute(batch("train", 10, 1), context("r1"), new CancellationToken());

        assertEquals("1", cluster.createdJobs().get(0).labels().get(ResourceNames.ATTEMPT_LABEL));
        assertEquals("2", cluster.createdJobs().get(1).labels().get(ResourceNames.ATTEMPT_LABEL));
    }

    @Test
    void hangingJobTimesOutAndIsDeleted() {
        cluster.scriptJob("slow", JobScript.hang());

        StageOutcome outcome = executor.execute(batch("slow", 1, 0), context("r1"), new CancellationToken());

        assertEquals(StageState.FAILED, outcome.state());
        assertEquals(1, outcome.attempts());
        assertTrue(outcome.message().contains("did not complete within 1s"), outcome.message());
        assertFalse(cluster.jobExists(NAMESPACE, job("slow", 1)));
    }

    @Test
    void transientReadErrorsAreRetried() {
        cluster.failNextReads(3);

        StageOutcome outcome = executor.execute(batch("train", 10, 0), context("r1"), new CancellationToken());

        assertEquals(StageState.SUCCEEDED, outcome.state());
        assertEquals(1, outcome.attempts());
    }

    @Test
    void cancelledTokenSubmitsNothing() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        StageOutcome outcome = executor.execute(batch("train", 10, 2), context("r1"), token);

        assertEquals(StageState.FAILED, outcome.state());
        assertEquals("cancelled", outcome.message());
        assertTrue(cluster.createdJobs().isEmpty());
    }

    @Test
    void missingNamespaceFailsSubmission() {
        StageOutcome outcome = new StageExecutor(new SimulatedCluster(), fastConfig())
                .execute(batch("train", 10, 2), context("r1"), new CancellationToken());

        assertEquals(StageState.FAILED, outcome.state());
        assertTrue(outcome.message().startsWith("failed to submit job"), outcome.message());
    }

    @Test
    void missingSecretsFailBeforeSubmission() {
        StageConfig stage = batch("train", 10, 0).toBuilder()
                .secrets(Map.of("API_TOKEN", "model-registry"))
                .build();
        StageExecutor verifying = new StageExecutor(cluster, fastConfig().withVerifySecrets(true));

        StageOutcome outcome = verifying.execute(stage, context("r1"), new CancellationToken());

        assertEquals(StageState.FAILED, outcome.state());
        assertEquals(0, outcome.attempts());
        assertTrue(outcome.message().contains("model-registry"), outcome.message());
        assertTrue(cluster.createdJobs().isEmpty());
    }
}
