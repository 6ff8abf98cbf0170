package deckhand.engine.schedule;

import deckhand.cluster.OrchestrationApiException;
import deckhand.cluster.model.CronJobInfo;
import deckhand.cluster.simulation.SimulatedCluster;
import deckhand.cluster.spec.CronJobSpec;
import deckhand.cluster.spec.JobSpec;
import deckhand.engine.config.EngineConfig;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleServiceTest {

    private static final String NS = "ml";
    private static final String REPO = "https://git.example.com/demo.git";

    private SimulatedCluster cluster;
    private ScheduleService schedules;

    @BeforeEach
    void setUp() {
        cluster = new SimulatedCluster().withNamespace(NS);
        schedules = new ScheduleService(cluster, EngineConfig.defaults().withControllerImage("deckhand/deckhand:0.4"));
    }

    @Test
    void createsCronJobRunningTheWorkflow() {
        String name = schedules.createCronJob(NS, "Nightly_Train", "0 3 * * *", REPO, "main", 2);

        assertEquals("nightly-train", name);
        CronJobSpec spec = cluster.cronJob(NS, name).orElseThrow();
        assertEquals("0 3 * * *", spec.schedule());
        assertEquals(2, spec.backoffLimit());
        assertEquals("deckhand/deckhand:0.4", spec.container().image());
        assertEquals(ScheduleService.WORKFLOW_COMMAND, spec.container().command());
        assertEquals(List.of("--namespace=ml", REPO, "main"), spec.container().args());
        assertEquals("deckhand-workflow-controller", spec.serviceAccount());
        assertEquals(ScheduleService.WORKFLOW_COMPONENT, spec.labels().get(ScheduleService.COMPONENT_LABEL));
    }

    @Test
    void listsCronJobsWithTheirSource() {
        schedules.createCronJob(NS, "nightly", "0 3 * * *", REPO, "release", 0);

        List<CronJobInfo> jobs = schedules.listCronJobs(NS);

        assertEquals(1, jobs.size());
        assertEquals("nightly", jobs.get(0).name());
        assertEquals(REPO, jobs.get(0).repoUrl());
        assertEquals("release", jobs.get(0).branch());
    }

    @Test
    void deleteUnknownCronJobFails() {
        OrchestrationApiException e = assertThrows(OrchestrationApiException.class,
                () -> schedules.deleteCronJob(NS, "missing"));
        assertTrue(e.isNotFound());
    }

    @Test
    void deleteRemovesCronJob() {
        schedules.createCronJob(NS, "nightly", "0 3 * * *", REPO, null, 0);

        schedules.deleteCronJob(NS, "nightly");

        assertTrue(cluster.cronJob(NS, "nightly").isEmpty());
    }

    @Test
    void rejectsInvalidSchedules() {
        assertThrows(IllegalArgumentException.class, () -> ScheduleService.validateSchedule(""));
        assertThrows(IllegalArgumentException.class, () -> ScheduleService.validateSchedule("0 3 * *"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleService.validateSchedule("0 3 * * * *"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleService.validateSchedule("0 3 * * ;"));
        assertDoesNotThrow(() -> ScheduleService.validateSchedule("*/15 0-6 1,15 * MON-FRI"));
    }

    @Test
    void rejectsNegativeRetries() {
        assertThrows(IllegalArgumentException.class,
                () -> schedules.createCronJob(NS, "nightly", "0 3 * * *", REPO, "main", -1));
        assertThrows(IllegalArgumentException.class,
                () -> schedules.submitWorkflowJob(NS, "demo", REPO, "main", -1));
    }

    @Test
    void submitsOneOffWorkflowJob() {
        String job = schedules.submitWorkflowJob(NS, "demo", REPO, null, 1);

        assertTrue(job.startsWith("demo-"), job);
        JobSpec spec = cluster.createdJobs().get(0);
        assertEquals(job, spec.name());
        assertEquals(1, spec.backoffLimit());
        assertEquals(List.of("--namespace=ml", REPO), spec.container().args());
    }

    @Test
    void longJobNamesAreShortened() {
        String job = schedules.submitWorkflowJob(NS, "x".repeat(80), REPO, "main", 0);

        assertTrue(job.length() <= 63, job);
    }

    @Test
    void historyAndLogsOfWorkflowJobs() {
        String job = schedules.submitWorkflowJob(NS, "demo", REPO, "main", 0);
        schedules.submitWorkflowJob(NS, "other", REPO, "main", 0);

        assertEquals(List.of(job), schedules.workflowHistory(NS, "demo").stream().map(j -> j.name()).toList());
        assertEquals("simulated run of " + job, schedules.workflowLogs(NS, job).orElseThrow());
        assertTrue(schedules.workflowLogs(NS, "no-such-job").isEmpty());
    }
}
