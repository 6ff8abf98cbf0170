package deckhand.engine.schedule;

import deckhand.cluster.OrchestrationApi;
import deckhand.cluster.model.CronJobInfo;
import deckhand.cluster.model.JobObservation;
import deckhand.cluster.spec.ContainerSpec;
import deckhand.cluster.spec.CronJobSpec;
import deckhand.cluster.spec.JobSpec;
import deckhand.cluster.spec.ResourceRequests;
import deckhand.engine.config.EngineConfig;
import deckhand.engine.translate.ResourceNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Registers the workflow entry point to run inside the cluster, either on a
 * cron schedule or once, and reads back the history and logs of those runs.
 * Contains no graph or lifecycle logic: the scheduled container simply runs
 * {@code deckhand workflow --namespace=<ns> <repo> <branch>}.
 */
public class ScheduleService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    public static final String COMPONENT_LABEL = "component";
    public static final String WORKFLOW_COMPONENT = "workflow";
    public static final List<String> WORKFLOW_COMMAND = List.of("deckhand", "workflow");

    private static final Pattern CRON_FIELD = Pattern.compile("[0-9*/,\\-A-Za-z?]+");

    private final OrchestrationApi api;
    private final EngineConfig config;

    public ScheduleService(OrchestrationApi api, EngineConfig config) {
        this.api = api;
        this.config = config;
    }

    /**
     * Register a cron job that runs the workflow on a schedule.
     *
     * @param retries how many times the workflow job itself is retried
     * @return the cron job name
     * @throws IllegalArgumentException if the schedule or retries are invalid
     */
    public String createCronJob(String namespace, String name, String schedule, String repoUrl, String branch,
            int retries) {
        validateSchedule(schedule);
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0");
        }
        String cronName = ResourceNames.toValidName(name);
        CronJobSpec spec = new CronJobSpec(
                namespace,
                cronName,
                workflowLabels(),
                schedule.trim(),
                workflowContainer(namespace, repoUrl, branch),
                config.workflowServiceAccount(),
                retries,
                1,
                1);
        api.createCronJob(spec);
        log.info("Created cron job {} in namespace {} with schedule '{}'", cronName, namespace, schedule);
        return cronName;
    }

    public void deleteCronJob(String namespace, String name) {
        api.deleteCronJob(namespace, name);
        log.info("Deleted cron job {} from namespace {}", name, namespace);
    }

    public List<CronJobInfo> listCronJobs(String namespace) {
        return api.listCronJobs(namespace);
    }

    /**
     * Run the workflow once inside the cluster, outside any schedule.
     *
     * @return the job name
     */
    public String submitWorkflowJob(String namespace, String name, String repoUrl, String branch, int retries) {
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0");
        }
        String suffix = "-" + UUID.randomUUID().toString().substring(0, 8);
        String base = ResourceNames.toValidName(name);
        if (base.length() + suffix.length() > ResourceNames.MAX_NAME_LENGTH) {
            base = base.substring(0, ResourceNames.MAX_NAME_LENGTH - suffix.length());
        }
        JobSpec spec = new JobSpec(
                namespace,
                base + suffix,
                workflowLabels(),
                workflowContainer(namespace, repoUrl, branch),
                config.workflowServiceAccount(),
                "Never",
                retries);
        api.createJob(spec);
        log.info("Submitted workflow job {} in namespace {}", spec.name(), namespace);
        return spec.name();
    }

    /**
     * Workflow jobs whose names start with the given cron job or job name,
     * newest first.
     */
    public List<JobObservation> workflowHistory(String namespace, String name) {
        return api.listJobs(namespace, workflowLabels()).stream()
                .filter(job -> job.name().startsWith(name))
                .sorted(Comparator.comparing(JobObservation::startTime,
                        Comparator.nullsFirst(Comparator.<Instant>naturalOrder())).reversed())
                .collect(Collectors.toList());
    }

    /**
     * Log of the latest pod of a workflow job.
     */
    public Optional<String> workflowLogs(String namespace, String jobName) {
        return api.latestPodName(namespace, Map.of("job-name", jobName))
                .map(pod -> api.readPodLog(namespace, pod));
    }

    static void validateSchedule(String schedule) {
        if (schedule == null || schedule.isBlank()) {
            throw new IllegalArgumentException("schedule is required");
        }
        String[] fields = schedule.trim().split("\\s+");
        if (fields.length != 5) {
            throw new IllegalArgumentException("schedule must have 5 fields, got " + fields.length + ": " + schedule);
        }
        for (String field : fields) {
            if (!CRON_FIELD.matcher(field).matches()) {
                throw new IllegalArgumentException("invalid schedule field '" + field + "' in " + schedule);
            }
        }
    }

    private ContainerSpec workflowContainer(String namespace, String repoUrl, String branch) {
        List<String> args = branch != null && !branch.isBlank()
                ? List.of("--namespace=" + namespace, repoUrl, branch)
                : List.of("--namespace=" + namespace, repoUrl);
        return new ContainerSpec("deckhand", config.controllerImage(), WORKFLOW_COMMAND, args, List.of(),
                ResourceRequests.none(), null);
    }

    private static Map<String, String> workflowLabels() {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(ResourceNames.APP_LABEL, ResourceNames.APP);
        labels.put(COMPONENT_LABEL, WORKFLOW_COMPONENT);
        return labels;
    }
}
