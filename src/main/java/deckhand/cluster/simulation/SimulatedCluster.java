package deckhand.cluster.simulation;

import deckhand.cluster.OrchestrationApi;
import deckhand.cluster.OrchestrationApiException;
import deckhand.cluster.model.CronJobInfo;
import deckhand.cluster.model.DeploymentObservation;
import deckhand.cluster.model.JobObservation;
import deckhand.cluster.model.JobPhase;
import deckhand.cluster.model.SecretInfo;
import deckhand.cluster.spec.CronJobSpec;
import deckhand.cluster.spec.DeploymentSpec;
import deckhand.cluster.spec.EndpointSpec;
import deckhand.cluster.spec.IngressSpec;
import deckhand.cluster.spec.JobSpec;
import deckhand.cluster.spec.SecretSpec;
import deckhand.engine.translate.ResourceNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * In-memory cluster for dry runs and tests.
 *
 * <p>
 * Jobs and deployments progress one step per read: a job scripted with
 * {@code succeedAfter(3)} reports ACTIVE on its first two reads and
 * SUCCEEDED from the third on. Scripts are keyed by stage name (and attempt
 * for jobs); unscripted resources finish on their first read. All methods
 * are synchronized.
 */
public final class SimulatedCluster implements OrchestrationApi {

    private static final Logger log = LoggerFactory.getLogger(SimulatedCluster.class);

    /** Outcome script for one job attempt. */
    public record JobScript(JobPhase result, int afterPolls, String podLog) {

        public static JobScript succeedAfter(int polls) {
            return new JobScript(JobPhase.SUCCEEDED, polls, null);
        }

        public static JobScript failAfter(int polls) {
            return new JobScript(JobPhase.FAILED, polls, null);
        }

        /** Never leaves ACTIVE. */
        public static JobScript hang() {
            return new JobScript(JobPhase.ACTIVE, Integer.MAX_VALUE, null);
        }

        public JobScript withLog(String text) {
            return new JobScript(result, afterPolls, text);
        }
    }

    /**
     * Readiness script for the next rollout of a deployment.
     *
     * @param oldPodServing while not ready, one pod of the previous revision
     *                      stays ready next to the new ones, as in a surge
     *                      rollout whose last new pod never becomes ready
     */
    public record RolloutScript(int readyAfterPolls, boolean oldPodServing) {

        public static RolloutScript readyAfter(int polls) {
            return new RolloutScript(polls, false);
        }

        public static RolloutScript never() {
            return new RolloutScript(Integer.MAX_VALUE, false);
        }

        /** Never completes, but ready pod counts already reach the target. */
        public static RolloutScript stuckWithOldPodServing() {
            return new RolloutScript(Integer.MAX_VALUE, true);
        }
    }

    /** Recorded rollback request. */
    public record Rollback(String namespace, String name, long toRevision) {
    }

    /**
     * A job submitted or seen finished, in the order the cluster saw it.
     */
    public record JobEvent(Kind kind, String stage, int attempt, Instant at) {

        public enum Kind { CREATED, FINISHED }

        @Override
        public String toString() {
            return kind + " " + stage + "#" + attempt;
        }
    }

    private static final class SimJob {
        final JobSpec spec;
        final JobScript script;
        final Instant startTime;
        int polls;
        Instant completionTime;

        SimJob(JobSpec spec, JobScript script, Instant startTime) {
            this.spec = spec;
            this.script = script;
            this.startTime = startTime;
        }
    }

    private static final class SimDeployment {
        DeploymentSpec spec;
        long generation;
        long revision;
        RolloutScript script;
        int polls;
        final Map<Long, DeploymentSpec> revisions = new TreeMap<>();

        SimDeployment(DeploymentSpec spec, RolloutScript script) {
            this.spec = spec;
            this.script = script;
            this.generation = 1;
            this.revision = 1;
            revisions.put(1L, spec);
        }

        void rollout(DeploymentSpec next, RolloutScript nextScript) {
            spec = next;
            generation++;
            revision++;
            revisions.put(revision, next);
            script = nextScript;
            polls = 0;
        }

        boolean ready() {
            return polls >= script.readyAfterPolls();
        }
    }

    private record SimPod(String name, Map<String, String> labels, long seq, String log) {
    }

    private final Clock clock;
    private final Set<String> namespaces = new HashSet<>();
    private final Set<String> serviceAccounts = new HashSet<>();
    private final Set<String> roleBindings = new HashSet<>();
    private final Map<String, SimJob> jobs = new LinkedHashMap<>();
    private final Map<String, SimDeployment> deployments = new LinkedHashMap<>();
    private final Map<String, EndpointSpec> endpoints = new HashMap<>();
    private final Map<String, IngressSpec> ingresses = new HashMap<>();
    private final Map<String, CronJobSpec> cronJobs = new LinkedHashMap<>();
    private final Map<String, SecretSpec> secrets = new LinkedHashMap<>();
    private final Map<String, List<SimPod>> pods = new HashMap<>();

    private final Map<String, JobScript> jobScripts = new HashMap<>();
    private final Map<String, RolloutScript> rolloutScripts = new HashMap<>();
    private JobScript defaultJobScript = JobScript.succeedAfter(1);
    private RolloutScript defaultRolloutScript = RolloutScript.readyAfter(1);
    private int failingReads;

    private final List<String> calls = new ArrayList<>();
    private final List<JobSpec> createdJobs = new ArrayList<>();
    private final List<Rollback> rollbacks = new ArrayList<>();
    private final List<JobEvent> timeline = new ArrayList<>();
    private long podSeq;

    public SimulatedCluster() {
        this(Clock.systemUTC());
    }

    public SimulatedCluster(Clock clock) {
        this.clock = clock;
    }

    // ---------- Scripting ----------

    public synchronized SimulatedCluster withNamespace(String namespace) {
        namespaces.add(namespace);
        return this;
    }

    /**
     * Script attempt {@code attempt} (1-based) of the given stage.
     */
    public synchronized SimulatedCluster scriptJob(String stage, int attempt, JobScript script) {
        jobScripts.put(ResourceNames.toValidName(stage) + "#" + attempt, script);
        return this;
    }

    /**
     * Script every attempt of the given stage not scripted individually.
     */
    public synchronized SimulatedCluster scriptJob(String stage, JobScript script) {
        jobScripts.put(ResourceNames.toValidName(stage) + "#*", script);
        return this;
    }

    public synchronized SimulatedCluster defaultJobScript(JobScript script) {
        this.defaultJobScript = script;
        return this;
    }

    /**
     * Script the next rollout of the deployment behind the given stage.
     */
    public synchronized SimulatedCluster scriptRollout(String stage, RolloutScript script) {
        rolloutScripts.put(ResourceNames.toValidName(stage), script);
        return this;
    }

    public synchronized SimulatedCluster defaultRolloutScript(RolloutScript script) {
        this.defaultRolloutScript = script;
        return this;
    }

    /**
     * Make the next {@code count} job and deployment reads fail with HTTP 503.
     */
    public synchronized SimulatedCluster failNextReads(int count) {
        this.failingReads = count;
        return this;
    }

    // ---------- Inspection ----------

    public synchronized List<String> calls() {
        return List.copyOf(calls);
    }

    public synchronized List<JobSpec> createdJobs() {
        return List.copyOf(createdJobs);
    }

    public synchronized List<Rollback> rollbacks() {
        return List.copyOf(rollbacks);
    }

    public synchronized List<JobEvent> timeline() {
        return List.copyOf(timeline);
    }

    public synchronized boolean jobExists(String namespace, String name) {
        return jobs.containsKey(key(namespace, name));
    }

    public synchronized Optional<DeploymentSpec> deploymentSpec(String namespace, String name) {
        SimDeployment d = deployments.get(key(namespace, name));
        return d != null ? Optional.of(d.spec) : Optional.empty();
    }

    public synchronized Optional<SecretSpec> secret(String namespace, String name) {
        return Optional.ofNullable(secrets.get(key(namespace, name)));
    }

    // ---------- Namespaces ----------

    @Override
    public synchronized boolean namespaceExists(String namespace) {
        return namespaces.contains(namespace);
    }

    @Override
    public synchronized void createNamespace(String namespace) {
        record("createNamespace " + namespace);
        if (!namespaces.add(namespace)) {
            throw new OrchestrationApiException(409, "namespace " + namespace + " already exists");
        }
    }

    @Override
    public synchronized void ensureServiceAccount(String namespace, String name) {
        record("ensureServiceAccount " + key(namespace, name));
        requireNamespace(namespace);
        serviceAccounts.add(key(namespace, name));
    }

    @Override
    public synchronized void ensureRoleBinding(String namespace, String name, String clusterRole,
            String serviceAccount) {
        record("ensureRoleBinding " + key(namespace, name) + " " + clusterRole);
        requireNamespace(namespace);
        roleBindings.add(key(namespace, name));
    }

    public synchronized boolean serviceAccountExists(String namespace, String name) {
        return serviceAccounts.contains(key(namespace, name));
    }

    public synchronized boolean roleBindingExists(String namespace, String name) {
        return roleBindings.contains(key(namespace, name));
    }

    // ---------- Jobs ----------

    @Override
    public synchronized void createJob(JobSpec spec) {
        record("createJob " + key(spec.namespace(), spec.name()));
        requireNamespace(spec.namespace());
        String key = key(spec.namespace(), spec.name());
        if (jobs.containsKey(key)) {
            throw new OrchestrationApiException(409, "job " + spec.name() + " already exists");
        }
        JobScript script = jobScriptFor(spec.labels());
        jobs.put(key, new SimJob(spec, script, clock.instant()));
        createdJobs.add(spec);
        timeline.add(jobEvent(JobEvent.Kind.CREATED, spec.labels()));

        Map<String, String> podLabels = new LinkedHashMap<>(spec.labels());
        podLabels.put("job-name", spec.name());
        String text = script.podLog() != null ? script.podLog() : "simulated run of " + spec.name();
        addPod(spec.namespace(), spec.name() + "-" + Long.toHexString(podSeq + 0x1000), podLabels, text);
    }

    @Override
    public synchronized JobObservation readJob(String namespace, String name) {
        failReadIfScripted("read job " + name);
        SimJob job = jobs.get(key(namespace, name));
        if (job == null) {
            return JobObservation.notFound(name);
        }
        job.polls++;
        return observe(job);
    }

    @Override
    public synchronized void deleteJob(String namespace, String name) {
        record("deleteJob " + key(namespace, name));
        jobs.remove(key(namespace, name));
        List<SimPod> nsPods = pods.get(namespace);
        if (nsPods != null) {
            nsPods.removeIf(p -> name.equals(p.labels().get("job-name")));
        }
    }

    @Override
    public synchronized List<JobObservation> listJobs(String namespace, Map<String, String> labelSelector) {
        List<JobObservation> result = new ArrayList<>();
        for (SimJob job : jobs.values()) {
            if (job.spec.namespace().equals(namespace) && matches(job.spec.labels(), labelSelector)) {
                result.add(observe(job));
            }
        }
        return result;
    }

    // ---------- Deployments ----------

    @Override
    public synchronized Optional<DeploymentObservation> readDeployment(String namespace, String name) {
        failReadIfScripted("read deployment " + name);
        SimDeployment d = deployments.get(key(namespace, name));
        if (d == null) {
            return Optional.empty();
        }
        d.polls++;
        return Optional.of(observe(d));
    }

    @Override
    public synchronized void createDeployment(DeploymentSpec spec) {
        record("createDeployment " + key(spec.namespace(), spec.name()));
        requireNamespace(spec.namespace());
        String key = key(spec.namespace(), spec.name());
        if (deployments.containsKey(key)) {
            throw new OrchestrationApiException(409, "deployment " + spec.name() + " already exists");
        }
        SimDeployment d = new SimDeployment(spec, rolloutScriptFor(spec));
        deployments.put(key, d);
        addDeploymentPod(d);
    }

    @Override
    public synchronized void updateDeployment(DeploymentSpec spec) {
        record("updateDeployment " + key(spec.namespace(), spec.name()));
        SimDeployment d = deployments.get(key(spec.namespace(), spec.name()));
        if (d == null) {
            throw new OrchestrationApiException(404, "deployment " + spec.name() + " not found");
        }
        d.rollout(spec, rolloutScriptFor(spec));
        addDeploymentPod(d);
    }

    @Override
    public synchronized void rollbackDeployment(String namespace, String name, long toRevision) {
        record("rollbackDeployment " + key(namespace, name) + " " + toRevision);
        SimDeployment d = deployments.get(key(namespace, name));
        if (d == null) {
            throw new OrchestrationApiException(404, "deployment " + name + " not found");
        }
        long target = toRevision > 0 ? toRevision : d.revision - 1;
        DeploymentSpec previous = d.revisions.get(target);
        if (previous == null) {
            throw new OrchestrationApiException(404, "revision " + target + " of " + name + " not found");
        }
        rollbacks.add(new Rollback(namespace, name, target));
        d.rollout(previous, RolloutScript.readyAfter(0));
        log.info("Simulated rollback of {} to revision {}", name, target);
    }

    @Override
    public synchronized void deleteDeployment(String namespace, String name) {
        record("deleteDeployment " + key(namespace, name));
        deployments.remove(key(namespace, name));
    }

    @Override
    public synchronized List<DeploymentObservation> listDeployments(String namespace,
            Map<String, String> labelSelector) {
        List<DeploymentObservation> result = new ArrayList<>();
        for (SimDeployment d : deployments.values()) {
            if (d.spec.namespace().equals(namespace) && matches(d.spec.podLabels(), labelSelector)) {
                result.add(observe(d));
            }
        }
        return result;
    }

    // ---------- Endpoints and ingress ----------

    @Override
    public synchronized boolean endpointExists(String namespace, String name) {
        return endpoints.containsKey(key(namespace, name));
    }

    @Override
    public synchronized void createEndpoint(EndpointSpec spec) {
        record("createEndpoint " + key(spec.namespace(), spec.name()));
        if (endpoints.putIfAbsent(key(spec.namespace(), spec.name()), spec) != null) {
            throw new OrchestrationApiException(409, "service " + spec.name() + " already exists");
        }
    }

    @Override
    public synchronized void deleteEndpoint(String namespace, String name) {
        record("deleteEndpoint " + key(namespace, name));
        endpoints.remove(key(namespace, name));
    }

    @Override
    public synchronized boolean ingressExists(String namespace, String name) {
        return ingresses.containsKey(key(namespace, name));
    }

    @Override
    public synchronized void createIngress(IngressSpec spec) {
        record("createIngress " + key(spec.namespace(), spec.name()));
        if (ingresses.putIfAbsent(key(spec.namespace(), spec.name()), spec) != null) {
            throw new OrchestrationApiException(409, "ingress " + spec.name() + " already exists");
        }
    }

    @Override
    public synchronized void deleteIngress(String namespace, String name) {
        record("deleteIngress " + key(namespace, name));
        ingresses.remove(key(namespace, name));
    }

    public synchronized Optional<IngressSpec> ingress(String namespace, String name) {
        return Optional.ofNullable(ingresses.get(key(namespace, name)));
    }

    // ---------- Cron jobs ----------

    @Override
    public synchronized void createCronJob(CronJobSpec spec) {
        record("createCronJob " + key(spec.namespace(), spec.name()));
        requireNamespace(spec.namespace());
        if (cronJobs.putIfAbsent(key(spec.namespace(), spec.name()), spec) != null) {
            throw new OrchestrationApiException(409, "cron job " + spec.name() + " already exists");
        }
    }

    @Override
    public synchronized void deleteCronJob(String namespace, String name) {
        record("deleteCronJob " + key(namespace, name));
        if (cronJobs.remove(key(namespace, name)) == null) {
            throw new OrchestrationApiException(404, "cron job " + name + " not found");
        }
    }

    @Override
    public synchronized List<CronJobInfo> listCronJobs(String namespace) {
        List<CronJobInfo> result = new ArrayList<>();
        for (CronJobSpec spec : cronJobs.values()) {
            if (!spec.namespace().equals(namespace)) {
                continue;
            }
            List<String> positional = spec.container().args().stream()
                    .filter(a -> !a.startsWith("--"))
                    .toList();
            result.add(new CronJobInfo(spec.name(), spec.schedule(), null,
                    !positional.isEmpty() ? positional.get(0) : null,
                    positional.size() > 1 ? positional.get(1) : null));
        }
        return result;
    }

    public synchronized Optional<CronJobSpec> cronJob(String namespace, String name) {
        return Optional.ofNullable(cronJobs.get(key(namespace, name)));
    }

    // ---------- Secrets ----------

    @Override
    public synchronized void createSecret(SecretSpec spec) {
        record("createSecret " + key(spec.namespace(), spec.name()));
        requireNamespace(spec.namespace());
        secrets.put(key(spec.namespace(), spec.name()), spec);
    }

    @Override
    public synchronized boolean secretExists(String namespace, String name) {
        return secrets.containsKey(key(namespace, name));
    }

    @Override
    public synchronized void deleteSecret(String namespace, String name) {
        record("deleteSecret " + key(namespace, name));
        if (secrets.remove(key(namespace, name)) == null) {
            throw new OrchestrationApiException(404, "secret " + name + " not found");
        }
    }

    @Override
    public synchronized List<SecretInfo> listSecrets(String namespace, Map<String, String> labelSelector) {
        List<SecretInfo> result = new ArrayList<>();
        for (SecretSpec spec : secrets.values()) {
            if (spec.namespace().equals(namespace) && matches(spec.labels(), labelSelector)) {
                result.add(new SecretInfo(spec.name(), spec.labels().get(ResourceNames.SECRET_GROUP_LABEL),
                        List.copyOf(new TreeMap<>(spec.data()).keySet())));
            }
        }
        return result;
    }

    // ---------- Pods ----------

    @Override
    public synchronized Optional<String> latestPodName(String namespace, Map<String, String> labelSelector) {
        SimPod latest = null;
        for (SimPod pod : pods.getOrDefault(namespace, List.of())) {
            if (matches(pod.labels(), labelSelector) && (latest == null || pod.seq() > latest.seq())) {
                latest = pod;
            }
        }
        return latest != null ? Optional.of(latest.name()) : Optional.empty();
    }

    @Override
    public synchronized String readPodLog(String namespace, String podName) {
        for (SimPod pod : pods.getOrDefault(namespace, List.of())) {
            if (pod.name().equals(podName)) {
                return pod.log();
            }
        }
        throw new OrchestrationApiException(404, "pod " + podName + " not found");
    }

    // ---------- Internals ----------

    private JobObservation observe(SimJob job) {
        boolean done = job.script.result() != JobPhase.ACTIVE && job.polls >= job.script.afterPolls();
        JobPhase phase = done ? job.script.result() : JobPhase.ACTIVE;
        if (done && job.completionTime == null) {
            job.completionTime = clock.instant();
            timeline.add(jobEvent(JobEvent.Kind.FINISHED, job.spec.labels()));
        }
        return new JobObservation(
                job.spec.name(),
                phase,
                done ? 0 : 1,
                phase == JobPhase.SUCCEEDED ? 1 : 0,
                phase == JobPhase.FAILED ? 1 : 0,
                job.spec.labels(),
                job.startTime,
                phase == JobPhase.SUCCEEDED ? job.completionTime : null);
    }

    private DeploymentObservation observe(SimDeployment d) {
        int desired = d.spec.replicas();
        if (d.ready()) {
            return observation(d, desired, desired, desired, desired, 0, d.generation);
        }
        if (d.script.oldPodServing()) {
            // desired - 1 new pods ready plus one old pod; one new pod unready
            return observation(d, desired + 1, desired, desired, desired, 1, d.generation);
        }
        return observation(d, desired, 0, 0, 0, desired, d.generation - 1);
    }

    private static DeploymentObservation observation(SimDeployment d, int replicas, int ready, int updated,
            int available, int unavailable, long observedGeneration) {
        return new DeploymentObservation(
                d.spec.name(),
                d.spec.replicas(),
                replicas,
                ready,
                updated,
                available,
                unavailable,
                d.generation,
                observedGeneration,
                d.revision,
                d.spec.podLabels(),
                d.spec.container().containerPort());
    }

    private JobScript jobScriptFor(Map<String, String> labels) {
        String stage = labels.get(ResourceNames.STAGE_LABEL);
        String attempt = labels.get(ResourceNames.ATTEMPT_LABEL);
        JobScript script = jobScripts.get(stage + "#" + attempt);
        if (script == null) {
            script = jobScripts.get(stage + "#*");
        }
        return script != null ? script : defaultJobScript;
    }

    private RolloutScript rolloutScriptFor(DeploymentSpec spec) {
        RolloutScript script = rolloutScripts.remove(spec.podLabels().get(ResourceNames.STAGE_LABEL));
        return script != null ? script : defaultRolloutScript;
    }

    private void addDeploymentPod(SimDeployment d) {
        addPod(d.spec.namespace(), d.spec.name() + "-r" + d.revision, d.spec.podLabels(),
                "simulated service " + d.spec.name() + " revision " + d.revision);
    }

    private void addPod(String namespace, String name, Map<String, String> labels, String text) {
        pods.computeIfAbsent(namespace, k -> new ArrayList<>()).add(new SimPod(name, Map.copyOf(labels), podSeq++, text));
    }

    private void failReadIfScripted(String what) {
        if (failingReads > 0) {
            failingReads--;
            throw new OrchestrationApiException(503, what + " failed: simulated outage");
        }
    }

    private void requireNamespace(String namespace) {
        if (!namespaces.contains(namespace)) {
            throw new OrchestrationApiException(404, "namespace " + namespace + " not found");
        }
    }

    private JobEvent jobEvent(JobEvent.Kind kind, Map<String, String> labels) {
        String attempt = labels.getOrDefault(ResourceNames.ATTEMPT_LABEL, "0");
        return new JobEvent(kind, labels.get(ResourceNames.STAGE_LABEL), Integer.parseInt(attempt), clock.instant());
    }

    private void record(String call) {
        calls.add(call);
        log.debug("Simulated call: {}", call);
    }

    private static boolean matches(Map<String, String> labels, Map<String, String> selector) {
        if (selector == null) {
            return true;
        }
        for (Map.Entry<String, String> e : selector.entrySet()) {
            if (!e.getValue().equals(labels.get(e.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private static String key(String namespace, String name) {
        return namespace + "/" + name;
    }
}
