package deckhand.cluster.kubernetes;

import deckhand.cluster.model.CronJobInfo;
import deckhand.cluster.model.DeploymentObservation;
import deckhand.cluster.model.JobObservation;
import deckhand.cluster.model.JobPhase;
import deckhand.cluster.model.SecretInfo;
import deckhand.cluster.spec.ContainerSpec;
import deckhand.cluster.spec.CronJobSpec;
import deckhand.cluster.spec.DeploymentSpec;
import deckhand.cluster.spec.EndpointSpec;
import deckhand.cluster.spec.EnvVarSpec;
import deckhand.cluster.spec.IngressSpec;
import deckhand.cluster.spec.JobSpec;
import deckhand.cluster.spec.SecretSpec;
import io.kubernetes.client.custom.IntOrString;
import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.models.RbacV1Subject;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1ContainerPort;
import io.kubernetes.client.openapi.models.V1CronJob;
import io.kubernetes.client.openapi.models.V1CronJobSpec;
import io.kubernetes.client.openapi.models.V1Deployment;
import io.kubernetes.client.openapi.models.V1DeploymentSpec;
import io.kubernetes.client.openapi.models.V1DeploymentStatus;
import io.kubernetes.client.openapi.models.V1EnvVar;
import io.kubernetes.client.openapi.models.V1EnvVarSource;
import io.kubernetes.client.openapi.models.V1HTTPIngressPath;
import io.kubernetes.client.openapi.models.V1HTTPIngressRuleValue;
import io.kubernetes.client.openapi.models.V1Ingress;
import io.kubernetes.client.openapi.models.V1IngressBackend;
import io.kubernetes.client.openapi.models.V1IngressRule;
import io.kubernetes.client.openapi.models.V1IngressServiceBackend;
import io.kubernetes.client.openapi.models.V1IngressSpec;
import io.kubernetes.client.openapi.models.V1Job;
import io.kubernetes.client.openapi.models.V1JobCondition;
import io.kubernetes.client.openapi.models.V1JobSpec;
import io.kubernetes.client.openapi.models.V1JobStatus;
import io.kubernetes.client.openapi.models.V1JobTemplateSpec;
import io.kubernetes.client.openapi.models.V1LabelSelector;
import io.kubernetes.client.openapi.models.V1Namespace;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodSpec;
import io.kubernetes.client.openapi.models.V1PodTemplateSpec;
import io.kubernetes.client.openapi.models.V1ReplicaSet;
import io.kubernetes.client.openapi.models.V1ResourceRequirements;
import io.kubernetes.client.openapi.models.V1RoleBinding;
import io.kubernetes.client.openapi.models.V1RoleRef;
import io.kubernetes.client.openapi.models.V1Secret;
import io.kubernetes.client.openapi.models.V1SecretKeySelector;
import io.kubernetes.client.openapi.models.V1Service;
import io.kubernetes.client.openapi.models.V1ServiceAccount;
import io.kubernetes.client.openapi.models.V1ServiceBackendPort;
import io.kubernetes.client.openapi.models.V1ServicePort;
import io.kubernetes.client.openapi.models.V1ServiceSpec;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts resource specs to Kubernetes API objects and API objects back to
 * observations. Pure functions over the client's model classes.
 */
public final class KubernetesManifests {

    public static final String REVISION_ANNOTATION = "deployment.kubernetes.io/revision";
    public static final String REWRITE_ANNOTATION = "nginx.ingress.kubernetes.io/rewrite-target";
    public static final String POD_TEMPLATE_HASH = "pod-template-hash";

    private KubernetesManifests() {
    }

    // ---------- Specs to API objects ----------

    public static V1Namespace namespace(String name) {
        return new V1Namespace()
                .apiVersion("v1")
                .kind("Namespace")
                .metadata(new V1ObjectMeta().name(name));
    }

    public static V1ServiceAccount serviceAccount(String namespace, String name) {
        return new V1ServiceAccount()
                .apiVersion("v1")
                .kind("ServiceAccount")
                .metadata(metadata(namespace, name, Map.of()));
    }

    public static V1RoleBinding roleBinding(String namespace, String name, String clusterRole, String serviceAccount) {
        return new V1RoleBinding()
                .apiVersion("rbac.authorization.k8s.io/v1")
                .kind("RoleBinding")
                .metadata(metadata(namespace, name, Map.of()))
                .roleRef(new V1RoleRef()
                        .apiGroup("rbac.authorization.k8s.io")
                        .kind("ClusterRole")
                        .name(clusterRole))
                .subjects(List.of(new RbacV1Subject()
                        .kind("ServiceAccount")
                        .name(serviceAccount)
                        .namespace(namespace)));
    }

    public static V1Job job(JobSpec spec) {
        return new V1Job()
                .apiVersion("batch/v1")
                .kind("Job")
                .metadata(metadata(spec.namespace(), spec.name(), spec.labels()))
                .spec(new V1JobSpec()
                        .backoffLimit(spec.backoffLimit())
                        .template(podTemplate(spec.labels(), spec.container(), spec.serviceAccount(),
                                spec.restartPolicy())));
    }

    public static V1Deployment deployment(DeploymentSpec spec) {
        return new V1Deployment()
                .apiVersion("apps/v1")
                .kind("Deployment")
                .metadata(metadata(spec.namespace(), spec.name(), spec.podLabels()))
                .spec(new V1DeploymentSpec()
                        .replicas(spec.replicas())
                        .selector(new V1LabelSelector().matchLabels(new LinkedHashMap<>(spec.selector())))
                        .template(podTemplate(spec.podLabels(), spec.container(), spec.serviceAccount(), null)));
    }

    public static V1Service service(EndpointSpec spec) {
        return new V1Service()
                .apiVersion("v1")
                .kind("Service")
                .metadata(metadata(spec.namespace(), spec.name(), spec.labels()))
                .spec(new V1ServiceSpec()
                        .type("ClusterIP")
                        .selector(new LinkedHashMap<>(spec.selector()))
                        .ports(List.of(new V1ServicePort()
                                .port(spec.port())
                                .targetPort(new IntOrString(spec.port()))
                                .protocol("TCP"))));
    }

    public static V1Ingress ingress(IngressSpec spec) {
        V1ObjectMeta metadata = metadata(spec.namespace(), spec.name(), spec.labels())
                .annotations(new LinkedHashMap<>(Map.of(REWRITE_ANNOTATION, "/$2")));
        V1HTTPIngressPath path = new V1HTTPIngressPath()
                .path(spec.path())
                .pathType("ImplementationSpecific")
                .backend(new V1IngressBackend()
                        .service(new V1IngressServiceBackend()
                                .name(spec.serviceName())
                                .port(new V1ServiceBackendPort().number(spec.port()))));
        return new V1Ingress()
                .apiVersion("networking.k8s.io/v1")
                .kind("Ingress")
                .metadata(metadata)
                .spec(new V1IngressSpec()
                        .rules(List.of(new V1IngressRule()
                                .http(new V1HTTPIngressRuleValue().paths(List.of(path))))));
    }

    public static V1CronJob cronJob(CronJobSpec spec) {
        V1JobTemplateSpec jobTemplate = new V1JobTemplateSpec()
                .metadata(new V1ObjectMeta().labels(new LinkedHashMap<>(spec.labels())))
                .spec(new V1JobSpec()
                        .backoffLimit(spec.backoffLimit())
                        .template(podTemplate(spec.labels(), spec.container(), spec.serviceAccount(), "Never")));
        return new V1CronJob()
                .apiVersion("batch/v1")
                .kind("CronJob")
                .metadata(metadata(spec.namespace(), spec.name(), spec.labels()))
                .spec(new V1CronJobSpec()
                        .schedule(spec.schedule())
                        .successfulJobsHistoryLimit(spec.successfulJobsHistoryLimit())
                        .failedJobsHistoryLimit(spec.failedJobsHistoryLimit())
                        .jobTemplate(jobTemplate));
    }

    public static V1Secret secret(SecretSpec spec) {
        return new V1Secret()
                .apiVersion("v1")
                .kind("Secret")
                .metadata(metadata(spec.namespace(), spec.name(), spec.labels()))
                .type("Opaque")
                .stringData(new LinkedHashMap<>(spec.data()));
    }

    static V1Container container(ContainerSpec spec) {
        V1Container container = new V1Container()
                .name(spec.name())
                .image(spec.image())
                .imagePullPolicy("Always");
        if (!spec.command().isEmpty()) {
            container.command(new ArrayList<>(spec.command()));
        }
        if (!spec.args().isEmpty()) {
            container.args(new ArrayList<>(spec.args()));
        }
        if (!spec.env().isEmpty()) {
            List<V1EnvVar> env = new ArrayList<>();
            for (EnvVarSpec var : spec.env()) {
                V1EnvVar entry = new V1EnvVar().name(var.name());
                if (var.secretRef() != null) {
                    entry.valueFrom(new V1EnvVarSource().secretKeyRef(new V1SecretKeySelector()
                            .name(var.secretRef().secretName())
                            .key(var.secretRef().key())));
                } else {
                    entry.value(var.value());
                }
                env.add(entry);
            }
            container.env(env);
        }
        if (!spec.resources().isEmpty()) {
            Map<String, Quantity> requests = new LinkedHashMap<>();
            if (spec.resources().cpu() != null) {
                requests.put("cpu", Quantity.fromString(spec.resources().cpu()));
            }
            if (spec.resources().memory() != null) {
                requests.put("memory", Quantity.fromString(spec.resources().memory()));
            }
            container.resources(new V1ResourceRequirements().requests(requests));
        }
        if (spec.containerPort() != null) {
            container.ports(List.of(new V1ContainerPort()
                    .containerPort(spec.containerPort())
                    .protocol("TCP")));
        }
        return container;
    }

    private static V1PodTemplateSpec podTemplate(Map<String, String> labels, ContainerSpec container,
            String serviceAccount, String restartPolicy) {
        V1PodSpec podSpec = new V1PodSpec().containers(List.of(container(container)));
        if (serviceAccount != null) {
            podSpec.serviceAccountName(serviceAccount);
        }
        if (restartPolicy != null) {
            podSpec.restartPolicy(restartPolicy);
        }
        return new V1PodTemplateSpec()
                .metadata(new V1ObjectMeta().labels(new LinkedHashMap<>(labels)))
                .spec(podSpec);
    }

    private static V1ObjectMeta metadata(String namespace, String name, Map<String, String> labels) {
        V1ObjectMeta metadata = new V1ObjectMeta().name(name).namespace(namespace);
        if (!labels.isEmpty()) {
            metadata.labels(new LinkedHashMap<>(labels));
        }
        return metadata;
    }

    // ---------- API objects to observations ----------

    public static JobObservation jobObservation(V1Job job) {
        V1JobStatus status = job.getStatus() != null ? job.getStatus() : new V1JobStatus();
        int active = orZero(status.getActive());
        int succeeded = orZero(status.getSucceeded());
        int failed = orZero(status.getFailed());

        JobPhase phase = JobPhase.ACTIVE;
        if (hasCondition(status, "Failed")) {
            phase = JobPhase.FAILED;
        } else if (hasCondition(status, "Complete") || (succeeded > 0 && active == 0)) {
            phase = JobPhase.SUCCEEDED;
        }
        V1ObjectMeta metadata = job.getMetadata() != null ? job.getMetadata() : new V1ObjectMeta();
        return new JobObservation(
                metadata.getName(),
                phase,
                active,
                succeeded,
                failed,
                metadata.getLabels(),
                instant(status.getStartTime()),
                instant(status.getCompletionTime()));
    }

    public static DeploymentObservation deploymentObservation(V1Deployment deployment) {
        V1ObjectMeta metadata = deployment.getMetadata() != null ? deployment.getMetadata() : new V1ObjectMeta();
        V1DeploymentStatus status = deployment.getStatus() != null ? deployment.getStatus() : new V1DeploymentStatus();
        V1DeploymentSpec spec = deployment.getSpec();
        Integer desired = spec != null ? spec.getReplicas() : null;
        return new DeploymentObservation(
                metadata.getName(),
                desired != null ? desired : 1,
                orZero(status.getReplicas()),
                orZero(status.getReadyReplicas()),
                orZero(status.getUpdatedReplicas()),
                orZero(status.getAvailableReplicas()),
                orZero(status.getUnavailableReplicas()),
                metadata.getGeneration() != null ? metadata.getGeneration() : 0,
                status.getObservedGeneration() != null ? status.getObservedGeneration() : 0,
                revision(metadata),
                metadata.getLabels(),
                containerPort(spec));
    }

    /**
     * The repository URL and branch are recovered from the positional
     * arguments of the workflow container.
     */
    public static CronJobInfo cronJobInfo(V1CronJob cronJob) {
        List<String> positional = new ArrayList<>();
        V1CronJobSpec spec = cronJob.getSpec();
        for (String arg : workflowArgs(spec)) {
            if (!arg.startsWith("--")) {
                positional.add(arg);
            }
        }
        return new CronJobInfo(
                cronJob.getMetadata().getName(),
                spec != null ? spec.getSchedule() : null,
                cronJob.getStatus() != null ? instant(cronJob.getStatus().getLastScheduleTime()) : null,
                !positional.isEmpty() ? positional.get(0) : null,
                positional.size() > 1 ? positional.get(1) : null);
    }

    private static List<String> workflowArgs(V1CronJobSpec spec) {
        if (spec == null || spec.getJobTemplate() == null || spec.getJobTemplate().getSpec() == null) {
            return List.of();
        }
        V1PodTemplateSpec template = spec.getJobTemplate().getSpec().getTemplate();
        if (template == null || template.getSpec() == null || template.getSpec().getContainers().isEmpty()) {
            return List.of();
        }
        List<String> args = template.getSpec().getContainers().get(0).getArgs();
        return args != null ? args : List.of();
    }

    public static SecretInfo secretInfo(V1Secret secret, String groupLabel) {
        List<String> keys = secret.getData() != null ? new ArrayList<>(secret.getData().keySet()) : List.of();
        Map<String, String> labels = secret.getMetadata().getLabels();
        return new SecretInfo(
                secret.getMetadata().getName(),
                labels != null ? labels.get(groupLabel) : null,
                keys);
    }

    /**
     * Pod template of the replica set carrying the given rollout revision,
     * without the hash label the controller adds.
     */
    public static Optional<V1PodTemplateSpec> templateForRevision(List<V1ReplicaSet> replicaSets, long revision) {
        for (V1ReplicaSet rs : replicaSets) {
            if (revision(rs.getMetadata()) == revision && rs.getSpec() != null && rs.getSpec().getTemplate() != null) {
                V1PodTemplateSpec template = rs.getSpec().getTemplate();
                if (template.getMetadata() != null && template.getMetadata().getLabels() != null) {
                    Map<String, String> labels = new HashMap<>(template.getMetadata().getLabels());
                    labels.remove(POD_TEMPLATE_HASH);
                    template.getMetadata().setLabels(labels);
                }
                return Optional.of(template);
            }
        }
        return Optional.empty();
    }

    /**
     * Highest revision below {@code current} among the replica sets.
     */
    public static long previousRevision(List<V1ReplicaSet> replicaSets, long current) {
        long previous = 0;
        for (V1ReplicaSet rs : replicaSets) {
            long revision = revision(rs.getMetadata());
            if (revision < current && revision > previous) {
                previous = revision;
            }
        }
        return previous;
    }

    /**
     * Name of the most recently created pod in a pod list.
     */
    public static Optional<String> latestPod(List<V1Pod> pods) {
        String latest = null;
        Instant latestCreated = null;
        for (V1Pod pod : pods) {
            Instant created = instant(pod.getMetadata().getCreationTimestamp());
            if (latest == null || (created != null && (latestCreated == null || created.isAfter(latestCreated)))) {
                latest = pod.getMetadata().getName();
                latestCreated = created;
            }
        }
        return Optional.ofNullable(latest);
    }

    /**
     * @return the selector string, null for no selector
     */
    public static String labelSelector(Map<String, String> labels) {
        if (labels == null || labels.isEmpty()) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        labels.forEach((k, v) -> {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(k).append('=').append(v);
        });
        return sb.toString();
    }

    private static boolean hasCondition(V1JobStatus status, String type) {
        if (status.getConditions() == null) {
            return false;
        }
        for (V1JobCondition condition : status.getConditions()) {
            if (type.equals(condition.getType()) && "True".equals(condition.getStatus())) {
                return true;
            }
        }
        return false;
    }

    static long revision(V1ObjectMeta metadata) {
        if (metadata == null || metadata.getAnnotations() == null) {
            return 0;
        }
        String value = metadata.getAnnotations().getOrDefault(REVISION_ANNOTATION, "");
        try {
            return value.isEmpty() ? 0 : Long.parseLong(value);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static Integer containerPort(V1DeploymentSpec spec) {
        if (spec == null || spec.getTemplate() == null || spec.getTemplate().getSpec() == null) {
            return null;
        }
        List<V1Container> containers = spec.getTemplate().getSpec().getContainers();
        if (containers.isEmpty() || containers.get(0).getPorts() == null || containers.get(0).getPorts().isEmpty()) {
            return null;
        }
        return containers.get(0).getPorts().get(0).getContainerPort();
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }

    private static Instant instant(OffsetDateTime time) {
        return time != null ? time.toInstant() : null;
    }
}
