package deckhand.cluster.kubernetes;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import deckhand.cluster.OrchestrationApi;
import deckhand.cluster.OrchestrationApiException;
import deckhand.cluster.model.CronJobInfo;
import deckhand.cluster.model.DeploymentObservation;
import deckhand.cluster.model.JobObservation;
import deckhand.cluster.model.SecretInfo;
import deckhand.cluster.spec.CronJobSpec;
import deckhand.cluster.spec.DeploymentSpec;
import deckhand.cluster.spec.EndpointSpec;
import deckhand.cluster.spec.IngressSpec;
import deckhand.cluster.spec.JobSpec;
import deckhand.cluster.spec.SecretSpec;
import deckhand.engine.translate.ResourceNames;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.apis.AppsV1Api;
import io.kubernetes.client.openapi.apis.BatchV1Api;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.apis.NetworkingV1Api;
import io.kubernetes.client.openapi.apis.RbacAuthorizationV1Api;
import io.kubernetes.client.openapi.models.V1CronJob;
import io.kubernetes.client.openapi.models.V1Deployment;
import io.kubernetes.client.openapi.models.V1Job;
import io.kubernetes.client.openapi.models.V1PodTemplateSpec;
import io.kubernetes.client.openapi.models.V1ReplicaSet;
import io.kubernetes.client.openapi.models.V1Secret;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link OrchestrationApi} over the Kubernetes API, using the typed clients
 * of {@code client-java}.
 *
 * <p>
 * Every {@link ApiException} becomes an {@link OrchestrationApiException}
 * carrying the HTTP status; transport failures carry status 0.
 */
public class KubernetesApiClient implements OrchestrationApi {

    private static final Logger log = LoggerFactory.getLogger(KubernetesApiClient.class);

    private static final String BACKGROUND = "Background";

    private final CoreV1Api core;
    private final BatchV1Api batch;
    private final AppsV1Api apps;
    private final NetworkingV1Api networking;
    private final RbacAuthorizationV1Api rbac;
    private final ObjectMapper json = new ObjectMapper();

    public KubernetesApiClient(ApiClient client) {
        this.core = new CoreV1Api(client);
        this.batch = new BatchV1Api(client);
        this.apps = new AppsV1Api(client);
        this.networking = new NetworkingV1Api(client);
        this.rbac = new RbacAuthorizationV1Api(client);
    }

    // ---------- Namespaces ----------

    @Override
    public boolean namespaceExists(String namespace) {
        try {
            return read(() -> core.readNamespace(namespace).execute(), "read namespace " + namespace).isPresent();
        } catch (OrchestrationApiException e) {
            if (e.statusCode() == 403) {
                // Namespaced service accounts may not read namespaces
                log.warn("Not allowed to read namespace {}, assuming it exists", namespace);
                return true;
            }
            throw e;
        }
    }

    @Override
    public void createNamespace(String namespace) {
        call(() -> core.createNamespace(KubernetesManifests.namespace(namespace)).execute(),
                "create namespace " + namespace);
    }

    @Override
    public void ensureServiceAccount(String namespace, String name) {
        createIfAbsent(() -> core.createNamespacedServiceAccount(namespace,
                KubernetesManifests.serviceAccount(namespace, name)).execute(), "create service account " + name);
    }

    @Override
    public void ensureRoleBinding(String namespace, String name, String clusterRole, String serviceAccount) {
        createIfAbsent(() -> rbac.createNamespacedRoleBinding(namespace,
                KubernetesManifests.roleBinding(namespace, name, clusterRole, serviceAccount)).execute(),
                "create role binding " + name);
    }

    // ---------- Jobs ----------

    @Override
    public void createJob(JobSpec spec) {
        call(() -> batch.createNamespacedJob(spec.namespace(), KubernetesManifests.job(spec)).execute(),
                "create job " + spec.name());
    }

    @Override
    public JobObservation readJob(String namespace, String name) {
        return read(() -> batch.readNamespacedJob(name, namespace).execute(), "read job " + name)
                .map(KubernetesManifests::jobObservation)
                .orElseGet(() -> JobObservation.notFound(name));
    }

    @Override
    public void deleteJob(String namespace, String name) {
        deleteIfPresent(() -> batch.deleteNamespacedJob(name, namespace).propagationPolicy(BACKGROUND).execute(),
                "delete job " + name);
    }

    @Override
    public List<JobObservation> listJobs(String namespace, Map<String, String> labelSelector) {
        List<V1Job> items = call(() -> batch.listNamespacedJob(namespace)
                .labelSelector(KubernetesManifests.labelSelector(labelSelector)).execute(), "list jobs").getItems();
        List<JobObservation> jobs = new ArrayList<>();
        for (V1Job item : items) {
            jobs.add(KubernetesManifests.jobObservation(item));
        }
        return jobs;
    }

    // ---------- Deployments ----------

    @Override
    public Optional<DeploymentObservation> readDeployment(String namespace, String name) {
        return read(() -> apps.readNamespacedDeployment(name, namespace).execute(), "read deployment " + name)
                .map(KubernetesManifests::deploymentObservation);
    }

    @Override
    public void createDeployment(DeploymentSpec spec) {
        call(() -> apps.createNamespacedDeployment(spec.namespace(), KubernetesManifests.deployment(spec)).execute(),
                "create deployment " + spec.name());
    }

    @Override
    public void updateDeployment(DeploymentSpec spec) {
        String what = "update deployment " + spec.name();
        V1Deployment current = existingDeployment(spec.namespace(), spec.name(), what);
        V1Deployment desired = KubernetesManifests.deployment(spec);
        desired.getMetadata().setResourceVersion(current.getMetadata().getResourceVersion());
        call(() -> apps.replaceNamespacedDeployment(spec.name(), spec.namespace(), desired).execute(), what);
    }

    @Override
    public void rollbackDeployment(String namespace, String name, long toRevision) {
        String what = "roll back deployment " + name;
        V1Deployment deployment = existingDeployment(namespace, name, what);
        String selector = KubernetesManifests.labelSelector(deployment.getSpec().getSelector().getMatchLabels());
        List<V1ReplicaSet> replicaSets = call(() -> apps.listNamespacedReplicaSet(namespace)
                .labelSelector(selector).execute(), what).getItems();

        long current = KubernetesManifests.deploymentObservation(deployment).revision();
        long target = toRevision > 0 ? toRevision : KubernetesManifests.previousRevision(replicaSets, current);
        V1PodTemplateSpec template = KubernetesManifests.templateForRevision(replicaSets, target)
                .orElseThrow(() -> new OrchestrationApiException(404, what + ": revision " + target + " not found"));

        deployment.getSpec().setTemplate(template);
        call(() -> apps.replaceNamespacedDeployment(name, namespace, deployment).execute(), what);
        log.info("Rolled back deployment {} in namespace {} to revision {}", name, namespace, target);
    }

    @Override
    public void deleteDeployment(String namespace, String name) {
        deleteIfPresent(() -> apps.deleteNamespacedDeployment(name, namespace).propagationPolicy(BACKGROUND).execute(),
                "delete deployment " + name);
    }

    @Override
    public List<DeploymentObservation> listDeployments(String namespace, Map<String, String> labelSelector) {
        List<V1Deployment> items = call(() -> apps.listNamespacedDeployment(namespace)
                .labelSelector(KubernetesManifests.labelSelector(labelSelector)).execute(),
                "list deployments").getItems();
        List<DeploymentObservation> deployments = new ArrayList<>();
        for (V1Deployment item : items) {
            deployments.add(KubernetesManifests.deploymentObservation(item));
        }
        return deployments;
    }

    private V1Deployment existingDeployment(String namespace, String name, String what) {
        return read(() -> apps.readNamespacedDeployment(name, namespace).execute(), what)
                .orElseThrow(() -> new OrchestrationApiException(404, what + ": deployment not found"));
    }

    // ---------- Endpoints and ingress ----------

    @Override
    public boolean endpointExists(String namespace, String name) {
        return read(() -> core.readNamespacedService(name, namespace).execute(), "read service " + name).isPresent();
    }

    @Override
    public void createEndpoint(EndpointSpec spec) {
        call(() -> core.createNamespacedService(spec.namespace(), KubernetesManifests.service(spec)).execute(),
                "create service " + spec.name());
    }

    @Override
    public void deleteEndpoint(String namespace, String name) {
        deleteIfPresent(() -> core.deleteNamespacedService(name, namespace).execute(), "delete service " + name);
    }

    @Override
    public boolean ingressExists(String namespace, String name) {
        return read(() -> networking.readNamespacedIngress(name, namespace).execute(), "read ingress " + name)
                .isPresent();
    }

    @Override
    public void createIngress(IngressSpec spec) {
        call(() -> networking.createNamespacedIngress(spec.namespace(), KubernetesManifests.ingress(spec)).execute(),
                "create ingress " + spec.name());
    }

    @Override
    public void deleteIngress(String namespace, String name) {
        deleteIfPresent(() -> networking.deleteNamespacedIngress(name, namespace).execute(), "delete ingress " + name);
    }

    // ---------- Cron jobs ----------

    @Override
    public void createCronJob(CronJobSpec spec) {
        call(() -> batch.createNamespacedCronJob(spec.namespace(), KubernetesManifests.cronJob(spec)).execute(),
                "create cron job " + spec.name());
    }

    @Override
    public void deleteCronJob(String namespace, String name) {
        call(() -> batch.deleteNamespacedCronJob(name, namespace).propagationPolicy(BACKGROUND).execute(),
                "delete cron job " + name);
    }

    @Override
    public List<CronJobInfo> listCronJobs(String namespace) {
        String selector = KubernetesManifests.labelSelector(Map.of(ResourceNames.APP_LABEL, ResourceNames.APP));
        List<V1CronJob> items = call(() -> batch.listNamespacedCronJob(namespace).labelSelector(selector).execute(),
                "list cron jobs").getItems();
        List<CronJobInfo> cronJobs = new ArrayList<>();
        for (V1CronJob item : items) {
            cronJobs.add(KubernetesManifests.cronJobInfo(item));
        }
        return cronJobs;
    }

    // ---------- Secrets ----------

    @Override
    public void createSecret(SecretSpec spec) {
        V1Secret body = KubernetesManifests.secret(spec);
        try {
            call(() -> core.createNamespacedSecret(spec.namespace(), body).execute(), "create secret " + spec.name());
        } catch (OrchestrationApiException e) {
            if (!e.isConflict()) {
                throw e;
            }
            call(() -> core.replaceNamespacedSecret(spec.name(), spec.namespace(), body).execute(),
                    "replace secret " + spec.name());
        }
    }

    @Override
    public boolean secretExists(String namespace, String name) {
        return read(() -> core.readNamespacedSecret(name, namespace).execute(), "read secret " + name).isPresent();
    }

    @Override
    public void deleteSecret(String namespace, String name) {
        call(() -> core.deleteNamespacedSecret(name, namespace).execute(), "delete secret " + name);
    }

    @Override
    public List<SecretInfo> listSecrets(String namespace, Map<String, String> labelSelector) {
        List<V1Secret> items = call(() -> core.listNamespacedSecret(namespace)
                .labelSelector(KubernetesManifests.labelSelector(labelSelector)).execute(), "list secrets").getItems();
        List<SecretInfo> secrets = new ArrayList<>();
        for (V1Secret item : items) {
            secrets.add(KubernetesManifests.secretInfo(item, ResourceNames.SECRET_GROUP_LABEL));
        }
        return secrets;
    }

    // ---------- Pods ----------

    @Override
    public Optional<String> latestPodName(String namespace, Map<String, String> labelSelector) {
        return KubernetesManifests.latestPod(call(() -> core.listNamespacedPod(namespace)
                .labelSelector(KubernetesManifests.labelSelector(labelSelector)).execute(), "list pods").getItems());
    }

    @Override
    public String readPodLog(String namespace, String podName) {
        return call(() -> core.readNamespacedPodLog(podName, namespace).execute(), "read log of pod " + podName);
    }

    // ---------- Error mapping ----------

    @FunctionalInterface
    private interface ApiCall<T> {
        T execute() throws ApiException;
    }

    private <T> T call(ApiCall<T> request, String what) {
        try {
            return request.execute();
        } catch (ApiException e) {
            throw translate(e, what);
        }
    }

    /**
     * @return the resource, empty on 404
     */
    private <T> Optional<T> read(ApiCall<T> request, String what) {
        try {
            return Optional.ofNullable(request.execute());
        } catch (ApiException e) {
            if (e.getCode() == 404) {
                return Optional.empty();
            }
            throw translate(e, what);
        }
    }

    /** Absent resources are ignored. */
    private void deleteIfPresent(ApiCall<?> request, String what) {
        try {
            request.execute();
        } catch (ApiException e) {
            if (e.getCode() == 404) {
                log.debug("{}: already absent", what);
                return;
            }
            throw translate(e, what);
        }
    }

    private void createIfAbsent(ApiCall<?> request, String what) {
        try {
            request.execute();
        } catch (ApiException e) {
            if (e.getCode() == 409) {
                log.debug("{}: already exists", what);
                return;
            }
            throw translate(e, what);
        }
    }

    private OrchestrationApiException translate(ApiException e, String what) {
        int status = e.getCode();
        if (status == 0) {
            return new OrchestrationApiException(what + " failed: " + e.getMessage(), e);
        }
        return new OrchestrationApiException(status, what + " failed: HTTP " + status + ": "
                + statusMessage(e.getResponseBody()));
    }

    private String statusMessage(String body) {
        if (body == null || body.isBlank()) {
            return "no response body";
        }
        try {
            JsonNode status = json.readTree(body);
            if (status != null && status.hasNonNull("message")) {
                return status.get("message").asText();
            }
        } catch (JsonProcessingException e) {
            log.trace("Non-JSON error body", e);
        }
        return body;
    }
}
