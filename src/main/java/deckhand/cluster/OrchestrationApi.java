package deckhand.cluster;

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

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operations the engine issues against the container-orchestration cluster.
 * Every resource is addressed by namespace and name. Implementations must be
 * safe to call from several stage executor threads at once.
 *
 * <p>
 * All methods throw {@link OrchestrationApiException} when the cluster
 * rejects the call or cannot be reached.
 */
public interface OrchestrationApi {

    // ---------- Namespaces ----------

    boolean namespaceExists(String namespace);

    void createNamespace(String namespace);

    /**
     * Create a service account, doing nothing if it already exists.
     */
    void ensureServiceAccount(String namespace, String name);

    /**
     * Bind a cluster role to a service account within the namespace, doing
     * nothing if the binding already exists.
     */
    void ensureRoleBinding(String namespace, String name, String clusterRole, String serviceAccount);

    // ---------- Jobs ----------

    void createJob(JobSpec spec);

    /**
     * @return the job's current state, phase NOT_FOUND if absent
     */
    JobObservation readJob(String namespace, String name);

    /**
     * Delete a job and its pods. Absent jobs are ignored.
     */
    void deleteJob(String namespace, String name);

    List<JobObservation> listJobs(String namespace, Map<String, String> labelSelector);

    // ---------- Deployments ----------

    Optional<DeploymentObservation> readDeployment(String namespace, String name);

    void createDeployment(DeploymentSpec spec);

    /**
     * Replace the desired state of an existing deployment in place.
     */
    void updateDeployment(DeploymentSpec spec);

    /**
     * Restore the pod template of an earlier rollout revision.
     */
    void rollbackDeployment(String namespace, String name, long toRevision);

    void deleteDeployment(String namespace, String name);

    List<DeploymentObservation> listDeployments(String namespace, Map<String, String> labelSelector);

    // ---------- Endpoints and ingress ----------

    boolean endpointExists(String namespace, String name);

    void createEndpoint(EndpointSpec spec);

    void deleteEndpoint(String namespace, String name);

    boolean ingressExists(String namespace, String name);

    void createIngress(IngressSpec spec);

    void deleteIngress(String namespace, String name);

    // ---------- Cron jobs ----------

    void createCronJob(CronJobSpec spec);

    void deleteCronJob(String namespace, String name);

    List<CronJobInfo> listCronJobs(String namespace);

    // ---------- Secrets ----------

    /**
     * Create a secret, replacing any existing secret with the same name.
     */
    void createSecret(SecretSpec spec);

    boolean secretExists(String namespace, String name);

    void deleteSecret(String namespace, String name);

    List<SecretInfo> listSecrets(String namespace, Map<String, String> labelSelector);

    // ---------- Pods ----------

    /**
     * Name of the most recently created pod matching the selector.
     */
    Optional<String> latestPodName(String namespace, Map<String, String> labelSelector);

    String readPodLog(String namespace, String podName);
}
