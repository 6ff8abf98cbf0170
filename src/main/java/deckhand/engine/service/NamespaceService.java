package deckhand.engine.service;

import deckhand.cluster.OrchestrationApi;
import deckhand.engine.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prepares namespaces for pipeline deployments.
 */
public class NamespaceService {

    private static final Logger log = LoggerFactory.getLogger(NamespaceService.class);

    /** Cluster role granted to the workflow controller inside the namespace. */
    public static final String WORKFLOW_CLUSTER_ROLE = "edit";

    private final OrchestrationApi api;
    private final EngineConfig config;

    public NamespaceService(OrchestrationApi api, EngineConfig config) {
        this.api = api;
        this.config = config;
    }

    public boolean exists(String namespace) {
        return api.namespaceExists(namespace);
    }

    /**
     * Create the namespace if needed, plus the service accounts used by stage
     * pods and by in-cluster workflow runs. Safe to repeat.
     *
     * @return true if the namespace was created
     */
    public boolean setup(String namespace) {
        boolean created = false;
        if (!api.namespaceExists(namespace)) {
            api.createNamespace(namespace);
            log.info("Created namespace {}", namespace);
            created = true;
        } else {
            log.info("Namespace {} already exists", namespace);
        }

        api.ensureServiceAccount(namespace, config.stageServiceAccount());
        api.ensureServiceAccount(namespace, config.workflowServiceAccount());
        api.ensureRoleBinding(namespace, config.workflowServiceAccount(), WORKFLOW_CLUSTER_ROLE,
                config.workflowServiceAccount());
        log.info("Service accounts {} and {} ready in namespace {}",
                config.stageServiceAccount(), config.workflowServiceAccount(), namespace);
        return created;
    }
}
