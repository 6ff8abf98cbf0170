package deckhand.engine.service;

import deckhand.cluster.OrchestrationApi;
import deckhand.cluster.model.DeploymentObservation;
import deckhand.engine.translate.ResourceNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lists and removes the long-running deployments created by service stages.
 */
public class ServiceDeploymentService {

    private static final Logger log = LoggerFactory.getLogger(ServiceDeploymentService.class);

    private final OrchestrationApi api;

    public ServiceDeploymentService(OrchestrationApi api) {
        this.api = api;
    }

    public List<ServiceDeploymentInfo> list(String namespace) {
        List<ServiceDeploymentInfo> services = new ArrayList<>();
        for (DeploymentObservation d : api.listDeployments(namespace,
                Map.of(ResourceNames.APP_LABEL, ResourceNames.APP))) {
            String route = api.ingressExists(namespace, d.name())
                    ? ResourceNames.ingressRoute(namespace, d.name())
                    : null;
            String url = d.containerPort() != null
                    ? ResourceNames.clusterUrl(namespace, d.name(), d.containerPort())
                    : null;
            services.add(new ServiceDeploymentInfo(
                    d.name(),
                    namespace,
                    d.labels().get(ResourceNames.PIPELINE_LABEL),
                    d.labels().get(ResourceNames.STAGE_LABEL),
                    d.desiredReplicas(),
                    d.readyReplicas(),
                    d.containerPort(),
                    url,
                    route,
                    d.labels().get(ResourceNames.GIT_COMMIT_LABEL)));
        }
        return services;
    }

    /**
     * Delete a deployment together with its endpoint and ingress.
     *
     * @throws IllegalArgumentException if no such deployment exists
     */
    public void delete(String namespace, String name) {
        if (api.readDeployment(namespace, name).isEmpty()) {
            throw new IllegalArgumentException("deployment " + name + " not found in namespace " + namespace);
        }
        api.deleteDeployment(namespace, name);
        if (api.endpointExists(namespace, name)) {
            api.deleteEndpoint(namespace, name);
        }
        if (api.ingressExists(namespace, name)) {
            api.deleteIngress(namespace, name);
        }
        log.info("Deleted service deployment {} from namespace {}", name, namespace);
    }
}
