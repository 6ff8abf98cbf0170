package deckhand.engine.service;

/**
 * Summary of a running service stage.
 *
 * @param ingressRoute external route, null when not exposed
 */
public record ServiceDeploymentInfo(
        String name,
        String namespace,
        String pipeline,
        String stage,
        int replicas,
        int readyReplicas,
        Integer port,
        String clusterUrl,
        String ingressRoute,
        String gitCommit) {

    public boolean exposed() {
        return ingressRoute != null;
    }
}
