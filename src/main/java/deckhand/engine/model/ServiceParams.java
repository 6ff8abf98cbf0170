package deckhand.engine.model;

/**
 * Service stage parameters.
 *
 * @param maxStartupTimeSeconds deadline for all replicas to become ready
 * @param replicas              desired replica count
 * @param port                  container and endpoint port
 * @param exposeExternally      whether an ingress route is created
 */
public record ServiceParams(int maxStartupTimeSeconds, int replicas, int port, boolean exposeExternally) {
}
