package deckhand.cluster.model;

import java.util.Map;

/**
 * Point-in-time view of a deployment's rollout.
 *
 * @param desiredReplicas     replicas requested in the spec
 * @param replicas            pods of every revision the controller manages
 * @param readyReplicas       ready pods of every revision
 * @param updatedReplicas     pods running the latest template
 * @param unavailableReplicas pods still needed before the deployment is
 *                            fully available
 * @param revision            rollout revision number, 0 when unknown
 */
public record DeploymentObservation(
        String name,
        int desiredReplicas,
        int replicas,
        int readyReplicas,
        int updatedReplicas,
        int availableReplicas,
        int unavailableReplicas,
        long generation,
        long observedGeneration,
        long revision,
        Map<String, String> labels,
        Integer containerPort) {

    public DeploymentObservation {
        labels = labels != null ? Map.copyOf(labels) : Map.of();
    }

    /**
     * True once the controller has observed the latest spec, every pod runs
     * the latest template and none is unavailable. Ready counts alone are not
     * enough: during a surge rollout they include pods of the old revision.
     */
    public boolean isRolledOut(int expectedReplicas) {
        return observedGeneration >= generation
                && updatedReplicas >= expectedReplicas
                && replicas == updatedReplicas
                && availableReplicas >= updatedReplicas
                && unavailableReplicas == 0;
    }

    public String describe() {
        return "ready=" + readyReplicas + "/" + desiredReplicas
                + ", updated=" + updatedReplicas + "/" + replicas
                + ", unavailable=" + unavailableReplicas
                + ", generation=" + observedGeneration + "/" + generation
                + ", revision=" + revision;
    }
}
