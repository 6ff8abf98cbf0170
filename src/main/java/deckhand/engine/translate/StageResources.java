package deckhand.engine.translate;

import deckhand.cluster.spec.DeploymentSpec;
import deckhand.cluster.spec.EndpointSpec;
import deckhand.cluster.spec.IngressSpec;
import deckhand.cluster.spec.JobSpec;
import deckhand.engine.model.StageKind;

import java.util.Optional;

/**
 * Resource specs produced for one stage submission.
 * A batch stage has only a job; a service stage has a deployment, an
 * endpoint and, when exposed, an ingress.
 */
public record StageResources(
        StageKind kind,
        JobSpec job,
        DeploymentSpec deployment,
        EndpointSpec endpoint,
        IngressSpec ingress) {

    public static StageResources batch(JobSpec job) {
        return new StageResources(StageKind.BATCH, job, null, null, null);
    }

    public static StageResources service(DeploymentSpec deployment, EndpointSpec endpoint, IngressSpec ingress) {
        return new StageResources(StageKind.SERVICE, null, deployment, endpoint, ingress);
    }

    public Optional<IngressSpec> ingressIfExposed() {
        return Optional.ofNullable(ingress);
    }
}
