package deckhand.cluster.spec;

import java.util.Map;

/**
 * Run-to-completion job. The engine owns retries, so {@code backoffLimit} is
 * 0 for stage jobs.
 */
public record JobSpec(
        String namespace,
        String name,
        Map<String, String> labels,
        ContainerSpec container,
        String serviceAccount,
        String restartPolicy,
        int backoffLimit) {

    public JobSpec {
        labels = Map.copyOf(labels);
    }
}
