package deckhand.engine.translate;

import deckhand.engine.model.PipelineDescriptor;

import java.util.Objects;

/**
 * Run-wide values shared by every stage's resources.
 *
 * @param namespace    target namespace
 * @param project      pipeline name from the descriptor
 * @param image        container image, descriptor value unless overridden
 * @param repoUrl      code bundle location
 * @param branch       code bundle branch
 * @param runId        short identifier of this workflow run
 * @param secretsGroup secret name prefix, null when not grouped
 * @param gitCommit    commit hash of the bundle, null when unknown
 */
public record PipelineContext(
        String namespace,
        String project,
        String image,
        String repoUrl,
        String branch,
        String runId,
        String secretsGroup,
        String gitCommit) {

    public PipelineContext {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(project, "project");
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(runId, "runId");
    }

    public static PipelineContext of(PipelineDescriptor descriptor, String namespace, String repoUrl,
            String branch, String runId, String imageOverride, String gitCommit) {
        String image = imageOverride != null && !imageOverride.isBlank()
                ? imageOverride
                : descriptor.containerImage();
        return new PipelineContext(namespace, descriptor.name(), image, repoUrl, branch, runId,
                descriptor.secretsGroup().orElse(null), gitCommit);
    }
}
