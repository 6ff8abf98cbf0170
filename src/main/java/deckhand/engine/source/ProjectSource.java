package deckhand.engine.source;

/**
 * Fetches a pipeline's code bundle.
 */
@FunctionalInterface
public interface ProjectSource {

    /**
     * Fetch the bundle at the given location and branch.
     *
     * @param repoUrl repository location
     * @param branch  branch or ref, null for the default branch
     * @return the local checkout; the caller closes it
     * @throws SourceException if the bundle cannot be fetched
     */
    FetchedSource fetch(String repoUrl, String branch);
}
