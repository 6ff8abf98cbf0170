package deckhand.engine.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * A code bundle checked out into a local directory.
 * Closing it deletes the directory when it was created for this fetch.
 */
public final class FetchedSource implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FetchedSource.class);

    private final Path directory;
    private final String commitHash;
    private final boolean temporary;

    public FetchedSource(Path directory, String commitHash, boolean temporary) {
        this.directory = directory;
        this.commitHash = commitHash;
        this.temporary = temporary;
    }

    /** Bundle that is not owned by the fetch and is kept on close. */
    public static FetchedSource existing(Path directory) {
        return new FetchedSource(directory, null, false);
    }

    public Path directory() {
        return directory;
    }

    /** Commit hash of the checkout, null when unknown. */
    public String commitHash() {
        return commitHash;
    }

    @Override
    public void close() {
        if (!temporary || !Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.delete(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
            log.debug("Deleted checkout {}", directory);
        } catch (IOException | UncheckedIOException e) {
            log.warn("Failed to delete checkout {}: {}", directory, e.getMessage());
        }
    }
}
