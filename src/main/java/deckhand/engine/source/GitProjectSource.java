package deckhand.engine.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Clones a single branch with the {@code git} command line client.
 * A local directory path is used as-is without cloning.
 */
public class GitProjectSource implements ProjectSource {

    private static final Logger log = LoggerFactory.getLogger(GitProjectSource.class);

    private static final long CLONE_TIMEOUT_SECONDS = 300;

    @Override
    public FetchedSource fetch(String repoUrl, String branch) {
        if (!repoUrl.contains("://") && !repoUrl.contains("@")) {
            Path local = Path.of(repoUrl);
            if (Files.isDirectory(local)) {
                log.info("Using local project directory {}", local.toAbsolutePath());
                return FetchedSource.existing(local);
            }
        }

        Path target;
        try {
            target = Files.createTempDirectory("deckhand-src-");
        } catch (IOException e) {
            throw new SourceException("Failed to create checkout directory", e);
        }

        List<String> clone = new ArrayList<>(List.of("git", "clone", "--depth", "1", "--single-branch"));
        if (branch != null && !branch.isBlank()) {
            clone.add("--branch");
            clone.add(branch);
        }
        clone.add(repoUrl);
        clone.add(target.toString());

        log.info("Cloning {} (branch {})", repoUrl, branch != null ? branch : "default");
        FetchedSource source = new FetchedSource(target, null, true);
        try {
            run(clone, null);
            String commit = run(List.of("git", "rev-parse", "HEAD"), target).trim();
            log.info("Checked out commit {}", commit);
            return new FetchedSource(target, commit, true);
        } catch (SourceException e) {
            source.close();
            throw e;
        }
    }

    private String run(List<String> command, Path workDir) {
        ProcessBuilder pb = new ProcessBuilder(command).redirectErrorStream(true);
        if (workDir != null) {
            pb.directory(workDir.toFile());
        }
        pb.environment().put("GIT_TERMINAL_PROMPT", "0");
        try {
            Process process = pb.start();
            byte[] output = process.getInputStream().readAllBytes();
            if (!process.waitFor(CLONE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new SourceException(command.get(1) + " timed out after " + CLONE_TIMEOUT_SECONDS + "s");
            }
            String text = new String(output, StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                throw new SourceException("git " + command.get(1) + " failed with exit code "
                        + process.exitValue() + ": " + text.strip());
            }
            return text;
        } catch (IOException e) {
            throw new SourceException("Failed to run git: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceException("Interrupted while running git", e);
        }
    }
}
