package deckhand.engine.execution;

import deckhand.engine.model.StageConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs a stage's entry point inside its container: a child process started
 * in the bundle directory, whose combined output is relayed line by line
 * through the {@code deckhand.stage.<name>} logger.
 */
public class StageProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(StageProcessRunner.class);

    /**
     * @return the child's exit code
     * @throws IllegalStateException if the process cannot be started
     */
    public int run(StageConfig stage, Path bundleRoot) {
        List<String> command = command(stage, bundleRoot);
        if (!stage.requirements().isEmpty()) {
            log.info("Stage {} declares requirements: {}", stage.name(), stage.requirements());
        }
        log.info("Starting stage {}: {}", stage.name(), command);

        Logger output = LoggerFactory.getLogger("deckhand.stage." + stage.name());
        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(bundleRoot.toFile())
                .redirectErrorStream(true);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to start stage " + stage.name() + ": " + e.getMessage(), e);
        }

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.info(line);
            }
        } catch (IOException e) {
            log.warn("Lost output of stage {}: {}", stage.name(), e.getMessage());
        }

        try {
            int exit = process.waitFor();
            if (exit == 0) {
                log.info("Stage {} finished", stage.name());
            } else {
                log.error("Stage {} exited with code {}", stage.name(), exit);
            }
            return exit;
        } catch (InterruptedException e) {
            process.destroy();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for stage " + stage.name(), e);
        }
    }

    /**
     * Entry point files in the bundle are addressed by path; anything else is
     * looked up on the PATH.
     */
    static List<String> command(StageConfig stage, Path bundleRoot) {
        List<String> command = new ArrayList<>();
        Path local = bundleRoot.resolve(stage.entryPoint());
        command.add(Files.isRegularFile(local) ? local.toAbsolutePath().toString() : stage.entryPoint());
        command.addAll(stage.args());
        return command;
    }
}
