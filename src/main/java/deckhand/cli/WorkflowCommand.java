package deckhand.cli;

import deckhand.engine.config.Dependencies;
import deckhand.engine.model.StageOutcome;
import deckhand.engine.model.WorkflowRun;
import deckhand.engine.workflow.WorkflowRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs a pipeline once, from this process.
 * Interrupting the JVM cancels the run and waits briefly for stage cleanup.
 */
@Command(name = "workflow", description = "Run the workflow of a pipeline repository")
public class WorkflowCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCommand.class);

    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    @Mixin
    EngineOptions engine;

    @Option(names = "--image", description = "Container image to use instead of the descriptor's")
    String image;

    @Parameters(index = "0", description = "Git URL or local directory of the pipeline")
    String repoUrl;

    @Parameters(index = "1", arity = "0..1", description = "Branch to check out")
    String branch;

    @Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        try (Dependencies deps = engine.dependencies()) {
            WorkflowRunner runner = deps.workflowRunner();
            CountDownLatch finished = new CountDownLatch(1);
            Thread hook = new Thread(() -> {
                runner.cancel();
                try {
                    finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "deckhand-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);

            WorkflowRun run;
            try {
                run = runner.run(engine.namespace(), repoUrl, branch, image);
            } finally {
                finished.countDown();
                removeHook(hook);
            }
            print(spec.commandLine().getOut(), run);
            return run.succeeded() ? CommandLine.ExitCode.OK : CommandLine.ExitCode.SOFTWARE;
        }
    }

    private static void print(PrintWriter out, WorkflowRun run) {
        out.printf("Run %s of %s: %s%n", run.runId(), run.project(), run.state());
        for (StageOutcome outcome : run.outcomes()) {
            out.printf("  %-24s %-12s attempts=%d %s%n", outcome.stageName(), outcome.state(), outcome.attempts(),
                    outcome.message() != null ? outcome.message() : "");
        }
        run.failureHandler().ifPresent(h -> out.printf("  on-failure %-13s %-12s %s%n",
                h.stageName(), h.state(), h.message() != null ? h.message() : ""));
        out.flush();
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM is shutting down, hook stays registered");
        }
    }
}
