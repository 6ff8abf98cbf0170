package deckhand.cli;

import deckhand.engine.config.EngineConfig;
import deckhand.engine.model.StageOutcome;
import deckhand.engine.model.WorkflowRun;
import deckhand.engine.repository.RunRepository;
import deckhand.engine.store.Database;
import deckhand.engine.store.JdbcRunRepository;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.PrintWriter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Reads the local run history. Does not contact the cluster.
 */
@Command(name = "runs", description = "Show recorded workflow runs")
public class RunsCommand implements Callable<Integer> {

    @Option(names = {"-c", "--config"}, description = "INI configuration file")
    File configFile;

    @Option(names = "--project", description = "Only runs of this pipeline")
    String project;

    @Option(names = "--limit", defaultValue = "20", description = "Maximum number of runs (default: ${DEFAULT-VALUE})")
    int limit;

    @Parameters(index = "0", arity = "0..1", description = "Run id to show in detail")
    String runId;

    @Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        EngineConfig config = configFile != null ? EngineConfig.load(configFile) : EngineConfig.fromEnv();
        PrintWriter out = spec.commandLine().getOut();
        if (!config.historyEnabled()) {
            spec.commandLine().getErr().println("Run history is disabled");
            return CommandLine.ExitCode.USAGE;
        }
        try (Database db = new Database(config)) {
            RunRepository runs = new JdbcRunRepository(db);
            if (runId != null) {
                Optional<WorkflowRun> run = runs.findById(runId);
                if (run.isEmpty()) {
                    spec.commandLine().getErr().printf("No run %s%n", runId);
                    return CommandLine.ExitCode.SOFTWARE;
                }
                printDetail(out, run.get());
                return CommandLine.ExitCode.OK;
            }
            List<WorkflowRun> recent = project != null ? runs.findByProject(project, limit) : runs.findRecent(limit);
            for (WorkflowRun run : recent) {
                out.printf("%-10s %-25s %-10s %-9s %s%s%n", run.runId(), run.project(), run.namespace(), run.state(),
                        run.startedAt(), run.failedStage().map(s -> "  failed at " + s).orElse(""));
            }
            return CommandLine.ExitCode.OK;
        }
    }

    private static void printDetail(PrintWriter out, WorkflowRun run) {
        out.printf("Run %s of %s in %s: %s%s%n", run.runId(), run.project(), run.namespace(), run.state(),
                run.cancelled() ? " (cancelled)" : "");
        out.printf("Source %s %s%n", run.repoUrl(), run.branch() != null ? run.branch() : "");
        run.steps().forEach(step -> {
            out.printf("Step %d %s%n", step.step().index() + 1, step.step().stages());
            for (StageOutcome o : step.outcomes()) {
                out.printf("  %-24s %-12s attempts=%d %s%n", o.stageName(), o.state(), o.attempts(),
                        o.message() != null ? o.message() : "");
            }
        });
        run.failureHandler().ifPresent(h -> out.printf("On failure: %s %s%n", h.stageName(), h.state()));
    }
}
