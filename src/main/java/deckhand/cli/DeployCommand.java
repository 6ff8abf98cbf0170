package deckhand.cli;

import deckhand.engine.config.Dependencies;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Submits a single workflow run to the cluster instead of running it here.
 */
@Command(name = "deploy", description = "Run a workflow once inside the cluster")
public class DeployCommand implements Callable<Integer> {

    @Mixin
    EngineOptions engine;

    @Option(names = "--name", description = "Job name prefix (default: repository name)")
    String name;

    @Option(names = "--retries", defaultValue = "0", description = "Retries of the workflow job")
    int retries;

    @Parameters(index = "0", description = "Git URL of the pipeline")
    String repoUrl;

    @Parameters(index = "1", arity = "0..1", description = "Branch to check out")
    String branch;

    @Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        try (Dependencies deps = engine.dependencies()) {
            String job = deps.scheduleService().submitWorkflowJob(engine.namespace(),
                    name != null ? name : repositoryName(repoUrl), repoUrl, branch, retries);
            spec.commandLine().getOut().printf("Submitted workflow job %s in namespace %s%n", job,
                    engine.namespace());
            return CommandLine.ExitCode.OK;
        }
    }

    static String repositoryName(String repoUrl) {
        String trimmed = repoUrl.replaceAll("/+$", "");
        if (trimmed.endsWith(".git")) {
            trimmed = trimmed.substring(0, trimmed.length() - 4);
        }
        int slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf(':'));
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }
}
