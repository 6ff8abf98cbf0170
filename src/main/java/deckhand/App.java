package deckhand;

import deckhand.cli.CronJobCommand;
import deckhand.cli.DeployCommand;
import deckhand.cli.RunsCommand;
import deckhand.cli.SecretCommand;
import deckhand.cli.ServiceCommand;
import deckhand.cli.SetupNamespaceCommand;
import deckhand.cli.StageCommand;
import deckhand.cli.ValidateCommand;
import deckhand.cli.WorkflowCommand;
import deckhand.cluster.OrchestrationApiException;
import deckhand.engine.descriptor.DescriptorException;
import deckhand.engine.graph.GraphException;
import deckhand.engine.source.SourceException;
import deckhand.engine.workflow.WorkflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Command line entry point.
 *
 * <p>
 * Exit codes: 0 success, 1 workflow or stage failure and cluster API errors,
 * 2 descriptor, graph, setup and usage errors.
 */
@Command(name = "deckhand", mixinStandardHelpOptions = true, version = "deckhand 0.4.0",
        description = "Deploys pipelines of batch jobs and services to a Kubernetes cluster",
        subcommands = {
                WorkflowCommand.class,
                StageCommand.class,
                DeployCommand.class,
                CronJobCommand.class,
                SecretCommand.class,
                ServiceCommand.class,
                SetupNamespaceCommand.class,
                RunsCommand.class,
                ValidateCommand.class
        })
public class App implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    @Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return CommandLine.ExitCode.USAGE;
    }

    public static CommandLine commandLine() {
        return new CommandLine(new App()).setExecutionExceptionHandler(App::handleException);
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static int handleException(Exception e, CommandLine cmd, CommandLine.ParseResult parseResult) {
        int code = exitCode(e);
        if (code == CommandLine.ExitCode.USAGE) {
            log.error("{}", e.getMessage());
            if (e instanceof DescriptorException) {
                ((DescriptorException) e).problems().forEach(p -> log.error("  - {}", p));
            }
        } else if (e instanceof OrchestrationApiException) {
            log.error("Cluster API error: {}", e.getMessage());
        } else {
            log.error("Command failed", e);
        }
        return code;
    }

    static int exitCode(Exception e) {
        if (e instanceof DescriptorException || e instanceof GraphException
                || e instanceof SourceException || e instanceof IllegalArgumentException) {
            return CommandLine.ExitCode.USAGE;
        }
        if (e instanceof WorkflowException) {
            return ((WorkflowException) e).reason() == WorkflowException.Reason.CLUSTER_UNAVAILABLE
                    ? CommandLine.ExitCode.SOFTWARE
                    : CommandLine.ExitCode.USAGE;
        }
        return CommandLine.ExitCode.SOFTWARE;
    }
}
