package deckhand.cli;

import deckhand.engine.descriptor.DescriptorLoader;
import deckhand.engine.descriptor.DescriptorValidator;
import deckhand.engine.model.ExecutionStep;
import deckhand.engine.model.PipelineDescriptor;
import deckhand.engine.source.FetchedSource;
import deckhand.engine.source.GitProjectSource;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Loads and validates a descriptor and prints the resolved plan without
 * touching the cluster.
 */
@Command(name = "validate", description = "Validate a pipeline descriptor and print its execution plan")
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Git URL or local directory of the pipeline")
    String repoUrl;

    @Parameters(index = "1", arity = "0..1", description = "Branch to check out")
    String branch;

    @Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        try (FetchedSource source = new GitProjectSource().fetch(repoUrl, branch)) {
            PipelineDescriptor descriptor = new DescriptorLoader().loadFromBundle(source.directory());
            List<ExecutionStep> plan = DescriptorValidator.validate(descriptor);
            PrintWriter out = spec.commandLine().getOut();
            out.printf("Pipeline %s (version %s), image %s%n", descriptor.name(), descriptor.version(),
                    descriptor.containerImage());
            for (ExecutionStep step : plan) {
                out.printf("  step %d: %s%n", step.index() + 1, step.stages());
            }
            descriptor.runOnFailure().ifPresent(s -> out.printf("  on failure: %s%n", s));
            return CommandLine.ExitCode.OK;
        }
    }
}
