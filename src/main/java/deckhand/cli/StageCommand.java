package deckhand.cli;

import deckhand.engine.descriptor.DescriptorException;
import deckhand.engine.descriptor.DescriptorLoader;
import deckhand.engine.execution.StageProcessRunner;
import deckhand.engine.model.PipelineDescriptor;
import deckhand.engine.model.StageConfig;
import deckhand.engine.source.FetchedSource;
import deckhand.engine.source.GitProjectSource;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * Container entry point of a stage pod. The exit code of the stage process
 * becomes the exit code of the pod.
 */
@Command(name = "stage", description = "Run one stage of a pipeline in the current container")
public class StageCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Git URL or local directory of the pipeline")
    String repoUrl;

    @Parameters(index = "1", description = "Stage to run")
    String stageName;

    @Option(names = "--branch", description = "Branch to check out")
    String branch;

    @Override
    public Integer call() {
        try (FetchedSource source = new GitProjectSource().fetch(repoUrl, branch)) {
            PipelineDescriptor descriptor = new DescriptorLoader().loadFromBundle(source.directory());
            StageConfig stage = descriptor.stage(stageName).orElseThrow(() -> new DescriptorException(
                    DescriptorException.Reason.UNKNOWN_STAGE,
                    "stage " + stageName + " is not declared in " + DescriptorLoader.DESCRIPTOR_FILENAME));
            return new StageProcessRunner().run(stage, source.directory());
        }
    }
}
