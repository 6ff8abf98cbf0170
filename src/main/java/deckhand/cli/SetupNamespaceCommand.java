package deckhand.cli;

import deckhand.engine.config.Dependencies;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(name = "setup-namespace", description = "Create a namespace with the service accounts deckhand needs")
public class SetupNamespaceCommand implements Callable<Integer> {

    @Mixin
    EngineOptions engine;

    @Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        try (Dependencies deps = engine.dependencies()) {
            boolean created = deps.namespaceService().setup(engine.namespace());
            spec.commandLine().getOut().printf("Namespace %s %s%n", engine.namespace(),
                    created ? "created" : "updated");
            return CommandLine.ExitCode.OK;
        }
    }
}
