package deckhand.cli;

import deckhand.engine.config.Dependencies;
import deckhand.engine.service.ServiceDeploymentInfo;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "service", description = "Inspect and remove deployed service stages",
        subcommands = {
                ServiceCommand.ListServices.class,
                ServiceCommand.Delete.class
        })
public class ServiceCommand implements Callable<Integer> {

    @Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return CommandLine.ExitCode.USAGE;
    }

    @Command(name = "list", description = "List service deployments")
    static class ListServices implements Callable<Integer> {

        @Mixin
        EngineOptions engine;

        @Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            try (Dependencies deps = engine.dependencies()) {
                PrintWriter out = spec.commandLine().getOut();
                for (ServiceDeploymentInfo s : deps.serviceDeploymentService().list(engine.namespace())) {
                    out.printf("%-35s %d/%d ready  %s%s  git=%s%n", s.name(), s.readyReplicas(), s.replicas(),
                            s.clusterUrl() != null ? s.clusterUrl() : "-",
                            s.exposed() ? "  route=" + s.ingressRoute() : "",
                            s.gitCommit() != null ? s.gitCommit() : "-");
                }
                return CommandLine.ExitCode.OK;
            }
        }
    }

    @Command(name = "delete", description = "Delete a service deployment with its endpoint and ingress")
    static class Delete implements Callable<Integer> {

        @Mixin
        EngineOptions engine;

        @Parameters(index = "0", description = "Deployment name, e.g. my-pipeline--serve")
        String name;

        @Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            try (Dependencies deps = engine.dependencies()) {
                deps.serviceDeploymentService().delete(engine.namespace(), name);
                spec.commandLine().getOut().printf("Deleted service %s%n", name);
                return CommandLine.ExitCode.OK;
            }
        }
    }
}
