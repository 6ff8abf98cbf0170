package deckhand.cli;

import deckhand.cluster.model.SecretInfo;
import deckhand.engine.config.Dependencies;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "secret", description = "Manage secrets referenced by stages",
        subcommands = {
                SecretCommand.Create.class,
                SecretCommand.Delete.class,
                SecretCommand.ListSecrets.class
        })
public class SecretCommand implements Callable<Integer> {

    @Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return CommandLine.ExitCode.USAGE;
    }

    @Command(name = "create", description = "Create or replace a secret")
    static class Create implements Callable<Integer> {

        @Mixin
        EngineOptions engine;

        @Option(names = "--group", description = "Secret group, usually the pipeline's secrets_group")
        String group;

        @Option(names = "--data", required = true, description = "KEY=VALUE pair, repeatable")
        Map<String, String> data = new LinkedHashMap<>();

        @Parameters(index = "0", description = "Secret name")
        String name;

        @Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            try (Dependencies deps = engine.dependencies()) {
                String created = deps.secretService().create(engine.namespace(), group, name, data);
                spec.commandLine().getOut().printf("Created secret %s with keys %s%n", created, data.keySet());
                return CommandLine.ExitCode.OK;
            }
        }
    }

    @Command(name = "delete", description = "Delete a secret")
    static class Delete implements Callable<Integer> {

        @Mixin
        EngineOptions engine;

        @Option(names = "--group", description = "Secret group")
        String group;

        @Parameters(index = "0", description = "Secret name")
        String name;

        @Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            try (Dependencies deps = engine.dependencies()) {
                deps.secretService().delete(engine.namespace(), group, name);
                spec.commandLine().getOut().printf("Deleted secret %s%n", name);
                return CommandLine.ExitCode.OK;
            }
        }
    }

    @Command(name = "list", description = "List secret names and keys")
    static class ListSecrets implements Callable<Integer> {

        @Mixin
        EngineOptions engine;

        @Option(names = "--group", description = "Only secrets of this group")
        String group;

        @Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            try (Dependencies deps = engine.dependencies()) {
                List<SecretInfo> secrets = deps.secretService().list(engine.namespace(), group);
                PrintWriter out = spec.commandLine().getOut();
                for (SecretInfo secret : secrets) {
                    out.printf("%-30s %-15s %s%n", secret.name(), secret.group() != null ? secret.group() : "-",
                            secret.keys());
                }
                return CommandLine.ExitCode.OK;
            }
        }
    }
}
