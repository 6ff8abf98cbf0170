package deckhand.cli;

import deckhand.cluster.model.CronJobInfo;
import deckhand.cluster.model.JobObservation;
import deckhand.engine.config.Dependencies;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "cronjob", description = "Manage scheduled workflow runs",
        subcommands = {
                CronJobCommand.Create.class,
                CronJobCommand.Delete.class,
                CronJobCommand.ListCronJobs.class,
                CronJobCommand.History.class,
                CronJobCommand.Logs.class
        })
public class CronJobCommand implements Callable<Integer> {

    @Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return CommandLine.ExitCode.USAGE;
    }

    @Command(name = "create", description = "Run a workflow on a cron schedule")
    static class Create implements Callable<Integer> {

        @Mixin
        EngineOptions engine;

        @Option(names = "--name", required = true, description = "Cron job name")
        String name;

        @Option(names = "--schedule", required = true, description = "Five-field cron expression")
        String schedule;

        @Option(names = "--retries", defaultValue = "2", description = "Retries of each workflow run")
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
                String created = deps.scheduleService().createCronJob(engine.namespace(), name, schedule, repoUrl,
                        branch, retries);
                spec.commandLine().getOut().printf("Created cron job %s in namespace %s%n", created,
                        engine.namespace());
                return CommandLine.ExitCode.OK;
            }
        }
    }

    @Command(name = "delete", description = "Delete a cron job")
    static class Delete implements Callable<Integer> {

        @Mixin
        EngineOptions engine;

        @Parameters(index = "0", description = "Cron job name")
        String name;

        @Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            try (Dependencies deps = engine.dependencies()) {
                deps.scheduleService().deleteCronJob(engine.namespace(), name);
                spec.commandLine().getOut().printf("Deleted cron job %s%n", name);
                return CommandLine.ExitCode.OK;
            }
        }
    }

    @Command(name = "list", description = "List cron jobs")
    static class ListCronJobs implements Callable<Integer> {

        @Mixin
        EngineOptions engine;

        @Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            try (Dependencies deps = engine.dependencies()) {
                List<CronJobInfo> cronJobs = deps.scheduleService().listCronJobs(engine.namespace());
                PrintWriter out = spec.commandLine().getOut();
                if (cronJobs.isEmpty()) {
                    out.printf("No cron jobs in namespace %s%n", engine.namespace());
                }
                for (CronJobInfo cron : cronJobs) {
                    out.printf("%-30s %-16s %-25s %s %s%n", cron.name(), cron.schedule(),
                            cron.lastScheduleTime() != null ? cron.lastScheduleTime() : "-",
                            cron.repoUrl(), cron.branch() != null ? cron.branch() : "");
                }
                return CommandLine.ExitCode.OK;
            }
        }
    }

    @Command(name = "history", description = "Show recent runs of a cron job")
    static class History implements Callable<Integer> {

        @Mixin
        EngineOptions engine;

        @Parameters(index = "0", description = "Cron job name")
        String name;

        @Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            try (Dependencies deps = engine.dependencies()) {
                PrintWriter out = spec.commandLine().getOut();
                for (JobObservation job : deps.scheduleService().workflowHistory(engine.namespace(), name)) {
                    out.printf("%-40s %-10s %-25s %s%n", job.name(), job.phase(),
                            job.startTime() != null ? job.startTime() : "-",
                            job.completionTime() != null ? job.completionTime() : "-");
                }
                return CommandLine.ExitCode.OK;
            }
        }
    }

    @Command(name = "logs", description = "Print the log of one workflow run")
    static class Logs implements Callable<Integer> {

        @Mixin
        EngineOptions engine;

        @Parameters(index = "0", description = "Workflow job name, as shown by history")
        String jobName;

        @Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            try (Dependencies deps = engine.dependencies()) {
                Optional<String> logs = deps.scheduleService().workflowLogs(engine.namespace(), jobName);
                if (logs.isEmpty()) {
                    spec.commandLine().getErr().printf("No pod found for job %s%n", jobName);
                    return CommandLine.ExitCode.SOFTWARE;
                }
                spec.commandLine().getOut().print(logs.get());
                return CommandLine.ExitCode.OK;
            }
        }
    }
}
