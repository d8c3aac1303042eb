package io.snapshots.financial;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.snapshots.jobs.CrontabRenderer;
import io.snapshots.jobs.JobCommands;
import io.snapshots.jobs.JobDescriptor;
import io.snapshots.jobs.JobRegistry;
import io.snapshots.sink.Compactor;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command line used by cron and operators: run or backfill a job, list jobs, print a crontab, create tables and
 * compact append-only tables.
 */
@CommandLine.Command(name = "snapshots", mixinStandardHelpOptions = true,
        description = "Time-scoped market snapshot jobs",
        subcommands = {
                SnapshotCli.Run.class,
                SnapshotCli.Backfill.class,
                SnapshotCli.ListJobs.class,
                SnapshotCli.Crontab.class,
                SnapshotCli.InitSchema.class,
                SnapshotCli.Compact.class
        })
public final class SnapshotCli implements Callable<Integer> {
    private final Injector injector;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public SnapshotCli(Injector injector) {
        this.injector = injector;
    }

    public static void main(String[] args) {
        Injector injector = Guice.createInjector(new MarketDataModule(SnapshotConfig.fromEnv()));
        int code;
        try (JobRegistry registry = injector.getInstance(JobRegistry.class)) {
            code = commandLine(injector).execute(args);
        }
        System.exit(code);
    }

    public static CommandLine commandLine(Injector injector) {
        return new CommandLine(new SnapshotCli(injector));
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    abstract static class Sub implements Callable<Integer> {
        @CommandLine.ParentCommand
        SnapshotCli parent;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        <T> T get(Class<T> type) { return parent.injector.getInstance(type); }

        PrintWriter out() { return spec.commandLine().getOut(); }
    }

    @CommandLine.Command(name = "run", description = "Run a job once over its incremental window")
    static final class Run extends Sub {
        @CommandLine.Parameters(index = "0", description = "Job name")
        String job;

        @Override
        public Integer call() throws Exception {
            get(QuoteJobs.class).createTables();
            return get(JobCommands.class).runJob(job);
        }
    }

    @CommandLine.Command(name = "backfill", description = "Re-run a job over past slices, oldest first")
    static final class Backfill extends Sub {
        @CommandLine.Parameters(index = "0", description = "Job name")
        String job;

        @CommandLine.Option(names = {"-d", "--days"}, description = "How many days to go back", defaultValue = "1")
        int days;

        @CommandLine.Option(names = {"--step-hours"}, description = "Slice length in hours", defaultValue = "24")
        int stepHours;

        @Override
        public Integer call() throws Exception {
            if (days < 0 || stepHours < 1) {
                spec.commandLine().getErr().println("--days must be >= 0 and --step-hours >= 1");
                return 2;
            }
            get(QuoteJobs.class).createTables();
            return get(JobCommands.class).backfill(job, Duration.ofDays(days), Duration.ofHours(stepHours));
        }
    }

    @CommandLine.Command(name = "list", description = "List registered jobs and their last run")
    static final class ListJobs extends Sub {
        @Override
        public Integer call() {
            for (Map.Entry<String, JobDescriptor> e : get(JobRegistry.class).list().entrySet()) {
                JobDescriptor d = e.getValue();
                out().printf("%-22s %-14s %-10s %s%n", e.getKey(), d.schedule(), d.status(),
                        d.lastRunTime().map(Object::toString).orElse("never"));
            }
            out().flush();
            return 0;
        }
    }

    @CommandLine.Command(name = "crontab", description = "Print crontab entries for every job")
    static final class Crontab extends Sub {
        @CommandLine.Option(names = {"--launcher"}, description = "Command that accepts 'run <job>'", defaultValue = "cd /opt/snapshots && java -jar snapshots.jar")
        String launcher;

        @CommandLine.Option(names = {"--log"}, description = "Log file cron output is appended to", defaultValue = "logs/cron.log")
        String logFile;

        @Override
        public Integer call() {
            out().print(new CrontabRenderer(launcher, logFile).render(get(JobRegistry.class).list()));
            out().flush();
            return 0;
        }
    }

    @CommandLine.Command(name = "init-schema", description = "Create missing target tables")
    static final class InitSchema extends Sub {
        @Override
        public Integer call() throws Exception {
            QuoteJobs jobs = get(QuoteJobs.class);
            jobs.createTables();
            out().println("Created " + jobs.loaders().size() + " table(s) if missing");
            out().flush();
            return 0;
        }
    }

    @CommandLine.Command(name = "compact", description = "Remove superseded rows from append-only tables")
    static final class Compact extends Sub {
        @Override
        public Integer call() throws Exception {
            QuoteJobs jobs = get(QuoteJobs.class);
            jobs.createTables();
            try (Compactor compactor = new Compactor(jobs.appendLoaders())) {
                out().println("Removed " + compactor.compactAll() + " superseded row(s)");
            }
            out().flush();
            return 0;
        }
    }
}
