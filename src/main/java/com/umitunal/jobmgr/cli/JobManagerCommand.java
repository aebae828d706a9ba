package com.umitunal.jobmgr.cli;

import com.umitunal.jobmgr.JobManager;
import com.umitunal.jobmgr.core.Job;
import com.umitunal.jobmgr.core.JobMetrics;
import com.umitunal.jobmgr.error.JobManagerException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "jobmgr",
        mixinStandardHelpOptions = true,
        description = "Queue shell commands and run them in the background",
        subcommands = {
                JobManagerCommand.AddCommand.class,
                JobManagerCommand.ListCommand.class,
                JobManagerCommand.RunCommand.class,
                JobManagerCommand.PauseCommand.class,
                JobManagerCommand.ResumeCommand.class,
                JobManagerCommand.ViewCommand.class,
                JobManagerCommand.StartCommand.class,
                JobManagerCommand.StopCommand.class,
                JobManagerCommand.DeleteCommand.class,
                JobManagerCommand.CleanCommand.class,
                JobManagerCommand.PruneCommand.class,
                JobManagerCommand.StatusCommand.class,
                JobManagerCommand.DaemonCommand.class
        }
)
public final class JobManagerCommand implements Runnable {
    static final String DAEMON_REMINDER = "Daemon is not running. Start it with 'jobmgr start'";

    private final ManagerFactory factory;
    private JobManager manager;

    @Spec
    CommandSpec spec;

    public JobManagerCommand(ManagerFactory factory) {
        this.factory = factory;
    }

    /**
     * Build the command line with error reporting wired in: failures of an operation
     * print their message to stderr and exit with 1.
     */
    public static CommandLine newCommandLine(ManagerFactory factory) {
        CommandLine commandLine = new CommandLine(new JobManagerCommand(factory));
        commandLine.setUnmatchedOptionsArePositionalParams(true);
        commandLine.setExecutionExceptionHandler((ex, cl, parseResult) -> {
            if (ex instanceof JobManagerException
                    || ex instanceof IllegalStateException
                    || ex instanceof IllegalArgumentException) {
                cl.getErr().println(ex.getMessage());
                cl.getErr().flush();
                return 1;
            }
            throw ex;
        });
        return commandLine;
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    JobManager manager() throws JobManagerException {
        if (manager == null) {
            manager = factory.create();
        }
        return manager;
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    /**
     * Creates the job manager on first use, so {@code --help} works without a store.
     */
    @FunctionalInterface
    public interface ManagerFactory {
        JobManager create() throws JobManagerException;
    }

    /**
     * Base for user commands: prints a reminder afterwards when no daemon is running.
     */
    abstract static class JobCommand implements Callable<Integer> {
        @ParentCommand
        JobManagerCommand parent;

        @Override
        public Integer call() throws Exception {
            try {
                return execute(parent.manager(), parent.out());
            } finally {
                if (remindsAboutDaemon() && parent.manager != null && !parent.manager.isDaemonRunning()) {
                    parent.out().println(DAEMON_REMINDER);
                }
                parent.out().flush();
            }
        }

        abstract int execute(JobManager manager, PrintWriter out) throws Exception;

        boolean remindsAboutDaemon() {
            return true;
        }
    }

    @Command(name = "add", description = "Queue a command to run in the current directory")
    static final class AddCommand extends JobCommand {
        @Parameters(arity = "1..*", paramLabel = "COMMAND", description = "Command line to run")
        List<String> words;

        @Override
        int execute(JobManager manager, PrintWriter out) throws JobManagerException {
            Job job = manager.add(String.join(" ", words), Paths.get("").toAbsolutePath());
            out.println("Added job " + job.getId() + ": " + job.getCommand());
            return 0;
        }
    }

    @Command(name = "list", description = "List jobs with their status")
    static final class ListCommand extends JobCommand {
        @Override
        int execute(JobManager manager, PrintWriter out) throws JobManagerException {
            List<Job> jobs = manager.list();
            if (jobs.isEmpty()) {
                out.println("No jobs.");
            }
            for (Job job : jobs) {
                out.println(job.toListLine());
            }
            return 0;
        }
    }

    @Command(name = "run", description = "Run all pending jobs now, without the daemon, and wait for them")
    static final class RunCommand extends JobCommand {
        @Override
        int execute(JobManager manager, PrintWriter out) throws Exception {
            int started = manager.runPending();
            out.println("Ran " + started + " job(s).");
            return 0;
        }
    }

    @Command(name = "pause", description = "Suspend a running job")
    static final class PauseCommand extends JobCommand {
        @Parameters(index = "0", paramLabel = "ID")
        int id;

        @Override
        int execute(JobManager manager, PrintWriter out) throws JobManagerException {
            manager.pause(id);
            out.println("Paused job " + id + ".");
            return 0;
        }
    }

    @Command(name = "resume", description = "Continue a paused job")
    static final class ResumeCommand extends JobCommand {
        @Parameters(index = "0", paramLabel = "ID")
        int id;

        @Override
        int execute(JobManager manager, PrintWriter out) throws JobManagerException {
            manager.resume(id);
            out.println("Resumed job " + id + ".");
            return 0;
        }
    }

    @Command(name = "view", description = "Show the captured output of a finished job")
    static final class ViewCommand extends JobCommand {
        @Parameters(index = "0", paramLabel = "ID")
        int id;

        @Override
        int execute(JobManager manager, PrintWriter out) throws JobManagerException {
            out.print(manager.view(id));
            return 0;
        }
    }

    @Command(name = "start", description = "Start the background daemon")
    static final class StartCommand extends JobCommand {
        @Override
        int execute(JobManager manager, PrintWriter out) throws JobManagerException {
            long pid = manager.startDaemon();
            out.println("Daemon started (pid " + pid + ").");
            return 0;
        }

        @Override
        boolean remindsAboutDaemon() {
            return false;
        }
    }

    @Command(name = "stop", description = "Stop the background daemon")
    static final class StopCommand extends JobCommand {
        @Override
        int execute(JobManager manager, PrintWriter out) throws JobManagerException {
            manager.stopDaemon();
            out.println("Daemon stopped.");
            return 0;
        }

        @Override
        boolean remindsAboutDaemon() {
            return false;
        }
    }

    @Command(name = "delete", description = "Delete a job; later ids shift down by one")
    static final class DeleteCommand extends JobCommand {
        @Parameters(index = "0", paramLabel = "ID")
        int id;

        @Override
        int execute(JobManager manager, PrintWriter out) throws JobManagerException {
            Job removed = manager.delete(id);
            out.println("Deleted job " + id + ": " + removed.getCommand());
            return 0;
        }
    }

    @Command(name = "clean", description = "Delete every job and all output (daemon must be stopped)")
    static final class CleanCommand extends JobCommand {
        @Override
        int execute(JobManager manager, PrintWriter out) throws JobManagerException {
            manager.clean();
            out.println("Removed all jobs and output.");
            return 0;
        }
    }

    @Command(name = "prune", description = "Delete completed and failed jobs")
    static final class PruneCommand extends JobCommand {
        @Override
        int execute(JobManager manager, PrintWriter out) throws JobManagerException {
            List<Job> removed = manager.prune();
            out.println("Removed " + removed.size() + " finished job(s).");
            return 0;
        }
    }

    @Command(name = "status", description = "Show job counts and daemon state")
    static final class StatusCommand extends JobCommand {
        @Override
        int execute(JobManager manager, PrintWriter out) throws JobManagerException {
            JobMetrics metrics = manager.metrics();
            out.println("pending:   " + metrics.getPendingJobs());
            out.println("running:   " + metrics.getRunningJobs());
            out.println("paused:    " + metrics.getPausedJobs());
            out.println("completed: " + metrics.getCompletedJobs());
            out.println("error:     " + metrics.getFailedJobs());
            if (manager.isDaemonRunning()) {
                out.println(manager.isDaemonLockStale()
                        ? "daemon:    lock is stale (holder is gone); run 'jobmgr stop' to clear it"
                        : "daemon:    running");
            }
            return 0;
        }
    }

    @Command(name = "daemon", hidden = true, description = "Run the daemon loop in the foreground")
    static final class DaemonCommand extends JobCommand {
        @Override
        int execute(JobManager manager, PrintWriter out) throws JobManagerException {
            manager.runDaemon();
            return 0;
        }

        @Override
        boolean remindsAboutDaemon() {
            return false;
        }
    }
}
