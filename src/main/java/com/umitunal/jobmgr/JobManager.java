package com.umitunal.jobmgr;

import com.umitunal.jobmgr.config.ManagerConfig;
import com.umitunal.jobmgr.core.Job;
import com.umitunal.jobmgr.core.JobMetrics;
import com.umitunal.jobmgr.core.JobStore;
import com.umitunal.jobmgr.core.OutputSink;
import com.umitunal.jobmgr.daemon.Daemon;
import com.umitunal.jobmgr.daemon.DaemonLauncher;
import com.umitunal.jobmgr.daemon.DaemonLock;
import com.umitunal.jobmgr.daemon.JobScheduler;
import com.umitunal.jobmgr.error.JobManagerException;
import com.umitunal.jobmgr.error.JobNotFoundException;
import com.umitunal.jobmgr.error.StoreBusyException;
import com.umitunal.jobmgr.process.CommandExecutor;
import com.umitunal.jobmgr.process.KillSignaller;
import com.umitunal.jobmgr.process.ProcessController;
import com.umitunal.jobmgr.process.ShellCommandExecutor;
import com.umitunal.jobmgr.process.Signaller;
import com.umitunal.jobmgr.storage.FileOutputSink;
import com.umitunal.jobmgr.storage.FlatFileJobStore;
import com.umitunal.jobmgr.storage.StoreLayout;
import com.umitunal.jobmgr.worker.WorkerPool;

import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for every user-facing operation: the CLI translates each command
 * into one call on this class.
 */
public class JobManager {
    private final ManagerConfig config;
    private final JobStore store;
    private final OutputSink outputSink;
    private final ProcessController processController;
    private final CommandExecutor commandExecutor;
    private final DaemonLock daemonLock;
    private final DaemonLauncher launcher;

    public JobManager(ManagerConfig config, JobStore store, OutputSink outputSink, Signaller signaller,
                      CommandExecutor commandExecutor, DaemonLock daemonLock, DaemonLauncher launcher) {
        this.config = config;
        this.store = store;
        this.outputSink = outputSink;
        this.processController = new ProcessController(store, signaller);
        this.commandExecutor = commandExecutor;
        this.daemonLock = daemonLock;
        this.launcher = launcher;
    }

    /**
     * Wire the file-backed components under the configured base directory.
     *
     * @param mainClass class the detached daemon JVM is started with
     */
    public static JobManager create(ManagerConfig config, String mainClass) throws JobManagerException {
        StoreLayout layout = new StoreLayout(config.getBaseDirectory());
        DaemonLock lock = new DaemonLock(layout.daemonLockFile());
        return new JobManager(config,
                new FlatFileJobStore(config),
                new FileOutputSink(config),
                new KillSignaller(),
                new ShellCommandExecutor(config.getShell()),
                lock,
                new DaemonLauncher(config, lock, mainClass));
    }

    public Job add(String command, Path workdir) throws JobManagerException {
        return store.add(command, workdir.toAbsolutePath().normalize().toString());
    }

    public List<Job> list() throws JobManagerException {
        return store.list();
    }

    public JobMetrics metrics() throws JobManagerException {
        return store.metrics();
    }

    /**
     * Dispatch every pending job in this process and wait for all of them to finish.
     *
     * @return number of jobs that were started
     */
    public int runPending() throws JobManagerException, InterruptedException {
        try (WorkerPool pool = newWorkerPool()) {
            int started = new JobScheduler(store, pool).dispatchAll();
            pool.awaitIdle();
            return started;
        }
    }

    public Job pause(int id) throws JobManagerException {
        return processController.pause(id);
    }

    public Job resume(int id) throws JobManagerException {
        return processController.resume(id);
    }

    /**
     * Captured output of job {@code id}.
     *
     * @throws JobNotFoundException if the id is unknown or the job has not finished yet
     */
    public String view(int id) throws JobManagerException {
        Job job = store.get(id);
        try {
            return outputSink.read(job.getKey());
        } catch (JobNotFoundException e) {
            throw new JobNotFoundException("No output yet for job " + id + " (status " + job.getStatus() + ")");
        }
    }

    public Job delete(int id) throws JobManagerException {
        Job removed = store.delete(id);
        outputSink.delete(removed.getKey());
        return removed;
    }

    /**
     * Remove every job and all output.
     *
     * @throws StoreBusyException if the daemon is running or a job is running or paused
     */
    public void clean() throws JobManagerException {
        // Both checks and the output removal happen under the store lock, before
        // any job is removed
        store.deleteAll(() -> {
            if (daemonLock.isHeld()) {
                throw new StoreBusyException("Daemon is running; stop it before cleaning");
            }
            outputSink.clear();
        });
    }

    /**
     * Remove finished jobs and their output, leaving pending and active ones.
     */
    public List<Job> prune() throws JobManagerException {
        List<Job> removed = store.deleteFinished();
        for (Job job : removed) {
            outputSink.delete(job.getKey());
        }
        return removed;
    }

    public boolean isDaemonRunning() {
        return daemonLock.isHeld();
    }

    public boolean isDaemonLockStale() throws JobManagerException {
        return daemonLock.isStale();
    }

    public long startDaemon() throws JobManagerException {
        return launcher.start();
    }

    public long stopDaemon() throws JobManagerException {
        return launcher.stop();
    }

    /**
     * Run the daemon loop in this process until it receives SIGTERM.
     */
    public void runDaemon() throws JobManagerException {
        WorkerPool pool = newWorkerPool();
        Daemon daemon = new Daemon(daemonLock, new JobScheduler(store, pool), pool,
                config.getPollIntervalMillis(), config.getShutdownGraceMillis());
        try {
            daemon.runUntilTerminated();
        } catch (JobManagerException e) {
            pool.close();
            throw e;
        }
    }

    public ManagerConfig getConfig() {
        return config;
    }

    WorkerPool newWorkerPool() {
        return new WorkerPool(config.getWorkerCapacity(), store, outputSink, processController, commandExecutor);
    }
}
