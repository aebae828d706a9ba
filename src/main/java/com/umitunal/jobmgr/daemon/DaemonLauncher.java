package com.umitunal.jobmgr.daemon;

import com.umitunal.jobmgr.config.ManagerConfig;
import com.umitunal.jobmgr.error.DaemonStateException;
import com.umitunal.jobmgr.error.JobManagerException;
import com.umitunal.jobmgr.storage.StoreLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Starts the daemon as a detached JVM and stops it by signal.
 */
public class DaemonLauncher {
    private static final Logger log = LoggerFactory.getLogger(DaemonLauncher.class);
    private static final Path SETSID = Paths.get("/usr/bin/setsid");
    private static final long START_TIMEOUT_MILLIS = 10_000;

    private final ManagerConfig config;
    private final StoreLayout layout;
    private final DaemonLock lock;
    private final String mainClass;

    public DaemonLauncher(ManagerConfig config, DaemonLock lock, String mainClass) {
        this.config = config;
        this.layout = new StoreLayout(config.getBaseDirectory());
        this.lock = lock;
        this.mainClass = mainClass;
    }

    /**
     * Spawn a background JVM running the daemon loop and wait until it holds the lock.
     *
     * @return pid of the daemon
     * @throws DaemonStateException if a lock already exists, stale or not
     */
    public long start() throws JobManagerException {
        checkNotRunning();

        List<String> command = daemonCommand();
        log.info("Launching daemon: {}", command);
        Process child;
        try {
            Files.createDirectories(layout.baseDirectory());
            child = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.appendTo(layout.daemonOutFile().toFile()))
                    .start();
            child.getOutputStream().close();
        } catch (IOException e) {
            throw new JobManagerException("Cannot launch daemon process", e);
        }

        long deadline = System.currentTimeMillis() + START_TIMEOUT_MILLIS;
        while (System.currentTimeMillis() < deadline) {
            OptionalLong pid = lock.readPid();
            if (pid.isPresent()) {
                return pid.getAsLong();
            }
            if (!child.isAlive()) {
                throw new JobManagerException("Daemon exited with code " + child.exitValue()
                        + " during startup; see " + layout.daemonOutFile());
            }
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new JobManagerException("Interrupted while waiting for the daemon to start", e);
            }
        }
        throw new JobManagerException("Daemon did not take the lock within "
                + START_TIMEOUT_MILLIS + " ms; see " + layout.daemonOutFile());
    }

    /**
     * Send SIGTERM to the daemon recorded in the lock and remove the lock. Does not
     * wait for the daemon to exit.
     *
     * @return pid found in the lock
     * @throws DaemonStateException if no lock exists
     */
    public long stop() throws JobManagerException {
        OptionalLong pid = lock.readPid();
        if (pid.isEmpty()) {
            throw DaemonStateException.notRunning();
        }
        boolean signalled = ProcessHandle.of(pid.getAsLong())
                .map(ProcessHandle::destroy)
                .orElse(false);
        if (!signalled) {
            log.warn("Daemon pid {} was not running; removing its lock", pid.getAsLong());
        }
        lock.release();
        log.info("Daemon stopped (pid {})", pid.getAsLong());
        return pid.getAsLong();
    }

    /**
     * Refuse to start when a lock file exists, pointing at {@code stop} for stale locks.
     */
    public void checkNotRunning() throws JobManagerException {
        OptionalLong holder = lock.readPid();
        if (holder.isPresent()) {
            if (lock.isStale()) {
                throw DaemonStateException.staleLock(holder.getAsLong());
            }
            throw DaemonStateException.alreadyRunning(holder.getAsLong());
        }
    }

    List<String> daemonCommand() {
        List<String> command = new ArrayList<>();
        if (Files.isExecutable(SETSID)) {
            command.add(SETSID.toString());
        }
        command.add(javaExecutable());
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add("-D" + ManagerConfig.HOME_PROPERTY + "=" + config.getBaseDirectory());
        command.add("-Djobmgr.pollInterval=" + config.getPollIntervalMillis());
        command.add("-Djobmgr.workers=" + config.getWorkerCapacity());
        command.add("-Djobmgr.durableWrites=" + config.isDurableWrites());
        command.add("-Djobmgr.shutdownGrace=" + config.getShutdownGraceMillis());
        command.add(mainClass);
        command.add("daemon");
        return command;
    }

    private static String javaExecutable() {
        return ProcessHandle.current().info().command()
                .orElse(Paths.get(System.getProperty("java.home"), "bin", "java").toString());
    }
}
