package com.umitunal.jobmgr.daemon;

import com.umitunal.jobmgr.error.JobManagerException;
import com.umitunal.jobmgr.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The polling loop of the background daemon.
 * <p>
 * {@link #run()} takes the daemon lock with this process's pid and scans the store
 * every poll interval until {@link #shutdown()} is called, typically from the JVM
 * shutdown hook installed by {@link #runUntilTerminated()} when {@code stop} sends
 * SIGTERM.
 */
public class Daemon {
    private static final Logger log = LoggerFactory.getLogger(Daemon.class);

    /**
     * Lifecycle of a daemon instance.
     */
    public enum State {
        NOT_RUNNING,
        STARTING,
        RUNNING,
        STOPPING
    }

    private final DaemonLock lock;
    private final JobScheduler scheduler;
    private final WorkerPool pool;
    private final long pollIntervalMillis;
    private final long shutdownGraceMillis;
    private final long pid;
    private final AtomicReference<State> state = new AtomicReference<>(State.NOT_RUNNING);
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    public Daemon(DaemonLock lock, JobScheduler scheduler, WorkerPool pool,
                  long pollIntervalMillis, long shutdownGraceMillis) {
        this(lock, scheduler, pool, pollIntervalMillis, shutdownGraceMillis, ProcessHandle.current().pid());
    }

    Daemon(DaemonLock lock, JobScheduler scheduler, WorkerPool pool,
           long pollIntervalMillis, long shutdownGraceMillis, long pid) {
        this.lock = lock;
        this.scheduler = scheduler;
        this.pool = pool;
        this.pollIntervalMillis = pollIntervalMillis;
        this.shutdownGraceMillis = shutdownGraceMillis;
        this.pid = pid;
    }

    /**
     * Install a shutdown hook that stops the loop, then run it.
     */
    public void runUntilTerminated() throws JobManagerException {
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "daemon-shutdown"));
        run();
    }

    /**
     * Acquire the lock and poll until shut down.
     *
     * @throws com.umitunal.jobmgr.error.DaemonStateException if another daemon holds the lock
     */
    public void run() throws JobManagerException {
        if (!state.compareAndSet(State.NOT_RUNNING, State.STARTING)) {
            throw new IllegalStateException("Daemon already " + state.get());
        }
        try {
            lock.acquire(pid);
        } catch (JobManagerException e) {
            state.set(State.NOT_RUNNING);
            throw e;
        }
        state.set(State.RUNNING);
        log.info("Daemon started (pid {}, poll every {} ms, {} workers)",
                pid, pollIntervalMillis, pool.getCapacity());

        while (state.get() == State.RUNNING) {
            try {
                scheduler.pollOnce();
            } catch (JobManagerException | RuntimeException e) {
                log.error("Poll failed, retrying next cycle: {}", e.getMessage(), e);
            }
            try {
                if (stopSignal.await(pollIntervalMillis, TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                shutdown();
                break;
            }
        }
    }

    /**
     * Stop polling, drain the worker pool and release the lock if this daemon still holds it.
     */
    public void shutdown() {
        if (!state.compareAndSet(State.RUNNING, State.STOPPING)) {
            return;
        }
        log.info("Daemon stopping (pid {})", pid);
        stopSignal.countDown();
        pool.shutdown(shutdownGraceMillis);
        try {
            lock.releaseIfOwnedBy(pid);
        } catch (JobManagerException e) {
            log.warn("Could not release daemon lock: {}", e.getMessage());
        }
        state.set(State.NOT_RUNNING);
        log.info("Daemon stopped (pid {})", pid);
    }

    public State getState() {
        return state.get();
    }

    public long getPid() {
        return pid;
    }
}
