package com.umitunal.jobmgr.worker;

import com.umitunal.jobmgr.core.Job;
import com.umitunal.jobmgr.core.JobStore;
import com.umitunal.jobmgr.core.OutputSink;
import com.umitunal.jobmgr.error.JobManagerException;
import com.umitunal.jobmgr.process.CommandExecutor;
import com.umitunal.jobmgr.process.ProcessController;
import com.umitunal.jobmgr.process.RunningCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded pool that executes claimed jobs.
 * <p>
 * A slot is taken before a job is claimed and given back only after its terminal
 * status is stored, so the number of RUNNING or PAUSED jobs started by this pool
 * never exceeds its capacity. The claim itself is refused while the store already
 * holds that many active jobs, which bounds pools of different processes sharing
 * one store.
 */
public class WorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
    private static final long CLAIM_RETRY_MILLIS = 250;

    private final int capacity;
    private final JobStore store;
    private final JobRunner runner;
    private final ExecutorService executor;
    private final Semaphore slots;
    private final Set<RunningCommand> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicLong completedCount = new AtomicLong(0);
    private final AtomicLong failedCount = new AtomicLong(0);

    public WorkerPool(int capacity, JobStore store, OutputSink outputSink,
                      ProcessController processController, CommandExecutor commandExecutor) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.store = store;
        this.runner = new JobRunner(store, outputSink, processController, commandExecutor);
        this.slots = new Semaphore(capacity);

        AtomicInteger threadIndex = new AtomicInteger(0);
        this.executor = new ThreadPoolExecutor(capacity, capacity, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), task -> {
                    Thread thread = new Thread(task, "worker-" + threadIndex.incrementAndGet());
                    thread.setDaemon(false);
                    return thread;
                });
    }

    /**
     * Outcome of handing one job to the pool.
     */
    public enum Dispatch {
        STARTED,       // Claimed and queued for execution
        NO_SLOT,       // Pool or store is full, job left PENDING
        NOT_PENDING    // Someone else claimed it, or it was deleted
    }

    /**
     * Dispatch without waiting for a free slot.
     */
    public Dispatch tryDispatch(Job job) throws JobManagerException {
        if (!slots.tryAcquire()) {
            return Dispatch.NO_SLOT;
        }
        JobStore.Claim claim;
        try {
            claim = executor.isShutdown() ? JobStore.Claim.AT_CAPACITY : store.claim(job.getKey(), capacity);
        } catch (JobManagerException | RuntimeException e) {
            slots.release();
            throw e;
        }
        return submit(job, claim);
    }

    /**
     * Dispatch, waiting as long as needed for a free slot in this pool and in
     * the store.
     */
    public Dispatch dispatch(Job job) throws JobManagerException, InterruptedException {
        slots.acquire();
        JobStore.Claim claim;
        try {
            claim = awaitClaim(job);
        } catch (JobManagerException | InterruptedException | RuntimeException e) {
            slots.release();
            throw e;
        }
        return submit(job, claim);
    }

    /**
     * Claim in the store, which also counts jobs started by other processes,
     * retrying until one of them finishes or the pool shuts down.
     */
    private JobStore.Claim awaitClaim(Job job) throws JobManagerException, InterruptedException {
        while (!executor.isShutdown()) {
            JobStore.Claim claim = store.claim(job.getKey(), capacity);
            if (claim != JobStore.Claim.AT_CAPACITY) {
                return claim;
            }
            log.debug("Store is at capacity, job {} waits", job.getId());
            TimeUnit.MILLISECONDS.sleep(CLAIM_RETRY_MILLIS);
        }
        return JobStore.Claim.AT_CAPACITY;
    }

    private Dispatch submit(Job job, JobStore.Claim claim) throws JobManagerException {
        if (claim != JobStore.Claim.CLAIMED) {
            slots.release();
            return claim == JobStore.Claim.NOT_PENDING ? Dispatch.NOT_PENDING : Dispatch.NO_SLOT;
        }
        try {
            executor.execute(() -> execute(job));
        } catch (RejectedExecutionException e) {
            slots.release();
            log.error("Worker pool is shut down, job {} cannot run", job.getId());
            store.finish(job.getKey(), Job.Status.ERROR);
            return Dispatch.NOT_PENDING;
        }
        return Dispatch.STARTED;
    }

    private void execute(Job job) {
        try {
            Job.Status status = runner.run(job, inFlight);
            if (status == Job.Status.COMPLETED) {
                completedCount.incrementAndGet();
            } else {
                failedCount.incrementAndGet();
            }
        } finally {
            slots.release();
        }
    }

    /**
     * Wait until every dispatched job has finished.
     */
    public void awaitIdle() throws InterruptedException {
        slots.acquire(capacity);
        slots.release(capacity);
    }

    /**
     * Wait up to {@code timeout} for every dispatched job to finish.
     *
     * @return true if the pool became idle in time
     */
    public boolean awaitIdle(long timeout, TimeUnit unit) throws InterruptedException {
        if (slots.tryAcquire(capacity, timeout, unit)) {
            slots.release(capacity);
            return true;
        }
        return false;
    }

    /**
     * Stop accepting jobs, let running ones finish for {@code graceMillis}, then kill
     * the remaining child processes. Their workers record them as ERROR.
     */
    public void shutdown(long graceMillis) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(graceMillis, TimeUnit.MILLISECONDS)) {
                log.warn("Killing {} job(s) still running after {} ms", inFlight.size(), graceMillis);
                inFlight.forEach(RunningCommand::kill);
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            inFlight.forEach(RunningCommand::kill);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public int getCapacity() { return capacity; }
    public int getAvailableSlots() { return slots.availablePermits(); }
    public int getActiveCount() { return capacity - slots.availablePermits(); }
    public long getCompletedCount() { return completedCount.get(); }
    public long getFailedCount() { return failedCount.get(); }

    @Override
    public void close() {
        shutdown(0);
    }
}
