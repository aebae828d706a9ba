package com.umitunal.jobmgr.core;

import com.umitunal.jobmgr.error.JobManagerException;

import java.util.List;

/**
 * Persistent, positionally ordered collection of jobs and their statuses.
 * <p>
 * Every read and every read-modify-write runs under one mutual-exclusion section,
 * so concurrent workers never lose each other's status updates.
 */
public interface JobStore {

    /**
     * Append a new PENDING job.
     *
     * @param command literal command line
     * @param workdir absolute working directory captured at submission
     * @return the stored job with its 1-based id
     */
    Job add(String command, String workdir) throws JobManagerException;

    /**
     * Consistent snapshot of all jobs in id order.
     */
    List<Job> list() throws JobManagerException;

    /**
     * Look up a job by its positional id.
     */
    Job get(int id) throws JobManagerException;

    /**
     * Set the status of the job at {@code id}. Terminal statuses drop the pid binding.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    Job updateStatus(int id, Job.Status status) throws JobManagerException;

    /**
     * Atomically move a PENDING job to RUNNING, unless {@code capacity} jobs are
     * already running or paused in the store, whichever process started them.
     */
    Claim claim(String key, int capacity) throws JobManagerException;

    /**
     * Record the pid of the process running a job.
     */
    void bindProcess(String key, long pid) throws JobManagerException;

    /**
     * Set a terminal status by key and drop the pid binding.
     */
    Job finish(String key, Job.Status terminalStatus) throws JobManagerException;

    /**
     * Signal the process bound to job {@code id} and record the resulting status,
     * both inside the store's mutual-exclusion section.
     *
     * @throws com.umitunal.jobmgr.error.JobNotFoundException if no process is bound
     */
    Job signalBound(int id, Job.Status newStatus, ProcessAction action) throws JobManagerException;

    /**
     * Remove one job; later ids shift down by one.
     */
    Job delete(int id) throws JobManagerException;

    /**
     * Remove every job. {@code beforeCommit} runs inside the same locked section,
     * after the busy check and before anything is written; if it throws, the
     * store is left unchanged.
     *
     * @throws com.umitunal.jobmgr.error.StoreBusyException if any job is running or paused
     */
    void deleteAll(StoreAction beforeCommit) throws JobManagerException;

    /**
     * Remove every COMPLETED or ERROR job.
     *
     * @return the removed jobs, with the ids they had before removal
     */
    List<Job> deleteFinished() throws JobManagerException;

    default JobMetrics metrics() throws JobManagerException {
        return JobMetrics.of(list());
    }

    /**
     * Outcome of {@link #claim}.
     */
    enum Claim {
        CLAIMED,       // Job is now RUNNING
        AT_CAPACITY,   // Too many active jobs, job left PENDING
        NOT_PENDING    // Deleted or claimed by someone else
    }

    /**
     * Work done while the store is locked.
     */
    @FunctionalInterface
    interface StoreAction {
        void run() throws JobManagerException;
    }

    /**
     * Action applied to a bound pid while the store is locked.
     */
    @FunctionalInterface
    interface ProcessAction {
        void apply(long pid) throws JobManagerException;
    }
}
