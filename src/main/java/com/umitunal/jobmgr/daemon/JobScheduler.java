package com.umitunal.jobmgr.daemon;

import com.umitunal.jobmgr.core.Job;
import com.umitunal.jobmgr.core.JobStore;
import com.umitunal.jobmgr.error.JobManagerException;
import com.umitunal.jobmgr.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One scan of the store: every PENDING job is offered to the worker pool.
 */
public class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final JobStore store;
    private final WorkerPool pool;

    public JobScheduler(JobStore store, WorkerPool pool) {
        this.store = store;
        this.pool = pool;
    }

    /**
     * Dispatch pending jobs until the pool is full. Never waits for a slot; jobs
     * that do not fit stay PENDING for the next poll.
     *
     * @return number of jobs started
     */
    public int pollOnce() throws JobManagerException {
        int started = 0;
        for (Job job : pendingJobs()) {
            WorkerPool.Dispatch outcome = pool.tryDispatch(job);
            if (outcome == WorkerPool.Dispatch.NO_SLOT) {
                log.debug("No free slot, remaining jobs wait for the next poll");
                break;
            }
            if (outcome == WorkerPool.Dispatch.STARTED) {
                started++;
            }
        }
        if (started > 0) {
            log.info("Dispatched {} job(s)", started);
        }
        return started;
    }

    /**
     * Dispatch every job pending at the time of the scan, waiting for free slots.
     *
     * @return number of jobs started
     */
    public int dispatchAll() throws JobManagerException, InterruptedException {
        int started = 0;
        for (Job job : pendingJobs()) {
            if (pool.dispatch(job) == WorkerPool.Dispatch.STARTED) {
                started++;
            }
        }
        log.info("Dispatched {} job(s)", started);
        return started;
    }

    private List<Job> pendingJobs() throws JobManagerException {
        return store.list().stream()
                .filter(job -> job.getStatus() == Job.Status.PENDING)
                .collect(Collectors.toList());
    }
}
