package com.umitunal.jobmgr.process;

import com.umitunal.jobmgr.core.Job;
import com.umitunal.jobmgr.core.JobStore;
import com.umitunal.jobmgr.error.JobManagerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks which OS process runs which job and pauses or resumes it by signal.
 * <p>
 * Bindings are kept in the job store, so a CLI process can signal a job that a
 * worker in the daemon process started. The binding disappears when the job
 * reaches a terminal status.
 */
public class ProcessController {
    private static final Logger log = LoggerFactory.getLogger(ProcessController.class);

    private final JobStore store;
    private final Signaller signaller;

    public ProcessController(JobStore store, Signaller signaller) {
        this.store = store;
        this.signaller = signaller;
    }

    /**
     * Bind a freshly spawned process to the job it runs.
     */
    public void bind(String jobKey, long pid) throws JobManagerException {
        store.bindProcess(jobKey, pid);
    }

    /**
     * Suspend the process of job {@code id} and mark the job PAUSED.
     *
     * @throws com.umitunal.jobmgr.error.JobNotFoundException if no process is bound
     */
    public Job pause(int id) throws JobManagerException {
        Job job = store.signalBound(id, Job.Status.PAUSED, pid -> signaller.send(pid, Signal.STOP));
        log.info("Paused job {} (pid {})", id, job.getPid().orElse(-1));
        return job;
    }

    /**
     * Continue the process of job {@code id} and mark the job RUNNING again.
     */
    public Job resume(int id) throws JobManagerException {
        Job job = store.signalBound(id, Job.Status.RUNNING, pid -> signaller.send(pid, Signal.CONT));
        log.info("Resumed job {} (pid {})", id, job.getPid().orElse(-1));
        return job;
    }
}
