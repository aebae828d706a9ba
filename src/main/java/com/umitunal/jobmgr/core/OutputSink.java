package com.umitunal.jobmgr.core;

import com.umitunal.jobmgr.error.JobManagerException;

/**
 * Durable capture of a finished job's stdout and stderr, keyed by job key.
 */
public interface OutputSink {

    /**
     * Separator written between stdout and a non-empty stderr section.
     */
    String ERRORS_SEPARATOR = "\n--- Errors ---\n";

    /**
     * Replace the captured output for a job. Readers never see a partial write.
     *
     * @param jobKey stable key of the job
     * @param stdout captured standard output
     * @param stderr captured standard error, may be empty
     */
    void write(String jobKey, String stdout, String stderr) throws JobManagerException;

    /**
     * Read the captured output of a job.
     *
     * @throws com.umitunal.jobmgr.error.JobNotFoundException if nothing was written yet
     */
    String read(String jobKey) throws JobManagerException;

    /**
     * Remove the output of one job, if any.
     */
    void delete(String jobKey) throws JobManagerException;

    /**
     * Remove all stored output.
     */
    void clear() throws JobManagerException;
}
