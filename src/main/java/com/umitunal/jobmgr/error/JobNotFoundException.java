package com.umitunal.jobmgr.error;

/**
 * Raised when a job id is out of range, a job has no captured output yet,
 * or no process is bound to the job.
 */
public class JobNotFoundException extends JobManagerException {

    public JobNotFoundException(String message) {
        super(message);
    }

    public static JobNotFoundException noSuchJob(int id) {
        return new JobNotFoundException("No job with id " + id);
    }

    public static JobNotFoundException noSuchKey(String key) {
        return new JobNotFoundException("No job with key " + key);
    }
}
