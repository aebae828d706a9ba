package com.umitunal.jobmgr.error;

/**
 * Base type for failures reported to the caller of a job manager operation.
 */
public class JobManagerException extends Exception {

    public JobManagerException(String message) {
        super(message);
    }

    public JobManagerException(String message, Throwable cause) {
        super(message, cause);
    }
}
