package com.umitunal.jobmgr.error;

/**
 * Raised when a destructive store operation is refused because work is still active.
 */
public class StoreBusyException extends JobManagerException {

    public StoreBusyException(String message) {
        super(message);
    }
}
