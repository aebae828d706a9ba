package com.umitunal.jobmgr.error;

/**
 * Wraps an I/O failure while reading or writing persisted state.
 */
public class StorageException extends JobManagerException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
