package com.umitunal.jobmgr.process;

import com.umitunal.jobmgr.error.JobManagerException;

/**
 * Delivers a signal to a process and the processes it started.
 */
@FunctionalInterface
public interface Signaller {

    void send(long pid, Signal signal) throws JobManagerException;
}
