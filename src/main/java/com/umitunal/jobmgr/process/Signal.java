package com.umitunal.jobmgr.process;

/**
 * Job-control signals delivered to a running job.
 */
public enum Signal {
    STOP,   // Suspend
    CONT;   // Continue after STOP

    public String killOption() {
        return "-" + name();
    }
}
