package com.umitunal.jobmgr.error;

/**
 * Raised when a daemon lifecycle request conflicts with the current lock state.
 */
public class DaemonStateException extends JobManagerException {

    public enum Reason {
        ALREADY_RUNNING,
        NOT_RUNNING,
        STALE_LOCK
    }

    private final Reason reason;

    private DaemonStateException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() { return reason; }

    public static DaemonStateException alreadyRunning(long pid) {
        return new DaemonStateException(Reason.ALREADY_RUNNING,
                "Daemon is already running (pid " + pid + ")");
    }

    public static DaemonStateException notRunning() {
        return new DaemonStateException(Reason.NOT_RUNNING, "Daemon is not running");
    }

    public static DaemonStateException staleLock(long pid) {
        return new DaemonStateException(Reason.STALE_LOCK,
                "Daemon lock is held by pid " + pid + " which is no longer alive; run 'stop' to clear it");
    }
}
