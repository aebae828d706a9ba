package com.umitunal.jobmgr.core;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Snapshot of a queued shell command as seen at one observation of the store.
 * <p>
 * The {@code id} is the 1-based position of the job in the store and shifts down
 * when an earlier job is deleted. The {@code key} never changes and is what workers,
 * pid bindings and output files use to address the job.
 */
public final class Job {
    private final int id;
    private final String key;
    private final String command;
    private final String workdir;
    private final Status status;
    private final Long pid;

    public Job(int id, String key, String command, String workdir, Status status, Long pid) {
        this.id = id;
        this.key = Objects.requireNonNull(key, "key");
        this.command = Objects.requireNonNull(command, "command");
        this.workdir = Objects.requireNonNull(workdir, "workdir");
        this.status = Objects.requireNonNull(status, "status");
        this.pid = pid;
    }

    public int getId() { return id; }
    public String getKey() { return key; }
    public String getCommand() { return command; }
    public String getWorkdir() { return workdir; }
    public Status getStatus() { return status; }

    /**
     * The OS process id, present only while the job is running or paused.
     */
    public OptionalLong getPid() {
        return pid == null ? OptionalLong.empty() : OptionalLong.of(pid);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Job)) return false;
        Job other = (Job) o;
        return id == other.id
                && key.equals(other.key)
                && command.equals(other.command)
                && workdir.equals(other.workdir)
                && status == other.status
                && Objects.equals(pid, other.pid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, key, command, workdir, status, pid);
    }

    /**
     * The one-line form printed by {@code list}: {@code 1. [PENDING] echo hi}.
     */
    public String toListLine() {
        return id + ". [" + status + "] " + command;
    }

    @Override
    public String toString() {
        return String.format("Job{id=%d, key='%s', status=%s, pid=%s, command='%s', workdir='%s'}",
                id, key, status, pid, command, workdir);
    }

    /**
     * Lifecycle states of a job.
     */
    public enum Status {
        PENDING,     // Waiting for a free worker
        RUNNING,     // Claimed by a worker, process running
        PAUSED,      // Process stopped with SIGSTOP
        COMPLETED,   // Exited with code 0
        ERROR;       // Non-zero exit or failed to start

        public boolean isTerminal() {
            return this == COMPLETED || this == ERROR;
        }

        /**
         * Whether a live process may be attached to a job in this state.
         */
        public boolean isActive() {
            return this == RUNNING || this == PAUSED;
        }

        public boolean canTransitionTo(Status next) {
            switch (this) {
                case PENDING:
                    return next == RUNNING || next == ERROR;
                case RUNNING:
                    return next == PAUSED || next == RUNNING || next.isTerminal();
                case PAUSED:
                    // A process can exit between the pause signal and its delivery
                    return next == RUNNING || next == PAUSED || next.isTerminal();
                default:
                    return false;
            }
        }
    }
}
