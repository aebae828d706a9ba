package com.umitunal.jobmgr.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One line of the pids file: the OS process currently running a job.
 */
@JsonPropertyOrder({"key", "pid"})
public final class PidBinding {
    private final String key;
    private final long pid;

    @JsonCreator
    public PidBinding(@JsonProperty(value = "key", required = true) String key,
                      @JsonProperty(value = "pid", required = true) long pid) {
        this.key = Objects.requireNonNull(key, "key");
        if (pid <= 0) {
            throw new IllegalArgumentException("pid must be positive: " + pid);
        }
        this.pid = pid;
    }

    @JsonProperty("key")
    public String getKey() { return key; }

    @JsonProperty("pid")
    public long getPid() { return pid; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PidBinding)) return false;
        PidBinding other = (PidBinding) o;
        return pid == other.pid && key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, pid);
    }

    @Override
    public String toString() {
        return "PidBinding{key='" + key + "', pid=" + pid + "}";
    }
}
