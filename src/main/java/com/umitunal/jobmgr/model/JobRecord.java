package com.umitunal.jobmgr.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;
import java.util.UUID;

/**
 * One line of the jobs file: what to run and where.
 */
@JsonPropertyOrder({"key", "command", "workdir"})
public final class JobRecord {
    private final String key;
    private final String command;
    private final String workdir;

    @JsonCreator
    public JobRecord(@JsonProperty(value = "key", required = true) String key,
                     @JsonProperty(value = "command", required = true) String command,
                     @JsonProperty(value = "workdir", required = true) String workdir) {
        this.key = Objects.requireNonNull(key, "key");
        this.command = Objects.requireNonNull(command, "command");
        this.workdir = Objects.requireNonNull(workdir, "workdir");
    }

    public static JobRecord newRecord(String command, String workdir) {
        return new JobRecord(UUID.randomUUID().toString(), command, workdir);
    }

    @JsonProperty("key")
    public String getKey() { return key; }

    @JsonProperty("command")
    public String getCommand() { return command; }

    @JsonProperty("workdir")
    public String getWorkdir() { return workdir; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobRecord)) return false;
        JobRecord other = (JobRecord) o;
        return key.equals(other.key) && command.equals(other.command) && workdir.equals(other.workdir);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, command, workdir);
    }

    @Override
    public String toString() {
        return String.format("JobRecord{key='%s', command='%s', workdir='%s'}", key, command, workdir);
    }
}
