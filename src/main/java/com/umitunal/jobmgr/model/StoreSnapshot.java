package com.umitunal.jobmgr.model;

import com.umitunal.jobmgr.core.Job;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory copy of the store's three collections, loaded and written back as a
 * whole inside one mutual-exclusion section.
 * <p>
 * Not thread-safe; callers confine an instance to the section that loaded it.
 */
public class StoreSnapshot {
    private final List<JobRecord> records;
    private final List<Job.Status> statuses;
    private final Map<String, Long> pids;

    public StoreSnapshot() {
        this(new ArrayList<>(), new ArrayList<>(), new LinkedHashMap<>());
    }

    StoreSnapshot(List<JobRecord> records, List<Job.Status> statuses, Map<String, Long> pids) {
        if (records.size() != statuses.size()) {
            throw new IllegalArgumentException("jobs and statuses differ in length: "
                    + records.size() + " vs " + statuses.size());
        }
        this.records = records;
        this.statuses = statuses;
        this.pids = pids;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public boolean containsId(int id) {
        return id >= 1 && id <= records.size();
    }

    /**
     * 1-based id of the job with this key, or -1.
     */
    public int idOf(String key) {
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i).getKey().equals(key)) {
                return i + 1;
            }
        }
        return -1;
    }

    public Job job(int id) {
        JobRecord record = records.get(id - 1);
        return new Job(id, record.getKey(), record.getCommand(), record.getWorkdir(),
                statuses.get(id - 1), pids.get(record.getKey()));
    }

    public List<Job> jobs() {
        List<Job> jobs = new ArrayList<>(records.size());
        for (int id = 1; id <= records.size(); id++) {
            jobs.add(job(id));
        }
        return jobs;
    }

    public boolean hasActiveJobs() {
        return statuses.stream().anyMatch(Job.Status::isActive);
    }

    public Job append(JobRecord record) {
        records.add(record);
        statuses.add(Job.Status.PENDING);
        return job(records.size());
    }

    /**
     * Change the status of job {@code id}; leaving RUNNING/PAUSED drops the pid binding.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public Job setStatus(int id, Job.Status next) {
        Job.Status current = statuses.get(id - 1);
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException("Job " + id + " cannot move from " + current + " to " + next);
        }
        statuses.set(id - 1, next);
        if (!next.isActive()) {
            pids.remove(records.get(id - 1).getKey());
        }
        return job(id);
    }

    public void bind(int id, long pid) {
        Job.Status status = statuses.get(id - 1);
        if (!status.isActive()) {
            throw new IllegalStateException("Job " + id + " is " + status + ", cannot bind pid " + pid);
        }
        pids.put(records.get(id - 1).getKey(), pid);
    }

    public Job remove(int id) {
        Job removed = job(id);
        records.remove(id - 1);
        statuses.remove(id - 1);
        pids.remove(removed.getKey());
        return removed;
    }

    public void clear() {
        records.clear();
        statuses.clear();
        pids.clear();
    }

    List<JobRecord> records() {
        return Collections.unmodifiableList(records);
    }

    List<Job.Status> statuses() {
        return Collections.unmodifiableList(statuses);
    }

    Map<String, Long> pids() {
        return Collections.unmodifiableMap(pids);
    }
}
