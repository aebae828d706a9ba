package com.umitunal.jobmgr.serialization;

import com.umitunal.jobmgr.core.Job;

/**
 * Codec for status lines: the bare status keyword.
 */
public class StatusCodec implements RecordCodec<Job.Status> {

    @Override
    public String encode(Job.Status status) {
        return status.name();
    }

    @Override
    public Job.Status decode(String line) {
        String keyword = line == null ? "" : line.trim();
        try {
            return Job.Status.valueOf(keyword);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown status '" + keyword + "'", e);
        }
    }
}
