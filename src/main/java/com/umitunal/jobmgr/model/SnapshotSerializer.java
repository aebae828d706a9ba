package com.umitunal.jobmgr.model;

import com.umitunal.jobmgr.core.Job;
import com.umitunal.jobmgr.error.CorruptStoreException;
import com.umitunal.jobmgr.serialization.JsonRecordCodec;
import com.umitunal.jobmgr.serialization.RecordCodec;
import com.umitunal.jobmgr.serialization.StatusCodec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts between the line-oriented store files and a {@link StoreSnapshot}.
 *
 * File formats:
 * - jobs: one JSON object per line, {@code {"key":..,"command":..,"workdir":..}}
 * - status: one status keyword per line, aligned with jobs
 * - pids: one JSON object per line, {@code {"key":..,"pid":..}}
 *
 * Any line that cannot be decoded, a length mismatch between jobs and statuses,
 * or a pid line for an unknown key is reported as {@link CorruptStoreException}.
 */
public class SnapshotSerializer {
    private final RecordCodec<JobRecord> jobCodec;
    private final RecordCodec<Job.Status> statusCodec;
    private final RecordCodec<PidBinding> pidCodec;

    public SnapshotSerializer() {
        this(new JsonRecordCodec<>(JobRecord.class), new StatusCodec(), new JsonRecordCodec<>(PidBinding.class));
    }

    public SnapshotSerializer(RecordCodec<JobRecord> jobCodec,
                              RecordCodec<Job.Status> statusCodec,
                              RecordCodec<PidBinding> pidCodec) {
        this.jobCodec = jobCodec;
        this.statusCodec = statusCodec;
        this.pidCodec = pidCodec;
    }

    public StoreSnapshot deserialize(Lines jobs, Lines statuses, Lines pids) throws CorruptStoreException {
        List<JobRecord> records = decodeAll(jobs, jobCodec);
        List<Job.Status> states = decodeAll(statuses, statusCodec);

        if (records.size() != states.size()) {
            throw new CorruptStoreException(statuses.file(), String.format(
                    "%d status lines for %d jobs in %s", states.size(), records.size(), jobs.file()));
        }

        Set<String> keys = new HashSet<>();
        for (int i = 0; i < records.size(); i++) {
            if (!keys.add(records.get(i).getKey())) {
                throw new CorruptStoreException(jobs.file(), i + 1,
                        "duplicate key " + records.get(i).getKey());
            }
        }

        Map<String, Long> bindings = new LinkedHashMap<>();
        List<PidBinding> decodedPids = decodeAll(pids, pidCodec);
        for (int i = 0; i < decodedPids.size(); i++) {
            PidBinding binding = decodedPids.get(i);
            if (!keys.contains(binding.getKey())) {
                throw new CorruptStoreException(pids.file(), i + 1, "pid bound to unknown key " + binding.getKey());
            }
            bindings.put(binding.getKey(), binding.getPid());
        }

        return new StoreSnapshot(records, states, bindings);
    }

    public List<String> serializeJobs(StoreSnapshot snapshot) {
        List<String> lines = new ArrayList<>(snapshot.size());
        for (JobRecord record : snapshot.records()) {
            lines.add(jobCodec.encode(record));
        }
        return lines;
    }

    public List<String> serializeStatuses(StoreSnapshot snapshot) {
        List<String> lines = new ArrayList<>(snapshot.size());
        for (Job.Status status : snapshot.statuses()) {
            lines.add(statusCodec.encode(status));
        }
        return lines;
    }

    public List<String> serializePids(StoreSnapshot snapshot) {
        List<String> lines = new ArrayList<>();
        for (Map.Entry<String, Long> entry : snapshot.pids().entrySet()) {
            lines.add(pidCodec.encode(new PidBinding(entry.getKey(), entry.getValue())));
        }
        return lines;
    }

    private static <T> List<T> decodeAll(Lines lines, RecordCodec<T> codec) throws CorruptStoreException {
        List<T> decoded = new ArrayList<>(lines.content().size());
        int lineNo = 0;
        for (String line : lines.content()) {
            lineNo++;
            try {
                decoded.add(codec.decode(line));
            } catch (IllegalArgumentException e) {
                throw new CorruptStoreException(lines.file(), lineNo, e.getMessage());
            }
        }
        return decoded;
    }

    /**
     * Raw lines of one store file, with the file they came from for error reporting.
     */
    public static final class Lines {
        private final Path file;
        private final List<String> content;

        public Lines(Path file, List<String> content) {
            this.file = file;
            this.content = content;
        }

        public Path file() { return file; }
        public List<String> content() { return content; }
    }
}
