package com.umitunal.jobmgr.storage;

import com.umitunal.jobmgr.config.ManagerConfig;
import com.umitunal.jobmgr.core.Job;
import com.umitunal.jobmgr.core.JobStore;
import com.umitunal.jobmgr.error.JobManagerException;
import com.umitunal.jobmgr.error.JobNotFoundException;
import com.umitunal.jobmgr.error.StorageException;
import com.umitunal.jobmgr.error.StoreBusyException;
import com.umitunal.jobmgr.model.JobRecord;
import com.umitunal.jobmgr.model.SnapshotSerializer;
import com.umitunal.jobmgr.model.StoreSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Flat-file implementation of JobStore.
 * <p>
 * Jobs, statuses and pid bindings live in three line-oriented files under the base
 * directory. Each operation loads all three into a {@link StoreSnapshot}, applies its
 * change and writes the files back as one {@link StoreTransaction}, all inside a
 * {@link StoreMutex}.
 */
public class FlatFileJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(FlatFileJobStore.class);

    private final StoreLayout layout;
    private final StoreMutex mutex;
    private final SnapshotSerializer serializer;
    private final boolean durableWrites;

    public FlatFileJobStore(ManagerConfig config) throws StorageException {
        this(new StoreLayout(config.getBaseDirectory()), new SnapshotSerializer(), config.isDurableWrites());
    }

    public FlatFileJobStore(StoreLayout layout, SnapshotSerializer serializer, boolean durableWrites)
            throws StorageException {
        this.layout = layout;
        this.serializer = serializer;
        this.durableWrites = durableWrites;
        initialize();
        this.mutex = new StoreMutex(layout.storeLockFile());
    }

    private void initialize() throws StorageException {
        try {
            Files.createDirectories(layout.baseDirectory());
            Files.createDirectories(layout.outputDirectory());
            for (Path file : List.of(layout.jobsFile(), layout.statusFile(), layout.pidsFile())) {
                // CREATE without CREATE_NEW tolerates another process creating it first
                FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE).close();
            }
        } catch (IOException e) {
            throw new StorageException("Cannot initialize store in " + layout.baseDirectory(), e);
        }
    }

    @Override
    public Job add(String command, String workdir) throws JobManagerException {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        JobRecord record = JobRecord.newRecord(command, workdir);
        Job job = mutex.withLock(() -> {
            StoreSnapshot snapshot = load();
            Job added = snapshot.append(record);
            save(snapshot);
            return added;
        });
        log.info("Added job {}: {}", job.getId(), command);
        return job;
    }

    @Override
    public List<Job> list() throws JobManagerException {
        return mutex.withLock(() -> load().jobs());
    }

    @Override
    public Job get(int id) throws JobManagerException {
        return mutex.withLock(() -> {
            StoreSnapshot snapshot = load();
            requireId(snapshot, id);
            return snapshot.job(id);
        });
    }

    @Override
    public Job updateStatus(int id, Job.Status status) throws JobManagerException {
        return mutex.withLock(() -> {
            StoreSnapshot snapshot = load();
            requireId(snapshot, id);
            Job updated = snapshot.setStatus(id, status);
            save(snapshot);
            log.debug("Job {} is now {}", id, status);
            return updated;
        });
    }

    @Override
    public Claim claim(String key, int capacity) throws JobManagerException {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        return mutex.withLock(() -> {
            StoreSnapshot snapshot = load();
            int id = snapshot.idOf(key);
            if (id < 0 || snapshot.job(id).getStatus() != Job.Status.PENDING) {
                return Claim.NOT_PENDING;
            }
            // RUNNING and PAUSED jobs hold their slot until a terminal status is stored
            if (snapshot.jobs().stream().filter(job -> job.getStatus().isActive()).count() >= capacity) {
                return Claim.AT_CAPACITY;
            }
            snapshot.setStatus(id, Job.Status.RUNNING);
            save(snapshot);
            return Claim.CLAIMED;
        });
    }

    @Override
    public void bindProcess(String key, long pid) throws JobManagerException {
        mutex.withLock(() -> {
            StoreSnapshot snapshot = load();
            int id = requireKey(snapshot, key);
            snapshot.bind(id, pid);
            save(snapshot);
            log.debug("Job {} bound to pid {}", id, pid);
            return null;
        });
    }

    @Override
    public Job finish(String key, Job.Status terminalStatus) throws JobManagerException {
        if (!terminalStatus.isTerminal()) {
            throw new IllegalArgumentException(terminalStatus + " is not a terminal status");
        }
        return mutex.withLock(() -> {
            StoreSnapshot snapshot = load();
            int id = requireKey(snapshot, key);
            Job finished = snapshot.setStatus(id, terminalStatus);
            save(snapshot);
            return finished;
        });
    }

    @Override
    public Job signalBound(int id, Job.Status newStatus, ProcessAction action) throws JobManagerException {
        return mutex.withLock(() -> {
            StoreSnapshot snapshot = load();
            requireId(snapshot, id);
            Job job = snapshot.job(id);
            if (job.getPid().isEmpty()) {
                throw new JobNotFoundException("No running process is bound to job " + id
                        + " (status " + job.getStatus() + ")");
            }
            if (!job.getStatus().canTransitionTo(newStatus)) {
                throw new IllegalStateException("Job " + id + " cannot move from "
                        + job.getStatus() + " to " + newStatus);
            }
            action.apply(job.getPid().getAsLong());
            Job updated = snapshot.setStatus(id, newStatus);
            save(snapshot);
            return updated;
        });
    }

    @Override
    public Job delete(int id) throws JobManagerException {
        Job removed = mutex.withLock(() -> {
            StoreSnapshot snapshot = load();
            requireId(snapshot, id);
            Job job = snapshot.job(id);
            if (job.getStatus().isActive()) {
                throw new StoreBusyException("Job " + id + " is " + job.getStatus()
                        + "; wait for it to finish before deleting it");
            }
            snapshot.remove(id);
            save(snapshot);
            return job;
        });
        log.info("Deleted job {}: {}", id, removed.getCommand());
        return removed;
    }

    @Override
    public void deleteAll(StoreAction beforeCommit) throws JobManagerException {
        int count = mutex.withLock(() -> {
            StoreSnapshot snapshot = load();
            if (snapshot.hasActiveJobs()) {
                throw new StoreBusyException("Cannot clean while jobs are running or paused");
            }
            beforeCommit.run();
            int size = snapshot.size();
            snapshot.clear();
            save(snapshot);
            return size;
        });
        log.info("Removed all {} jobs", count);
    }

    @Override
    public List<Job> deleteFinished() throws JobManagerException {
        List<Job> removed = mutex.withLock(() -> {
            StoreSnapshot snapshot = load();
            List<Job> finished = new ArrayList<>();
            // Walk backwards so removals do not shift the ids still to visit
            for (int id = snapshot.size(); id >= 1; id--) {
                if (snapshot.job(id).getStatus().isTerminal()) {
                    finished.add(0, snapshot.remove(id));
                }
            }
            if (!finished.isEmpty()) {
                save(snapshot);
            }
            return finished;
        });
        log.info("Pruned {} finished jobs", removed.size());
        return removed;
    }

    public StoreLayout getLayout() {
        return layout;
    }

    private StoreSnapshot load() throws IOException, JobManagerException {
        StoreTransaction.recover(layout);
        return serializer.deserialize(
                new SnapshotSerializer.Lines(layout.jobsFile(), AtomicFiles.readLines(layout.jobsFile())),
                new SnapshotSerializer.Lines(layout.statusFile(), AtomicFiles.readLines(layout.statusFile())),
                new SnapshotSerializer.Lines(layout.pidsFile(), AtomicFiles.readLines(layout.pidsFile())));
    }

    private void save(StoreSnapshot snapshot) throws IOException {
        StoreTransaction transaction = new StoreTransaction(layout, durableWrites);
        transaction.stage(layout.jobsFile(), serializer.serializeJobs(snapshot));
        transaction.stage(layout.statusFile(), serializer.serializeStatuses(snapshot));
        transaction.stage(layout.pidsFile(), serializer.serializePids(snapshot));
        transaction.commit();
    }

    private static void requireId(StoreSnapshot snapshot, int id) throws JobNotFoundException {
        if (!snapshot.containsId(id)) {
            throw JobNotFoundException.noSuchJob(id);
        }
    }

    private static int requireKey(StoreSnapshot snapshot, String key) throws JobNotFoundException {
        int id = snapshot.idOf(key);
        if (id < 0) {
            throw JobNotFoundException.noSuchKey(key);
        }
        return id;
    }
}
