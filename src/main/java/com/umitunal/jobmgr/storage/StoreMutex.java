package com.umitunal.jobmgr.storage;

import com.umitunal.jobmgr.error.JobManagerException;
import com.umitunal.jobmgr.error.StorageException;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutual exclusion over the store files for threads of this JVM and for other
 * processes (the daemon and CLI invocations).
 * <p>
 * The in-process lock is shared by every mutex on the same lock file, because the
 * OS file lock is held per JVM and cannot be taken twice by one process.
 */
public class StoreMutex {
    private static final ConcurrentMap<Path, ReentrantLock> LOCAL_LOCKS = new ConcurrentHashMap<>();

    private final Path lockFile;
    private final ReentrantLock localLock;

    public StoreMutex(Path lockFile) {
        this.lockFile = lockFile.toAbsolutePath().normalize();
        this.localLock = LOCAL_LOCKS.computeIfAbsent(this.lockFile, p -> new ReentrantLock());
    }

    /**
     * Run {@code section} while holding both locks. Nested calls on the same thread
     * reuse the file lock taken by the outermost call.
     */
    public <T> T withLock(Section<T> section) throws JobManagerException {
        localLock.lock();
        try {
            if (localLock.getHoldCount() > 1) {
                return section.run();
            }
            try (FileChannel channel = FileChannel.open(lockFile,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                return section.run();
            }
        } catch (IOException e) {
            throw new StorageException("I/O failure on store " + lockFile.getParent(), e);
        } finally {
            localLock.unlock();
        }
    }

    /**
     * Body of a critical section.
     */
    @FunctionalInterface
    public interface Section<T> {
        T run() throws JobManagerException, IOException;
    }
}
