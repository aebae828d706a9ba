package com.umitunal.jobmgr.daemon;

import com.umitunal.jobmgr.error.CorruptStoreException;
import com.umitunal.jobmgr.error.DaemonStateException;
import com.umitunal.jobmgr.error.JobManagerException;
import com.umitunal.jobmgr.error.StorageException;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.OptionalLong;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Singleton token of the daemon: a file holding the daemon's pid.
 * <p>
 * Existence of the file is what every command treats as "daemon running". A daemon
 * that crashed leaves the file behind; {@link #isStale()} detects that case but
 * nothing removes the file automatically.
 */
public class DaemonLock {
    private final Path lockFile;

    public DaemonLock(Path lockFile) {
        this.lockFile = lockFile;
    }

    public Path getLockFile() {
        return lockFile;
    }

    public boolean isHeld() {
        return Files.exists(lockFile);
    }

    /**
     * Pid recorded in the lock, or empty if there is no lock.
     */
    public OptionalLong readPid() throws JobManagerException {
        String content;
        try {
            content = Files.readString(lockFile, UTF_8).trim();
        } catch (NoSuchFileException e) {
            return OptionalLong.empty();
        } catch (IOException e) {
            throw new StorageException("Cannot read daemon lock " + lockFile, e);
        }
        try {
            return OptionalLong.of(Long.parseLong(content));
        } catch (NumberFormatException e) {
            throw new CorruptStoreException(lockFile, 1, "not a pid: '" + content + "'");
        }
    }

    /**
     * Whether a lock exists but its holder process is gone.
     */
    public boolean isStale() throws JobManagerException {
        OptionalLong pid = readPid();
        return pid.isPresent() && ProcessHandle.of(pid.getAsLong()).map(p -> !p.isAlive()).orElse(true);
    }

    /**
     * Create the lock for {@code pid}.
     *
     * @throws DaemonStateException if a lock already exists
     */
    public void acquire(long pid) throws JobManagerException {
        Path temp = null;
        try {
            Files.createDirectories(lockFile.getParent());
            temp = Files.createTempFile(lockFile.getParent(), "." + lockFile.getFileName(), ".tmp");
            Files.writeString(temp, Long.toString(pid), UTF_8, StandardOpenOption.WRITE);
            // Linking fails if the lock exists, and readers never see a half-written pid
            Files.createLink(lockFile, temp);
        } catch (FileAlreadyExistsException e) {
            throw DaemonStateException.alreadyRunning(readPid().orElse(-1));
        } catch (IOException e) {
            throw new StorageException("Cannot create daemon lock " + lockFile, e);
        } finally {
            removeTemp(temp);
        }
    }

    private static void removeTemp(Path temp) throws StorageException {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            throw new StorageException("Cannot remove temporary lock file " + temp, e);
        }
    }

    /**
     * Remove the lock whoever holds it.
     *
     * @return true if a lock was removed
     */
    public boolean release() throws JobManagerException {
        try {
            return Files.deleteIfExists(lockFile);
        } catch (IOException e) {
            throw new StorageException("Cannot remove daemon lock " + lockFile, e);
        }
    }

    /**
     * Remove the lock only if it still names {@code pid}.
     */
    public boolean releaseIfOwnedBy(long pid) throws JobManagerException {
        OptionalLong holder = readPid();
        if (holder.isPresent() && holder.getAsLong() == pid) {
            return release();
        }
        return false;
    }
}
