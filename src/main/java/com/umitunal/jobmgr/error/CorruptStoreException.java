package com.umitunal.jobmgr.error;

import java.nio.file.Path;

/**
 * Raised when persisted state cannot be decoded. The store never repairs
 * such files on its own.
 */
public class CorruptStoreException extends JobManagerException {
    private final Path file;
    private final int line;

    public CorruptStoreException(Path file, int line, String reason) {
        super(String.format("Corrupt record in %s at line %d: %s", file, line, reason));
        this.file = file;
        this.line = line;
    }

    public CorruptStoreException(Path file, String reason) {
        super(String.format("Corrupt store file %s: %s", file, reason));
        this.file = file;
        this.line = 0;
    }

    public Path getFile() { return file; }

    /**
     * 1-based line number, or 0 when the problem spans the whole file.
     */
    public int getLine() { return line; }
}
