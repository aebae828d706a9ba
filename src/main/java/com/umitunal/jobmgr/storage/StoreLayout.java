package com.umitunal.jobmgr.storage;

import java.nio.file.Path;

/**
 * File names under the per-user base directory.
 */
public final class StoreLayout {
    private final Path baseDirectory;

    public StoreLayout(Path baseDirectory) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
    }

    public Path baseDirectory() { return baseDirectory; }
    public Path jobsFile() { return baseDirectory.resolve("jobs.txt"); }
    public Path statusFile() { return baseDirectory.resolve("status.txt"); }
    public Path pidsFile() { return baseDirectory.resolve("pids.txt"); }
    public Path outputDirectory() { return baseDirectory.resolve("output"); }
    public Path storeLockFile() { return baseDirectory.resolve("store.lock"); }
    public Path commitFile() { return baseDirectory.resolve("store.commit"); }
    public Path daemonLockFile() { return baseDirectory.resolve("jobmgr.lock"); }
    public Path daemonOutFile() { return baseDirectory.resolve("daemon.out"); }

    public Path outputFile(String jobKey) {
        return outputDirectory().resolve("job_" + jobKey + ".txt");
    }
}
