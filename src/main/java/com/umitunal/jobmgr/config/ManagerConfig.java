package com.umitunal.jobmgr.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration for the job store, the worker pool and the daemon loop.
 */
public class ManagerConfig {
    public static final String HOME_PROPERTY = "jobmgr.home";
    public static final String HOME_ENV = "JOBMGR_HOME";

    private final Path baseDirectory;
    private final boolean durableWrites;
    private final long pollIntervalMillis;
    private final int workerCapacity;
    private final String shell;
    private final long shutdownGraceMillis;

    private ManagerConfig(Builder builder) {
        this.baseDirectory = builder.baseDirectory;
        this.durableWrites = builder.durableWrites;
        this.pollIntervalMillis = builder.pollIntervalMillis;
        this.workerCapacity = builder.workerCapacity;
        this.shell = builder.shell;
        this.shutdownGraceMillis = builder.shutdownGraceMillis;
    }

    public Path getBaseDirectory() { return baseDirectory; }
    public boolean isDurableWrites() { return durableWrites; }
    public long getPollIntervalMillis() { return pollIntervalMillis; }
    public int getWorkerCapacity() { return workerCapacity; }
    public String getShell() { return shell; }
    public long getShutdownGraceMillis() { return shutdownGraceMillis; }

    public static Builder newBuilder(Path baseDirectory) {
        return new Builder(baseDirectory);
    }

    /**
     * Build a configuration from the process environment.
     * <p>
     * Base directory: system property {@code jobmgr.home}, then {@code $JOBMGR_HOME},
     * then {@code ~/.jobmgr}. The shell comes from {@code $SHELL}. The remaining
     * settings can be overridden with {@code jobmgr.pollInterval},
     * {@code jobmgr.workers}, {@code jobmgr.durableWrites} and {@code jobmgr.shutdownGrace}.
     */
    public static ManagerConfig fromEnvironment() {
        return fromEnvironment(System.getenv(), System.getProperties());
    }

    static ManagerConfig fromEnvironment(Map<String, String> env, Properties props) {
        String home = props.getProperty(HOME_PROPERTY);
        if (home == null || home.isBlank()) {
            home = env.get(HOME_ENV);
        }
        Path base = home == null || home.isBlank()
                ? Paths.get(props.getProperty("user.home"), ".jobmgr")
                : Paths.get(home);

        Builder builder = newBuilder(base.toAbsolutePath());

        String shell = env.get("SHELL");
        if (shell != null && !shell.isBlank()) {
            builder.withShell(shell);
        }

        String poll = props.getProperty("jobmgr.pollInterval");
        if (poll != null) {
            builder.withPollInterval(Long.parseLong(poll.trim()));
        }
        String workers = props.getProperty("jobmgr.workers");
        if (workers != null) {
            builder.withWorkerCapacity(Integer.parseInt(workers.trim()));
        }
        String durable = props.getProperty("jobmgr.durableWrites");
        if (durable != null) {
            builder.withDurableWrites(Boolean.parseBoolean(durable.trim()));
        }
        String grace = props.getProperty("jobmgr.shutdownGrace");
        if (grace != null) {
            builder.withShutdownGrace(Long.parseLong(grace.trim()));
        }

        return builder.build();
    }

    public static class Builder {
        private final Path baseDirectory;
        private boolean durableWrites = false;
        private long pollIntervalMillis = 10_000;
        private int workerCapacity = 10;
        private String shell = "/bin/sh";
        private long shutdownGraceMillis = 30_000;

        private Builder(Path baseDirectory) {
            this.baseDirectory = baseDirectory;
        }

        /**
         * Enable durable writes (fsync before every rename).
         * Default: false
         */
        public Builder withDurableWrites(boolean enable) {
            this.durableWrites = enable;
            return this;
        }

        /**
         * Delay between two scans of the daemon loop.
         * Default: 10 seconds
         */
        public Builder withPollInterval(long millis) {
            if (millis <= 0) {
                throw new IllegalArgumentException("poll interval must be positive: " + millis);
            }
            this.pollIntervalMillis = millis;
            return this;
        }

        /**
         * Maximum number of jobs executing at once.
         * Default: 10
         */
        public Builder withWorkerCapacity(int capacity) {
            if (capacity <= 0) {
                throw new IllegalArgumentException("worker capacity must be positive: " + capacity);
            }
            this.workerCapacity = capacity;
            return this;
        }

        /**
         * Shell used as {@code <shell> -c <command>}.
         * Default: /bin/sh
         */
        public Builder withShell(String shell) {
            this.shell = shell;
            return this;
        }

        /**
         * How long a stopping daemon lets running jobs finish before killing them.
         * Default: 30 seconds
         */
        public Builder withShutdownGrace(long millis) {
            this.shutdownGraceMillis = millis;
            return this;
        }

        public ManagerConfig build() {
            return new ManagerConfig(this);
        }
    }
}
