package com.umitunal.jobmgr.core;

/**
 * Per-status job counts.
 */
public class JobMetrics {
    private final long totalJobs;
    private final long pendingJobs;
    private final long runningJobs;
    private final long pausedJobs;
    private final long completedJobs;
    private final long failedJobs;

    public JobMetrics(long totalJobs, long pendingJobs, long runningJobs,
                      long pausedJobs, long completedJobs, long failedJobs) {
        this.totalJobs = totalJobs;
        this.pendingJobs = pendingJobs;
        this.runningJobs = runningJobs;
        this.pausedJobs = pausedJobs;
        this.completedJobs = completedJobs;
        this.failedJobs = failedJobs;
    }

    public static JobMetrics of(Iterable<Job> jobs) {
        long total = 0;
        long pending = 0;
        long running = 0;
        long paused = 0;
        long completed = 0;
        long failed = 0;

        for (Job job : jobs) {
            total++;
            switch (job.getStatus()) {
                case PENDING -> pending++;
                case RUNNING -> running++;
                case PAUSED -> paused++;
                case COMPLETED -> completed++;
                case ERROR -> failed++;
            }
        }

        return new JobMetrics(total, pending, running, paused, completed, failed);
    }

    public long getTotalJobs() { return totalJobs; }
    public long getPendingJobs() { return pendingJobs; }
    public long getRunningJobs() { return runningJobs; }
    public long getPausedJobs() { return pausedJobs; }
    public long getCompletedJobs() { return completedJobs; }
    public long getFailedJobs() { return failedJobs; }

    @Override
    public String toString() {
        return String.format(
            "JobMetrics{total=%d, pending=%d, running=%d, paused=%d, completed=%d, error=%d}",
            totalJobs, pendingJobs, runningJobs, pausedJobs, completedJobs, failedJobs
        );
    }
}
