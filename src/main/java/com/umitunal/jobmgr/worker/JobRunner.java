package com.umitunal.jobmgr.worker;

import com.umitunal.jobmgr.core.Job;
import com.umitunal.jobmgr.core.JobStore;
import com.umitunal.jobmgr.core.OutputSink;
import com.umitunal.jobmgr.error.JobManagerException;
import com.umitunal.jobmgr.process.CommandExecutor;
import com.umitunal.jobmgr.process.ExecutionResult;
import com.umitunal.jobmgr.process.ProcessController;
import com.umitunal.jobmgr.process.RunningCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Set;

/**
 * Executes one claimed job: spawn, bind pid, wait, store output, record the
 * terminal status. Failures end this job only.
 */
class JobRunner {
    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final JobStore store;
    private final OutputSink outputSink;
    private final ProcessController processController;
    private final CommandExecutor executor;

    JobRunner(JobStore store, OutputSink outputSink, ProcessController processController, CommandExecutor executor) {
        this.store = store;
        this.outputSink = outputSink;
        this.processController = processController;
        this.executor = executor;
    }

    /**
     * Run a job already marked RUNNING.
     *
     * @param job      the claimed job
     * @param inFlight holds the live command from spawn until it has exited
     * @return the terminal status that was recorded
     */
    Job.Status run(Job job, Set<RunningCommand> inFlight) {
        RunningCommand running = null;
        boolean outputWritten = false;
        try {
            Path workdir = Paths.get(job.getWorkdir());
            if (!Files.isDirectory(workdir)) {
                throw new NoSuchFileException(job.getWorkdir(), null, "working directory does not exist");
            }

            log.info("Starting job {} in {}: {}", job.getId(), workdir, job.getCommand());
            running = executor.start(job.getCommand(), workdir);
            inFlight.add(running);
            processController.bind(job.getKey(), running.pid());

            ExecutionResult result = running.await();
            outputSink.write(job.getKey(), result.getStdout(), result.getStderr());
            outputWritten = true;

            Job.Status status = result.isSuccess() ? Job.Status.COMPLETED : Job.Status.ERROR;
            store.finish(job.getKey(), status);
            if (result.isSuccess()) {
                log.info("Completed job {}: {}", job.getId(), job.getCommand());
            } else {
                log.error("Error in job {} with code {}: {}", job.getId(), result.getExitCode(), job.getCommand());
            }
            return status;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (running != null) {
                running.kill();
            }
            fail(job, e, outputWritten);
            return Job.Status.ERROR;
        } catch (Exception e) {
            if (running != null) {
                running.kill();
            }
            fail(job, e, outputWritten);
            return Job.Status.ERROR;
        } finally {
            if (running != null) {
                inFlight.remove(running);
            }
        }
    }

    /**
     * Record ERROR. The captured output of a process that did exit is kept; the
     * failure message only replaces it when there is none.
     */
    private void fail(Job job, Exception cause, boolean outputWritten) {
        log.error("Error running job {}: {}", job.getId(), cause.toString());
        if (!outputWritten) {
            try {
                outputSink.write(job.getKey(), "", "Job failed: " + cause);
            } catch (JobManagerException e) {
                log.warn("Could not record failure output of job {}", job.getId(), e);
            }
        }
        try {
            store.finish(job.getKey(), Job.Status.ERROR);
        } catch (JobManagerException | IllegalStateException e) {
            log.warn("Could not mark job {} as ERROR", job.getId(), e);
        }
    }
}
