package com.umitunal.jobmgr.process;

import com.umitunal.jobmgr.error.JobManagerException;
import com.umitunal.jobmgr.error.JobNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Sends signals with the {@code kill} builtin of {@code /bin/sh}. The JDK can only
 * terminate processes, so suspend and continue go through {@code kill -STOP/-CONT}.
 * <p>
 * The signal also goes to every descendant, since a shell may fork the actual
 * command instead of exec'ing it.
 */
public class KillSignaller implements Signaller {
    private static final Logger log = LoggerFactory.getLogger(KillSignaller.class);
    private static final String SHELL = "/bin/sh";

    /**
     * {@code kill} run as a builtin of the same shell that runs the jobs, so no
     * separate kill binary has to be on the PATH.
     */
    static List<String> command(Signal signal, long pid, List<Long> descendants) {
        StringBuilder script = new StringBuilder("kill ").append(signal.killOption()).append(' ').append(pid);
        for (long descendant : descendants) {
            script.append(' ').append(descendant);
        }
        return List.of(SHELL, "-c", script.toString());
    }

    @Override
    public void send(long pid, Signal signal) throws JobManagerException {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty() || !handle.get().isAlive()) {
            throw new JobNotFoundException("Process " + pid + " is no longer running");
        }

        List<String> command = command(signal, pid, handle.get().descendants()
                .map(ProcessHandle::pid)
                .collect(Collectors.toList()));

        try {
            Process kill = new ProcessBuilder(command).redirectErrorStream(true).start();
            String output = new String(kill.getInputStream().readAllBytes(), UTF_8).trim();
            int rc = kill.waitFor();
            if (rc != 0) {
                throw new JobManagerException("kill " + signal.killOption() + " " + pid
                        + " failed with code " + rc + (output.isEmpty() ? "" : ": " + output));
            }
            log.debug("Sent SIG{} to {} and its descendants", signal, pid);
        } catch (IOException e) {
            throw new JobManagerException("Cannot run " + SHELL + " to signal pid " + pid, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobManagerException("Interrupted while signalling pid " + pid, e);
        }
    }
}
