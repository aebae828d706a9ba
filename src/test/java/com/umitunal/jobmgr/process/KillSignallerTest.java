package com.umitunal.jobmgr.process;

import com.umitunal.jobmgr.error.JobNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;
import static org.assertj.core.api.Assumptions.assumeThat;
import static org.awaitility.Awaitility.await;

class KillSignallerTest {

    private final KillSignaller signaller = new KillSignaller();
    private Process sleeper;

    @BeforeEach
    void setUp() throws Exception {
        assumeThat(Paths.get("/proc/self/stat")).exists();
        sleeper = new ProcessBuilder("sleep", "30").start();
    }

    @AfterEach
    void tearDown() {
        if (sleeper != null) {
            sleeper.destroyForcibly();
        }
    }

    /**
     * Scheduler state letter from /proc: T means stopped.
     */
    private static char state(long pid) throws Exception {
        String stat = Files.readString(Path.of("/proc", Long.toString(pid), "stat"), UTF_8);
        return stat.charAt(stat.lastIndexOf(')') + 2);
    }

    @Test
    @DisplayName("Should stop and continue a live process")
    void testStopAndContinue() throws Exception {
        long pid = sleeper.pid();

        signaller.send(pid, Signal.STOP);
        await().atMost(Duration.ofSeconds(5)).until(() -> state(pid) == 'T');

        signaller.send(pid, Signal.CONT);
        await().atMost(Duration.ofSeconds(5)).until(() -> state(pid) != 'T');
        assertThat(sleeper.isAlive()).isTrue();
    }

    @Test
    @DisplayName("Should report a process that has exited as not found")
    void testDeadProcess() throws Exception {
        sleeper.destroyForcibly().waitFor();

        assertThatThrownBy(() -> signaller.send(sleeper.pid(), Signal.STOP))
                .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    @DisplayName("Should signal through the shell builtin, not a kill binary")
    void testShellBuiltinCommand() {
        // When
        var command = KillSignaller.command(Signal.STOP, 123, List.of(124L, 125L));

        // Then
        assertThat(command).containsExactly("/bin/sh", "-c", "kill -STOP 123 124 125");
    }
}
