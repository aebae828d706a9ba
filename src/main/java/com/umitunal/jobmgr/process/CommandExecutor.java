package com.umitunal.jobmgr.process;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Spawns a command line as a child process.
 */
@FunctionalInterface
public interface CommandExecutor {

    /**
     * Start {@code command} in {@code workdir} with the current environment.
     *
     * @throws IOException if the process cannot be spawned
     */
    RunningCommand start(String command, Path workdir) throws IOException;
}
