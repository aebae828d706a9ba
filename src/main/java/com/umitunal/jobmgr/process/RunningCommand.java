package com.umitunal.jobmgr.process;

import java.io.IOException;

/**
 * Handle on a command that has been spawned but not yet awaited.
 */
public interface RunningCommand {

    /**
     * OS process id of the spawned child.
     */
    long pid();

    /**
     * Block until the child exits and return its exit code with the full
     * stdout and stderr.
     */
    ExecutionResult await() throws IOException, InterruptedException;

    /**
     * Kill the child and everything it started. Works on stopped processes too.
     */
    void kill();
}
