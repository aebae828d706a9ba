package com.umitunal.jobmgr.process;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Runs commands as {@code <shell> -c <command>}, inheriting the environment of
 * this JVM. Stderr is drained on its own thread so a chatty child never blocks
 * on a full pipe.
 */
public class ShellCommandExecutor implements CommandExecutor {
    private final String shell;

    public ShellCommandExecutor(String shell) {
        this.shell = shell;
    }

    public String getShell() {
        return shell;
    }

    @Override
    public RunningCommand start(String command, Path workdir) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(shell, "-c", command)
                .directory(workdir.toFile());
        Process process = builder.start();
        // Jobs run unattended: stdin is at EOF from the start
        process.getOutputStream().close();
        return new ShellProcess(process);
    }

    private static String readFully(InputStream in) throws IOException {
        try (in) {
            return new String(in.readAllBytes(), UTF_8);
        }
    }

    private static final class ShellProcess implements RunningCommand {
        private final Process process;
        private final CompletableFuture<String> stderr;

        ShellProcess(Process process) {
            this.process = process;
            this.stderr = CompletableFuture.supplyAsync(() -> {
                try {
                    return readFully(process.getErrorStream());
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }, task -> {
                Thread thread = new Thread(task, "job-stderr-" + process.pid());
                thread.setDaemon(true);
                thread.start();
            });
        }

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public ExecutionResult await() throws IOException, InterruptedException {
            String out = readFully(process.getInputStream());
            int exitCode = process.waitFor();
            try {
                return new ExecutionResult(exitCode, out, stderr.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof UncheckedIOException) {
                    throw ((UncheckedIOException) e.getCause()).getCause();
                }
                throw e;
            }
        }

        @Override
        public void kill() {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }
    }
}
