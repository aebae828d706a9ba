package com.umitunal.jobmgr.storage;

import com.umitunal.jobmgr.config.ManagerConfig;
import com.umitunal.jobmgr.core.OutputSink;
import com.umitunal.jobmgr.error.JobManagerException;
import com.umitunal.jobmgr.error.JobNotFoundException;
import com.umitunal.jobmgr.error.StorageException;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * One output file per job under {@code output/}. Files are replaced by atomic rename,
 * so a reader sees either no file, the previous content or the complete new content.
 */
public class FileOutputSink implements OutputSink {
    private final StoreLayout layout;
    private final boolean durableWrites;

    public FileOutputSink(ManagerConfig config) {
        this(new StoreLayout(config.getBaseDirectory()), config.isDurableWrites());
    }

    public FileOutputSink(StoreLayout layout, boolean durableWrites) {
        this.layout = layout;
        this.durableWrites = durableWrites;
    }

    /**
     * Stdout, then the errors separator and stderr when stderr is not empty.
     */
    public static String format(String stdout, String stderr) {
        StringBuilder content = new StringBuilder(stdout == null ? "" : stdout);
        if (stderr != null && !stderr.isEmpty()) {
            content.append(ERRORS_SEPARATOR).append(stderr);
        }
        return content.toString();
    }

    @Override
    public void write(String jobKey, String stdout, String stderr) throws JobManagerException {
        try {
            Files.createDirectories(layout.outputDirectory());
            AtomicFiles.writeString(layout.outputFile(jobKey), format(stdout, stderr), durableWrites);
        } catch (IOException e) {
            throw new StorageException("Cannot write output of job " + jobKey, e);
        }
    }

    @Override
    public String read(String jobKey) throws JobManagerException {
        try {
            return Files.readString(layout.outputFile(jobKey), UTF_8);
        } catch (NoSuchFileException e) {
            throw new JobNotFoundException("No output yet for job " + jobKey);
        } catch (IOException e) {
            throw new StorageException("Cannot read output of job " + jobKey, e);
        }
    }

    @Override
    public void delete(String jobKey) throws JobManagerException {
        try {
            Files.deleteIfExists(layout.outputFile(jobKey));
        } catch (IOException e) {
            throw new StorageException("Cannot delete output of job " + jobKey, e);
        }
    }

    /**
     * Swap the output directory for an empty one, then delete the old files.
     * The swap is a single rename, so readers see either every output or none.
     * Directories left by an interrupted earlier clear are removed too.
     */
    @Override
    public void clear() throws JobManagerException {
        Path dir = layout.outputDirectory();
        try {
            if (Files.isDirectory(dir)) {
                Path trash = dir.resolveSibling("." + dir.getFileName() + "-" + UUID.randomUUID() + ".trash");
                Files.move(dir, trash, StandardCopyOption.ATOMIC_MOVE);
            }
            Files.createDirectories(dir);
            try (DirectoryStream<Path> trashed = Files.newDirectoryStream(dir.getParent(),
                    "." + dir.getFileName() + "-*.trash")) {
                for (Path trash : trashed) {
                    deleteTree(trash);
                }
            }
        } catch (IOException e) {
            throw new StorageException("Cannot clear output directory " + dir, e);
        }
    }

    private static void deleteTree(Path trash) throws IOException {
        try (DirectoryStream<Path> files = Files.newDirectoryStream(trash)) {
            for (Path file : files) {
                Files.deleteIfExists(file);
            }
        }
        Files.deleteIfExists(trash);
    }
}
