package com.umitunal.jobmgr.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces several store files as one unit.
 * <p>
 * New contents are staged in temp files. Renaming the commit manifest (temp name
 * and target name per line) into place is the commit point; the renames of the
 * staged files follow. If the process dies or a rename fails after the commit
 * point, {@link #recover} finishes the renames on the next access. Staged files
 * without a committed manifest are discarded, leaving the previous contents.
 * <p>
 * Callers hold the {@link StoreMutex} for the whole transaction and for recovery.
 */
final class StoreTransaction {
    private static final Logger log = LoggerFactory.getLogger(StoreTransaction.class);
    private static final String SEPARATOR = "\t";

    private final StoreLayout layout;
    private final boolean durable;
    private final Map<Path, Path> staged = new LinkedHashMap<>();

    StoreTransaction(StoreLayout layout, boolean durable) {
        this.layout = layout;
        this.durable = durable;
    }

    /**
     * Stage the new lines of {@code target}; nothing visible changes yet.
     */
    void stage(Path target, List<String> lines) throws IOException {
        try {
            staged.put(AtomicFiles.writeTemp(target, AtomicFiles.joinLines(lines), durable), target);
        } catch (IOException e) {
            discard();
            throw e;
        }
    }

    /**
     * Commit and apply every staged file.
     */
    void commit() throws IOException {
        try {
            prepare();
        } catch (IOException e) {
            discard();
            throw e;
        }
        apply(layout);
    }

    /**
     * Write the manifest. Once this returns the transaction is durable.
     */
    void prepare() throws IOException {
        List<String> manifest = new ArrayList<>(staged.size());
        for (Map.Entry<Path, Path> entry : staged.entrySet()) {
            manifest.add(entry.getKey().getFileName() + SEPARATOR + entry.getValue().getFileName());
        }
        AtomicFiles.writeLines(layout.commitFile(), manifest, durable);
    }

    private void discard() throws IOException {
        for (Path temp : staged.keySet()) {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Finish a committed transaction left behind by a crash or a failed rename,
     * and remove staged files that were never committed.
     */
    static void recover(StoreLayout layout) throws IOException {
        if (Files.exists(layout.commitFile())) {
            log.warn("Completing an interrupted store write in {}", layout.baseDirectory());
            apply(layout);
        }
        removeUncommitted(layout);
    }

    private static void apply(StoreLayout layout) throws IOException {
        Path base = layout.baseDirectory();
        for (String line : AtomicFiles.readLines(layout.commitFile())) {
            String[] names = line.split(SEPARATOR, 2);
            if (names.length != 2) {
                throw new IOException("Malformed commit manifest line in " + layout.commitFile() + ": " + line);
            }
            Path temp = base.resolve(names[0]);
            // A missing temp was renamed by an earlier, interrupted attempt
            if (Files.exists(temp)) {
                Files.move(temp, base.resolve(names[1]),
                        StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            }
        }
        Files.deleteIfExists(layout.commitFile());
    }

    private static void removeUncommitted(StoreLayout layout) throws IOException {
        String glob = ".{" + String.join(",",
                layout.jobsFile().getFileName().toString(),
                layout.statusFile().getFileName().toString(),
                layout.pidsFile().getFileName().toString(),
                layout.commitFile().getFileName().toString()) + "}*.tmp";
        try (DirectoryStream<Path> leftovers = Files.newDirectoryStream(layout.baseDirectory(), glob)) {
            for (Path leftover : leftovers) {
                log.warn("Removing uncommitted store file {}", leftover.getFileName());
                Files.deleteIfExists(leftover);
            }
        }
    }
}
