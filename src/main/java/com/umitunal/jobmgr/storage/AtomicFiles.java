package com.umitunal.jobmgr.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Whole-file replacement through a temp file and an atomic rename, so readers
 * see either the old or the new content.
 */
final class AtomicFiles {

    private AtomicFiles() {
    }

    static void writeLines(Path target, List<String> lines, boolean durable) throws IOException {
        writeString(target, joinLines(lines), durable);
    }

    static void writeString(Path target, String content, boolean durable) throws IOException {
        Path temp = writeTemp(target, content, durable);
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    static String joinLines(List<String> lines) {
        StringBuilder content = new StringBuilder();
        for (String line : lines) {
            content.append(line).append('\n');
        }
        return content.toString();
    }

    /**
     * Write {@code content} to a new temp file next to {@code target}, named
     * {@code .<target name><random>.tmp}.
     */
    static Path writeTemp(Path target, String content, boolean durable) throws IOException {
        Path temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
        try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(content.getBytes(UTF_8));
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            if (durable) {
                channel.force(true);
            }
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        return temp;
    }

    static List<String> readLines(Path file) throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        return Files.readAllLines(file, UTF_8);
    }
}
