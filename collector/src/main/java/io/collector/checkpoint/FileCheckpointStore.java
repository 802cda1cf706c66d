package io.collector.checkpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Cursor kept in a plain text file: one base-10 integer and a line terminator.
 * Saves go through a sibling temp file, forced to disk and then renamed, so a crash never leaves a half-written value.
 */
public class FileCheckpointStore implements CheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(FileCheckpointStore.class);

    private final Path file;

    public FileCheckpointStore(Path file) {
        this.file = file;
    }

    public Path file() { return file; }

    @Override
    public long load() throws IOException {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            log.debug("No checkpoint at {}, starting from 0", file);
            return 0;
        }
        String first = lines.isEmpty() ? "" : lines.get(0).trim();
        try {
            long cursor = Long.parseLong(first);
            if (cursor < 0) throw new CorruptCheckpointException(file, first, null);
            return cursor;
        } catch (NumberFormatException e) {
            throw new CorruptCheckpointException(file, first, e);
        }
    }

    @Override
    public void save(long cursor) throws IOException {
        if (cursor < 0) throw new IllegalArgumentException("cursor must be >= 0, got " + cursor);
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        ByteBuffer content = ByteBuffer.wrap((cursor + System.lineSeparator()).getBytes(StandardCharsets.UTF_8));
        try (FileChannel channel = FileChannel.open(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            while (content.hasRemaining()) channel.write(content);
            channel.force(true);
        }
        try {
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public void reset() throws IOException {
        log.info("Resetting checkpoint {} to 0", file);
        save(0);
    }
}
