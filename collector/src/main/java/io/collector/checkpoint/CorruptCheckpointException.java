package io.collector.checkpoint;

import java.io.IOException;
import java.nio.file.Path;

/** The checkpoint file exists but does not hold a non-negative integer. */
public class CorruptCheckpointException extends IOException {
    private final Path file;

    public CorruptCheckpointException(Path file, String content, Throwable cause) {
        super("checkpoint " + file + " is not a non-negative integer: '" + content + "'", cause);
        this.file = file;
    }

    public Path file() { return file; }
}
