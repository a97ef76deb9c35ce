package io.spillq.core;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Open/read/write/rewrite failure on a backing file.
 * Surfaced to the caller as-is; the queue never retries I/O on its own.
 */
public class QueueIoException extends QueueException {
    private final transient Path path;

    public QueueIoException(String message, Path path, IOException cause) {
        super(message + " (" + path + ")", cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
