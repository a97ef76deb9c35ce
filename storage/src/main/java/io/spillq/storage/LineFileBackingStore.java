// file: storage/src/main/java/io/spillq/storage/LineFileBackingStore.java
package io.spillq.storage;

import io.spillq.core.QueueIoException;
import io.spillq.core.RecordLines;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardOpenOption.*;

/**
 * Newline-delimited UTF-8 file holding spilled records.
 * <p>
 * Format:
 *   record-1 '\n' record-2 '\n' ... record-n '\n'
 *   (no header, no length prefix, no checksum)
 * <p>
 * append():
 *   - opens the file with CREATE+APPEND,
 *   - terminates a torn last line first, so it stays a record of its own,
 *   - writes all records through one buffered stream,
 *   - optionally forces contents to the device,
 *   - on failure truncates back to the pre-append size (best effort).
 * <p>
 * popFirst():
 *   - streams the file; bytes up to the first '\n' are the returned record,
 *   - the rest is copied verbatim to "<name>.<random>.compact" in the same directory,
 *   - the scratch file takes over the original's POSIX permissions, where
 *     the file system has them,
 *   - the scratch file then replaces the original using ATOMIC_MOVE.
 *   If anything before the move fails the scratch file is deleted and the
 *   original is untouched.
 */
public final class LineFileBackingStore implements BackingStore {
    private static final Logger log = Logger.getLogger(LineFileBackingStore.class.getName());
    private static final int IO_BUFFER_BYTES = 64 * 1024;

    private final Path path;
    private final Path scratchDir;
    private final boolean fsync;

    public LineFileBackingStore(Path path, boolean fsync) {
        this(path, fsync, Objects.requireNonNull(path, "path").toAbsolutePath().getParent());
    }

    /** scratchDir must be on the same file system as path. */
    LineFileBackingStore(Path path, boolean fsync, Path scratchDir) {
        this.path = Objects.requireNonNull(path, "path");
        this.scratchDir = Objects.requireNonNull(scratchDir, "scratchDir");
        this.fsync = fsync;
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public void append(List<String> records) {
        if (records.isEmpty()) return;
        try (FileChannel ch = FileChannel.open(path, CREATE, READ, WRITE, APPEND)) {
            long before = ch.size();
            try {
                // not closed on purpose: closing it would close ch before rollback
                OutputStream out = new BufferedOutputStream(Channels.newOutputStream(ch), IO_BUFFER_BYTES);
                if (before > 0 && lastByte(ch, before) != RecordLines.TERMINATOR) {
                    log.warning(() -> "Terminating torn last line of " + path + " before append");
                    out.write(RecordLines.TERMINATOR);
                }
                for (String r : records) {
                    out.write(r.getBytes(StandardCharsets.UTF_8));
                    out.write(RecordLines.TERMINATOR);
                }
                out.flush();
                if (fsync) ch.force(true);
            } catch (IOException e) {
                rollback(ch, before, e);
                throw e;
            }
        } catch (IOException e) {
            throw new QueueIoException("append of " + records.size() + " records failed", path, e);
        }
    }

    @Override
    public Optional<String> popFirst() {
        String first;
        Path scratch;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path, READ), IO_BUFFER_BYTES)) {
            first = readFirstLine(in);
            if (first == null) return Optional.empty();

            scratch = createScratch();
            try {
                copyPermissions(scratch);
                copyRemainder(in, scratch);
            } catch (IOException e) {
                deleteScratch(scratch, e);
                throw e;
            }
        } catch (NoSuchFileException e) {
            // nothing was ever spilled here
            return Optional.empty();
        } catch (IOException e) {
            throw new QueueIoException("compaction failed, store left unchanged", path, e);
        }

        try {
            Files.move(scratch, path, ATOMIC_MOVE);
        } catch (IOException e) {
            deleteScratch(scratch, e);
            throw new QueueIoException("replacing store with compacted copy failed", path, e);
        }
        return Optional.of(first);
    }

    @Override
    public long countRecords() {
        try (InputStream in = Files.newInputStream(path, READ)) {
            byte[] buf = new byte[IO_BUFFER_BYTES];
            long count = 0;
            for (int n; (n = in.read(buf)) != -1; ) {
                for (int i = 0; i < n; i++) {
                    if (buf[i] == RecordLines.TERMINATOR) count++;
                }
            }
            return count;
        } catch (NoSuchFileException e) {
            return 0;
        } catch (IOException e) {
            throw new QueueIoException("counting records failed", path, e);
        }
    }

    @Override
    public boolean hasRecords() {
        try {
            return Files.size(path) > 0;
        } catch (NoSuchFileException e) {
            return false;
        } catch (IOException e) {
            throw new QueueIoException("stat failed", path, e);
        }
    }

    /**
     * @return bytes up to (not including) the first '\n', decoded as UTF-8;
     *         a final line without terminator is returned as-is;
     *         null if the stream is empty.
     */
    private static String readFirstLine(InputStream in) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream(256);
        boolean sawAny = false;
        for (int b; (b = in.read()) != -1; ) {
            sawAny = true;
            if (b == RecordLines.TERMINATOR) break;
            line.write(b);
        }
        return sawAny ? line.toString(StandardCharsets.UTF_8) : null;
    }

    private static int lastByte(FileChannel ch, long size) throws IOException {
        ByteBuffer one = ByteBuffer.allocate(1);
        while (one.hasRemaining()) {
            if (ch.read(one, size - 1) < 0) throw new IOException("file shrank during append");
        }
        return one.get(0);
    }

    private Path createScratch() throws IOException {
        return Files.createTempFile(scratchDir, path.getFileName().toString() + ".", ".compact");
    }

    // createTempFile makes rw------- files; the compacted copy keeps the original mode
    private void copyPermissions(Path scratch) throws IOException {
        if (path.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(scratch, Files.getPosixFilePermissions(path));
        }
    }

    private void copyRemainder(InputStream in, Path scratch) throws IOException {
        try (FileChannel ch = FileChannel.open(scratch, WRITE, TRUNCATE_EXISTING)) {
            OutputStream out = new BufferedOutputStream(Channels.newOutputStream(ch), IO_BUFFER_BYTES);
            in.transferTo(out);
            out.flush();
            if (fsync) ch.force(true);
        }
    }

    private void rollback(FileChannel ch, long size, IOException cause) {
        try {
            ch.truncate(size);
        } catch (IOException e) {
            cause.addSuppressed(e);
            log.log(Level.WARNING, "Could not roll back partial append on " + path
                    + "; file may hold a partial batch", e);
        }
    }

    private static void deleteScratch(Path scratch, IOException cause) {
        try {
            Files.deleteIfExists(scratch);
        } catch (IOException e) {
            cause.addSuppressed(e);
            log.log(Level.WARNING, "Could not delete scratch file " + scratch, e);
        }
    }
}
