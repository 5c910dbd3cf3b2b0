package org.logsplit.pipeline.sink;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.zip.GZIPOutputStream;

import org.logsplit.pipeline.ir.RawRecord;

import lombok.extern.slf4j.Slf4j;

/**
 * A buffered, append-only output stream for one file.
 *
 * Files are always opened with APPEND and never truncated, so reopening a file after it was
 * closed continues exactly where the previous writer stopped. Under gzip every writer session
 * adds one gzip member; concatenated members read back as a single stream.
 */
@Slf4j
public class ShardWriter implements AutoCloseable {

    static final int BUFFER_SIZE = 64 * 1024;

    private final Path path;
    private final OutputStream output;
    private long recordsWritten;
    private boolean closed;

    private ShardWriter(Path path, OutputStream output) {
        this.path = path;
        this.output = output;
    }

    /**
     * Open {@code path} for appending, creating it and any missing parent directories.
     */
    public static ShardWriter open(Path path, boolean gzip) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        OutputStream file = Files.newOutputStream(path,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND,
            StandardOpenOption.WRITE);
        if (!gzip) {
            return new ShardWriter(path, new BufferedOutputStream(file, BUFFER_SIZE));
        }
        try {
            return new ShardWriter(path, new GZIPOutputStream(new BufferedOutputStream(file, BUFFER_SIZE), BUFFER_SIZE));
        } catch (IOException e) {
            file.close();
            throw e;
        }
    }

    public void write(RawRecord record) throws IOException {
        if (closed) {
            throw new IOException("Writer is closed: " + path);
        }
        output.write(record.payload());
        record.terminator().writeTo(output);
        recordsWritten++;
    }

    /**
     * Flush buffered bytes, then close the file. Idempotent.
     * A failing flush still closes the file; the flush failure is thrown with any close failure suppressed.
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try (OutputStream toClose = output) {
            toClose.flush();
        }
        log.trace("Closed {} after {} records", path, recordsWritten);
    }

    public Path getPath() {
        return path;
    }

    public long getRecordsWritten() {
        return recordsWritten;
    }

    public boolean isClosed() {
        return closed;
    }
}
