package org.logsplit.pipeline.source;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;

import org.logsplit.pipeline.ir.LineTerminator;
import org.logsplit.pipeline.ir.RawRecord;

/**
 * Splits a byte stream into records on '\n', keeping payload bytes untouched.
 * A '\r' directly before the '\n' is treated as part of the terminator.
 */
class LineReader implements Closeable {

    private static final int BUFFER_SIZE = 64 * 1024;

    private final InputStream input;
    private final byte[] buffer = new byte[BUFFER_SIZE];
    private final ByteArrayOutputStream line = new ByteArrayOutputStream(256);
    private int position;
    private int limit;
    private long lineNumber;

    LineReader(InputStream input) {
        this.input = input;
    }

    /**
     * Read the next record.
     * @return the record, or null at end of input
     */
    RawRecord next() throws IOException {
        line.reset();
        boolean sawBytes = false;
        while (true) {
            if (position >= limit) {
                int read = input.read(buffer, 0, buffer.length);
                position = 0;
                limit = Math.max(read, 0);
                if (read < 0) {
                    return sawBytes ? toRecord(line.toByteArray(), LineTerminator.NONE) : null;
                }
                continue;
            }
            sawBytes = true;
            int start = position;
            while (position < limit && buffer[position] != '\n') {
                position++;
            }
            line.write(buffer, start, position - start);
            if (position < limit) {
                position++;
                return terminatedRecord(line.toByteArray());
            }
        }
    }

    private RawRecord terminatedRecord(byte[] bytes) {
        if (bytes.length > 0 && bytes[bytes.length - 1] == '\r') {
            return toRecord(Arrays.copyOf(bytes, bytes.length - 1), LineTerminator.CRLF);
        }
        return toRecord(bytes, LineTerminator.LF);
    }

    private RawRecord toRecord(byte[] payload, LineTerminator terminator) {
        return new RawRecord(++lineNumber, payload, terminator);
    }

    @Override
    public void close() throws IOException {
        input.close();
    }
}
