package org.logsplit.pipeline.ir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * The terminator that ended a record's line in the input.
 * A record is written back out with the same terminator it was read with.
 */
public enum LineTerminator {
    LF("\n"),
    CRLF("\r\n"),
    /** Last line of a file that has no trailing newline. Written out as LF so later appends stay on their own line. */
    NONE("\n");

    private final byte[] outputBytes;

    LineTerminator(String output) {
        this.outputBytes = output.getBytes(StandardCharsets.US_ASCII);
    }

    public void writeTo(OutputStream output) throws IOException {
        output.write(outputBytes);
    }
}
