package org.logsplit.pipeline.ir;

import java.nio.charset.StandardCharsets;

/**
 * One input line exactly as read, without its line terminator.
 *
 * The payload bytes are never modified between reading and writing; a routed record
 * lands in its shard file byte-for-byte.
 */
public record RawRecord(
    long lineNumber,
    byte[] payload,
    LineTerminator terminator
) {
    /** Payload decoded as UTF-8, for diagnostics only. */
    public String text() {
        return new String(payload, StandardCharsets.UTF_8);
    }
}
