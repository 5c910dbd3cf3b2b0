package org.logsplit.pipeline.ir;

/**
 * Outcome of extracting a timestamp from one record: either a timestamp,
 * or the reason the record has to be skipped plus a readable detail message.
 */
public record ExtractionResult(
    ParsedTimestamp timestamp,
    SkipReason skipReason,
    String detail
) {
    public static ExtractionResult success(ParsedTimestamp timestamp) {
        return new ExtractionResult(timestamp, null, null);
    }

    public static ExtractionResult skipped(SkipReason reason, String detail) {
        return new ExtractionResult(null, reason, detail);
    }

    public boolean isSuccess() {
        return timestamp != null;
    }
}
