package org.logsplit.pipeline.ir;

/**
 * Why a record was not routed to any shard.
 */
public enum SkipReason {
    /** Payload is not a JSON object. */
    MALFORMED("malformed"),
    /** The timestamp field is absent or null. */
    MISSING_FIELD("missing_field"),
    /** The timestamp field is present but could not be parsed as a date-time. */
    UNPARSABLE_TIMESTAMP("unparsable_timestamp");

    private final String label;

    SkipReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
