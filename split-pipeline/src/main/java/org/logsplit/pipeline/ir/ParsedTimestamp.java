package org.logsplit.pipeline.ir;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Date-time recovered from a record's timestamp field.
 *
 * The local date-time is kept exactly as written in the record. An offset, when the
 * string carried one, is retained but never applied, so the calendar date is the one
 * visible in the log line.
 */
public record ParsedTimestamp(
    LocalDateTime localDateTime,
    ZoneOffset offset
) {
    public static ParsedTimestamp of(LocalDateTime localDateTime) {
        return new ParsedTimestamp(localDateTime, null);
    }

    public LocalDate date() {
        return localDateTime.toLocalDate();
    }
}
