package org.logsplit.pipeline;

import java.time.Duration;
import java.util.StringJoiner;

/** Renders elapsed times as {@code 1h 2m 3s 45ms}. */
final class Durations {

    private Durations() {}

    static String humanReadable(Duration duration) {
        StringJoiner parts = new StringJoiner(" ");
        if (duration.toHours() > 0) {
            parts.add(duration.toHours() + "h");
        }
        if (duration.toMinutesPart() > 0) {
            parts.add(duration.toMinutesPart() + "m");
        }
        if (duration.toSecondsPart() > 0) {
            parts.add(duration.toSecondsPart() + "s");
        }
        if (duration.toMillisPart() > 0 || parts.length() == 0) {
            parts.add(duration.toMillisPart() + "ms");
        }
        return parts.toString();
    }
}
