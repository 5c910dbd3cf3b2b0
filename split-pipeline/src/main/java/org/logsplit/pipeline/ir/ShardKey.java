package org.logsplit.pipeline.ir;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;

/**
 * Identifies one output partition. Records with equal keys share a file.
 * Keys order by the start of the period they cover.
 */
public record ShardKey(
    String label,
    LocalDateTime periodStart
) implements Comparable<ShardKey> {

    private static final Comparator<ShardKey> ORDER =
        Comparator.comparing(ShardKey::periodStart).thenComparing(ShardKey::label);

    public ShardKey {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Shard key label cannot be null or empty");
        }
        if (periodStart == null) {
            throw new IllegalArgumentException("Shard key period start cannot be null");
        }
    }

    /** Day key labelled {@code YYYY-MM-DD}. */
    public static ShardKey ofDay(LocalDate day) {
        return new ShardKey(day.toString(), day.atStartOfDay());
    }

    @Override
    public int compareTo(ShardKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return label;
    }
}
