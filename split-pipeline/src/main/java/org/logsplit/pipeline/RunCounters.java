package org.logsplit.pipeline;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import org.logsplit.pipeline.ir.SkipReason;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * Per-run tallies. A record is counted as read at the moment it is accounted for,
 * so {@code recordsRead == recordsRouted + totalSkipped()} holds between any two records.
 *
 * Owned by a single pipeline run and updated from its routing stage only.
 */
@Getter
public class RunCounters {

    private long recordsRead;
    private long recordsRouted;
    @Getter(AccessLevel.NONE)
    private final EnumMap<SkipReason, Long> skipped = new EnumMap<>(SkipReason.class);

    public RunCounters() {
        for (SkipReason reason : SkipReason.values()) {
            skipped.put(reason, 0L);
        }
    }

    public void recordRouted() {
        recordsRead++;
        recordsRouted++;
    }

    public void recordSkipped(SkipReason reason) {
        recordsRead++;
        skipped.merge(reason, 1L, Long::sum);
    }

    public long skipped(SkipReason reason) {
        return skipped.get(reason);
    }

    public long totalSkipped() {
        return skipped.values().stream().mapToLong(Long::longValue).sum();
    }

    public Map<SkipReason, Long> skippedByReason() {
        return Collections.unmodifiableMap(new EnumMap<>(skipped));
    }

    public String summary() {
        StringBuilder summary = new StringBuilder()
            .append("read=").append(recordsRead)
            .append(" routed=").append(recordsRouted)
            .append(" skipped=").append(totalSkipped());
        skipped.forEach((reason, count) -> summary.append(' ').append(reason.label()).append('=').append(count));
        return summary.toString();
    }

    @Override
    public String toString() {
        return "RunCounters{" + summary() + "}";
    }
}
