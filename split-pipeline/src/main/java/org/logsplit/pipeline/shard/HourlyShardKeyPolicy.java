package org.logsplit.pipeline.shard;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

import org.logsplit.pipeline.ir.ParsedTimestamp;
import org.logsplit.pipeline.ir.ShardKey;

/**
 * One shard per hour, labelled {@code YYYY-MM-DDTHH}.
 */
public class HourlyShardKeyPolicy implements ShardKeyPolicy {

    private static final DateTimeFormatter LABEL = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH");

    @Override
    public ShardKey keyFor(ParsedTimestamp timestamp) {
        LocalDateTime hour = timestamp.localDateTime().truncatedTo(ChronoUnit.HOURS);
        return new ShardKey(LABEL.format(hour), hour);
    }
}
