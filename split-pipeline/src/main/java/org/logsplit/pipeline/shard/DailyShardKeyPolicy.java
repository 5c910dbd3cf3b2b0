package org.logsplit.pipeline.shard;

import org.logsplit.pipeline.ir.ParsedTimestamp;
import org.logsplit.pipeline.ir.ShardKey;

/**
 * One shard per calendar day, labelled {@code YYYY-MM-DD}.
 */
public class DailyShardKeyPolicy implements ShardKeyPolicy {

    @Override
    public ShardKey keyFor(ParsedTimestamp timestamp) {
        return ShardKey.ofDay(timestamp.date());
    }
}
