package org.logsplit.pipeline.shard;

import java.time.YearMonth;

import org.logsplit.pipeline.ir.ParsedTimestamp;
import org.logsplit.pipeline.ir.ShardKey;

/**
 * One shard per calendar month, labelled {@code YYYY-MM}.
 */
public class MonthlyShardKeyPolicy implements ShardKeyPolicy {

    @Override
    public ShardKey keyFor(ParsedTimestamp timestamp) {
        YearMonth month = YearMonth.from(timestamp.localDateTime());
        return new ShardKey(month.toString(), month.atDay(1).atStartOfDay());
    }
}
