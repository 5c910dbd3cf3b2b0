package org.logsplit.pipeline.shard;

import org.logsplit.pipeline.ir.ParsedTimestamp;
import org.logsplit.pipeline.ir.ShardKey;

/**
 * The partitioning function: maps a timestamp to the shard it belongs to.
 * Must be pure, total and deterministic.
 */
@FunctionalInterface
public interface ShardKeyPolicy {

    ShardKey keyFor(ParsedTimestamp timestamp);
}
