package org.logsplit.pipeline.shard;

import java.util.function.Supplier;

/**
 * Named partitioning granularities, each backed by a {@link ShardKeyPolicy}.
 */
public enum ShardGranularity {
    HOUR(HourlyShardKeyPolicy::new),
    DAY(DailyShardKeyPolicy::new),
    MONTH(MonthlyShardKeyPolicy::new);

    private final Supplier<ShardKeyPolicy> policyFactory;

    ShardGranularity(Supplier<ShardKeyPolicy> policyFactory) {
        this.policyFactory = policyFactory;
    }

    public ShardKeyPolicy policy() {
        return policyFactory.get();
    }
}
