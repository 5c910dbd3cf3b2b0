package org.logsplit.pipeline;

import java.nio.file.Path;

import org.logsplit.pipeline.extract.JsonTimestampExtractor;
import org.logsplit.pipeline.extract.TimestampFormat;
import org.logsplit.pipeline.shard.ShardGranularity;
import org.logsplit.pipeline.sink.ShardHandlePool;

import lombok.Builder;
import lombok.Value;

/**
 * Everything a split run needs to know, with the defaults of the command line tool.
 */
@Value
@Builder
public class SplitConfig {

    Path inputPath;

    /** Shards are written to {@code <outputPrefix>-<key>}. */
    String outputPrefix;

    @Builder.Default
    String timestampField = JsonTimestampExtractor.DEFAULT_FIELD;

    /** A java.time pattern, or {@code ISO}. */
    @Builder.Default
    String timestampFormat = TimestampFormat.ASCTIME_PATTERN;

    @Builder.Default
    ShardGranularity granularity = ShardGranularity.DAY;

    @Builder.Default
    int maxOpenShards = ShardHandlePool.DEFAULT_MAX_OPEN_SHARDS;

    @Builder.Default
    boolean gzip = false;

    @Builder.Default
    String shardSuffix = "";

    /** Keep skipped lines in {@code <outputPrefix>.error}. */
    @Builder.Default
    boolean writeSkippedRecords = true;

    /** Threads used to parse records; 1 keeps the whole run on the calling thread. */
    @Builder.Default
    int extractionParallelism = 1;

    /**
     * @throws IllegalArgumentException describing the first invalid setting
     */
    public void validate() {
        if (inputPath == null) {
            throw new IllegalArgumentException("Input path is required");
        }
        if (outputPrefix == null || outputPrefix.isBlank()) {
            throw new IllegalArgumentException("Output prefix is required");
        }
        if (timestampField == null || timestampField.isBlank()) {
            throw new IllegalArgumentException("Timestamp field cannot be empty");
        }
        if (granularity == null) {
            throw new IllegalArgumentException("Granularity is required");
        }
        if (maxOpenShards < 1) {
            throw new IllegalArgumentException("maxOpenShards must be at least 1, got " + maxOpenShards);
        }
        if (extractionParallelism < 1) {
            throw new IllegalArgumentException("extractionParallelism must be at least 1, got " + extractionParallelism);
        }
        TimestampFormat.of(timestampFormat);
    }
}
