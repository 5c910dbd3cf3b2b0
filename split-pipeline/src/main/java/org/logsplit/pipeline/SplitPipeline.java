package org.logsplit.pipeline;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import org.logsplit.pipeline.extract.JsonTimestampExtractor;
import org.logsplit.pipeline.extract.TimestampExtractor;
import org.logsplit.pipeline.extract.TimestampFormat;
import org.logsplit.pipeline.ir.ExtractionResult;
import org.logsplit.pipeline.ir.RawRecord;
import org.logsplit.pipeline.ir.ShardKey;
import org.logsplit.pipeline.shard.ShardKeyPolicy;
import org.logsplit.pipeline.sink.FileSkippedRecordSink;
import org.logsplit.pipeline.sink.ShardHandlePool;
import org.logsplit.pipeline.sink.ShardPathResolver;
import org.logsplit.pipeline.sink.SkippedRecordSink;
import org.logsplit.pipeline.source.FileRecordSource;
import org.logsplit.pipeline.source.RecordSource;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Wires a RecordSource to a ShardHandlePool: read, extract, route, write.
 *
 * Routing and writing happen one record at a time in input order, which is what keeps every
 * shard's records in their original relative order. Records without a usable timestamp are
 * counted and handed to the SkippedRecordSink; an I/O failure on the output side aborts the run.
 *
 * The source, the pool and the skipped sink are scoped to the run: they are released exactly once,
 * before the result (or the error) reaches the subscriber, whether the run completes, fails or is cancelled.
 */
@Slf4j
public class SplitPipeline {

    private final RecordSource source;
    private final TimestampExtractor extractor;
    private final ShardKeyPolicy keyPolicy;
    private final ShardHandlePool pool;
    private final SkippedRecordSink skippedSink;
    private final int extractionParallelism;
    private final AtomicReference<PipelineState> state = new AtomicReference<>(PipelineState.IDLE);

    public SplitPipeline(RecordSource source,
                         TimestampExtractor extractor,
                         ShardKeyPolicy keyPolicy,
                         ShardHandlePool pool,
                         SkippedRecordSink skippedSink,
                         int extractionParallelism) {
        if (extractionParallelism < 1) {
            throw new IllegalArgumentException("extractionParallelism must be at least 1, got " + extractionParallelism);
        }
        this.source = source;
        this.extractor = extractor;
        this.keyPolicy = keyPolicy;
        this.pool = pool;
        this.skippedSink = skippedSink;
        this.extractionParallelism = extractionParallelism;
    }

    public SplitPipeline(RecordSource source, TimestampExtractor extractor, ShardKeyPolicy keyPolicy, ShardHandlePool pool) {
        this(source, extractor, keyPolicy, pool, SkippedRecordSink.discarding(), 1);
    }

    /**
     * Build a file-to-files pipeline from configuration.
     *
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public static SplitPipeline fromConfig(SplitConfig config) {
        config.validate();
        var pathResolver = new ShardPathResolver(config.getOutputPrefix(), config.getShardSuffix(), config.isGzip());
        SkippedRecordSink skippedSink = config.isWriteSkippedRecords()
            ? FileSkippedRecordSink.forOutput(pathResolver)
            : SkippedRecordSink.discarding();
        return new SplitPipeline(
            new FileRecordSource(config.getInputPath()),
            new JsonTimestampExtractor(config.getTimestampField(), TimestampFormat.of(config.getTimestampFormat())),
            config.getGranularity().policy(),
            new ShardHandlePool(pathResolver, config.getMaxOpenShards()),
            skippedSink,
            config.getExtractionParallelism()
        );
    }

    /**
     * Run the split. Emits the run's counters once every shard has been flushed and closed.
     * A pipeline runs once; subscribing again signals IllegalStateException.
     */
    public Mono<RunCounters> split() {
        return Mono.defer(() -> {
            if (!state.compareAndSet(PipelineState.IDLE, PipelineState.RUNNING)) {
                return Mono.error(new IllegalStateException("Pipeline cannot run again, state is " + state.get()));
            }
            var run = new Run();
            return Flux.usingWhen(
                    Mono.just(pool),
                    ignored -> routeAll(run),
                    ignored -> Mono.fromRunnable(this::releaseOutputs),
                    (ignored, error) -> Mono.fromRunnable(() -> releaseOutputsAfter(error)),
                    ignored -> Mono.fromRunnable(() -> releaseOutputsAfter(null)))
                .then(Mono.fromSupplier(() -> run.counters))
                .doOnSuccess(counters -> {
                    state.set(PipelineState.COMPLETED);
                    log.info("Finished processing {} lines in {}.", counters.getRecordsRead(), run.elapsed());
                    logSummary(counters);
                })
                .doOnError(error -> {
                    state.set(PipelineState.ABORTED);
                    log.error("Split aborted after {} lines: {}", run.counters.getRecordsRead(), error.getMessage());
                    logSummary(run.counters);
                })
                .doOnCancel(() -> {
                    state.set(PipelineState.ABORTED);
                    log.warn("Split cancelled after {} lines", run.counters.getRecordsRead());
                });
        });
    }

    private Flux<ExtractedRecord> routeAll(Run run) {
        return extractAll(source.readRecords())
            .doOnNext(extracted -> route(extracted, run))
            .doOnComplete(run.shardProgress::finish);
    }

    // flatMapSequential re-emits in input order, so routing stays sequential even when parsing is not
    private Flux<ExtractedRecord> extractAll(Flux<RawRecord> records) {
        if (extractionParallelism == 1) {
            return records.map(this::extract);
        }
        return records.flatMapSequential(
            record -> Mono.fromSupplier(() -> extract(record)).subscribeOn(Schedulers.parallel()),
            extractionParallelism);
    }

    private ExtractedRecord extract(RawRecord record) {
        return new ExtractedRecord(record, extractor.extract(record));
    }

    private void route(ExtractedRecord extracted, Run run) {
        RawRecord record = extracted.record();
        ExtractionResult result = extracted.result();
        if (!result.isSuccess()) {
            skip(record, result, run);
            return;
        }

        ShardKey key = keyPolicy.keyFor(result.timestamp());
        run.shardProgress.advance(key);
        try {
            pool.acquire(key).write(record);
        } catch (IOException e) {
            throw new ShardWriteException(pool.pathFor(key), e);
        }
        run.counters.recordRouted();
    }

    private void skip(RawRecord record, ExtractionResult result, Run run) {
        log.warn("Skipping line {} [{}]: {}", record.lineNumber(), result.skipReason().label(), result.detail());
        try {
            skippedSink.accept(record, result.skipReason());
        } catch (IOException e) {
            throw new ShardWriteException("Could not write skipped line " + record.lineNumber(), e);
        }
        run.counters.recordSkipped(result.skipReason());
    }

    private void releaseOutputs() {
        closeSource();
        IOException failure = null;
        try {
            pool.releaseAll();
        } catch (IOException e) {
            failure = e;
        }
        try {
            skippedSink.close();
        } catch (IOException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }
        if (failure != null) {
            throw new ShardWriteException("Could not flush and close output files", failure);
        }
    }

    private void closeSource() {
        try {
            source.close();
        } catch (Exception e) {
            log.warn("Failed to close record source: {}", e.getMessage(), e);
        }
    }

    /** Release after an error or cancellation; a release failure is attached to the original error. */
    private void releaseOutputsAfter(Throwable error) {
        try {
            releaseOutputs();
        } catch (ShardWriteException e) {
            if (error != null) {
                error.addSuppressed(e);
            } else {
                log.error("Failed to release output files after cancellation", e);
            }
        }
    }

    private static void logSummary(RunCounters counters) {
        log.info("Run summary: {}", counters.summary());
    }

    public PipelineState getState() {
        return state.get();
    }

    private record ExtractedRecord(RawRecord record, ExtractionResult result) {}

    /** Mutable state of one run, touched only from the routing stage. */
    private static final class Run {
        private final RunCounters counters = new RunCounters();
        private final ShardProgress shardProgress = new ShardProgress();
        private final long startNanos = System.nanoTime();

        String elapsed() {
            return Durations.humanReadable(Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    /** Logs each stretch of consecutive records that share a shard once it ends. */
    private static final class ShardProgress {
        private ShardKey current;
        private long records;
        private long startNanos;

        void advance(ShardKey key) {
            if (!key.equals(current)) {
                finish();
                current = key;
                records = 0;
                startNanos = System.nanoTime();
            }
            records++;
        }

        void finish() {
            if (current == null) {
                return;
            }
            log.info("Completed processing {}.  {} records. [Took: {}]",
                current, String.format("%,d", records), Durations.humanReadable(Duration.ofNanos(System.nanoTime() - startNanos)));
        }
    }
}
