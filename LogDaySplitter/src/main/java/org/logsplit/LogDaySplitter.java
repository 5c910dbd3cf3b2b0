package org.logsplit;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.logsplit.pipeline.RunCounters;
import org.logsplit.pipeline.SplitConfig;
import org.logsplit.pipeline.SplitPipeline;
import org.logsplit.pipeline.SplitPipelineException;
import org.logsplit.pipeline.extract.JsonTimestampExtractor;
import org.logsplit.pipeline.extract.TimestampFormat;
import org.logsplit.pipeline.ir.RawRecord;
import org.logsplit.pipeline.shard.ShardGranularity;
import org.logsplit.pipeline.sink.ShardHandlePool;
import org.logsplit.pipeline.source.FileRecordSource;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Command line entry point: splits a JSON-lines log into one file per day.
 *
 * Exit status is 0 when the run completes (skipped lines included), 1 when it is aborted by an
 * I/O failure, and 2 for invalid arguments.
 */
@Command(name = "split", mixinStandardHelpOptions = true, version = "0.1.0",
         description = "Split a JSON-lines log file into one output file per calendar day")
@Slf4j
public class LogDaySplitter implements Callable<Integer> {

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;

    /** Output value that prints the input to stdout instead of splitting it. */
    static final String STDOUT = "-";

    @Spec
    CommandSpec spec;

    @Option(names = { "-i", "--input" }, required = true,
            description = "Log file to split; .gz files are decompressed")
    private Path input;

    @Option(names = { "-o", "--output" }, defaultValue = "",
            description = "Output prefix, files are named <prefix>-<YYYY-MM-DD>. "
                + "Defaults to the input path without .json.1/.jsonl/.json. Use '-' to print the input to stdout")
    private String output;

    @Option(names = { "--timestamp-field" }, defaultValue = JsonTimestampExtractor.DEFAULT_FIELD,
            description = "JSON field holding the timestamp (default: ${DEFAULT-VALUE})")
    private String timestampField;

    @Option(names = { "--timestamp-format" }, defaultValue = TimestampFormat.ASCTIME_PATTERN,
            description = "java.time pattern of the timestamp, or ISO (default: ${DEFAULT-VALUE})")
    private String timestampFormat;

    @Option(names = { "--granularity" }, defaultValue = "DAY",
            description = "Shard period: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private ShardGranularity granularity;

    @Option(names = { "--max-open-shards" }, defaultValue = "" + ShardHandlePool.DEFAULT_MAX_OPEN_SHARDS,
            description = "Maximum number of output files held open at once (default: ${DEFAULT-VALUE})")
    private int maxOpenShards;

    @Option(names = { "--gzip" }, description = "Gzip-compress output files")
    private boolean gzip;

    @Option(names = { "--suffix" }, defaultValue = "",
            description = "Appended to every shard file name, e.g. .jsonl")
    private String suffix;

    @Option(names = { "--no-error-file" },
            description = "Do not keep skipped lines in <prefix>.error")
    private boolean noErrorFile;

    @Option(names = { "--extraction-threads" }, defaultValue = "1",
            description = "Threads used to parse lines; output order is unaffected (default: ${DEFAULT-VALUE})")
    private int extractionThreads;

    private final PrintStream stdout;

    public LogDaySplitter() {
        this(System.out);
    }

    LogDaySplitter(PrintStream stdout) {
        this.stdout = stdout;
    }

    public static void main(String[] args) {
        int exitCode = commandLine(new LogDaySplitter()).execute(args);
        System.exit(exitCode);
    }

    static CommandLine commandLine(LogDaySplitter splitter) {
        return new CommandLine(splitter).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        if (STDOUT.equals(output)) {
            return printInput();
        }

        SplitConfig config = toConfig();
        SplitPipeline pipeline;
        try {
            pipeline = SplitPipeline.fromConfig(config);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }

        log.info("Splitting {} into {}-<{}>", input, config.getOutputPrefix(), granularity);
        try {
            RunCounters counters = pipeline.split().block();
            log.debug("Split completed: {}", counters);
            return EXIT_SUCCESS;
        } catch (SplitPipelineException e) {
            log.error("Split failed: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    SplitConfig toConfig() {
        String prefix = output.isEmpty() ? OutputPrefixes.derive(input.toString()) : output;
        return SplitConfig.builder()
            .inputPath(input)
            .outputPrefix(prefix)
            .timestampField(timestampField)
            .timestampFormat(timestampFormat)
            .granularity(granularity)
            .maxOpenShards(maxOpenShards)
            .gzip(gzip)
            .shardSuffix(suffix)
            .writeSkippedRecords(!noErrorFile)
            .extractionParallelism(extractionThreads)
            .build();
    }

    private int printInput() {
        try {
            new FileRecordSource(input).readRecords()
                .doOnNext(this::print)
                .blockLast();
            stdout.flush();
            return EXIT_SUCCESS;
        } catch (SplitPipelineException | UncheckedIOException e) {
            log.error("Could not print input: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    private void print(RawRecord record) {
        try {
            stdout.write(record.payload());
            record.terminator().writeTo(stdout);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
