package org.logsplit.pipeline.source;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.zip.GZIPInputStream;

import org.logsplit.pipeline.ir.RawRecord;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

/**
 * RecordSource reading a local log file line by line.
 * Files ending in {@code .gz} are decompressed on the fly.
 */
@RequiredArgsConstructor
@Slf4j
public class FileRecordSource implements RecordSource {

    private static final int GZIP_BUFFER_SIZE = 64 * 1024;

    private final Path inputPath;

    public FileRecordSource(String inputPath) {
        this(Paths.get(inputPath));
    }

    @Override
    public Flux<RawRecord> readRecords() {
        return Flux.using(
            this::openReader,
            reader -> Flux.generate(sink -> {
                try {
                    RawRecord record = reader.next();
                    if (record == null) {
                        sink.complete();
                    } else {
                        sink.next(record);
                    }
                } catch (IOException e) {
                    sink.error(new RecordSourceException(inputPath, e));
                }
            }),
            this::closeReader
        );
    }

    private LineReader openReader() {
        log.debug("Opening input: {}", inputPath);
        try {
            if (!Files.exists(inputPath)) {
                throw new IOException("File does not exist: " + inputPath);
            }
            if (!Files.isRegularFile(inputPath)) {
                throw new IOException("Path is not a regular file: " + inputPath);
            }
            InputStream stream = Files.newInputStream(inputPath);
            if (!isGzip()) {
                return new LineReader(stream);
            }
            try {
                return new LineReader(new GZIPInputStream(stream, GZIP_BUFFER_SIZE));
            } catch (IOException e) {
                stream.close();
                throw e;
            }
        } catch (IOException e) {
            throw new RecordSourceException(inputPath, e);
        }
    }

    private void closeReader(LineReader reader) {
        try {
            reader.close();
        } catch (IOException e) {
            log.warn("Failed to close input {}: {}", inputPath, e.getMessage());
        }
    }

    private boolean isGzip() {
        return inputPath.getFileName().toString().endsWith(".gz");
    }

    public Path getInputPath() {
        return inputPath;
    }
}
