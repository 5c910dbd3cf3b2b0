package org.logsplit.pipeline.sink;

import java.io.IOException;
import java.nio.file.Path;

import org.logsplit.pipeline.ir.RawRecord;
import org.logsplit.pipeline.ir.SkipReason;

import lombok.extern.slf4j.Slf4j;

/**
 * Appends skipped records, unmodified, to a dead-letter file.
 * The file is only created once the first record is skipped.
 */
@Slf4j
public class FileSkippedRecordSink implements SkippedRecordSink {

    private final Path path;
    private final boolean gzip;
    private ShardWriter writer;

    public FileSkippedRecordSink(Path path, boolean gzip) {
        this.path = path;
        this.gzip = gzip;
    }

    public static FileSkippedRecordSink forOutput(ShardPathResolver pathResolver) {
        return new FileSkippedRecordSink(pathResolver.errorPath(), pathResolver.gzip());
    }

    @Override
    public void accept(RawRecord record, SkipReason reason) throws IOException {
        if (writer == null) {
            log.info("Writing skipped lines to {}", path);
            writer = ShardWriter.open(path, gzip);
        }
        writer.write(record);
    }

    @Override
    public void close() throws IOException {
        if (writer != null) {
            writer.close();
        }
    }

    public long getRecordsWritten() {
        return writer != null ? writer.getRecordsWritten() : 0;
    }
}
