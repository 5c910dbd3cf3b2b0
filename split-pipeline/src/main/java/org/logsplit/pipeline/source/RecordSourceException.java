package org.logsplit.pipeline.source;

import java.io.IOException;
import java.nio.file.Path;

import org.logsplit.pipeline.SplitPipelineException;

/**
 * The input could not be opened or a read failed part way through.
 */
public class RecordSourceException extends SplitPipelineException {

    private final transient Path path;

    public RecordSourceException(Path path, IOException cause) {
        super(cause.getMessage() + ".  Could not read input: `" + path + "`", cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
