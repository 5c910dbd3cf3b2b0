package org.logsplit.pipeline;

import java.io.IOException;
import java.nio.file.Path;

/**
 * An output file could not be opened, written, flushed or closed.
 */
public class ShardWriteException extends SplitPipelineException {

    private final transient Path path;

    public ShardWriteException(Path path, IOException cause) {
        super(cause.getMessage() + ".  Could not write to file: `" + path + "`", cause);
        this.path = path;
    }

    public ShardWriteException(String message, IOException cause) {
        super(cause.getMessage() + ".  " + message, cause);
        this.path = null;
    }

    /** The file that failed, or null when the failure spans several files. */
    public Path getPath() {
        return path;
    }
}
