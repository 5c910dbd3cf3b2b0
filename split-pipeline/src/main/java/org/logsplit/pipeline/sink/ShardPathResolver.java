package org.logsplit.pipeline.sink;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.logsplit.pipeline.ir.ShardKey;

/**
 * Derives output file names from the output prefix:
 * {@code <prefix>-<key><suffix>} for shards and {@code <prefix>.error} for skipped lines,
 * both with {@code .gz} appended when compressing.
 */
public record ShardPathResolver(
    String outputPrefix,
    String suffix,
    boolean gzip
) {
    private static final String GZIP_EXTENSION = ".gz";

    public ShardPathResolver {
        if (outputPrefix == null || outputPrefix.isBlank()) {
            throw new IllegalArgumentException("Output prefix cannot be null or empty");
        }
        suffix = suffix != null ? suffix : "";
    }

    public ShardPathResolver(String outputPrefix) {
        this(outputPrefix, "", false);
    }

    public Path resolve(ShardKey key) {
        return Paths.get(outputPrefix + "-" + key.label() + suffix + compressionExtension());
    }

    public Path errorPath() {
        return Paths.get(outputPrefix + ".error" + compressionExtension());
    }

    private String compressionExtension() {
        return gzip ? GZIP_EXTENSION : "";
    }
}
