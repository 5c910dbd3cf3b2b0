package org.logsplit.pipeline.sink;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.logsplit.pipeline.ir.ShardKey;

import lombok.extern.slf4j.Slf4j;

/**
 * Bounded cache of open {@link ShardWriter}s, keyed by shard.
 *
 * At most {@code maxOpenShards} writers are open at any instant. Acquiring a shard that is not
 * open while the pool is full closes the least recently used writer first. Writers always open
 * in append mode, so a shard evicted and later reacquired keeps its records in input order.
 *
 * Not thread-safe: the pool is owned by the single thread that routes records.
 */
@Slf4j
public class ShardHandlePool implements AutoCloseable {

    public static final int DEFAULT_MAX_OPEN_SHARDS = 64;

    private final ShardPathResolver pathResolver;
    private final int maxOpenShards;
    // access-ordered: iteration starts at the least recently used writer
    private final LinkedHashMap<ShardKey, ShardWriter> openWriters = new LinkedHashMap<>(16, 0.75f, true);
    private final Set<ShardKey> seenShards = new HashSet<>();
    private long opened;
    private long reopened;
    private long evicted;
    private boolean released;

    public ShardHandlePool(ShardPathResolver pathResolver, int maxOpenShards) {
        if (maxOpenShards < 1) {
            throw new IllegalArgumentException("maxOpenShards must be at least 1, got " + maxOpenShards);
        }
        this.pathResolver = pathResolver;
        this.maxOpenShards = maxOpenShards;
    }

    /**
     * Return the open writer for {@code key}, opening its file if needed.
     *
     * @throws IOException if an evicted writer fails to flush or close, or the shard file cannot be opened
     * @throws IllegalStateException if the pool was already released
     */
    public ShardWriter acquire(ShardKey key) throws IOException {
        if (released) {
            throw new IllegalStateException("Shard pool has been released");
        }
        ShardWriter writer = openWriters.get(key);
        if (writer != null) {
            return writer;
        }

        if (openWriters.size() >= maxOpenShards) {
            evictLeastRecentlyUsed();
        }

        Path path = pathFor(key);
        writer = ShardWriter.open(path, pathResolver.gzip());
        openWriters.put(key, writer);
        opened++;
        if (seenShards.add(key)) {
            log.debug("Opened shard {} at {}", key, path);
        } else {
            reopened++;
            log.debug("Reopened shard {} at {} for append", key, path);
        }
        return writer;
    }

    private void evictLeastRecentlyUsed() throws IOException {
        Iterator<Map.Entry<ShardKey, ShardWriter>> eldest = openWriters.entrySet().iterator();
        Map.Entry<ShardKey, ShardWriter> entry = eldest.next();
        eldest.remove();
        evicted++;
        log.debug("Evicting shard {} to stay within the limit of {} open writers", entry.getKey(), maxOpenShards);
        entry.getValue().close();
    }

    /**
     * Flush and close every open writer. Idempotent.
     * All writers are closed even if some fail; the first failure is thrown with the rest suppressed.
     */
    public void releaseAll() throws IOException {
        if (released) {
            return;
        }
        released = true;
        log.debug("Releasing {} open shard writers", openWriters.size());

        IOException failure = null;
        for (ShardWriter writer : openWriters.values()) {
            try {
                writer.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        openWriters.clear();
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public void close() throws IOException {
        releaseAll();
    }

    public Path pathFor(ShardKey key) {
        return pathResolver.resolve(key);
    }

    public int openCount() {
        return openWriters.size();
    }

    public boolean isReleased() {
        return released;
    }

    public int getMaxOpenShards() {
        return maxOpenShards;
    }

    public PoolStatistics getStatistics() {
        return new PoolStatistics(seenShards.size(), opened, reopened, evicted);
    }

    /**
     * Counters describing how much opening and closing a run needed.
     */
    public record PoolStatistics(
        int distinctShards,
        long opened,
        long reopened,
        long evicted
    ) {}
}
