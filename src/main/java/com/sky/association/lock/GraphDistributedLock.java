package com.sky.association.lock;

import com.sky.association.store.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Tile locks shared by pipelines in several JVMs through the sky graph itself.
 *
 * <p>Each held tile is a {@code :TileLock} node owned by one pipeline instance. Taking a tile
 * is a single MERGE that either creates the node, takes over an expired one, or leaves the
 * current owner in place; the caller holds the tile when the returned owner is its own id.
 * A crashed pipeline's tiles free themselves once {@link LockConfig#lockTtlSeconds()} passes.</p>
 */
public class GraphDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(GraphDistributedLock.class);

    private static final String TAKE_TILE = """
            MERGE (l:TileLock {key: $key})
            ON CREATE SET l.owner = $owner, l.expiresAt = $expiresAt
            ON MATCH SET l.owner = CASE WHEN l.expiresAt < $now THEN $owner ELSE l.owner END,
                         l.expiresAt = CASE WHEN l.expiresAt < $now THEN $expiresAt ELSE l.expiresAt END
            RETURN l.owner as owner
            """;

    private static final String RELEASE_TILE = """
            MATCH (l:TileLock {key: $key, owner: $owner})
            DELETE l
            """;

    private final GraphConnection connection;
    private final LockConfig config;
    private final String ownerId;

    public GraphDistributedLock(GraphConnection connection) {
        this(connection, LockConfig.defaults());
    }

    public GraphDistributedLock(GraphConnection connection, LockConfig config) {
        this.connection = connection;
        this.config = config;
        this.ownerId = "pipeline-" + ProcessHandle.current().pid() + "-" + Long.toHexString(System.nanoTime());
        try {
            connection.execute("CREATE INDEX FOR (l:TileLock) ON (l.key)");
        } catch (RuntimeException e) {
            log.debug("TileLock index already present: {}", e.getMessage());
        }
    }

    @Override
    public boolean tryLock(String tile) {
        int attempts = config.maxRetries() + 1;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            String owner = takeTile(tile);
            if (ownerId.equals(owner)) {
                log.debug("tile.locked tile={} attempt={}", tile, attempt);
                return true;
            }
            log.debug("tile.busy tile={} owner={} attempt={}", tile, owner, attempt);
            if (attempt < attempts) {
                pause(tile);
            }
        }
        throw new LockAcquisitionException(tile,
                "Sky tile " + tile + " still held by another pipeline after " + attempts + " attempts");
    }

    @Override
    public void unlock(String tile) {
        try {
            connection.execute(RELEASE_TILE, Map.of("key", tile, "owner", ownerId));
            log.debug("tile.released tile={}", tile);
        } catch (RuntimeException e) {
            log.warn("Could not release sky tile {}; it expires after {}s: {}",
                    tile, config.lockTtlSeconds(), e.getMessage());
        }
    }

    String getOwnerId() {
        return ownerId;
    }

    /**
     * @return the tile's owner after the MERGE, or null if the attempt failed
     */
    private String takeTile(String tile) {
        Instant now = Instant.now();
        try {
            List<Map<String, Object>> rows = connection.query(TAKE_TILE, Map.of(
                    "key", tile,
                    "owner", ownerId,
                    "now", now.toString(),
                    "expiresAt", now.plusSeconds(config.lockTtlSeconds()).toString()));
            return rows.isEmpty() ? null : (String) rows.get(0).get("owner");
        } catch (RuntimeException e) {
            log.warn("Attempt to take sky tile {} failed: {}", tile, e.getMessage());
            return null;
        }
    }

    private void pause(String tile) {
        try {
            Thread.sleep(config.retryDelayMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException(tile, "Interrupted waiting for sky tile " + tile, e);
        }
    }
}
