package com.sky.association.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tile locks for pipelines sharing one JVM. Each tile gets a fair {@link ReentrantLock}
 * so images waiting on a busy region are served in arrival order. This is the default.
 */
public class LocalDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(LocalDistributedLock.class);

    private final Map<String, ReentrantLock> tiles = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalDistributedLock() {
        this(LockConfig.defaults());
    }

    public LocalDistributedLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public boolean tryLock(String tile) {
        ReentrantLock lock = tiles.computeIfAbsent(tile, t -> new ReentrantLock(true));
        boolean acquired;
        try {
            acquired = lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException(tile, "Interrupted waiting for sky tile " + tile, e);
        }
        if (!acquired) {
            throw new LockAcquisitionException(tile,
                    "Sky tile " + tile + " still busy after " + config.timeoutMs() + "ms");
        }
        log.debug("tile.locked tile={} holds={}", tile, lock.getHoldCount());
        return true;
    }

    @Override
    public void unlock(String tile) {
        ReentrantLock lock = tiles.get(tile);
        if (lock == null || !lock.isHeldByCurrentThread()) {
            return;
        }
        lock.unlock();
        log.debug("tile.released tile={}", tile);
    }
}
