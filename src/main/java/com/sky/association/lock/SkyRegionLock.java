package com.sky.association.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Serializes association and catalog matching of images whose fields overlap.
 *
 * <p>The sky is cut into declination bands of {@code tileSize} degrees, and each band
 * into right-ascension tiles of roughly the same angular width. Locking a field takes
 * every tile the field (plus a margin) touches, in sorted key order, so two pipelines
 * can never deadlock and never both run find-or-create on the same sky area.</p>
 */
public class SkyRegionLock {
    private static final Logger log = LoggerFactory.getLogger(SkyRegionLock.class);

    private static final double DEFAULT_TILE_SIZE = 5.0;

    private final DistributedLock lock;
    private final double tileSize;

    public SkyRegionLock(DistributedLock lock) {
        this(lock, DEFAULT_TILE_SIZE);
    }

    public SkyRegionLock(DistributedLock lock, double tileSize) {
        if (tileSize <= 0 || tileSize > 90) {
            throw new IllegalArgumentException("tileSize must be in (0, 90]");
        }
        this.lock = lock;
        this.tileSize = tileSize;
    }

    /**
     * Acquires every tile overlapping the cone. Tiles already taken are released if a later one fails.
     *
     * @throws LockAcquisitionException if any tile cannot be acquired
     */
    public Lease acquire(double ra, double dec, double radius) {
        SortedSet<String> keys = tilesFor(ra, dec, radius);
        Deque<String> held = new ArrayDeque<>();
        try {
            for (String key : keys) {
                lock.tryLock(key);
                held.push(key);
            }
        } catch (RuntimeException e) {
            releaseAll(held);
            throw e;
        }
        log.debug("Region locked: {} tiles around ({}, {})", held.size(), ra, dec);
        return new Lease(held);
    }

    /**
     * Tile keys covering a cone of {@code radius} degrees around the position.
     */
    public SortedSet<String> tilesFor(double ra, double dec, double radius) {
        SortedSet<String> keys = new TreeSet<>();
        int bands = (int) Math.ceil(180.0 / tileSize);
        int loBand = bandOf(Math.max(-90.0, dec - radius), bands);
        int hiBand = bandOf(Math.min(90.0, dec + radius), bands);
        for (int band = loBand; band <= hiBand; band++) {
            double bandLo = -90.0 + band * tileSize;
            double bandHi = Math.min(90.0, bandLo + tileSize);
            double widestDec = Math.max(Math.abs(bandLo), Math.abs(bandHi));
            int raTiles = raTilesInBand(bandLo, bandHi);
            double cosDec = Math.cos(Math.toRadians(Math.min(widestDec, 89.999)));
            double halfWidth = radius / cosDec;
            if (raTiles == 1 || halfWidth >= 180.0 || Math.abs(dec) + radius >= 90.0) {
                for (int t = 0; t < raTiles; t++) {
                    keys.add(key(band, t));
                }
                continue;
            }
            double tileWidth = 360.0 / raTiles;
            int first = (int) Math.floor((ra - halfWidth) / tileWidth);
            int last = (int) Math.floor((ra + halfWidth) / tileWidth);
            for (int t = first; t <= last; t++) {
                keys.add(key(band, Math.floorMod(t, raTiles)));
            }
        }
        return keys;
    }

    private int bandOf(double dec, int bands) {
        return Math.min(bands - 1, (int) Math.floor((dec + 90.0) / tileSize));
    }

    private int raTilesInBand(double bandLo, double bandHi) {
        double narrowestDec = (bandLo <= 0 && bandHi >= 0) ? 0.0 : Math.min(Math.abs(bandLo), Math.abs(bandHi));
        double circumference = 360.0 * Math.cos(Math.toRadians(narrowestDec));
        return Math.max(1, (int) Math.floor(circumference / tileSize));
    }

    private static String key(int band, int raTile) {
        return String.format("sky:%03d:%04d", band, raTile);
    }

    private void releaseAll(Deque<String> held) {
        while (!held.isEmpty()) {
            lock.unlock(held.pop());
        }
    }

    /**
     * Held set of tile locks, released in reverse acquisition order on close.
     */
    public final class Lease implements AutoCloseable {
        private final Deque<String> held;

        private Lease(Deque<String> held) {
            this.held = held;
        }

        public int size() {
            return held.size();
        }

        @Override
        public void close() {
            releaseAll(held);
        }
    }
}
