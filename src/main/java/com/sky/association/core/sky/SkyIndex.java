package com.sky.association.core.sky;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Declination-band spatial index for cone searches.
 * Items are bucketed by declination; a cone query scans only the bands the cone
 * overlaps and filters by exact angular separation.
 *
 * @param <K> item key type
 * @param <T> item type
 */
public class SkyIndex<K, T> {

    private static final double DEFAULT_BAND_HEIGHT = 0.5;

    private final double bandHeight;
    private final Function<T, K> keyOf;
    private final Function<T, SkyPosition> positionOf;
    private final Map<Integer, Map<K, T>> bands = new ConcurrentHashMap<>();
    private final Map<K, Integer> bandOfKey = new ConcurrentHashMap<>();

    public SkyIndex(Function<T, K> keyOf, Function<T, SkyPosition> positionOf) {
        this(DEFAULT_BAND_HEIGHT, keyOf, positionOf);
    }

    public SkyIndex(double bandHeight, Function<T, K> keyOf, Function<T, SkyPosition> positionOf) {
        if (bandHeight <= 0) {
            throw new IllegalArgumentException("bandHeight must be > 0");
        }
        this.bandHeight = bandHeight;
        this.keyOf = keyOf;
        this.positionOf = positionOf;
    }

    /**
     * Adds or re-positions an item.
     */
    public synchronized void put(T item) {
        K key = keyOf.apply(item);
        remove(key);
        int band = bandOf(positionOf.apply(item).dec());
        bands.computeIfAbsent(band, b -> new HashMap<>()).put(key, item);
        bandOfKey.put(key, band);
    }

    public synchronized boolean remove(K key) {
        Integer band = bandOfKey.remove(key);
        if (band == null) {
            return false;
        }
        Map<K, T> items = bands.get(band);
        if (items != null) {
            items.remove(key);
            if (items.isEmpty()) {
                bands.remove(band);
            }
        }
        return true;
    }

    public synchronized void clear() {
        bands.clear();
        bandOfKey.clear();
    }

    public int size() {
        return bandOfKey.size();
    }

    /**
     * Returns items within {@code radius} degrees of the given position, nearest first.
     */
    public synchronized List<T> within(double ra, double dec, double radius) {
        int lo = bandOf(Math.max(-90.0, dec - radius));
        int hi = bandOf(Math.min(90.0, dec + radius));
        List<Candidate<T>> hits = new ArrayList<>();
        for (int band = lo; band <= hi; band++) {
            Map<K, T> items = bands.get(band);
            if (items == null) {
                continue;
            }
            for (T item : items.values()) {
                SkyPosition p = positionOf.apply(item);
                double sep = SkyMath.separation(ra, dec, p.ra(), p.dec());
                if (sep <= radius) {
                    hits.add(new Candidate<>(item, sep));
                }
            }
        }
        hits.sort(Comparator.comparingDouble(Candidate::separation));
        return hits.stream().map(Candidate::item).toList();
    }

    private int bandOf(double dec) {
        return (int) Math.floor((dec + 90.0) / bandHeight);
    }

    private record Candidate<T>(T item, double separation) {}
}
