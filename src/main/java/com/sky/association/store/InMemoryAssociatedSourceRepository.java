package com.sky.association.store;

import com.sky.association.core.model.AssociatedSource;
import com.sky.association.core.sky.SkyIndex;
import com.sky.association.core.sky.SkyPosition;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory associated source store backed by a declination-band index.
 */
public class InMemoryAssociatedSourceRepository implements AssociatedSourceRepository {

    private final Map<Long, AssociatedSource> sources = new ConcurrentHashMap<>();
    private final SkyIndex<Long, AssociatedSource> index =
            new SkyIndex<>(AssociatedSource::getId, s -> new SkyPosition(s.getRa(), s.getDec()));
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public synchronized AssociatedSource save(AssociatedSource source) {
        if (source.getId() == null) {
            source.assignId(sequence.incrementAndGet());
        } else {
            sequence.accumulateAndGet(source.getId(), Math::max);
        }
        AssociatedSource stored = source.copy();
        sources.put(stored.getId(), stored);
        index.put(stored);
        return source;
    }

    @Override
    public Optional<AssociatedSource> findById(long id) {
        return Optional.ofNullable(sources.get(id)).map(AssociatedSource::copy);
    }

    @Override
    public List<AssociatedSource> findWithinCone(double ra, double dec, double radius) {
        return index.within(ra, dec, radius).stream().map(AssociatedSource::copy).toList();
    }

    @Override
    public List<AssociatedSource> findAll() {
        return sources.values().stream()
                .sorted(Comparator.comparing(AssociatedSource::getId))
                .map(AssociatedSource::copy)
                .toList();
    }

    @Override
    public synchronized boolean delete(long id) {
        index.remove(id);
        return sources.remove(id) != null;
    }

    @Override
    public synchronized void deleteAll() {
        sources.clear();
        index.clear();
        sequence.set(0);
    }
}
