package com.sky.association.store;

import com.sky.association.core.model.UniqueSource;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * In-memory survey-unique record store.
 */
public class InMemoryUniqueSourceRepository implements UniqueSourceRepository {

    private final Map<Key, UniqueSource> records = new ConcurrentHashMap<>();

    @Override
    public void upsert(UniqueSource record) {
        records.put(new Key(record.imageId(), record.associatedSourceId()), record);
    }

    @Override
    public Optional<UniqueSource> find(int imageId, long assocId) {
        return Optional.ofNullable(records.get(new Key(imageId, assocId)));
    }

    @Override
    public List<UniqueSource> findByImage(int imageId) {
        return select(r -> r.imageId() == imageId);
    }

    @Override
    public List<UniqueSource> findByAssociatedSource(long assocId) {
        return select(r -> r.associatedSourceId() == assocId);
    }

    @Override
    public boolean delete(int imageId, long assocId) {
        return records.remove(new Key(imageId, assocId)) != null;
    }

    @Override
    public synchronized List<UniqueSource> deleteByAssociatedSource(long assocId) {
        return deleteWhere(r -> r.associatedSourceId() == assocId);
    }

    @Override
    public synchronized List<UniqueSource> deleteByImage(int imageId) {
        return deleteWhere(r -> r.imageId() == imageId);
    }

    @Override
    public void deleteAll() {
        records.clear();
    }

    private List<UniqueSource> deleteWhere(Predicate<UniqueSource> filter) {
        List<UniqueSource> removed = select(filter);
        removed.forEach(r -> records.remove(new Key(r.imageId(), r.associatedSourceId())));
        return removed;
    }

    private List<UniqueSource> select(Predicate<UniqueSource> filter) {
        return records.values().stream()
                .filter(filter)
                .sorted(Comparator.comparingInt(UniqueSource::imageId)
                        .thenComparingLong(UniqueSource::associatedSourceId))
                .toList();
    }

    private record Key(int imageId, long assocId) {}
}
