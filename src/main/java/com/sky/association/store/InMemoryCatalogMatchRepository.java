package com.sky.association.store;

import com.sky.association.core.model.CatalogMatch;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * In-memory catalog match store keyed by the match triple.
 */
public class InMemoryCatalogMatchRepository implements CatalogMatchRepository {

    private final Map<CatalogMatch.Key, CatalogMatch> matches = new ConcurrentHashMap<>();

    @Override
    public boolean add(CatalogMatch match) {
        return matches.putIfAbsent(match.key(), match) == null;
    }

    @Override
    public boolean remove(CatalogMatch.Key key) {
        return matches.remove(key) != null;
    }

    @Override
    public List<CatalogMatch> findByAssociatedSource(long assocId) {
        return select(m -> m.associatedSourceId() == assocId);
    }

    @Override
    public List<CatalogMatch> findByCatalog(int catalogId) {
        return select(m -> m.catalogId() == catalogId);
    }

    @Override
    public boolean existsFor(int catalogId, long assocId) {
        return matches.values().stream()
                .anyMatch(m -> m.catalogId() == catalogId && m.associatedSourceId() == assocId);
    }

    @Override
    public synchronized List<CatalogMatch> deleteByAssociatedSource(long assocId) {
        List<CatalogMatch> removed = findByAssociatedSource(assocId);
        removed.forEach(m -> matches.remove(m.key()));
        return removed;
    }

    @Override
    public synchronized List<CatalogMatch> deleteByCatalog(int catalogId) {
        List<CatalogMatch> removed = findByCatalog(catalogId);
        removed.forEach(m -> matches.remove(m.key()));
        return removed;
    }

    @Override
    public void deleteAll() {
        matches.clear();
    }

    private List<CatalogMatch> select(Predicate<CatalogMatch> filter) {
        return matches.values().stream()
                .filter(filter)
                .sorted(Comparator.comparingLong(CatalogMatch::associatedSourceId)
                        .thenComparingInt(CatalogMatch::catalogId)
                        .thenComparingLong(CatalogMatch::catalogSourceId))
                .toList();
    }
}
