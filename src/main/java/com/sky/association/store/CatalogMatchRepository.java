package com.sky.association.store;

import com.sky.association.core.model.CatalogMatch;

import java.util.List;

/**
 * Persistence of catalog matches, unique per (catalog, catalog source, associated source).
 */
public interface CatalogMatchRepository {

    /**
     * Adds a match.
     *
     * @return false if a match with the same key already exists
     */
    boolean add(CatalogMatch match);

    boolean remove(CatalogMatch.Key key);

    List<CatalogMatch> findByAssociatedSource(long assocId);

    List<CatalogMatch> findByCatalog(int catalogId);

    boolean existsFor(int catalogId, long assocId);

    /**
     * Removes and returns every match of the associated source.
     */
    List<CatalogMatch> deleteByAssociatedSource(long assocId);

    /**
     * Removes and returns every match against the catalog.
     */
    List<CatalogMatch> deleteByCatalog(int catalogId);

    void deleteAll();
}
