package com.sky.association.store;

import com.sky.association.core.model.AssociatedSource;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of associated sources with positional lookup.
 */
public interface AssociatedSourceRepository {

    /**
     * Inserts or replaces a source. A source without an id is assigned the next one.
     */
    AssociatedSource save(AssociatedSource source);

    Optional<AssociatedSource> findById(long id);

    /**
     * Sources whose position lies within {@code radius} degrees, nearest first.
     */
    List<AssociatedSource> findWithinCone(double ra, double dec, double radius);

    List<AssociatedSource> findAll();

    boolean delete(long id);

    void deleteAll();
}
