package com.sky.association.catalog;

import com.sky.association.core.model.CatalogSource;

import java.util.List;

/**
 * Positional lookup over external catalog entries.
 */
public interface CatalogSourceRepository {

    /**
     * Entries of the catalog within {@code radius} degrees, nearest first.
     */
    List<CatalogSource> findWithinCone(String catalogName, double ra, double dec, double radius);

    int size(String catalogName);
}
