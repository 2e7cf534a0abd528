package com.sky.association.catalog;

import com.sky.association.core.model.CatalogSource;

import java.util.List;

/**
 * Supplies the normalized entries of one external catalog.
 */
@FunctionalInterface
public interface CatalogSourceLoader {

    /**
     * @throws UnknownCatalogException if the catalog is not known to the loader
     */
    List<CatalogSource> load(String catalogName);
}
