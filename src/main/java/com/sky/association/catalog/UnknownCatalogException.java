package com.sky.association.catalog;

import java.util.Collection;

/**
 * Thrown when a catalog name is not part of the configured registry.
 */
public class UnknownCatalogException extends RuntimeException {

    public UnknownCatalogException(String name) {
        super("Unknown catalog: " + name);
    }

    public UnknownCatalogException(Collection<String> names) {
        super("Unknown catalogs: " + String.join(", ", names));
    }
}
