package com.sky.association.catalog;

/**
 * Configuration for the parsed catalog cache.
 *
 * @param maxCatalogs       maximum number of catalogs held in memory
 * @param expireAfterAccessSeconds idle time after which a catalog is dropped
 */
public record CatalogCacheConfig(int maxCatalogs, long expireAfterAccessSeconds) {

    public CatalogCacheConfig {
        if (maxCatalogs <= 0) {
            throw new IllegalArgumentException("maxCatalogs must be > 0");
        }
        if (expireAfterAccessSeconds <= 0) {
            throw new IllegalArgumentException("expireAfterAccessSeconds must be > 0");
        }
    }

    /**
     * 32 catalogs, one hour idle expiry.
     */
    public static CatalogCacheConfig defaults() {
        return new CatalogCacheConfig(32, 3600);
    }
}
