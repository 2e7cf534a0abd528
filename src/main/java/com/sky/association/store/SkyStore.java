package com.sky.association.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The set of repositories that together hold the sky model.
 */
public record SkyStore(
        ImageRepository images,
        DetectionRepository detections,
        AssociatedSourceRepository associatedSources,
        CatalogMatchRepository catalogMatches,
        UniqueSourceRepository uniqueSources
) {
    private static final Logger log = LoggerFactory.getLogger(SkyStore.class);

    public static SkyStore inMemory() {
        return new SkyStore(
                new InMemoryImageRepository(),
                new InMemoryDetectionRepository(),
                new InMemoryAssociatedSourceRepository(),
                new InMemoryCatalogMatchRepository(),
                new InMemoryUniqueSourceRepository());
    }

    public static SkyStore graph(GraphConnection connection) {
        connection.createIndexes();
        return new SkyStore(
                new GraphImageRepository(connection),
                new GraphDetectionRepository(connection),
                new GraphAssociatedSourceRepository(connection),
                new GraphCatalogMatchRepository(connection),
                new GraphUniqueSourceRepository(connection));
    }

    /**
     * Removes every record and resets id sequences.
     */
    public void clearAll() {
        uniqueSources.deleteAll();
        catalogMatches.deleteAll();
        detections.deleteAll();
        associatedSources.deleteAll();
        images.deleteAll();
        log.info("store.cleared");
    }
}
