package com.sky.association.crossmatch;

import java.util.List;

/**
 * Outcome of removing external catalogs from the sky model.
 */
public record CatalogRemovalResult(
        List<String> catalogs,
        int matchesRemoved,
        int sourcesUpdated,
        int imagesUpdated,
        List<Long> nowUnmatched,
        int uniqueRecorded
) {
    public CatalogRemovalResult {
        catalogs = List.copyOf(catalogs);
        nowUnmatched = List.copyOf(nowUnmatched);
    }
}
