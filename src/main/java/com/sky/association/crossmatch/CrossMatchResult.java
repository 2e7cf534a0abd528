package com.sky.association.crossmatch;

import java.util.List;
import java.util.Map;

/**
 * Outcome of cross-matching one image.
 *
 * @param newlyChecked catalogs checked by this run, in registry order
 * @param matchesRecorded matches added by this run
 * @param uniqueRecorded survey-unique records written for the image
 * @param matchesPerCatalog matches added per catalog name
 */
public record CrossMatchResult(
        List<String> newlyChecked,
        int matchesRecorded,
        int uniqueRecorded,
        Map<String, Integer> matchesPerCatalog
) {
    public CrossMatchResult {
        newlyChecked = List.copyOf(newlyChecked);
        matchesPerCatalog = Map.copyOf(matchesPerCatalog);
    }

    public static CrossMatchResult empty() {
        return new CrossMatchResult(List.of(), 0, 0, Map.of());
    }
}
