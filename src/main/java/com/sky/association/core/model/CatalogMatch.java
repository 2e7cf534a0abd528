package com.sky.association.core.model;

/**
 * Cross-identification of an associated source with an external catalog entry.
 * Unique per (catalog, catalog source, associated source).
 *
 * @param catalogId          registry id of the external catalog
 * @param catalogSourceId    stable id of the entry within its catalog
 * @param associatedSourceId the matched associated source
 * @param deRuiter           de Ruiter radius of the match
 */
public record CatalogMatch(int catalogId, long catalogSourceId, long associatedSourceId, double deRuiter) {

    public Key key() {
        return new Key(catalogId, catalogSourceId, associatedSourceId);
    }

    public record Key(int catalogId, long catalogSourceId, long associatedSourceId) {
    }
}
