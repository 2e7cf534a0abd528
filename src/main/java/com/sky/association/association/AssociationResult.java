package com.sky.association.association;

import com.sky.association.core.model.AssociatedSource;

import java.util.List;
import java.util.stream.Stream;

/**
 * Associated sources touched while associating one image.
 *
 * @param created sources created from detections with no counterpart
 * @param updated existing sources a detection was merged into
 */
public record AssociationResult(List<AssociatedSource> created, List<AssociatedSource> updated) {

    public AssociationResult {
        created = List.copyOf(created);
        updated = List.copyOf(updated);
    }

    /**
     * Every source detected in the image, created first.
     */
    public List<AssociatedSource> all() {
        return Stream.concat(created.stream(), updated.stream()).toList();
    }
}
