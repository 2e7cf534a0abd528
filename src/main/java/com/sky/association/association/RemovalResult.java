package com.sky.association.association;

import java.util.List;

/**
 * Effect of taking detections out of their associated sources.
 *
 * @param updatedSources ids of sources that lost a detection and survive
 * @param deletedSources ids of sources deleted because no detection was left
 * @param orphanedDetections detections of other images re-pointed to the orphan state
 */
public record RemovalResult(List<Long> updatedSources, List<Long> deletedSources, int orphanedDetections) {

    public RemovalResult {
        updatedSources = List.copyOf(updatedSources);
        deletedSources = List.copyOf(deletedSources);
    }
}
