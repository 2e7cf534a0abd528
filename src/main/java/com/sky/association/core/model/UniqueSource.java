package com.sky.association.core.model;

/**
 * Records that an associated source with no catalog matches was seen in an image.
 */
public record UniqueSource(int imageId, long associatedSourceId, boolean detected) {
}
