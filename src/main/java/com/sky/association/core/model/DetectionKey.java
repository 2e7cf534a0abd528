package com.sky.association.core.model;

/**
 * Identity of a detection: extractor source id within its image.
 */
public record DetectionKey(int sourceId, int imageId) {
}
