package com.sky.association.core.model;

/**
 * Contiguous extraction region of one image, grouping one or more detections.
 * Fluxes in mJy, background statistics in mJy/beam.
 */
public record Island(
        int islandId,
        int imageId,
        double totalFlux,
        double eTotalFlux,
        double rms,
        double mean,
        double residualRms,
        double residualMean
) {
    public Island withImageId(int newImageId) {
        return new Island(islandId, newImageId, totalFlux, eTotalFlux, rms, mean, residualRms, residualMean);
    }
}
