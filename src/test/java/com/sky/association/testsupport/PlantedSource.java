package com.sky.association.testsupport;

/**
 * A source the fake extractor reports when it lies inside the image's field radius.
 */
public record PlantedSource(int islandId, double ra, double dec) {
}
