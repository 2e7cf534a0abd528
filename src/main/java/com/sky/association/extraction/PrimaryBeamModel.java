package com.sky.association.extraction;

/**
 * Relative response of the antenna primary beam.
 */
public interface PrimaryBeamModel {

    /**
     * Beam power in (0, 1] at a distance from the pointing centre.
     *
     * @param distance     angular distance in degrees
     * @param frequencyGhz observing frequency
     */
    double power(double distance, double frequencyGhz);
}
