package com.sky.association.qa;

/**
 * Expected number of sources above the detection limit within the central
 * {@value #COUNT_RADIUS} degrees of an image.
 *
 * <p>Integral counts follow N(&gt;S) = N0 (S / 1 Jy)^-gamma per steradian at the reference
 * frequency. The 5-sigma detection limit is scaled to the reference frequency with a
 * spectral index of -0.7.</p>
 */
public class SourceCountModel {

    public static final double COUNT_RADIUS = 1.5;

    private static final double REFERENCE_FREQ_GHZ = 0.325;
    private static final double N0_PER_SR = 600.0;
    private static final double GAMMA = 1.2;
    private static final double SPECTRAL_INDEX = -0.7;
    private static final double DETECTION_SIGMA = 5.0;
    private static final double MINIMUM_EXPECTED = 1.0;

    /**
     * @param frequencyGhz observing frequency of the image
     * @param noiseMjy     image noise in mJy/beam
     */
    public double expectedCount(double frequencyGhz, double noiseMjy) {
        if (frequencyGhz <= 0 || noiseMjy <= 0) {
            throw new IllegalArgumentException("frequency and noise must be > 0");
        }
        double limitJy = DETECTION_SIGMA * noiseMjy / 1000.0;
        double limitAtReference = limitJy * Math.pow(REFERENCE_FREQ_GHZ / frequencyGhz, SPECTRAL_INDEX);
        double perSteradian = N0_PER_SR * Math.pow(limitAtReference, -GAMMA);
        double radius = Math.toRadians(COUNT_RADIUS);
        double solidAngle = 2 * Math.PI * (1 - Math.cos(radius));
        return Math.max(MINIMUM_EXPECTED, perSteradian * solidAngle);
    }

    /**
     * (actual - expected) / expected.
     */
    public double metric(int actualWithinRadius, double frequencyGhz, double noiseMjy) {
        double expected = expectedCount(frequencyGhz, noiseMjy);
        return (actualWithinRadius - expected) / expected;
    }
}
