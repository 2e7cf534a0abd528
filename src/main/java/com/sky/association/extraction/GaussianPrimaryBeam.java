package com.sky.association.extraction;

/**
 * Gaussian primary beam whose FWHM scales inversely with frequency.
 */
public class GaussianPrimaryBeam implements PrimaryBeamModel {

    private static final double DEFAULT_FWHM_AT_1GHZ = 0.75;
    private static final double FOUR_LN2 = 4.0 * Math.log(2.0);

    private final double fwhmAt1Ghz;

    public GaussianPrimaryBeam() {
        this(DEFAULT_FWHM_AT_1GHZ);
    }

    /**
     * @param fwhmAt1Ghz full width at half maximum at 1 GHz, degrees
     */
    public GaussianPrimaryBeam(double fwhmAt1Ghz) {
        if (fwhmAt1Ghz <= 0) {
            throw new IllegalArgumentException("fwhmAt1Ghz must be > 0");
        }
        this.fwhmAt1Ghz = fwhmAt1Ghz;
    }

    @Override
    public double power(double distance, double frequencyGhz) {
        double fwhm = fwhmAt1Ghz / frequencyGhz;
        double x = distance / fwhm;
        return Math.exp(-FOUR_LN2 * x * x);
    }
}
