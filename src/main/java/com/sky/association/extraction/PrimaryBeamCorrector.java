package com.sky.association.extraction;

import com.sky.association.core.model.CorrectedFlux;
import com.sky.association.core.model.Detection;
import com.sky.association.core.model.Island;

/**
 * Applies the primary beam correction to detection photometry.
 * Fluxes and island background statistics are divided by the beam power and a
 * fractional systematic error is added to flux errors in quadrature.
 */
public class PrimaryBeamCorrector {

    private static final double DEFAULT_SYSTEMATIC = 0.2;

    private final PrimaryBeamModel beam;
    private final double systematic;

    public PrimaryBeamCorrector(PrimaryBeamModel beam) {
        this(beam, DEFAULT_SYSTEMATIC);
    }

    public PrimaryBeamCorrector(PrimaryBeamModel beam, double systematic) {
        if (systematic < 0) {
            throw new IllegalArgumentException("systematic must be >= 0");
        }
        this.beam = beam;
        this.systematic = systematic;
    }

    /**
     * @param island the detection's island, or null if unknown
     */
    public CorrectedFlux correct(Detection detection, Island island, double frequencyGhz) {
        double distance = detection.getDistFromCenter() != null ? detection.getDistFromCenter() : 0.0;
        double power = beam.power(distance, frequencyGhz);

        double total = detection.getTotalFlux() / power;
        double peak = detection.getPeakFlux() / power;
        double islandTotal = island != null ? island.totalFlux() / power : Double.NaN;
        double islandRms = island != null ? island.rms() / power : Double.NaN;
        double islandMean = island != null ? island.mean() / power : Double.NaN;
        double snr = island != null && islandRms > 0 ? (peak - islandMean) / islandRms : Double.NaN;

        return new CorrectedFlux(
                power,
                total,
                withSystematic(detection.getETotalFlux() / power, total),
                peak,
                withSystematic(detection.getEPeakFlux() / power, peak),
                islandTotal,
                island != null ? withSystematic(island.eTotalFlux() / power, islandTotal) : Double.NaN,
                islandRms,
                islandMean,
                snr);
    }

    private double withSystematic(double error, double flux) {
        return Math.hypot(error, systematic * flux);
    }
}
