package com.sky.association.qa;

/**
 * Limits applied by the {@link QualityGate}.
 *
 * @param minNvis                 minimum number of visibilities
 * @param maxSensitivityMetric    maximum noise x sqrt(integration time), mJy/beam s^1/2
 * @param maxBeamAxisRatio        maximum bmaj / bmin
 * @param maxSourceCountMetric    maximum (actual - expected) / expected source count within 1.5 deg
 */
public record QualityThresholds(int minNvis, double maxSensitivityMetric, double maxBeamAxisRatio,
                                double maxSourceCountMetric) {

    public QualityThresholds {
        if (minNvis < 0) {
            throw new IllegalArgumentException("minNvis must be >= 0");
        }
        if (maxSensitivityMetric <= 0) {
            throw new IllegalArgumentException("maxSensitivityMetric must be > 0");
        }
        if (maxBeamAxisRatio < 1) {
            throw new IllegalArgumentException("maxBeamAxisRatio must be >= 1");
        }
        if (maxSourceCountMetric <= 0) {
            throw new IllegalArgumentException("maxSourceCountMetric must be > 0");
        }
    }

    public static QualityThresholds defaults() {
        return new QualityThresholds(1000, 3000.0, 4.0, 10.0);
    }
}
