package com.sky.association.qa;

import com.sky.association.core.model.Detection;
import com.sky.association.core.model.Image;
import com.sky.association.core.model.ImageError;
import com.sky.association.core.model.ImageHeader;
import com.sky.association.core.sky.SkyPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Image-level validity checks run before and after source extraction.
 *
 * <p>Pre-extraction checks run in a fixed order and the first failure wins:
 * missing metadata, low visibility count, sensitivity metric, beam ellipticity,
 * disallowed target. A bright source inside the field is only a warning.
 * Post-extraction checks reject images with no detections or with far more
 * detections than the noise level predicts.</p>
 */
public class QualityGate {
    private static final Logger log = LoggerFactory.getLogger(QualityGate.class);

    public static final double DEFAULT_FREQUENCY_GHZ = 0.34;

    private final QualityThresholds thresholds;
    private final SourceCountModel sourceCountModel;

    public QualityGate() {
        this(QualityThresholds.defaults());
    }

    public QualityGate(QualityThresholds thresholds) {
        this(thresholds, new SourceCountModel());
    }

    public QualityGate(QualityThresholds thresholds, SourceCountModel sourceCountModel) {
        this.thresholds = thresholds;
        this.sourceCountModel = sourceCountModel;
    }

    public QualityThresholds getThresholds() {
        return thresholds;
    }

    /**
     * Runs the header checks and records the nearest bright source on the image.
     * The image's radius must already be set for the field-of-view warning.
     */
    public QualityVerdict checkHeader(Image image) {
        ImageHeader h = image.getHeader();

        List<String> missing = h.missingRequiredFields();
        if (!missing.isEmpty()) {
            return fail(image, ImageError.MISSING_METADATA, "missing " + String.join(", ", missing));
        }

        if (h.nvis() < thresholds.minNvis()) {
            return fail(image, ImageError.LOW_VISIBILITY_COUNT,
                    String.format(Locale.ROOT, "nvis %d < %d", h.nvis(), thresholds.minNvis()));
        }

        double sensitivity = h.noise() * Math.sqrt(h.tauTime());
        if (!(sensitivity > 0)) {
            return fail(image, ImageError.BAD_SENSITIVITY_METRIC,
                    String.format(Locale.ROOT, "sensitivity metric %.3f <= 0", sensitivity));
        }
        if (sensitivity > thresholds.maxSensitivityMetric()) {
            return fail(image, ImageError.BAD_SENSITIVITY_METRIC, String.format(Locale.ROOT,
                    "sensitivity metric %.3f > %.3f", sensitivity, thresholds.maxSensitivityMetric()));
        }

        double axisRatio = h.bmin() > 0 ? h.bmaj() / h.bmin() : Double.POSITIVE_INFINITY;
        if (axisRatio > thresholds.maxBeamAxisRatio()) {
            return fail(image, ImageError.EXCESSIVE_ELLIPTICITY, String.format(Locale.ROOT,
                    "beam axis ratio %.3f > %.3f", axisRatio, thresholds.maxBeamAxisRatio()));
        }

        if ("NCP".equalsIgnoreCase(h.object())) {
            return fail(image, ImageError.DISALLOWED_TARGET, "pointing is at the NCP");
        }
        if (h.obsRa() == 0.0 && h.obsDec() == 0.0) {
            return fail(image, ImageError.DISALLOWED_TARGET, "planet observation with RA, Dec = 0, 0");
        }

        BrightSourceField.Nearest nearest =
                BrightSourceField.nearest(new SkyPosition(h.obsRa(), h.obsDec()), h.mjdTime());
        image.setNearestProblem(nearest.name(), nearest.separation());
        if (image.getRadius() != null && nearest.separation() <= image.getRadius()) {
            log.info("image.qa.warning filename={} nearest={} separation={}",
                    image.getFilename(), nearest.name(), nearest.separation());
            image.setError(ImageError.BRIGHT_SOURCE_IN_FIELD);
            return QualityVerdict.of(ImageError.BRIGHT_SOURCE_IN_FIELD, nearest.name() + " is in the field of view");
        }

        image.setError(null);
        log.debug("Image {} passed header checks", image.getFilename());
        return QualityVerdict.passed();
    }

    /**
     * Checks the detections of an extracted image. Each detection must carry its
     * distance from the pointing centre.
     */
    public QualityVerdict checkSources(Image image, List<Detection> detections) {
        if (detections.isEmpty()) {
            return fail(image, ImageError.NO_SOURCES_DETECTED, "no sources were detected");
        }

        int central = (int) detections.stream()
                .filter(d -> d.getDistFromCenter() != null && d.getDistFromCenter() <= SourceCountModel.COUNT_RADIUS)
                .count();
        ImageHeader h = image.getHeader();
        double metric = sourceCountModel.metric(central, h.frequencyGhzOr(DEFAULT_FREQUENCY_GHZ), h.noise());
        if (metric > thresholds.maxSourceCountMetric()) {
            return fail(image, ImageError.ANOMALOUS_SOURCE_COUNT, String.format(Locale.ROOT,
                    "source count metric %.3f > %.3f", metric, thresholds.maxSourceCountMetric()));
        }
        log.debug("Image {} passed source count checks (metric {})", image.getFilename(), metric);
        return image.getError() != null ? QualityVerdict.of(image.getError(), image.getError().reason())
                : QualityVerdict.passed();
    }

    private QualityVerdict fail(Image image, ImageError error, String detail) {
        log.info("image.qa.failed filename={} code={} reason={}", image.getFilename(), error.code(), detail);
        image.setError(error);
        return QualityVerdict.of(error, detail);
    }
}
