package com.sky.association.extraction;

import java.util.Map;
import java.util.Objects;

/**
 * Parameters handed to the source extractor.
 *
 * @param mode  extraction mode, {@code default} or {@code minimize_islands}
 * @param scale fraction (0, 1] of the image radius searched for sources
 * @param extra extractor-specific settings passed through unchanged
 */
public record ExtractionParameters(String mode, double scale, Map<String, Object> extra) {

    public static final String MODE_DEFAULT = "default";
    public static final String MODE_MINIMIZE_ISLANDS = "minimize_islands";

    public ExtractionParameters {
        Objects.requireNonNull(mode, "mode is required");
        if (!MODE_DEFAULT.equals(mode) && !MODE_MINIMIZE_ISLANDS.equals(mode)) {
            throw new IllegalArgumentException("Unknown extraction mode: " + mode);
        }
        if (!(scale > 0 && scale <= 1)) {
            throw new IllegalArgumentException("scale must be in (0, 1]: " + scale);
        }
        extra = extra != null ? Map.copyOf(extra) : Map.of();
    }

    public static ExtractionParameters defaults() {
        return new ExtractionParameters(MODE_DEFAULT, 1.0, Map.of());
    }

    public ExtractionParameters withScale(double newScale) {
        return new ExtractionParameters(mode, newScale, extra);
    }
}
