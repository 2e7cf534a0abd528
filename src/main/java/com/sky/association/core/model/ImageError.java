package com.sky.association.core.model;

/**
 * Closed set of image-level quality classifications.
 * Only {@link #BRIGHT_SOURCE_IN_FIELD} is a warning; every other code aborts
 * further processing of the image for the current run.
 */
public enum ImageError {
    MISSING_METADATA(1, true, "Required header metadata is missing"),
    LOW_VISIBILITY_COUNT(2, true, "Visibility count below minimum"),
    BAD_SENSITIVITY_METRIC(3, true, "Sensitivity metric out of range"),
    EXCESSIVE_ELLIPTICITY(4, true, "Beam axis ratio too large"),
    DISALLOWED_TARGET(5, true, "Pointing at the celestial pole or a planet"),
    BRIGHT_SOURCE_IN_FIELD(6, false, "Bright source within the field of view"),
    NO_SOURCES_DETECTED(7, true, "No sources were detected"),
    ANOMALOUS_SOURCE_COUNT(8, true, "Source count far above expectation");

    private final int code;
    private final boolean fatal;
    private final String reason;

    ImageError(int code, boolean fatal, String reason) {
        this.code = code;
        this.fatal = fatal;
        this.reason = reason;
    }

    public int code() {
        return code;
    }

    public boolean isFatal() {
        return fatal;
    }

    public String reason() {
        return reason;
    }

    public static ImageError fromCode(int code) {
        for (ImageError error : values()) {
            if (error.code == code) {
                return error;
            }
        }
        throw new IllegalArgumentException("Unknown image error code: " + code);
    }
}
