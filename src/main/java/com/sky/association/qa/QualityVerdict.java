package com.sky.association.qa;

import com.sky.association.core.model.ImageError;

/**
 * Outcome of a quality check: passed, passed with a warning, or aborted.
 */
public record QualityVerdict(ImageError error, String detail) {

    private static final QualityVerdict PASSED = new QualityVerdict(null, "passed");

    public static QualityVerdict passed() {
        return PASSED;
    }

    public static QualityVerdict of(ImageError error, String detail) {
        return new QualityVerdict(error, detail);
    }

    public boolean isAbort() {
        return error != null && error.isFatal();
    }

    public boolean isWarning() {
        return error != null && !error.isFatal();
    }
}
