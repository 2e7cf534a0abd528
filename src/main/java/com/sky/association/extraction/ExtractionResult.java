package com.sky.association.extraction;

import com.sky.association.core.model.Detection;
import com.sky.association.core.model.Island;

import java.util.List;

/**
 * Islands and detections reported by the extractor for one image.
 * Image ids on the records are placeholders until the image is persisted.
 *
 * @param rmsBox background rms box used by the extractor, if reported
 */
public record ExtractionResult(List<Island> islands, List<Detection> detections, String rmsBox) {

    public ExtractionResult {
        islands = islands != null ? List.copyOf(islands) : List.of();
        detections = detections != null ? List.copyOf(detections) : List.of();
    }
}
