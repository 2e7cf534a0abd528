package com.sky.association.extraction;

import com.sky.association.core.model.Image;

/**
 * External Gaussian-fitting source finder.
 */
public interface SourceExtractor {

    /**
     * Extracts sources within the image's field radius.
     *
     * @throws ExtractionException if the extractor cannot run or its output cannot be read
     */
    ExtractionResult extract(Image image, ExtractionParameters parameters);
}
