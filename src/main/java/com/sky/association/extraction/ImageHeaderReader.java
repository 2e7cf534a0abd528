package com.sky.association.extraction;

import com.sky.association.core.model.ImageHeader;

/**
 * Reads the header of an image file.
 */
public interface ImageHeaderReader {

    /**
     * @throws ExtractionException if the file cannot be read
     */
    ImageHeader read(String filename);
}
