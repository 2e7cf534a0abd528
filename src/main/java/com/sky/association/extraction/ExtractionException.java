package com.sky.association.extraction;

/**
 * Unrecoverable failure of the external source extractor or header reader.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
