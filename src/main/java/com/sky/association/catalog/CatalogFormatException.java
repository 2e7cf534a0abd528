package com.sky.association.catalog;

/**
 * Thrown when a catalog file does not match its declared format.
 */
public class CatalogFormatException extends RuntimeException {

    public CatalogFormatException(String message) {
        super(message);
    }

    public CatalogFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
