package com.sky.association.lock;

/**
 * A sky tile could not be taken, so the image stage that needed it did not start.
 */
public class LockAcquisitionException extends RuntimeException {

    private final String tile;

    public LockAcquisitionException(String tile, String message) {
        super(message);
        this.tile = tile;
    }

    public LockAcquisitionException(String tile, String message, Throwable cause) {
        super(message, cause);
        this.tile = tile;
    }

    /**
     * Name of the tile that stayed busy.
     */
    public String getTile() {
        return tile;
    }
}
