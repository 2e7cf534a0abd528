package com.sky.association.lock;

/**
 * Exclusive hold on one sky tile, shared by every pipeline writing to the same store.
 * Tile names come from {@link SkyRegionLock}; implementations treat them as opaque.
 */
public interface DistributedLock {

    /**
     * Blocks until the tile is held by the caller.
     *
     * @return always true; failure is reported by exception
     * @throws LockAcquisitionException if the tile stays busy past the configured wait
     */
    boolean tryLock(String tile);

    /**
     * Releases a tile held by the caller. Releasing a tile the caller does not hold does nothing.
     */
    void unlock(String tile);
}
