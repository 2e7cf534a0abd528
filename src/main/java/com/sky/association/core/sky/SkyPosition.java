package com.sky.association.core.sky;

/**
 * Equatorial position in degrees.
 */
public record SkyPosition(double ra, double dec) {

    public SkyPosition {
        if (dec < -90.0 || dec > 90.0) {
            throw new IllegalArgumentException("dec out of range: " + dec);
        }
        ra = SkyMath.normalizeRa(ra);
    }

    public double separationTo(SkyPosition other) {
        return SkyMath.separation(ra, dec, other.ra, other.dec);
    }
}
