package com.sky.association.core.sky;

/**
 * Spherical geometry helpers. All angles in degrees unless stated otherwise.
 */
public final class SkyMath {

    public static final double ARCSEC_PER_DEGREE = 3600.0;

    private SkyMath() {
    }

    /**
     * Great-circle separation using the Vincenty formula, stable at all distances.
     */
    public static double separation(double ra1, double dec1, double ra2, double dec2) {
        double dRa = Math.toRadians(ra2 - ra1);
        double d1 = Math.toRadians(dec1);
        double d2 = Math.toRadians(dec2);
        double sinD1 = Math.sin(d1);
        double cosD1 = Math.cos(d1);
        double sinD2 = Math.sin(d2);
        double cosD2 = Math.cos(d2);
        double sinDRa = Math.sin(dRa);
        double cosDRa = Math.cos(dRa);

        double num1 = cosD2 * sinDRa;
        double num2 = cosD1 * sinD2 - sinD1 * cosD2 * cosDRa;
        double denominator = sinD1 * sinD2 + cosD1 * cosD2 * cosDRa;
        return Math.toDegrees(Math.atan2(Math.hypot(num1, num2), denominator));
    }

    /**
     * Signed RA difference {@code ra1 - ra2} wrapped into [-180, 180).
     */
    public static double raDifference(double ra1, double ra2) {
        double d = (ra1 - ra2) % 360.0;
        if (d >= 180.0) {
            d -= 360.0;
        } else if (d < -180.0) {
            d += 360.0;
        }
        return d;
    }

    public static double normalizeRa(double ra) {
        double r = ra % 360.0;
        return r < 0 ? r + 360.0 : r;
    }

    /**
     * de Ruiter radius: the positional offset between two sources normalized by
     * their combined position uncertainties.
     * Positions and errors must share the same angular unit.
     */
    public static double deRuiterRadius(double ra1, double eRa1, double dec1, double eDec1,
                                        double ra2, double eRa2, double dec2, double eDec2) {
        double meanDec = Math.toRadians((dec1 + dec2) / 2.0);
        double dRa = raDifference(ra1, ra2) * Math.cos(meanDec);
        double dDec = dec1 - dec2;
        double raVariance = eRa1 * eRa1 + eRa2 * eRa2;
        double decVariance = eDec1 * eDec1 + eDec2 * eDec2;
        if (raVariance <= 0 || decVariance <= 0) {
            return (dRa == 0 && dDec == 0) ? 0.0 : Double.POSITIVE_INFINITY;
        }
        return Math.sqrt(dRa * dRa / raVariance + dDec * dDec / decVariance);
    }

    public static double arcsecToDegrees(double arcsec) {
        return arcsec / ARCSEC_PER_DEGREE;
    }

    public static double degreesToArcsec(double degrees) {
        return degrees * ARCSEC_PER_DEGREE;
    }
}
