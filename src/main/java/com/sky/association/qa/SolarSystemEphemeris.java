package com.sky.association.qa;

import com.sky.association.core.sky.SkyPosition;

/**
 * Low-precision geocentric positions of the Sun, Moon and Jupiter, good to a
 * fraction of a degree between 1900 and 2100. Times are Modified Julian Dates.
 */
public final class SolarSystemEphemeris {

    private static final double MJD_J2000 = 51544.5;
    private static final double OBLIQUITY_J2000 = 23.43928;

    private SolarSystemEphemeris() {
    }

    public static SkyPosition sun(double mjd) {
        double d = mjd - MJD_J2000;
        double meanLongitude = 280.460 + 0.9856474 * d;
        double g = Math.toRadians(357.528 + 0.9856003 * d);
        double lambda = meanLongitude + 1.915 * Math.sin(g) + 0.020 * Math.sin(2 * g);
        double epsilon = 23.439 - 0.0000004 * d;
        return eclipticToEquatorial(lambda, 0.0, epsilon);
    }

    public static SkyPosition moon(double mjd) {
        double t = (mjd - MJD_J2000) / 36525.0;
        double lambda = 218.32 + 481267.881 * t
                + 6.29 * sinDeg(135.0 + 477198.87 * t)
                - 1.27 * sinDeg(259.3 - 413335.36 * t)
                + 0.66 * sinDeg(235.7 + 890534.22 * t)
                + 0.21 * sinDeg(269.9 + 954397.74 * t)
                - 0.19 * sinDeg(357.5 + 35999.05 * t)
                - 0.11 * sinDeg(186.5 + 966404.03 * t);
        double beta = 5.13 * sinDeg(93.3 + 483202.02 * t)
                + 0.28 * sinDeg(228.2 + 960400.89 * t)
                - 0.28 * sinDeg(318.3 + 6003.15 * t)
                - 0.17 * sinDeg(217.6 - 407332.21 * t);
        return eclipticToEquatorial(lambda, beta, OBLIQUITY_J2000 - 0.013 * t);
    }

    public static SkyPosition jupiter(double mjd) {
        double t = (mjd - MJD_J2000) / 36525.0;
        double[] earth = heliocentric(EARTH_MOON_BARYCENTER, t);
        double[] planet = heliocentric(JUPITER, t);
        double x = planet[0] - earth[0];
        double y = planet[1] - earth[1];
        double z = planet[2] - earth[2];
        double lambda = Math.toDegrees(Math.atan2(y, x));
        double beta = Math.toDegrees(Math.atan2(z, Math.hypot(x, y)));
        return eclipticToEquatorial(lambda, beta, OBLIQUITY_J2000);
    }

    /**
     * J2000 mean orbital elements and their rates per century:
     * a (au), e, I, L, longitude of perihelion, longitude of ascending node (degrees).
     */
    private record Elements(double a, double aRate, double e, double eRate, double i, double iRate,
                            double l, double lRate, double peri, double periRate, double node, double nodeRate) {}

    private static final Elements EARTH_MOON_BARYCENTER = new Elements(
            1.00000261, 0.00000562, 0.01671123, -0.00004392, -0.00001531, -0.01294668,
            100.46457166, 35999.37244981, 102.93768193, 0.32327364, 0.0, 0.0);

    private static final Elements JUPITER = new Elements(
            5.20288700, -0.00011607, 0.04838624, -0.00013253, 1.30439695, -0.00183714,
            34.39644051, 3034.74612775, 14.72847983, 0.21252668, 100.47390909, 0.20469106);

    private static double[] heliocentric(Elements el, double t) {
        double a = el.a() + el.aRate() * t;
        double e = el.e() + el.eRate() * t;
        double inc = Math.toRadians(el.i() + el.iRate() * t);
        double meanLongitude = el.l() + el.lRate() * t;
        double peri = el.peri() + el.periRate() * t;
        double node = el.node() + el.nodeRate() * t;
        double argPeri = Math.toRadians(peri - node);
        double nodeRad = Math.toRadians(node);

        double meanAnomaly = Math.toRadians(normalizeDegrees(meanLongitude - peri));
        double eccentricAnomaly = solveKepler(meanAnomaly, e);

        double xp = a * (Math.cos(eccentricAnomaly) - e);
        double yp = a * Math.sqrt(1 - e * e) * Math.sin(eccentricAnomaly);

        double cw = Math.cos(argPeri);
        double sw = Math.sin(argPeri);
        double cn = Math.cos(nodeRad);
        double sn = Math.sin(nodeRad);
        double ci = Math.cos(inc);
        double si = Math.sin(inc);
        double x = (cw * cn - sw * sn * ci) * xp + (-sw * cn - cw * sn * ci) * yp;
        double y = (cw * sn + sw * cn * ci) * xp + (-sw * sn + cw * cn * ci) * yp;
        double z = (sw * si) * xp + (cw * si) * yp;
        return new double[]{x, y, z};
    }

    static double solveKepler(double meanAnomaly, double e) {
        double m = meanAnomaly > Math.PI ? meanAnomaly - 2 * Math.PI : meanAnomaly;
        double ecc = m + e * Math.sin(m);
        for (int iteration = 0; iteration < 30; iteration++) {
            double delta = (ecc - e * Math.sin(ecc) - m) / (1 - e * Math.cos(ecc));
            ecc -= delta;
            if (Math.abs(delta) < 1e-12) {
                break;
            }
        }
        return ecc;
    }

    private static SkyPosition eclipticToEquatorial(double lambdaDeg, double betaDeg, double epsilonDeg) {
        double lambda = Math.toRadians(lambdaDeg);
        double beta = Math.toRadians(betaDeg);
        double eps = Math.toRadians(epsilonDeg);
        double ra = Math.atan2(Math.sin(lambda) * Math.cos(eps) - Math.tan(beta) * Math.sin(eps), Math.cos(lambda));
        double dec = Math.asin(Math.sin(beta) * Math.cos(eps) + Math.cos(beta) * Math.sin(eps) * Math.sin(lambda));
        return new SkyPosition(Math.toDegrees(ra), Math.toDegrees(dec));
    }

    private static double sinDeg(double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }

    private static double normalizeDegrees(double degrees) {
        double d = degrees % 360.0;
        return d < 0 ? d + 360.0 : d;
    }
}
