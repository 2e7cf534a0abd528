package com.sky.association.core.sky;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SkyMathTest {

    @Test
    void separationAlongMeridian() {
        assertEquals(1.0, SkyMath.separation(10.0, 20.0, 10.0, 21.0), 1e-12);
    }

    @Test
    void separationShrinksWithDeclination() {
        assertEquals(0.5, SkyMath.separation(0.0, 60.0, 1.0, 60.0), 1e-3);
    }

    @Test
    void separationAcrossZeroRa() {
        assertEquals(SkyMath.separation(0.5, 0.0, 359.5, 0.0), 1.0, 1e-12);
    }

    @Test
    void separationOfAntipodes() {
        assertEquals(180.0, SkyMath.separation(0.0, 90.0, 0.0, -90.0), 1e-9);
    }

    @Test
    void raDifferenceWraps() {
        assertEquals(1.0, SkyMath.raDifference(0.5, 359.5), 1e-12);
        assertEquals(-1.0, SkyMath.raDifference(359.5, 0.5), 1e-12);
        assertEquals(-180.0, SkyMath.raDifference(180.0, 0.0), 1e-12);
    }

    @Test
    void normalizeRa() {
        assertEquals(359.0, SkyMath.normalizeRa(-1.0), 1e-12);
        assertEquals(1.0, SkyMath.normalizeRa(361.0), 1e-12);
    }

    @Test
    void deRuiterScalesOffsetByCombinedError() {
        double error = SkyMath.arcsecToDegrees(1.0);
        double offset = SkyMath.arcsecToDegrees(2.0);

        double r = SkyMath.deRuiterRadius(150.0, error, 30.0, error, 150.0, error, 30.0 + offset, error);

        assertEquals(Math.sqrt(2.0), r, 1e-9);
    }

    @Test
    void deRuiterProjectsRaOffset() {
        double error = 0.001;
        double r = SkyMath.deRuiterRadius(0.002, error, 60.0, error, 0.0, 0.0, 60.0, 0.0);

        assertEquals(1.0, r, 1e-3);
    }

    @Test
    void deRuiterWithZeroVariance() {
        assertEquals(0.0, SkyMath.deRuiterRadius(1, 0, 1, 0, 1, 0, 1, 0));
        assertEquals(Double.POSITIVE_INFINITY, SkyMath.deRuiterRadius(1, 0, 1, 0, 1, 0, 1.1, 0));
    }

    @Test
    void arcsecConversions() {
        assertEquals(1.0, SkyMath.arcsecToDegrees(3600.0));
        assertEquals(1.8, SkyMath.degreesToArcsec(0.0005), 1e-12);
    }
}
