package com.sky.association.extraction;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GaussianPrimaryBeamTest {

    @Test
    void fullPowerAtCentre() {
        assertEquals(1.0, new GaussianPrimaryBeam().power(0.0, 1.4));
    }

    @Test
    void halfPowerAtHalfWidth() {
        GaussianPrimaryBeam beam = new GaussianPrimaryBeam(0.5);

        assertEquals(0.5, beam.power(0.25, 1.0), 1e-12);
        assertEquals(0.5, beam.power(0.125, 2.0), 1e-12);
    }

    @Test
    void rejectsNonPositiveWidth() {
        assertThrows(IllegalArgumentException.class, () -> new GaussianPrimaryBeam(0.0));
    }
}
