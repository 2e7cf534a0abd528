package com.sky.association.qa;

import com.sky.association.core.sky.SkyPosition;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BrightSourceFieldTest {

    @Test
    void nearestFixedSource() {
        BrightSourceField.Nearest nearest = BrightSourceField.nearest(new SkyPosition(350.9, 58.8), 58255.5);

        assertEquals("Cas A", nearest.name());
        assertTrue(nearest.separation() < 0.05);
    }

    @Test
    void sunIsConsidered() {
        SkyPosition sun = SolarSystemEphemeris.sun(58255.5);

        BrightSourceField.Nearest nearest = BrightSourceField.nearest(sun, 58255.5);

        assertEquals("Sun", nearest.name());
        assertEquals(0.0, nearest.separation(), 1e-9);
    }
}
