package com.sky.association.association;

import com.sky.association.core.model.AssociatedSource;
import com.sky.association.core.model.Detection;
import com.sky.association.core.sky.SkyMath;
import com.sky.association.testsupport.SkyFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PositionCombinerTest {

    private static final double ARCSEC = SkyMath.arcsecToDegrees(1.0);

    @Test
    @DisplayName("Add weights each axis by inverse variance")
    void addWeightsByInverseVariance() {
        AssociatedSource source = AssociatedSource.builder()
                .position(10.0, ARCSEC, -20.0, ARCSEC).ndetect(1).build();
        Detection precise = SkyFixtures.detection(1, 1, 10.0, 0.5 * ARCSEC, -20.0 + 5 * ARCSEC, 0.5 * ARCSEC);

        PositionCombiner.add(source, precise);

        // weights 1 and 4
        assertEquals(-20.0 + 4 * ARCSEC, source.getDec(), 1e-10);
        assertEquals(ARCSEC / Math.sqrt(5), source.getEDec(), 1e-12);
        assertEquals(10.0, source.getRa(), 1e-10);
    }

    @Test
    @DisplayName("Remove after add restores the previous position")
    void addThenRemoveRestores() {
        AssociatedSource source = AssociatedSource.builder()
                .position(45.0, 0.7 * ARCSEC, 12.0, 0.9 * ARCSEC).ndetect(3).build();
        Detection d = SkyFixtures.detection(4, 2, 45.0 + 0.3 * ARCSEC, 0.4 * ARCSEC, 12.0 - 0.2 * ARCSEC, 0.6 * ARCSEC);

        PositionCombiner.add(source, d);
        assertTrue(PositionCombiner.remove(source, d));

        assertEquals(45.0, source.getRa(), 1e-10);
        assertEquals(12.0, source.getDec(), 1e-10);
        assertEquals(0.7 * ARCSEC, source.getERa(), 1e-12);
        assertEquals(0.9 * ARCSEC, source.getEDec(), 1e-12);
    }

    @Test
    @DisplayName("Sources straddling RA 0 average across the wrap")
    void raWrap() {
        AssociatedSource source = AssociatedSource.builder()
                .position(359.9999, ARCSEC, 0.0, ARCSEC).ndetect(1).build();
        Detection d = SkyFixtures.detection(1, 1, 0.0001, ARCSEC, 0.0, ARCSEC);

        PositionCombiner.add(source, d);

        double ra = source.getRa();
        assertTrue(ra < 1e-6 || ra > 360.0 - 1e-6, "mean should sit on the wrap, got " + ra);
    }

    @Test
    @DisplayName("Removing the only weight is refused and leaves the source unchanged")
    void removeLastWeightRefused() {
        Detection only = SkyFixtures.detection(1, 1, 80.0, ARCSEC, 5.0, ARCSEC);
        AssociatedSource source = AssociatedSource.seededFrom(only);

        assertFalse(PositionCombiner.remove(source, only));
        assertEquals(80.0, source.getRa());
        assertEquals(5.0, source.getDec());
    }

    @Test
    @DisplayName("Recompute equals adding the detections one by one")
    void recompute() {
        Detection a = SkyFixtures.detection(1, 1, 80.0, ARCSEC, 5.0, ARCSEC);
        Detection b = SkyFixtures.detection(1, 2, 80.0, 2 * ARCSEC, 5.0 + ARCSEC, 2 * ARCSEC);
        AssociatedSource incremental = AssociatedSource.seededFrom(a);
        PositionCombiner.add(incremental, b);

        AssociatedSource rebuilt = AssociatedSource.builder().position(0, 1, 0, 1).ndetect(2).build();
        PositionCombiner.recompute(rebuilt, List.of(a, b));

        assertEquals(incremental.getDec(), rebuilt.getDec(), 1e-12);
        assertEquals(incremental.getEDec(), rebuilt.getEDec(), 1e-15);
        assertThrows(IllegalArgumentException.class, () -> PositionCombiner.recompute(rebuilt, List.of()));
    }
}
