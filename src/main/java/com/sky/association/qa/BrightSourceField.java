package com.sky.association.qa;

import com.sky.association.core.sky.SkyPosition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bright or confusing radio sources that degrade nearby images:
 * fixed positions for bright extragalactic and Galactic sources plus
 * the Sun, Moon and Jupiter at the observation time.
 */
public final class BrightSourceField {

    private static final Map<String, SkyPosition> FIXED = new LinkedHashMap<>();

    static {
        FIXED.put("Cas A", new SkyPosition(350.866250, 58.811667));
        FIXED.put("Cen A", new SkyPosition(201.365000, -43.019167));
        FIXED.put("Cyg A", new SkyPosition(299.867917, 40.733889));
        FIXED.put("Her A", new SkyPosition(252.783750, 4.992500));
        FIXED.put("Orion A", new SkyPosition(83.818750, -5.389722));
        FIXED.put("Per A", new SkyPosition(49.950417, 41.511667));
        FIXED.put("Tau A", new SkyPosition(83.633333, 22.014444));
        FIXED.put("Virgo A", new SkyPosition(187.705833, 12.391111));
        FIXED.put("GC", new SkyPosition(266.416833, -29.007806));
    }

    /**
     * A named problem source and its separation from the pointing in degrees.
     */
    public record Nearest(String name, double separation) {}

    private record Named(String name, SkyPosition position) {}

    private BrightSourceField() {
    }

    /**
     * The problem source closest to the pointing at the given MJD.
     */
    public static Nearest nearest(SkyPosition pointing, double mjd) {
        Nearest best = null;
        for (Named source : positionsAt(mjd)) {
            double sep = pointing.separationTo(source.position());
            if (best == null || sep < best.separation()) {
                best = new Nearest(source.name(), sep);
            }
        }
        return best;
    }

    private static List<Named> positionsAt(double mjd) {
        List<Named> all = new ArrayList<>();
        all.add(new Named("Sun", SolarSystemEphemeris.sun(mjd)));
        all.add(new Named("Moon", SolarSystemEphemeris.moon(mjd)));
        all.add(new Named("Jupiter", SolarSystemEphemeris.jupiter(mjd)));
        FIXED.forEach((name, position) -> all.add(new Named(name, position)));
        return all;
    }
}
