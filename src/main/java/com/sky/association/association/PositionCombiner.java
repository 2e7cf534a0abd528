package com.sky.association.association;

import com.sky.association.core.model.AssociatedSource;
import com.sky.association.core.model.Detection;
import com.sky.association.core.sky.SkyMath;

import java.util.List;

/**
 * Inverse-variance weighted combination of positions, applied independently
 * to right ascension and declination.
 *
 * <p>Adding a detection: {@code w = 1/s^2 + 1/sd^2}, {@code p = (p/s^2 + pd/sd^2)/w}, {@code s^2 = 1/w}.
 * Removing it is the exact algebraic inverse with the detection's weight subtracted,
 * so an add followed by a remove of the same detection restores the prior position.</p>
 *
 * <p>Right ascension is combined on the branch nearest the current mean so sources
 * straddling 0h average correctly.</p>
 */
public final class PositionCombiner {

    /** Floor applied to position errors (degrees) so weights stay finite. */
    static final double MIN_ERROR = 1e-10;

    /** Remaining weight below this fraction of the original is treated as cancellation noise. */
    private static final double RELATIVE_WEIGHT_FLOOR = 1e-12;

    private PositionCombiner() {
    }

    /**
     * Folds a detection into the source position.
     */
    public static void add(AssociatedSource source, Detection detection) {
        double raDet = source.getRa() + SkyMath.raDifference(detection.getRa(), source.getRa());
        Axis ra = combine(source.getRa(), source.getERa(), raDet, detection.getERa(), +1);
        Axis dec = combine(source.getDec(), source.getEDec(), detection.getDec(), detection.getEDec(), +1);
        source.setPosition(SkyMath.normalizeRa(ra.value), ra.error, dec.value, dec.error);
    }

    /**
     * Takes a previously added detection back out of the source position.
     *
     * @return false if the remaining weight is not positive, in which case the source is
     *         left unchanged and the caller must recompute it from its remaining detections
     */
    public static boolean remove(AssociatedSource source, Detection detection) {
        double raDet = source.getRa() + SkyMath.raDifference(detection.getRa(), source.getRa());
        Axis ra = combine(source.getRa(), source.getERa(), raDet, detection.getERa(), -1);
        Axis dec = combine(source.getDec(), source.getEDec(), detection.getDec(), detection.getEDec(), -1);
        if (ra == null || dec == null) {
            return false;
        }
        source.setPosition(SkyMath.normalizeRa(ra.value), ra.error, dec.value, dec.error);
        return true;
    }

    /**
     * Weighted mean of a set of detections, used to rebuild a source from scratch.
     */
    public static void recompute(AssociatedSource source, List<Detection> detections) {
        if (detections.isEmpty()) {
            throw new IllegalArgumentException("Cannot recompute a position from no detections");
        }
        Detection first = detections.get(0);
        source.setPosition(first.getRa(), first.getERa(), first.getDec(), first.getEDec());
        for (Detection detection : detections.subList(1, detections.size())) {
            add(source, detection);
        }
    }

    private static Axis combine(double value, double error, double detValue, double detError, int sign) {
        double wSource = 1.0 / square(Math.max(error, MIN_ERROR));
        double wDet = 1.0 / square(Math.max(detError, MIN_ERROR));
        double w = wSource + sign * wDet;
        if (!(w > wSource * RELATIVE_WEIGHT_FLOOR) || Double.isInfinite(w)) {
            return null;
        }
        double combined = (value * wSource + sign * detValue * wDet) / w;
        return new Axis(combined, Math.sqrt(1.0 / w));
    }

    private static double square(double x) {
        return x * x;
    }

    private record Axis(double value, double error) {}
}
