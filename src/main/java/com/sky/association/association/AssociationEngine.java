package com.sky.association.association;

import com.sky.association.core.model.AssociatedSource;
import com.sky.association.core.model.Detection;
import com.sky.association.core.model.Image;
import com.sky.association.core.sky.SkyMath;
import com.sky.association.store.AssociatedSourceRepository;
import com.sky.association.store.DetectionRepository;
import com.sky.association.store.StageTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges the detections of one image into persistent associated sources.
 *
 * <p>Candidates are the associated sources within the search cone of each detection
 * whose de Ruiter radius does not exceed the association limit. Pairs are assigned
 * greedily by increasing de Ruiter radius so each source takes at most one detection
 * per image. Unpaired detections seed new sources.</p>
 */
public class AssociationEngine {
    private static final Logger log = LoggerFactory.getLogger(AssociationEngine.class);

    public static final double DEFAULT_DE_RUITER_LIMIT = 5.68;
    public static final double DEFAULT_MAX_SEARCH_RADIUS_ARCSEC = 60.0;

    private final AssociatedSourceRepository sources;
    private final DetectionRepository detections;
    private final double deRuiterLimit;
    private final double maxSearchRadiusArcsec;

    public AssociationEngine(AssociatedSourceRepository sources, DetectionRepository detections) {
        this(sources, detections, DEFAULT_DE_RUITER_LIMIT, DEFAULT_MAX_SEARCH_RADIUS_ARCSEC);
    }

    public AssociationEngine(AssociatedSourceRepository sources, DetectionRepository detections,
                             double deRuiterLimit, double maxSearchRadiusArcsec) {
        if (deRuiterLimit <= 0) {
            throw new IllegalArgumentException("deRuiterLimit must be > 0");
        }
        if (maxSearchRadiusArcsec <= 0) {
            throw new IllegalArgumentException("maxSearchRadiusArcsec must be > 0");
        }
        this.sources = sources;
        this.detections = detections;
        this.deRuiterLimit = deRuiterLimit;
        this.maxSearchRadiusArcsec = maxSearchRadiusArcsec;
    }

    /**
     * Search cone radius in degrees for an image: half the beam major axis, capped.
     */
    public double searchRadius(Image image) {
        Double bmaj = image.getHeader().bmaj();
        double arcsec = bmaj != null && bmaj > 0 ? Math.min(bmaj / 2.0, maxSearchRadiusArcsec) : maxSearchRadiusArcsec;
        return SkyMath.arcsecToDegrees(arcsec);
    }

    /**
     * Associates every unassociated detection of the image. All writes go through the transaction.
     */
    public AssociationResult associate(Image image, List<Detection> imageDetections, StageTransaction tx) {
        double radius = searchRadius(image);
        List<Detection> pending = imageDetections.stream().filter(d -> !d.isAssociated()).toList();

        // Candidates come from the store as it was before this image, so detections
        // of the same image never merge with each other.
        List<Pairing> pairings = new ArrayList<>();
        Map<Long, AssociatedSource> candidates = new LinkedHashMap<>();
        for (Detection detection : pending) {
            for (AssociatedSource candidate : sources.findWithinCone(detection.getRa(), detection.getDec(), radius)) {
                double r = SkyMath.deRuiterRadius(
                        detection.getRa(), detection.getERa(), detection.getDec(), detection.getEDec(),
                        candidate.getRa(), candidate.getERa(), candidate.getDec(), candidate.getEDec());
                if (r <= deRuiterLimit) {
                    pairings.add(new Pairing(detection, candidate.getId(), r));
                    candidates.putIfAbsent(candidate.getId(), candidate);
                }
            }
        }
        pairings.sort(Comparator.comparingDouble(Pairing::deRuiter)
                .thenComparingInt(p -> p.detection().getSourceId())
                .thenComparingLong(Pairing::sourceId));

        Set<Detection> paired = new HashSet<>();
        Set<Long> taken = new HashSet<>();
        List<AssociatedSource> updated = new ArrayList<>();
        for (Pairing pairing : pairings) {
            if (paired.contains(pairing.detection()) || taken.contains(pairing.sourceId())) {
                continue;
            }
            paired.add(pairing.detection());
            taken.add(pairing.sourceId());
            AssociatedSource source = candidates.get(pairing.sourceId());
            merge(source, pairing.detection(), tx);
            updated.add(source);
        }

        List<AssociatedSource> created = new ArrayList<>();
        for (Detection detection : pending) {
            if (!paired.contains(detection)) {
                created.add(create(detection, tx));
            }
        }

        log.info("association.completed imageId={} detections={} created={} updated={}",
                image.getId(), pending.size(), created.size(), updated.size());
        return new AssociationResult(created, updated);
    }

    private void merge(AssociatedSource source, Detection detection, StageTransaction tx) {
        AssociatedSource before = source.copy();
        Detection detectionBefore = detection.copy();
        PositionCombiner.add(source, detection);
        source.setNdetect(source.getNdetect() + 1);
        tx.execute("merge detection " + detection.getKey() + " into source " + source.getId(),
                () -> sources.save(source),
                () -> sources.save(before));
        detection.associateTo(source.getId());
        tx.execute("link detection " + detection.getKey(),
                () -> detections.save(detection),
                () -> detections.save(detectionBefore));
    }

    private AssociatedSource create(Detection detection, StageTransaction tx) {
        Detection detectionBefore = detection.copy();
        AssociatedSource source = AssociatedSource.seededFrom(detection);
        tx.execute("create source from detection " + detection.getKey(),
                () -> sources.save(source),
                () -> sources.delete(source.getId()));
        detection.associateTo(source.getId());
        tx.execute("link detection " + detection.getKey(),
                () -> detections.save(detection),
                () -> detections.save(detectionBefore));
        return source;
    }

    private record Pairing(Detection detection, long sourceId, double deRuiter) {}
}
