package com.sky.association.association;

import com.sky.association.core.model.AssociatedSource;
import com.sky.association.core.model.CatalogMatch;
import com.sky.association.core.model.Detection;
import com.sky.association.core.model.Island;
import com.sky.association.core.model.UniqueSource;
import com.sky.association.store.SkyStore;
import com.sky.association.store.StageTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Keeps aggregate counters and dependent records consistent with the rows they count.
 *
 * <p>Reacts to three events as explicit transactional steps:</p>
 * <ul>
 *   <li>detections leaving their associated source: the position merge is undone,
 *       {@code ndetect} decremented and a source left with no detection deleted together
 *       with its matches and uniqueness records;</li>
 *   <li>the first catalog match of a source: its uniqueness records are deleted;</li>
 *   <li>match counts dropping to zero: the affected sources and the images in which they
 *       were detected are reported so the caller can restore uniqueness records.</li>
 * </ul>
 */
public class ConsistencyMaintainer {
    private static final Logger log = LoggerFactory.getLogger(ConsistencyMaintainer.class);

    private final SkyStore store;

    public ConsistencyMaintainer(SkyStore store) {
        this.store = store;
    }

    /**
     * Removes everything extracted from an image: its detections are un-merged and deleted,
     * then its islands and uniqueness records are deleted. The image row itself is kept.
     */
    public RemovalResult purgeImage(int imageId, StageTransaction tx) {
        RemovalResult result = purgeDetections(store.detections().findByImage(imageId), tx);

        List<Island> islands = store.detections().findIslandsByImage(imageId);
        if (!islands.isEmpty()) {
            tx.execute("delete islands of image " + imageId,
                    () -> store.detections().deleteIslandsByImage(imageId),
                    () -> islands.forEach(store.detections()::saveIsland));
        }
        List<UniqueSource> uniques = new ArrayList<>();
        tx.execute("delete uniqueness records of image " + imageId,
                () -> uniques.addAll(store.uniqueSources().deleteByImage(imageId)),
                () -> uniques.forEach(store.uniqueSources()::upsert));

        log.info("consistency.image.purged imageId={} islands={} deletedSources={}",
                imageId, islands.size(), result.deletedSources().size());
        return result;
    }

    /**
     * Un-merges the detections and deletes their rows.
     */
    public RemovalResult purgeDetections(List<Detection> removed, StageTransaction tx) {
        return detach(removed, true, tx);
    }

    /**
     * Un-merges the detections and leaves them unassociated, ready to be associated again.
     */
    public RemovalResult unlinkDetections(List<Detection> removed, StageTransaction tx) {
        return detach(removed, false, tx);
    }

    private RemovalResult detach(List<Detection> removed, boolean deleteRows, StageTransaction tx) {
        List<Long> updated = new ArrayList<>();
        List<Long> deleted = new ArrayList<>();
        int orphaned = 0;

        for (Detection detection : removed) {
            Detection before = detection.copy();
            if (detection.isAssociated()) {
                long assocId = detection.getAssociatedSourceId().get();
                Optional<AssociatedSource> found = store.associatedSources().findById(assocId);
                if (found.isEmpty()) {
                    log.warn("Detection {} points to missing associated source {}", detection.getKey(), assocId);
                } else if (found.get().getNdetect() <= 1) {
                    orphaned += deleteSource(found.get(), detection, tx);
                    deleted.add(assocId);
                } else {
                    removeFromSource(found.get(), detection, tx);
                    if (!updated.contains(assocId)) {
                        updated.add(assocId);
                    }
                }
            }

            if (deleteRows) {
                tx.execute("delete detection " + detection.getKey(),
                        () -> store.detections().delete(detection.getKey()),
                        () -> store.detections().save(before));
            } else if (detection.isAssociated() || detection.isOrphaned()) {
                detection.clearAssociation();
                tx.execute("unlink detection " + detection.getKey(),
                        () -> store.detections().save(detection),
                        () -> store.detections().save(before));
            }
        }

        if (!removed.isEmpty()) {
            log.info("consistency.detections.detached count={} updatedSources={} deletedSources={} orphaned={}",
                    removed.size(), updated.size(), deleted.size(), orphaned);
        }
        return new RemovalResult(updated, deleted, orphaned);
    }

    private void removeFromSource(AssociatedSource source, Detection detection, StageTransaction tx) {
        AssociatedSource before = source.copy();
        long assocId = source.getId();
        if (!PositionCombiner.remove(source, detection)) {
            List<Detection> remaining = store.detections().findByAssociatedSource(assocId).stream()
                    .filter(d -> !d.getKey().equals(detection.getKey()))
                    .toList();
            log.debug("Recomputing source {} from {} remaining detections", assocId, remaining.size());
            PositionCombiner.recompute(source, remaining);
        }
        source.setNdetect(source.getNdetect() - 1);
        tx.execute("un-merge detection " + detection.getKey() + " from source " + assocId,
                () -> store.associatedSources().save(source),
                () -> store.associatedSources().save(before));

        int imageId = detection.getImageId();
        Optional<UniqueSource> unique = store.uniqueSources().find(imageId, assocId);
        if (unique.isPresent()) {
            tx.execute("drop uniqueness record of source " + assocId + " in image " + imageId,
                    () -> store.uniqueSources().delete(imageId, assocId),
                    () -> store.uniqueSources().upsert(unique.get()));
        }
    }

    /**
     * Deletes a source that lost its last detection.
     *
     * @return number of other detections orphaned
     */
    private int deleteSource(AssociatedSource source, Detection leaving, StageTransaction tx) {
        List<Detection> others = store.detections().findByAssociatedSource(source.getId()).stream()
                .filter(d -> leaving == null || !d.getKey().equals(leaving.getKey()))
                .toList();
        deleteSourceRecords(source, tx);
        orphan(others, tx);
        return others.size();
    }

    private void deleteSourceRecords(AssociatedSource source, StageTransaction tx) {
        long assocId = source.getId();
        AssociatedSource before = source.copy();
        List<CatalogMatch> matches = new ArrayList<>();
        tx.execute("delete matches of source " + assocId,
                () -> matches.addAll(store.catalogMatches().deleteByAssociatedSource(assocId)),
                () -> matches.forEach(store.catalogMatches()::add));
        List<UniqueSource> uniques = new ArrayList<>();
        tx.execute("delete uniqueness records of source " + assocId,
                () -> uniques.addAll(store.uniqueSources().deleteByAssociatedSource(assocId)),
                () -> uniques.forEach(store.uniqueSources()::upsert));
        tx.execute("delete source " + assocId,
                () -> store.associatedSources().delete(assocId),
                () -> store.associatedSources().save(before));
    }

    private void orphan(List<Detection> detections, StageTransaction tx) {
        for (Detection detection : detections) {
            Detection before = detection.copy();
            detection.orphan();
            tx.execute("orphan detection " + detection.getKey(),
                    () -> store.detections().save(detection),
                    () -> store.detections().save(before));
        }
    }

    /**
     * Called when a source records its first catalog match: it is no longer survey-unique.
     */
    public void onFirstMatch(long assocId, StageTransaction tx) {
        List<UniqueSource> removed = new ArrayList<>();
        tx.execute("drop uniqueness records of newly matched source " + assocId,
                () -> removed.addAll(store.uniqueSources().deleteByAssociatedSource(assocId)),
                () -> removed.forEach(store.uniqueSources()::upsert));
        if (!removed.isEmpty()) {
            log.debug("Source {} matched; removed {} uniqueness records", assocId, removed.size());
        }
    }

    /**
     * Sources among {@code assocIds} whose match count is now zero, each with the ids of the
     * images in which it is detected. Nothing is written.
     */
    public Map<Long, Set<Integer>> onMatchesDropped(Collection<Long> assocIds) {
        Map<Long, Set<Integer>> candidates = new LinkedHashMap<>();
        for (Long assocId : new TreeSet<>(assocIds)) {
            store.associatedSources().findById(assocId)
                    .filter(AssociatedSource::isSurveyUnique)
                    .ifPresent(source -> {
                        Set<Integer> images = new TreeSet<>();
                        store.detections().findByAssociatedSource(assocId)
                                .forEach(d -> images.add(d.getImageId()));
                        candidates.put(assocId, images);
                    });
        }
        return candidates;
    }

    /**
     * Deletes associated sources with their matches and uniqueness records.
     * Their detections are orphaned.
     *
     * @return ids of the sources actually deleted
     */
    public List<Long> removeAssociatedSources(Collection<Long> assocIds, StageTransaction tx) {
        List<Long> deleted = new ArrayList<>();
        for (Long assocId : assocIds) {
            Optional<AssociatedSource> source = store.associatedSources().findById(assocId);
            if (source.isEmpty()) {
                log.warn("Associated source {} not found; skipping", assocId);
                continue;
            }
            deleteSource(source.get(), null, tx);
            deleted.add(assocId);
        }
        log.info("consistency.sources.removed count={}", deleted.size());
        return deleted;
    }
}
