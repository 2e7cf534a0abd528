package com.sky.association.association;

import com.sky.association.core.model.AssociatedSource;
import com.sky.association.core.model.CatalogMatch;
import com.sky.association.core.model.Detection;
import com.sky.association.core.model.Island;
import com.sky.association.core.model.UniqueSource;
import com.sky.association.core.sky.SkyMath;
import com.sky.association.store.SkyStore;
import com.sky.association.store.StageTransaction;
import com.sky.association.testsupport.SkyFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import static com.sky.association.testsupport.SkyFixtures.ERROR;
import static org.junit.jupiter.api.Assertions.*;

class ConsistencyMaintainerTest {

    private static final double ARCSEC = SkyMath.arcsecToDegrees(1.0);

    private SkyStore store;
    private ConsistencyMaintainer maintainer;

    /** Detected in images 1 and 2. */
    private AssociatedSource shared;
    /** Detected in image 1 only, matched to one catalog entry. */
    private AssociatedSource single;

    @BeforeEach
    void setUp() {
        store = SkyStore.inMemory();
        maintainer = new ConsistencyMaintainer(store);

        Detection d11 = SkyFixtures.detection(1, 1, 150.0, ERROR, 30.0, ERROR);
        Detection d21 = SkyFixtures.detection(1, 2, 150.0, ERROR, 30.0 + 0.4 * ARCSEC, ERROR);
        shared = SkyFixtures.source(150.0, 30.0, 1);
        PositionCombiner.add(shared, d21);
        shared.setNdetect(2);
        store.associatedSources().save(shared);
        d11.associateTo(shared.getId());
        d21.associateTo(shared.getId());

        Detection d12 = SkyFixtures.detection(2, 1, 150.2, ERROR, 30.1, ERROR);
        single = AssociatedSource.builder().position(150.2, ERROR, 30.1, ERROR).ndetect(1).nmatches(1).build();
        store.associatedSources().save(single);
        d12.associateTo(single.getId());

        List.of(d11, d21, d12).forEach(store.detections()::save);
        store.detections().saveIsland(new Island(1, 1, 10, 1, 0.5, 0, 0.4, 0));
        store.detections().saveIsland(new Island(2, 1, 10, 1, 0.5, 0, 0.4, 0));
        store.catalogMatches().add(new CatalogMatch(1, 77, single.getId(), 0.4));
        store.uniqueSources().upsert(new UniqueSource(1, shared.getId(), true));
        store.uniqueSources().upsert(new UniqueSource(2, shared.getId(), true));
    }

    private <T> T committed(Function<StageTransaction, T> work) {
        try (StageTransaction tx = new StageTransaction("test")) {
            T result = work.apply(tx);
            tx.markSuccess();
            return result;
        }
    }

    private int totalNdetect() {
        return store.associatedSources().findAll().stream().mapToInt(AssociatedSource::getNdetect).sum();
    }

    private int linkedDetections() {
        return (int) store.detections().findByImage(1).stream().filter(Detection::isAssociated).count()
                + (int) store.detections().findByImage(2).stream().filter(Detection::isAssociated).count();
    }

    @Nested
    @DisplayName("Purging an image")
    class PurgeImage {

        @Test
        @DisplayName("Un-merges shared sources and deletes sources left without detections")
        void purgeImageOne() {
            RemovalResult result = committed(tx -> maintainer.purgeImage(1, tx));

            assertEquals(List.of(shared.getId()), result.updatedSources());
            assertEquals(List.of(single.getId()), result.deletedSources());
            assertEquals(0, result.orphanedDetections());

            AssociatedSource remaining = store.associatedSources().findById(shared.getId()).orElseThrow();
            assertEquals(1, remaining.getNdetect());
            assertEquals(30.0 + 0.4 * ARCSEC, remaining.getDec(), 1e-9);
            assertEquals(ERROR, remaining.getEDec(), 1e-9);
            assertTrue(store.associatedSources().findById(single.getId()).isEmpty());
        }

        @Test
        @DisplayName("Deletes detections, islands, matches and uniqueness records of the image")
        void cascades() {
            committed(tx -> maintainer.purgeImage(1, tx));

            assertTrue(store.detections().findByImage(1).isEmpty());
            assertTrue(store.detections().findIslandsByImage(1).isEmpty());
            assertTrue(store.catalogMatches().findByAssociatedSource(single.getId()).isEmpty());
            assertTrue(store.uniqueSources().findByImage(1).isEmpty());
            assertEquals(1, store.uniqueSources().findByImage(2).size());
            assertEquals(1, store.detections().findByImage(2).size());
        }

        @Test
        @DisplayName("ndetect equals the number of linked detections afterwards")
        void countsStayConsistent() {
            committed(tx -> maintainer.purgeImage(1, tx));

            assertEquals(linkedDetections(), totalNdetect());
        }

        @Test
        @DisplayName("Rollback restores every row")
        void rollback() {
            try (StageTransaction tx = new StageTransaction("abandoned")) {
                maintainer.purgeImage(1, tx);
            }

            assertEquals(2, store.detections().findByImage(1).size());
            assertEquals(2, store.detections().findIslandsByImage(1).size());
            assertEquals(2, store.associatedSources().findById(shared.getId()).orElseThrow().getNdetect());
            assertTrue(store.associatedSources().findById(single.getId()).isPresent());
            assertEquals(1, store.catalogMatches().findByAssociatedSource(single.getId()).size());
            assertEquals(2, store.uniqueSources().findByAssociatedSource(shared.getId()).size());
        }
    }

    @Nested
    @DisplayName("Unlinking detections")
    class Unlink {

        @Test
        @DisplayName("Keeps the detection rows but clears their association")
        void unlinkKeepsRows() {
            List<Detection> image1 = store.detections().findByImage(1);

            committed(tx -> maintainer.unlinkDetections(image1, tx));

            List<Detection> after = store.detections().findByImage(1);
            assertEquals(2, after.size());
            assertTrue(after.stream().noneMatch(Detection::isAssociated));
            assertTrue(after.stream().noneMatch(Detection::isOrphaned));
            assertEquals(linkedDetections(), totalNdetect());
        }

        @Test
        @DisplayName("Drops the uniqueness record of the image for an un-merged source")
        void dropsImageUniqueness() {
            committed(tx -> maintainer.unlinkDetections(store.detections().findByImage(2), tx));

            assertTrue(store.uniqueSources().find(2, shared.getId()).isEmpty());
            assertTrue(store.uniqueSources().find(1, shared.getId()).isPresent());
        }
    }

    @Nested
    @DisplayName("Removing associated sources")
    class RemoveSources {

        @Test
        @DisplayName("Orphans every detection of the removed source")
        void orphansDetections() {
            List<Long> removed = committed(tx -> maintainer.removeAssociatedSources(List.of(shared.getId(), 999L), tx));

            assertEquals(List.of(shared.getId()), removed);
            assertTrue(store.associatedSources().findById(shared.getId()).isEmpty());
            assertTrue(store.uniqueSources().findByAssociatedSource(shared.getId()).isEmpty());
            Detection orphan = store.detections().findByImage(2).get(0);
            assertTrue(orphan.isOrphaned());
            assertFalse(orphan.isAssociated());
        }

        @Test
        @DisplayName("Purging an image whose detection is orphaned leaves other sources intact")
        void purgeWithOrphans() {
            committed(tx -> maintainer.removeAssociatedSources(List.of(shared.getId()), tx));

            RemovalResult result = committed(tx -> maintainer.purgeImage(2, tx));

            assertTrue(result.updatedSources().isEmpty());
            assertTrue(result.deletedSources().isEmpty());
            assertTrue(store.detections().findByImage(2).isEmpty());
            assertTrue(store.associatedSources().findById(single.getId()).isPresent());
        }
    }

    @Nested
    @DisplayName("Match bookkeeping")
    class Matches {

        @Test
        @DisplayName("First match removes every uniqueness record of the source")
        void firstMatch() {
            committed(tx -> {
                maintainer.onFirstMatch(shared.getId(), tx);
                return null;
            });

            assertTrue(store.uniqueSources().findByAssociatedSource(shared.getId()).isEmpty());
        }

        @Test
        @DisplayName("Dropped matches report unmatched sources with their images")
        void matchesDropped() {
            AssociatedSource unmatched = store.associatedSources().findById(single.getId()).orElseThrow();
            unmatched.setNmatches(0);
            store.associatedSources().save(unmatched);

            Map<Long, Set<Integer>> candidates = maintainer.onMatchesDropped(List.of(single.getId(), shared.getId()));

            assertEquals(Set.of(1), candidates.get(single.getId()));
            assertEquals(Set.of(1, 2), candidates.get(shared.getId()));
            assertEquals(2, store.uniqueSources().findByAssociatedSource(shared.getId()).size(), "read only");
        }

        @Test
        @DisplayName("Sources that still have matches are not reported")
        void matchedSourcesIgnored() {
            Map<Long, Set<Integer>> candidates = maintainer.onMatchesDropped(List.of(single.getId()));

            assertTrue(candidates.isEmpty());
        }
    }
}
