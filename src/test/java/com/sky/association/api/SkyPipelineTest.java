package com.sky.association.api;

import com.sky.association.audit.AuditAction;
import com.sky.association.audit.AuditEntry;
import com.sky.association.catalog.CatalogRegistry;
import com.sky.association.catalog.CatalogSourceCache;
import com.sky.association.catalog.UnknownCatalogException;
import com.sky.association.core.model.AssociatedSource;
import com.sky.association.core.model.CatalogSource;
import com.sky.association.core.model.Image;
import com.sky.association.core.model.ImageError;
import com.sky.association.core.model.ImageHeader;
import com.sky.association.core.model.ProcessingStage;
import com.sky.association.core.sky.SkyMath;
import com.sky.association.crossmatch.CatalogRemovalResult;
import com.sky.association.extraction.ExtractionException;
import com.sky.association.extraction.ExtractionParameters;
import com.sky.association.lock.DistributedLock;
import com.sky.association.lock.SkyRegionLock;
import com.sky.association.metrics.MetricsService;
import com.sky.association.store.SkyStore;
import com.sky.association.testsupport.FakeExtractor;
import com.sky.association.testsupport.FakeHeaderReader;
import com.sky.association.testsupport.SkyFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;

import static com.sky.association.testsupport.SkyFixtures.IMAGE_1;
import static com.sky.association.testsupport.SkyFixtures.IMAGE_2;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SkyPipelineTest {

    private static final List<String> BOTH = List.of(IMAGE_1, IMAGE_2);

    private FakeHeaderReader headerReader;
    private FakeExtractor extractor;
    private CatalogRegistry registry;
    private MetricsService metrics;
    private SkyPipeline pipeline;
    private SkyStore store;

    @BeforeEach
    void setUp() {
        headerReader = SkyFixtures.headerReader();
        extractor = SkyFixtures.extractor();
        registry = CatalogRegistry.of("nvss", "first");
        double[] p = SkyFixtures.inner(2);
        Map<String, List<CatalogSource>> catalogs = Map.of(
                "nvss", List.of(SkyFixtures.catalogSource(1, 0, p[0], p[1])),
                "first", List.of());
        metrics = mock(MetricsService.class);
        pipeline = SkyPipeline.builder()
                .headerReader(headerReader)
                .extractor(extractor)
                .catalogRegistry(registry)
                .catalogSources(new CatalogSourceCache(registry, catalogs::get))
                .metricsService(metrics)
                .build();
        store = pipeline.getStore();
    }

    private static PipelineOptions atScale(double scale) {
        return PipelineOptions.defaults().toBuilder()
                .extractionParameters(ExtractionParameters.defaults().withScale(scale))
                .build();
    }

    private Image image(String filename) {
        return store.images().findByFilename(filename).orElseThrow();
    }

    private List<AuditEntry> audits(AuditAction action) {
        return pipeline.getAuditService().getEntriesByAction(action);
    }

    private static ImageHeader noisyHeader() {
        return ImageHeader.builder()
                .imageSize(4096, 4096)
                .pointing(SkyFixtures.RA0, SkyFixtures.DEC0)
                .pixelScale(2.0)
                .object("FIELD_A")
                .obsDate("2018-05-17")
                .mapDate("2018-06-01")
                .obsFreq(340.0)
                .primaryFreq(0.34)
                .beam(5.0, 4.0, 0.0)
                .noise(200.0)
                .peak(100.0)
                .arrayConfig("A")
                .nvis(5000)
                .mjdTime(58255.5)
                .tauTime(1000.0)
                .duration(1000.0)
                .build();
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Requires a header reader")
        void requiresHeaderReader() {
            assertThrows(IllegalStateException.class,
                    () -> SkyPipeline.builder().extractor(extractor).build());
        }

        @Test
        @DisplayName("Requires an extractor")
        void requiresExtractor() {
            assertThrows(IllegalStateException.class,
                    () -> SkyPipeline.builder().headerReader(headerReader).build());
        }

        @Test
        @DisplayName("Defaults to an in-memory store and default options")
        void defaults() {
            SkyPipeline plain = SkyPipeline.builder().headerReader(headerReader).extractor(extractor).build();

            assertNotNull(plain.getStore());
            assertTrue(plain.getCatalogRegistry().names().isEmpty());
            assertTrue(plain.getDefaultOptions().isSourceFinding());
            assertTrue(plain.getDefaultOptions().isSaveToDatabase());
        }

        @Test
        @DisplayName("Registers catalogs by name")
        void catalogsByName() {
            SkyPipeline named = SkyPipeline.builder()
                    .headerReader(headerReader)
                    .extractor(extractor)
                    .catalogs("nvss", "first")
                    .build();

            assertEquals(List.of("nvss", "first"), named.getCatalogRegistry().names());
        }
    }

    @Nested
    @DisplayName("Full run")
    class FullRun {

        @Test
        @DisplayName("Takes both images through every stage")
        void everyStage() {
            RunSummary summary = pipeline.run(BOTH, atScale(0.5));

            assertEquals(2, summary.count(ImageOutcome.Status.COMPLETED));
            assertFalse(summary.nothingToDo());
            assertEquals(ProcessingStage.CATALOG_MATCHED, image(IMAGE_1).getStage());
            assertEquals(ProcessingStage.CATALOG_MATCHED, image(IMAGE_2).getStage());
            assertEquals(Set.of("nvss", "first"), image(IMAGE_1).getCatalogsChecked());
        }

        @Test
        @DisplayName("Second image updates the sources it re-detects")
        void secondImageUpdatesSources() {
            RunSummary summary = pipeline.run(BOTH, atScale(0.5));

            ImageOutcome first = summary.outcomeFor(IMAGE_1);
            ImageOutcome second = summary.outcomeFor(IMAGE_2);
            assertEquals(29, first.newSources());
            assertEquals(0, first.updatedSources());
            assertEquals(0, second.newSources());
            assertEquals(15, second.updatedSources());
            assertEquals(29, store.associatedSources().findAll().size());
            assertEquals(44, store.associatedSources().findAll().stream()
                    .mapToInt(AssociatedSource::getNdetect).sum());
        }

        @Test
        @DisplayName("Records the single catalog counterpart and the unique sources")
        void catalogMatches() {
            RunSummary summary = pipeline.run(List.of(IMAGE_1), atScale(0.5));

            ImageOutcome outcome = summary.outcomeFor(IMAGE_1);
            assertEquals(List.of("nvss", "first"), outcome.catalogsChecked());
            assertEquals(1, outcome.matchesRecorded());
            assertEquals(28, outcome.uniqueSources());
            assertEquals(1, store.catalogMatches().findByCatalog(registry.idOf("nvss")).size());
        }

        @Test
        @DisplayName("Audits each stage and the run itself")
        void audited() {
            RunSummary summary = pipeline.run(BOTH, atScale(0.5));

            assertEquals(2, audits(AuditAction.IMAGE_ADDED).size());
            assertEquals(2, audits(AuditAction.SOURCES_EXTRACTED).size());
            assertEquals(29, audits(AuditAction.ASSOCIATED_SOURCE_CREATED).size());
            assertEquals(1, audits(AuditAction.CATALOG_MATCHES_RECORDED).size());
            List<AuditEntry> completed = audits(AuditAction.RUN_COMPLETED);
            assertEquals(1, completed.size());
            assertEquals(summary.runId(), completed.get(0).runId());
            assertEquals(2L, completed.get(0).details().get("COMPLETED"));
            assertTrue(pipeline.getAuditService().getEntriesForRun(summary.runId()).size() > 1);
        }

        @Test
        @DisplayName("Reports stage durations, outcomes and counts to metrics")
        void metricsRecorded() {
            pipeline.run(BOTH, atScale(0.5));

            verify(metrics, times(2)).incrementImageOutcome("COMPLETED");
            verify(metrics).recordDetectionsPerImage(29);
            verify(metrics).recordDetectionsPerImage(15);
            verify(metrics).incrementAssociatedSourcesCreated(29);
            verify(metrics).incrementAssociatedSourcesUpdated(15);
            verify(metrics, times(2)).recordStageDuration(eq(ProcessingStage.EXTRACTED), any());
            verify(metrics, times(2)).recordStageDuration(eq(ProcessingStage.CATALOG_MATCHED), any());
            verify(metrics, never()).incrementQualityFailure(anyInt());
        }

        @Test
        @DisplayName("Nothing is saved when saving is off")
        void dryRun() {
            RunSummary summary = pipeline.run(BOTH, PipelineOptions.sourceFindingOnly().toBuilder()
                    .saveToDatabase(false)
                    .build());

            assertEquals(2, summary.count(ImageOutcome.Status.COMPLETED));
            assertEquals(29, summary.outcomeFor(IMAGE_1).detections());
            assertTrue(store.images().findAll().isEmpty());
            assertEquals(0, pipeline.getAuditService().size());
        }

        @Test
        @DisplayName("Association without saving is not ready")
        void associationNeedsSaving() {
            RunSummary summary = pipeline.run(List.of(IMAGE_1), PipelineOptions.defaults().toBuilder()
                    .saveToDatabase(false)
                    .build());

            assertEquals(ImageOutcome.Status.NOT_READY, summary.outcomeFor(IMAGE_1).status());
            assertEquals(0, extractor.calls());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("An image failing the header checks is stored with its error and not extracted")
        void qualityAbort() {
            headerReader.put(IMAGE_1, noisyHeader());

            RunSummary summary = pipeline.run(BOTH, atScale(0.5));

            ImageOutcome outcome = summary.outcomeFor(IMAGE_1);
            assertEquals(ImageOutcome.Status.ABORTED, outcome.status());
            assertEquals(ImageError.BAD_SENSITIVITY_METRIC, outcome.error());
            assertEquals(ImageError.BAD_SENSITIVITY_METRIC, image(IMAGE_1).getError());
            assertEquals(ProcessingStage.READ, image(IMAGE_1).getStage());
            assertEquals(1, extractor.calls(), "only the second image is extracted");
            assertEquals(ImageOutcome.Status.COMPLETED, summary.outcomeFor(IMAGE_2).status());
            assertEquals(1, audits(AuditAction.IMAGE_FAILED_QA).size());
            verify(metrics).incrementQualityFailure(ImageError.BAD_SENSITIVITY_METRIC.code());
            verify(metrics).incrementImageOutcome("ABORTED");
        }

        @Test
        @DisplayName("An image without a pointing is aborted even with the checks off")
        void noPointingWithoutChecks() {
            headerReader.put(IMAGE_1, ImageHeader.builder()
                    .imageSize(4096, 4096)
                    .pixelScale(2.0)
                    .obsDate("2018-05-17")
                    .obsFreq(1400.0)
                    .build());

            RunSummary summary = pipeline.run(BOTH, atScale(0.5).toBuilder().qualityChecks(false).build());

            ImageOutcome outcome = summary.outcomeFor(IMAGE_1);
            assertEquals(ImageOutcome.Status.ABORTED, outcome.status());
            assertEquals(ImageError.MISSING_METADATA, outcome.error());
            assertEquals(ImageError.MISSING_METADATA, image(IMAGE_1).getError());
            assertEquals(ProcessingStage.READ, image(IMAGE_1).getStage());
            assertEquals(1, extractor.calls(), "only the second image is extracted");
            assertEquals(ImageOutcome.Status.COMPLETED, summary.outcomeFor(IMAGE_2).status());
            verify(metrics).incrementQualityFailure(ImageError.MISSING_METADATA.code());
        }

        @Test
        @DisplayName("An aborted image is skipped until reprocessed")
        void abortedSkipped() {
            headerReader.put(IMAGE_1, noisyHeader());
            pipeline.run(List.of(IMAGE_1), atScale(0.5));
            headerReader.put(IMAGE_1, SkyFixtures.header());

            RunSummary again = pipeline.run(List.of(IMAGE_1), atScale(0.5));
            assertEquals(ImageOutcome.Status.NOTHING_TO_DO, again.outcomeFor(IMAGE_1).status());

            RunSummary reprocessed = pipeline.run(List.of(IMAGE_1), atScale(0.5).toBuilder().reprocess(true).build());
            assertEquals(ImageOutcome.Status.COMPLETED, reprocessed.outcomeFor(IMAGE_1).status());
            assertNull(image(IMAGE_1).getError());
            assertEquals(ProcessingStage.CATALOG_MATCHED, image(IMAGE_1).getStage());
        }

        @Test
        @DisplayName("An extractor failure rolls the image back and propagates")
        void extractorFailure() {
            extractor.failOn(IMAGE_2);

            assertThrows(ExtractionException.class, () -> pipeline.run(BOTH, atScale(0.5)));

            assertTrue(store.images().findByFilename(IMAGE_1).isPresent());
            assertTrue(store.images().findByFilename(IMAGE_2).isEmpty());
            assertEquals(29, store.associatedSources().findAll().size());
        }

        @Test
        @DisplayName("An unknown catalog is rejected before anything is written")
        void unknownCatalog() {
            PipelineOptions options = PipelineOptions.defaults().toBuilder()
                    .catalogs(List.of("nvss", "vlssr"))
                    .build();

            assertThrows(UnknownCatalogException.class, () -> pipeline.run(BOTH, options));
            assertTrue(store.images().findAll().isEmpty());
            assertEquals(0, extractor.calls());
        }
    }

    @Nested
    @DisplayName("Overwrite")
    class Overwrite {

        @Test
        @DisplayName("Clears the store once before processing")
        void clearsStore() {
            pipeline.run(BOTH, atScale(0.5));

            RunSummary summary = pipeline.run(List.of(IMAGE_2), atScale(0.5).toBuilder().overwrite(true).build());

            assertEquals(ImageOutcome.Status.COMPLETED, summary.outcomeFor(IMAGE_2).status());
            assertEquals(1, store.images().findAll().size());
            assertEquals(15, store.associatedSources().findAll().size());
            assertEquals(1, audits(AuditAction.STORE_CLEARED).size());
        }
    }

    @Nested
    @DisplayName("Maintenance")
    class Maintenance {

        @BeforeEach
        void runBoth() {
            pipeline.run(BOTH, atScale(0.5));
        }

        @Test
        @DisplayName("Removing an image un-merges its detections and skips unknown names")
        void removeImages() {
            int removed = pipeline.removeImages(List.of(IMAGE_2, "missing.fits"));

            assertEquals(1, removed);
            assertTrue(store.images().findByFilename(IMAGE_2).isEmpty());
            assertEquals(29, store.associatedSources().findAll().size());
            assertTrue(store.associatedSources().findAll().stream().allMatch(s -> s.getNdetect() == 1));
            assertEquals(1, audits(AuditAction.IMAGE_REMOVED).size());
        }

        @Test
        @DisplayName("Removing an image locks its field with the association margin")
        void removeImageLocksWithMargin() {
            DistributedLock lock = mock(DistributedLock.class);
            SkyPipeline locked = SkyPipeline.builder()
                    .headerReader(headerReader)
                    .extractor(extractor)
                    .store(store)
                    .distributedLock(lock)
                    .build();
            Image stored = image(IMAGE_2);
            double margin = SkyMath.arcsecToDegrees(60.0);
            SortedSet<String> widened = new SkyRegionLock(mock(DistributedLock.class))
                    .tilesFor(stored.getHeader().obsRa(), stored.getHeader().obsDec(), stored.getRadius() + margin);

            locked.removeImages(List.of(IMAGE_2));

            for (String tile : widened) {
                verify(lock).tryLock(tile);
                verify(lock).unlock(tile);
            }
            verify(lock, times(widened.size())).tryLock(any());
        }

        @Test
        @DisplayName("Removing every image leaves no associated sources")
        void removeAll() {
            assertEquals(2, pipeline.removeImages(BOTH));

            assertTrue(store.images().findAll().isEmpty());
            assertTrue(store.associatedSources().findAll().isEmpty());
            assertTrue(store.catalogMatches().findByCatalog(registry.idOf("nvss")).isEmpty());
        }

        @Test
        @DisplayName("Removing a catalog drops its matches and marks images unchecked")
        void removeCatalog() {
            CatalogRemovalResult result = pipeline.removeCatalogs(List.of("nvss"));

            assertEquals(List.of("nvss"), result.catalogs());
            assertEquals(1, result.matchesRemoved());
            assertTrue(store.catalogMatches().findByCatalog(registry.idOf("nvss")).isEmpty());
            assertEquals(Set.of("first"), image(IMAGE_1).getCatalogsChecked());
            assertEquals(1, audits(AuditAction.CATALOG_MATCHES_REMOVED).size());
        }

        @Test
        @DisplayName("Removing an unknown catalog fails without writes")
        void removeUnknownCatalog() {
            assertThrows(UnknownCatalogException.class, () -> pipeline.removeCatalogs(List.of("nvss", "sumss")));
            assertEquals(1, store.catalogMatches().findByCatalog(registry.idOf("nvss")).size());
        }

        @Test
        @DisplayName("Removing associated sources orphans their detections")
        void removeSources() {
            long id = store.associatedSources().findAll().get(0).getId();

            List<Long> removed = pipeline.removeAssociatedSources(List.of(id, 9999L));

            assertEquals(List.of(id), removed);
            assertTrue(store.associatedSources().findById(id).isEmpty());
            assertTrue(store.detections().findByImage(image(IMAGE_1).getId()).stream()
                    .anyMatch(d -> d.isOrphaned()));
            assertEquals(1, audits(AuditAction.ASSOCIATED_SOURCE_REMOVED).size());
        }
    }
}
