package com.sky.association.api;

import com.sky.association.association.AssociationEngine;
import com.sky.association.association.AssociationResult;
import com.sky.association.association.ConsistencyMaintainer;
import com.sky.association.association.RemovalResult;
import com.sky.association.audit.AuditAction;
import com.sky.association.core.model.AssociatedSource;
import com.sky.association.core.model.CorrectedFlux;
import com.sky.association.core.model.Detection;
import com.sky.association.core.model.Image;
import com.sky.association.core.model.ImageError;
import com.sky.association.core.model.ImageHeader;
import com.sky.association.core.model.Island;
import com.sky.association.core.model.ProcessingStage;
import com.sky.association.core.sky.SkyMath;
import com.sky.association.crossmatch.CatalogCrossMatcher;
import com.sky.association.crossmatch.CrossMatchResult;
import com.sky.association.crossmatch.UniquenessRegistry;
import com.sky.association.extraction.ExtractionResult;
import com.sky.association.lock.SkyRegionLock;
import com.sky.association.logging.LogContext;
import com.sky.association.qa.QualityGate;
import com.sky.association.qa.QualityVerdict;
import com.sky.association.store.SkyStore;
import com.sky.association.store.StageTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs the selected stages on one image.
 *
 * <p>A stage runs when it is selected and the image has not completed it, or when
 * reprocessing. Re-running a stage re-runs every later selected stage. Each stage's
 * writes go through one {@link StageTransaction}; association and catalog matching
 * hold the sky-region lock of the image field.</p>
 */
public class ImageProcessor {
    private static final Logger log = LoggerFactory.getLogger(ImageProcessor.class);

    private static final double DEFAULT_LOCK_RADIUS = 1.0;

    private final PipelineServices services;
    private final SkyStore store;
    private final PipelineOptions options;
    private final String runId;
    private final ConsistencyMaintainer maintainer;
    private final AssociationEngine associationEngine;
    private final CatalogCrossMatcher crossMatcher;

    public ImageProcessor(PipelineServices services, PipelineOptions options, String runId) {
        this.services = services;
        this.store = services.store();
        this.options = options;
        this.runId = runId;
        this.maintainer = new ConsistencyMaintainer(store);
        this.associationEngine = new AssociationEngine(store.associatedSources(), store.detections(),
                options.getAssociationDeRuiterLimit(), options.getAssociationMaxRadiusArcsec());
        this.crossMatcher = new CatalogCrossMatcher(store, services.catalogSources(), services.catalogRegistry(),
                maintainer, new UniquenessRegistry(store.uniqueSources()),
                options.getMatchDeRuiterThreshold(), options.getCatalogSearchRadiusArcsec());
    }

    public ConsistencyMaintainer getMaintainer() {
        return maintainer;
    }

    public CatalogCrossMatcher getCrossMatcher() {
        return crossMatcher;
    }

    public ImageOutcome process(String filename) {
        ImageOutcome.Builder outcome = ImageOutcome.builder(filename);
        Optional<Image> stored = store.images().findByFilename(filename);
        boolean known = stored.isPresent();
        boolean reprocess = options.isReprocess();
        boolean save = options.isSaveToDatabase();

        if (!options.anyStageSelected()) {
            if (known && !reprocess) {
                return nothingToDo(outcome, stored.get());
            }
            return readOnly(outcome, known ? stored.get() : newImage(filename), known);
        }

        Image image = known ? stored.get() : newImage(filename);
        if (known && image.isAborted() && !reprocess) {
            log.debug("Image {} failed quality checks earlier ({}); skipping", filename, image.getError());
            return nothingToDo(outcome, image);
        }

        boolean runSf = options.isSourceFinding()
                && (!known || reprocess || !image.hasCompleted(ProcessingStage.EXTRACTED));
        boolean runSa = options.isSourceAssociation()
                && (runSf || reprocess || !image.hasCompleted(ProcessingStage.ASSOCIATED));
        boolean runCm = options.isCatalogMatching()
                && (runSa || reprocess || options.isRedoMatch() || options.isUpdateMatch()
                || !image.hasCompleted(ProcessingStage.CATALOG_MATCHED));

        if (!runSf && !runSa && !runCm) {
            return nothingToDo(outcome, image);
        }

        ProcessingStage reached = runSf ? ProcessingStage.EXTRACTED : image.getStage();
        if (runSa && (!save || !reached.isAtLeast(ProcessingStage.EXTRACTED))) {
            return notReady(outcome, image, ProcessingStage.ASSOCIATED);
        }
        if (runSa) {
            reached = ProcessingStage.ASSOCIATED;
        }
        if (runCm && (!save || !reached.isAtLeast(ProcessingStage.ASSOCIATED))) {
            return notReady(outcome, image, ProcessingStage.CATALOG_MATCHED);
        }

        if (runSf && !findSources(image, known, outcome)) {
            return finish(outcome, image, ImageOutcome.Status.ABORTED);
        }
        if (runSa || runCm) {
            try (SkyRegionLock.Lease lease = lockField(image)) {
                if (runSa) {
                    associate(image, !runSf, outcome);
                }
                if (runCm) {
                    matchCatalogs(image, outcome);
                }
            }
        }
        return finish(outcome, image, ImageOutcome.Status.COMPLETED);
    }

    private Image newImage(String filename) {
        return Image.builder().filename(filename).stage(ProcessingStage.READ).build();
    }

    /**
     * Reads the header into the image and runs the header checks.
     *
     * @return false if a check failed fatally
     */
    private boolean readHeader(Image image) {
        ImageHeader header = services.headerReader().read(image.getFilename());
        image.setHeader(header);
        image.applyRadiusScale(options.getExtractionParameters().scale());
        image.setError(null);
        if (header.obsRa() == null || header.obsDec() == null) {
            // Nothing downstream can place the field without a pointing.
            image.setError(ImageError.MISSING_METADATA);
            services.metricsService().incrementQualityFailure(ImageError.MISSING_METADATA.code());
            log.warn("image.header.no_pointing filename={}", image.getFilename());
            return false;
        }
        if (!options.isQualityChecks()) {
            return true;
        }
        QualityVerdict verdict = services.qualityGate().checkHeader(image);
        if (verdict.isAbort()) {
            services.metricsService().incrementQualityFailure(verdict.error().code());
            return false;
        }
        logWarning(image, verdict);
        return true;
    }

    private void logWarning(Image image, QualityVerdict verdict) {
        if (verdict.isWarning()) {
            log.warn("image.quality.warning filename={} error={} detail={}",
                    image.getFilename(), verdict.error(), verdict.detail());
        }
    }

    private ImageOutcome readOnly(ImageOutcome.Builder outcome, Image image, boolean known) {
        try (LogContext ctx = LogContext.forStage(runId, image.getFilename(), "read")) {
            boolean passed = readHeader(image);
            if (options.isSaveToDatabase()) {
                if (!known) {
                    image.setStage(ProcessingStage.READ);
                }
                store.images().save(image);
                if (!known) {
                    audit(AuditAction.IMAGE_ADDED, image, Map.of("filename", image.getFilename()));
                }
                if (!passed) {
                    auditFailure(image);
                }
            }
            return finish(outcome, image, passed ? ImageOutcome.Status.COMPLETED : ImageOutcome.Status.ABORTED);
        }
    }

    /**
     * Source finding. Reprocessing first un-merges and deletes everything extracted earlier.
     *
     * @return false if a quality check aborted the image
     */
    private boolean findSources(Image image, boolean known, ImageOutcome.Builder outcome) {
        boolean save = options.isSaveToDatabase();
        Instant start = Instant.now();
        try (LogContext ctx = LogContext.forStage(runId, image.getFilename(), "source_finding");
             StageTransaction tx = new StageTransaction("source finding " + image.getFilename())) {
            Image before = image.copy();

            if (known && save) {
                RemovalResult purged = maintainer.purgeImage(image.getId(), tx);
                if (!purged.deletedSources().isEmpty() || !purged.updatedSources().isEmpty()) {
                    audit(AuditAction.SOURCES_PURGED, image, Map.of(
                            "updatedSources", purged.updatedSources().size(),
                            "deletedSources", purged.deletedSources().size()));
                }
                image.clearCatalogsChecked();
                image.setStage(ProcessingStage.READ);
            }

            boolean passed = readHeader(image);
            if (save) {
                saveImage(image, known ? before : null, tx);
                if (!known) {
                    audit(AuditAction.IMAGE_ADDED, image, Map.of("filename", image.getFilename()));
                }
            }
            if (!passed) {
                tx.markSuccess();
                if (save) {
                    auditFailure(image);
                }
                return false;
            }

            ExtractionResult result = services.extractor().extract(image, options.getExtractionParameters());
            int imageId = image.getId() != null ? image.getId() : 0;
            List<Island> islands = result.islands().stream().map(i -> i.withImageId(imageId)).toList();
            List<Detection> detections = result.detections();
            ImageHeader header = image.getHeader();
            for (Detection detection : detections) {
                detection.setImageId(imageId);
                detection.setDistFromCenter(SkyMath.separation(
                        header.obsRa(), header.obsDec(), detection.getRa(), detection.getDec()));
            }
            image.setNsrc(detections.size());
            image.setRmsBox(result.rmsBox());
            outcome.extraction(islands.size(), detections.size());
            services.metricsService().recordDetectionsPerImage(detections.size());

            if (options.isQualityChecks()) {
                QualityVerdict verdict = services.qualityGate().checkSources(image, detections);
                if (verdict.isAbort()) {
                    services.metricsService().incrementQualityFailure(verdict.error().code());
                    if (save) {
                        saveImage(image, null, tx);
                        auditFailure(image);
                    }
                    tx.markSuccess();
                    return false;
                }
                logWarning(image, verdict);
            }

            correctFluxes(image, islands, detections);
            image.setStage(ProcessingStage.EXTRACTED);
            if (save) {
                tx.execute("save islands of image " + imageId,
                        () -> islands.forEach(store.detections()::saveIsland),
                        () -> store.detections().deleteIslandsByImage(imageId));
                for (Detection detection : detections) {
                    tx.execute("save detection " + detection.getKey(),
                            () -> store.detections().save(detection),
                            () -> store.detections().delete(detection.getKey()));
                }
                saveImage(image, null, tx);
                audit(AuditAction.SOURCES_EXTRACTED, image, Map.of(
                        "islands", islands.size(), "detections", detections.size()));
            }
            tx.markSuccess();
            log.info("image.sources.extracted imageId={} islands={} detections={}",
                    image.getId(), islands.size(), detections.size());
            return true;
        } finally {
            services.metricsService().recordStageDuration(ProcessingStage.EXTRACTED, Duration.between(start, Instant.now()));
        }
    }

    private void correctFluxes(Image image, List<Island> islands, List<Detection> detections) {
        double frequency = image.getHeader().frequencyGhzOr(QualityGate.DEFAULT_FREQUENCY_GHZ);
        Map<Integer, Island> byId = islands.stream()
                .collect(Collectors.toMap(Island::islandId, Function.identity(), (a, b) -> a));
        for (Detection detection : detections) {
            CorrectedFlux corrected = services.beamCorrector()
                    .correct(detection, byId.get(detection.getIslandId()), frequency);
            detection.setCorrectedFlux(corrected);
        }
    }

    private void associate(Image image, boolean relink, ImageOutcome.Builder outcome) {
        Instant start = Instant.now();
        try (LogContext ctx = LogContext.forStage(runId, image.getFilename(), "source_association");
             StageTransaction tx = new StageTransaction("association " + image.getFilename())) {
            Image before = image.copy();
            List<Detection> detections = store.detections().findByImage(image.getId());
            if (relink) {
                List<Detection> linked = detections.stream()
                        .filter(d -> d.isAssociated() || d.isOrphaned())
                        .toList();
                maintainer.unlinkDetections(linked, tx);
                detections = store.detections().findByImage(image.getId());
            }

            AssociationResult result = associationEngine.associate(image, detections, tx);
            image.clearCatalogsChecked();
            image.setStage(ProcessingStage.ASSOCIATED);
            saveImage(image, before, tx);
            tx.markSuccess();

            outcome.association(result.created().size(), result.updated().size());
            services.metricsService().incrementAssociatedSourcesCreated(result.created().size());
            services.metricsService().incrementAssociatedSourcesUpdated(result.updated().size());
            for (AssociatedSource source : result.created()) {
                audit(AuditAction.ASSOCIATED_SOURCE_CREATED, String.valueOf(source.getId()),
                        Map.of("imageId", image.getId()));
            }
        } finally {
            services.metricsService().recordStageDuration(ProcessingStage.ASSOCIATED, Duration.between(start, Instant.now()));
        }
    }

    private void matchCatalogs(Image image, ImageOutcome.Builder outcome) {
        Instant start = Instant.now();
        try (LogContext ctx = LogContext.forStage(runId, image.getFilename(), "catalog_matching");
             StageTransaction tx = new StageTransaction("catalog matching " + image.getFilename())) {
            Image before = image.copy();
            Set<Long> sourceIds = store.detections().findByImage(image.getId()).stream()
                    .map(Detection::getAssociatedSourceId)
                    .flatMap(Optional::stream)
                    .collect(Collectors.toCollection(TreeSet::new));
            List<String> catalogs = options.getCatalogs().isEmpty()
                    ? services.catalogRegistry().names()
                    : options.getCatalogs();

            boolean redo = (options.isRedoMatch() || options.isReprocess())
                    && image.hasCompleted(ProcessingStage.CATALOG_MATCHED);
            CrossMatchResult result = redo
                    ? crossMatcher.redo(image, sourceIds, catalogs, tx)
                    : crossMatcher.matchImage(image, sourceIds, catalogs, tx);
            image.setStage(ProcessingStage.CATALOG_MATCHED);
            saveImage(image, before, tx);
            tx.markSuccess();

            outcome.matching(result.newlyChecked(), result.matchesRecorded(), result.uniqueRecorded());
            result.matchesPerCatalog().forEach(services.metricsService()::incrementCatalogMatches);
            if (result.matchesRecorded() > 0) {
                audit(AuditAction.CATALOG_MATCHES_RECORDED, image, Map.of(
                        "catalogs", String.join(",", result.newlyChecked()),
                        "matches", result.matchesRecorded(),
                        "redo", redo));
            }
        } finally {
            services.metricsService().recordStageDuration(ProcessingStage.CATALOG_MATCHED, Duration.between(start, Instant.now()));
        }
    }

    private SkyRegionLock.Lease lockField(Image image) {
        return lockField(services.regionLock(), image, options);
    }

    /**
     * Locks the image field widened by the largest association or catalog search radius.
     * The header must carry a pointing.
     */
    static SkyRegionLock.Lease lockField(SkyRegionLock regionLock, Image image, PipelineOptions options) {
        return regionLock.acquire(image.getHeader().obsRa(), image.getHeader().obsDec(), lockRadius(image, options));
    }

    static double lockRadius(Image image, PipelineOptions options) {
        double radius = image.getRadius() != null ? image.getRadius() : DEFAULT_LOCK_RADIUS;
        double margin = SkyMath.arcsecToDegrees(Math.max(options.getAssociationMaxRadiusArcsec(),
                options.getCatalogSearchRadiusArcsec()));
        return radius + margin;
    }

    /**
     * Saves the image; the compensation restores {@code before}, or deletes a newly inserted row.
     */
    private void saveImage(Image image, Image before, StageTransaction tx) {
        boolean inserted = image.getId() == null;
        tx.execute("save image " + image.getFilename(),
                () -> store.images().save(image),
                () -> {
                    if (inserted) {
                        store.images().delete(image.getId());
                    } else if (before != null) {
                        store.images().save(before);
                    }
                });
    }

    private ImageOutcome nothingToDo(ImageOutcome.Builder outcome, Image image) {
        log.info("image.nothing_to_do filename={} stage={}", image.getFilename(), image.getStage());
        return finish(outcome, image, ImageOutcome.Status.NOTHING_TO_DO);
    }

    private ImageOutcome notReady(ImageOutcome.Builder outcome, Image image, ProcessingStage wanted) {
        log.warn("image.not_ready filename={} stage={} requested={} saveToDatabase={}",
                image.getFilename(), image.getStage(), wanted, options.isSaveToDatabase());
        return finish(outcome, image, ImageOutcome.Status.NOT_READY);
    }

    private ImageOutcome finish(ImageOutcome.Builder outcome, Image image, ImageOutcome.Status status) {
        services.metricsService().incrementImageOutcome(status.name());
        return outcome.imageId(image.getId())
                .status(status)
                .stage(image.getStage())
                .error(image.getError())
                .build();
    }

    private void auditFailure(Image image) {
        audit(AuditAction.IMAGE_FAILED_QA, image, Map.of(
                "code", image.getError().code(),
                "reason", image.getError().reason()));
    }

    private void audit(AuditAction action, Image image, Map<String, Object> details) {
        audit(action, String.valueOf(image.getId()), details);
    }

    private void audit(AuditAction action, String subjectId, Map<String, Object> details) {
        if (options.isSaveToDatabase()) {
            services.auditService().record(action, Objects.requireNonNullElse(subjectId, ""), runId, details);
        }
    }
}
