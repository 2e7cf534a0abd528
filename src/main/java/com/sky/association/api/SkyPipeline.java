package com.sky.association.api;

import com.sky.association.association.ConsistencyMaintainer;
import com.sky.association.association.RemovalResult;
import com.sky.association.audit.AuditAction;
import com.sky.association.audit.AuditRepository;
import com.sky.association.audit.AuditService;
import com.sky.association.catalog.CatalogCacheConfig;
import com.sky.association.catalog.CatalogRegistry;
import com.sky.association.catalog.CatalogSourceCache;
import com.sky.association.catalog.CatalogSourceRepository;
import com.sky.association.catalog.FileCatalogSourceLoader;
import com.sky.association.core.model.Image;
import com.sky.association.core.model.ImageHeader;
import com.sky.association.crossmatch.CatalogCrossMatcher;
import com.sky.association.crossmatch.CatalogRemovalResult;
import com.sky.association.crossmatch.UniquenessRegistry;
import com.sky.association.extraction.GaussianPrimaryBeam;
import com.sky.association.extraction.ImageHeaderReader;
import com.sky.association.extraction.PrimaryBeamCorrector;
import com.sky.association.extraction.PrimaryBeamModel;
import com.sky.association.extraction.SourceExtractor;
import com.sky.association.lock.DistributedLock;
import com.sky.association.lock.LocalDistributedLock;
import com.sky.association.lock.SkyRegionLock;
import com.sky.association.logging.LogContext;
import com.sky.association.metrics.MetricsService;
import com.sky.association.metrics.NoOpMetricsService;
import com.sky.association.qa.QualityGate;
import com.sky.association.qa.QualityThresholds;
import com.sky.association.store.FalkorDBConnection;
import com.sky.association.store.GraphConnection;
import com.sky.association.store.SkyStore;
import com.sky.association.store.StageTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main entry point of the sky association pipeline.
 *
 * <pre>
 * try (SkyPipeline pipeline = SkyPipeline.builder()
 *         .headerReader(reader)
 *         .extractor(extractor)
 *         .catalogs("nvss", "first", "tgss")
 *         .catalogDirectory(Path.of("/data/catalogs"))
 *         .build()) {
 *     RunSummary summary = pipeline.run(List.of("image1.fits", "image2.fits"));
 * }
 * </pre>
 */
public class SkyPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SkyPipeline.class);

    private final PipelineServices services;
    private final PipelineOptions defaultOptions;
    private final GraphConnection connection;
    private final boolean ownsConnection;

    private SkyPipeline(Builder builder) {
        this.connection = builder.connection;
        this.ownsConnection = builder.ownsConnection;
        this.defaultOptions = builder.options;

        SkyStore store;
        if (builder.store != null) {
            store = builder.store;
        } else if (connection != null) {
            store = SkyStore.graph(connection);
        } else {
            store = SkyStore.inMemory();
        }

        AuditService auditService;
        if (builder.auditService != null) {
            auditService = builder.auditService;
        } else if (builder.auditRepository != null) {
            auditService = new AuditService(builder.auditRepository);
        } else {
            auditService = new AuditService();
        }

        CatalogRegistry registry = builder.catalogRegistry != null
                ? builder.catalogRegistry : CatalogRegistry.of(List.of());
        CatalogSourceRepository catalogSources;
        if (builder.catalogSources != null) {
            catalogSources = builder.catalogSources;
        } else if (builder.catalogDirectory != null) {
            catalogSources = new CatalogSourceCache(registry,
                    new FileCatalogSourceLoader(builder.catalogDirectory, registry), builder.catalogCacheConfig);
        } else {
            catalogSources = new CatalogSourceCache(registry, name -> List.of(), builder.catalogCacheConfig);
        }

        QualityGate qualityGate = builder.qualityGate != null
                ? builder.qualityGate : new QualityGate(builder.qualityThresholds);
        PrimaryBeamModel beam = builder.primaryBeam != null ? builder.primaryBeam : new GaussianPrimaryBeam();
        DistributedLock lock = builder.distributedLock != null ? builder.distributedLock : new LocalDistributedLock();
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        this.services = new PipelineServices(store, builder.headerReader, builder.extractor, qualityGate,
                new PrimaryBeamCorrector(beam), registry, catalogSources, new SkyRegionLock(lock),
                auditService, metricsService);

        log.info("SkyPipeline initialized: store={}, catalogs={}",
                connection != null ? connection.getGraphName() : "in-memory", registry.names());
    }

    // ========== Processing ==========

    /**
     * Processes the images with the default options.
     */
    public RunSummary run(List<String> filenames) {
        return run(filenames, defaultOptions);
    }

    /**
     * Processes the images in order. Configuration errors such as an unknown catalog
     * name are raised before anything is written.
     */
    public RunSummary run(List<String> filenames, PipelineOptions options) {
        String runId = LogContext.generateCorrelationId();
        Instant start = Instant.now();
        try (LogContext ctx = LogContext.forRun(runId)) {
            if (!options.getCatalogs().isEmpty()) {
                services.catalogRegistry().validate(options.getCatalogs());
            }
            if (options.isOverwrite() && options.isSaveToDatabase()) {
                services.store().clearAll();
                services.auditService().record(AuditAction.STORE_CLEARED, "", runId);
            }

            ImageProcessor processor = new ImageProcessor(services, options, runId);
            List<ImageOutcome> outcomes = new ArrayList<>();
            for (String filename : filenames) {
                outcomes.add(processor.process(filename));
            }

            RunSummary summary = new RunSummary(runId, outcomes, start, Duration.between(start, Instant.now()), options);
            if (options.isSaveToDatabase()) {
                Map<String, Object> details = new LinkedHashMap<>();
                for (ImageOutcome.Status status : ImageOutcome.Status.values()) {
                    details.put(status.name(), summary.count(status));
                }
                details.put("options", options.toString());
                services.auditService().record(AuditAction.RUN_COMPLETED, runId, runId, details);
            }
            if (summary.nothingToDo()) {
                log.info("run.nothing_to_do images={}", filenames.size());
            } else {
                log.info("run.completed images={} completed={} aborted={} notReady={} durationMs={}",
                        filenames.size(), summary.count(ImageOutcome.Status.COMPLETED),
                        summary.count(ImageOutcome.Status.ABORTED), summary.count(ImageOutcome.Status.NOT_READY),
                        summary.duration().toMillis());
            }
            return summary;
        }
    }

    // ========== Maintenance ==========

    /**
     * Deletes images with everything extracted from them. Their detections are un-merged
     * from the associated sources first. Unknown filenames are skipped.
     *
     * @return number of images removed
     */
    public int removeImages(List<String> filenames) {
        String runId = LogContext.generateCorrelationId();
        ConsistencyMaintainer maintainer = new ConsistencyMaintainer(services.store());
        int removed = 0;
        try (LogContext ctx = LogContext.forMaintenance(runId, "remove_images")) {
            for (String filename : filenames) {
                Optional<Image> found = services.store().images().findByFilename(filename);
                if (found.isEmpty()) {
                    log.warn("Image {} not found; skipping", filename);
                    continue;
                }
                Image image = found.get();
                ImageHeader header = image.getHeader();
                boolean located = header.obsRa() != null && header.obsDec() != null;
                try (SkyRegionLock.Lease lease = located
                        ? ImageProcessor.lockField(services.regionLock(), image, defaultOptions)
                        : null;
                     StageTransaction tx = new StageTransaction("remove image " + filename)) {
                    RemovalResult result = maintainer.purgeImage(image.getId(), tx);
                    Image snapshot = image.copy();
                    tx.execute("delete image " + filename,
                            () -> services.store().images().delete(image.getId()),
                            () -> services.store().images().save(snapshot));
                    tx.markSuccess();
                    services.auditService().record(AuditAction.IMAGE_REMOVED, String.valueOf(image.getId()), runId,
                            Map.of("filename", filename,
                                    "updatedSources", result.updatedSources().size(),
                                    "deletedSources", result.deletedSources().size()));
                }
                removed++;
            }
            log.info("images.removed requested={} removed={}", filenames.size(), removed);
        }
        return removed;
    }

    /**
     * Removes every match against the named catalogs. All names are validated before
     * anything is written.
     *
     * @throws com.sky.association.catalog.UnknownCatalogException if any name is not registered
     */
    public CatalogRemovalResult removeCatalogs(Collection<String> names) {
        return removeCatalogs(names, defaultOptions.isMaterializeUniqueOnCatalogRemoval());
    }

    public CatalogRemovalResult removeCatalogs(Collection<String> names, boolean materializeUnique) {
        List<String> catalogs = services.catalogRegistry().validate(names);
        String runId = LogContext.generateCorrelationId();
        try (LogContext ctx = LogContext.forMaintenance(runId, "remove_catalogs");
             StageTransaction tx = new StageTransaction("remove catalogs " + catalogs)) {
            ConsistencyMaintainer maintainer = new ConsistencyMaintainer(services.store());
            CatalogCrossMatcher matcher = new CatalogCrossMatcher(services.store(), services.catalogSources(),
                    services.catalogRegistry(), maintainer, new UniquenessRegistry(services.store().uniqueSources()));
            CatalogRemovalResult result = matcher.removeCatalogs(catalogs, materializeUnique, tx);
            tx.markSuccess();
            services.auditService().record(AuditAction.CATALOG_MATCHES_REMOVED, String.join(",", catalogs), runId,
                    Map.of("matches", result.matchesRemoved(),
                            "sources", result.sourcesUpdated(),
                            "images", result.imagesUpdated(),
                            "uniqueRecorded", result.uniqueRecorded()));
            return result;
        }
    }

    /**
     * Deletes associated sources with their matches and uniqueness records.
     * Their detections are left orphaned.
     *
     * @return ids of the sources removed
     */
    public List<Long> removeAssociatedSources(Collection<Long> ids) {
        String runId = LogContext.generateCorrelationId();
        try (LogContext ctx = LogContext.forMaintenance(runId, "remove_sources");
             StageTransaction tx = new StageTransaction("remove associated sources")) {
            List<Long> removed = new ConsistencyMaintainer(services.store()).removeAssociatedSources(ids, tx);
            tx.markSuccess();
            for (Long id : removed) {
                services.auditService().record(AuditAction.ASSOCIATED_SOURCE_REMOVED, String.valueOf(id), runId);
            }
            return removed;
        }
    }

    // ========== Accessors ==========

    public SkyStore getStore() {
        return services.store();
    }

    public AuditService getAuditService() {
        return services.auditService();
    }

    public CatalogRegistry getCatalogRegistry() {
        return services.catalogRegistry();
    }

    public PipelineOptions getDefaultOptions() {
        return defaultOptions;
    }

    @Override
    public void close() {
        if (ownsConnection && connection != null) {
            try {
                connection.close();
            } catch (Exception e) {
                log.warn("Error closing connection", e);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private GraphConnection connection;
        private boolean ownsConnection = false;
        private SkyStore store;
        private ImageHeaderReader headerReader;
        private SourceExtractor extractor;
        private QualityThresholds qualityThresholds = QualityThresholds.defaults();
        private QualityGate qualityGate;
        private PrimaryBeamModel primaryBeam;
        private CatalogRegistry catalogRegistry;
        private CatalogSourceRepository catalogSources;
        private Path catalogDirectory;
        private CatalogCacheConfig catalogCacheConfig = CatalogCacheConfig.defaults();
        private DistributedLock distributedLock;
        private AuditService auditService;
        private AuditRepository auditRepository;
        private MetricsService metricsService;
        private PipelineOptions options = PipelineOptions.defaults();

        /**
         * Stores the sky model in the given graph.
         */
        public Builder graphConnection(GraphConnection connection) {
            this.connection = connection;
            this.ownsConnection = false;
            return this;
        }

        /**
         * Creates a FalkorDB connection owned by the pipeline.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            this.connection = new FalkorDBConnection(host, port, graphName);
            this.ownsConnection = true;
            return this;
        }

        /**
         * Uses an existing store. Takes precedence over a graph connection.
         */
        public Builder store(SkyStore store) {
            this.store = store;
            return this;
        }

        public Builder headerReader(ImageHeaderReader headerReader) {
            this.headerReader = headerReader;
            return this;
        }

        public Builder extractor(SourceExtractor extractor) {
            this.extractor = extractor;
            return this;
        }

        public Builder qualityThresholds(QualityThresholds qualityThresholds) {
            this.qualityThresholds = qualityThresholds;
            return this;
        }

        public Builder qualityGate(QualityGate qualityGate) {
            this.qualityGate = qualityGate;
            return this;
        }

        public Builder primaryBeam(PrimaryBeamModel primaryBeam) {
            this.primaryBeam = primaryBeam;
            return this;
        }

        public Builder catalogRegistry(CatalogRegistry catalogRegistry) {
            this.catalogRegistry = catalogRegistry;
            return this;
        }

        /**
         * Registers the catalogs in order; ids are assigned from 1.
         */
        public Builder catalogs(String... names) {
            this.catalogRegistry = CatalogRegistry.of(names);
            return this;
        }

        public Builder catalogSources(CatalogSourceRepository catalogSources) {
            this.catalogSources = catalogSources;
            return this;
        }

        /**
         * Reads catalogs from {@code <name>_psql.txt} files in the directory.
         */
        public Builder catalogDirectory(Path catalogDirectory) {
            this.catalogDirectory = catalogDirectory;
            return this;
        }

        public Builder catalogCacheConfig(CatalogCacheConfig catalogCacheConfig) {
            this.catalogCacheConfig = catalogCacheConfig;
            return this;
        }

        public Builder distributedLock(DistributedLock distributedLock) {
            this.distributedLock = distributedLock;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder options(PipelineOptions options) {
            this.options = options;
            return this;
        }

        public SkyPipeline build() {
            if (headerReader == null) {
                throw new IllegalStateException("ImageHeaderReader is required");
            }
            if (extractor == null) {
                throw new IllegalStateException("SourceExtractor is required");
            }
            return new SkyPipeline(this);
        }
    }
}
