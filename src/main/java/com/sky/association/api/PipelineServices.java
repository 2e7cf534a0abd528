package com.sky.association.api;

import com.sky.association.audit.AuditService;
import com.sky.association.catalog.CatalogRegistry;
import com.sky.association.catalog.CatalogSourceRepository;
import com.sky.association.extraction.ImageHeaderReader;
import com.sky.association.extraction.PrimaryBeamCorrector;
import com.sky.association.extraction.SourceExtractor;
import com.sky.association.lock.SkyRegionLock;
import com.sky.association.metrics.MetricsService;
import com.sky.association.qa.QualityGate;
import com.sky.association.store.SkyStore;

/**
 * Collaborators shared by every run of a {@link SkyPipeline}.
 */
public record PipelineServices(
        SkyStore store,
        ImageHeaderReader headerReader,
        SourceExtractor extractor,
        QualityGate qualityGate,
        PrimaryBeamCorrector beamCorrector,
        CatalogRegistry catalogRegistry,
        CatalogSourceRepository catalogSources,
        SkyRegionLock regionLock,
        AuditService auditService,
        MetricsService metricsService
) {
}
