package com.sky.association.metrics;

import com.sky.association.core.model.ProcessingStage;

import java.time.Duration;

/**
 * Records pipeline metrics.
 * The default {@link NoOpMetricsService} does nothing.
 */
public interface MetricsService {

    void recordStageDuration(ProcessingStage stage, Duration duration);

    /**
     * Counts one image outcome, tagged by status name (e.g. COMPLETED, ABORTED).
     */
    void incrementImageOutcome(String status);

    void incrementQualityFailure(int errorCode);

    void incrementAssociatedSourcesCreated(int count);

    void incrementAssociatedSourcesUpdated(int count);

    void incrementCatalogMatches(String catalog, int count);

    void recordDetectionsPerImage(int count);
}
