package com.sky.association.metrics;

import com.sky.association.core.model.ProcessingStage;

import java.time.Duration;

/**
 * Metrics sink that discards everything.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordStageDuration(ProcessingStage stage, Duration duration) {
    }

    @Override
    public void incrementImageOutcome(String status) {
    }

    @Override
    public void incrementQualityFailure(int errorCode) {
    }

    @Override
    public void incrementAssociatedSourcesCreated(int count) {
    }

    @Override
    public void incrementAssociatedSourcesUpdated(int count) {
    }

    @Override
    public void incrementCatalogMatches(String catalog, int count) {
    }

    @Override
    public void recordDetectionsPerImage(int count) {
    }
}
