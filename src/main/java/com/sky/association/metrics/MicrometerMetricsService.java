package com.sky.association.metrics;

import com.sky.association.core.model.ProcessingStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code sky.stage.duration} Timer (tag: stage)</li>
 *   <li>{@code sky.image.outcome} Counter (tag: status)</li>
 *   <li>{@code sky.image.qa.failure} Counter (tag: code)</li>
 *   <li>{@code sky.assoc.created} / {@code sky.assoc.updated} Counters</li>
 *   <li>{@code sky.catalog.match} Counter (tag: catalog)</li>
 *   <li>{@code sky.image.detections} DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter assocCreatedCounter;
    private final Counter assocUpdatedCounter;
    private final DistributionSummary detectionsSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.assocCreatedCounter = Counter.builder("sky.assoc.created")
                .description("Number of associated sources created")
                .register(registry);
        this.assocUpdatedCounter = Counter.builder("sky.assoc.updated")
                .description("Number of associated sources updated by a new detection")
                .register(registry);
        this.detectionsSummary = DistributionSummary.builder("sky.image.detections")
                .description("Detections extracted per image")
                .register(registry);
    }

    @Override
    public void recordStageDuration(ProcessingStage stage, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(stage.name(), k ->
                Timer.builder("sky.stage.duration")
                        .description("Duration of one image stage")
                        .tag("stage", stage.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementImageOutcome(String status) {
        counter("outcome:" + status, "sky.image.outcome", "Image outcomes", "status", status).increment();
    }

    @Override
    public void incrementQualityFailure(int errorCode) {
        String code = Integer.toString(errorCode);
        counter("qa:" + code, "sky.image.qa.failure", "Images failing quality checks", "code", code).increment();
    }

    @Override
    public void incrementAssociatedSourcesCreated(int count) {
        assocCreatedCounter.increment(count);
    }

    @Override
    public void incrementAssociatedSourcesUpdated(int count) {
        assocUpdatedCounter.increment(count);
    }

    @Override
    public void incrementCatalogMatches(String catalog, int count) {
        counter("match:" + catalog, "sky.catalog.match", "Catalog matches recorded", "catalog", catalog)
                .increment(count);
    }

    @Override
    public void recordDetectionsPerImage(int count) {
        detectionsSummary.record(count);
    }

    private Counter counter(String key, String name, String description, String tag, String value) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tag, value)
                        .register(registry));
    }
}
