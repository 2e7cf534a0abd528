package com.sky.association.api;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Result of one pipeline run over a list of images.
 */
public record RunSummary(
        String runId,
        List<ImageOutcome> outcomes,
        Instant startedAt,
        Duration duration,
        PipelineOptions options
) {
    public RunSummary {
        outcomes = List.copyOf(outcomes);
    }

    /**
     * True when no image needed any work.
     */
    public boolean nothingToDo() {
        return !outcomes.isEmpty()
                && outcomes.stream().allMatch(o -> o.status() == ImageOutcome.Status.NOTHING_TO_DO);
    }

    public long count(ImageOutcome.Status status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public ImageOutcome outcomeFor(String filename) {
        return outcomes.stream()
                .filter(o -> o.filename().equals(filename))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No outcome for " + filename));
    }
}
