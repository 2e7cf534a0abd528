package com.sky.association.config;

import com.sky.association.api.PipelineOptions;
import com.sky.association.qa.QualityThresholds;

import java.util.List;

/**
 * A run configuration as read from a YAML file.
 *
 * @param options        stages, mode flags, catalogs to match and extraction parameters
 * @param thresholds     quality check limits
 * @param rootDirectory  directory the image files are resolved against, or null
 * @param files          image files to process; empty means every image found
 */
public record PipelineConfig(
        PipelineOptions options,
        QualityThresholds thresholds,
        String rootDirectory,
        List<String> files
) {
    public PipelineConfig {
        files = files != null ? List.copyOf(files) : List.of();
    }
}
