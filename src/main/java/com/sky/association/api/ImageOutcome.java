package com.sky.association.api;

import com.sky.association.core.model.ImageError;
import com.sky.association.core.model.ProcessingStage;

import java.util.List;

/**
 * What a pipeline run did to one image.
 */
public record ImageOutcome(
        String filename,
        Integer imageId,
        Status status,
        ProcessingStage stage,
        ImageError error,
        int islands,
        int detections,
        int newSources,
        int updatedSources,
        List<String> catalogsChecked,
        int matchesRecorded,
        int uniqueSources
) {
    public enum Status {
        /** Every selected stage ran. */
        COMPLETED,
        /** A quality check stopped the image. */
        ABORTED,
        /** The image is known and no selected stage needed to run. */
        NOTHING_TO_DO,
        /** A selected stage needs a stage the image has not completed. */
        NOT_READY
    }

    public ImageOutcome {
        catalogsChecked = catalogsChecked != null ? List.copyOf(catalogsChecked) : List.of();
    }

    public static Builder builder(String filename) {
        return new Builder(filename);
    }

    public static class Builder {
        private final String filename;
        private Integer imageId;
        private Status status = Status.COMPLETED;
        private ProcessingStage stage;
        private ImageError error;
        private int islands;
        private int detections;
        private int newSources;
        private int updatedSources;
        private List<String> catalogsChecked = List.of();
        private int matchesRecorded;
        private int uniqueSources;

        private Builder(String filename) {
            this.filename = filename;
        }

        public Builder imageId(Integer imageId) {
            this.imageId = imageId;
            return this;
        }

        public Builder status(Status status) {
            this.status = status;
            return this;
        }

        public Builder stage(ProcessingStage stage) {
            this.stage = stage;
            return this;
        }

        public Builder error(ImageError error) {
            this.error = error;
            return this;
        }

        public Builder extraction(int islands, int detections) {
            this.islands = islands;
            this.detections = detections;
            return this;
        }

        public Builder association(int newSources, int updatedSources) {
            this.newSources = newSources;
            this.updatedSources = updatedSources;
            return this;
        }

        public Builder matching(List<String> catalogsChecked, int matchesRecorded, int uniqueSources) {
            this.catalogsChecked = catalogsChecked;
            this.matchesRecorded = matchesRecorded;
            this.uniqueSources = uniqueSources;
            return this;
        }

        public ImageOutcome build() {
            return new ImageOutcome(filename, imageId, status, stage, error, islands, detections,
                    newSources, updatedSources, catalogsChecked, matchesRecorded, uniqueSources);
        }
    }
}
