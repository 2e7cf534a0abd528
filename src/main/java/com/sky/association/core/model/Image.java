package com.sky.association.core.model;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One processed sky image. Created on first encounter of a filename and
 * mutated as it advances through the pipeline stages.
 */
public class Image {
    private Integer id;
    private final String filename;
    private ImageHeader header;
    private Double radius;
    private ProcessingStage stage;
    private ImageError error;
    private String nearestProblem;
    private Double separation;
    private final SortedSet<String> catalogsChecked;
    private Integer nsrc;
    private String rmsBox;

    private Image(Builder builder) {
        this.id = builder.id;
        this.filename = Objects.requireNonNull(builder.filename, "filename is required");
        this.header = builder.header != null ? builder.header : ImageHeader.builder().build();
        this.radius = builder.radius;
        this.stage = builder.stage != null ? builder.stage : ProcessingStage.READ;
        this.error = builder.error;
        this.nearestProblem = builder.nearestProblem;
        this.separation = builder.separation;
        this.catalogsChecked = new TreeSet<>(builder.catalogsChecked);
        this.nsrc = builder.nsrc;
        this.rmsBox = builder.rmsBox;
    }

    public Integer getId() {
        return id;
    }

    /**
     * Assigned once by the image repository on first save.
     */
    public void assignId(int id) {
        if (this.id != null && this.id != id) {
            throw new IllegalStateException("Image " + filename + " already has id " + this.id);
        }
        this.id = id;
    }

    public String getFilename() {
        return filename;
    }

    public ImageHeader getHeader() {
        return header;
    }

    public void setHeader(ImageHeader header) {
        this.header = Objects.requireNonNull(header);
    }

    public Double getRadius() {
        return radius;
    }

    public void setRadius(Double radius) {
        this.radius = radius;
    }

    /**
     * Sets the field radius from the extraction scale:
     * half the image height times the scale, converted to degrees and rounded to 0.01.
     */
    public void applyRadiusScale(double scale) {
        if (header.naxis2() == null || header.pixelScale() == null) {
            this.radius = null;
            return;
        }
        double r = (header.naxis2() / 2.0) * scale;
        this.radius = Math.round(r * header.pixelScale() / 3600.0 * 100.0) / 100.0;
    }

    public ProcessingStage getStage() {
        return stage;
    }

    public void setStage(ProcessingStage stage) {
        this.stage = Objects.requireNonNull(stage);
    }

    public boolean hasCompleted(ProcessingStage required) {
        return stage.isAtLeast(required);
    }

    public ImageError getError() {
        return error;
    }

    public void setError(ImageError error) {
        this.error = error;
    }

    /**
     * True when a fatal quality error is recorded for this image.
     */
    public boolean isAborted() {
        return error != null && error.isFatal();
    }

    public String getNearestProblem() {
        return nearestProblem;
    }

    public Double getSeparation() {
        return separation;
    }

    public void setNearestProblem(String nearestProblem, Double separation) {
        this.nearestProblem = nearestProblem;
        this.separation = separation;
    }

    public Set<String> getCatalogsChecked() {
        return Collections.unmodifiableSortedSet(catalogsChecked);
    }

    public void addCatalogsChecked(Set<String> names) {
        catalogsChecked.addAll(names);
    }

    public boolean removeCatalogChecked(String name) {
        return catalogsChecked.remove(name);
    }

    public void clearCatalogsChecked() {
        catalogsChecked.clear();
    }

    public Integer getNsrc() {
        return nsrc;
    }

    public void setNsrc(Integer nsrc) {
        this.nsrc = nsrc;
    }

    public String getRmsBox() {
        return rmsBox;
    }

    public void setRmsBox(String rmsBox) {
        this.rmsBox = rmsBox;
    }

    /**
     * Returns an independent copy, used to snapshot state before a stage mutates it.
     */
    public Image copy() {
        return builder()
                .id(id)
                .filename(filename)
                .header(header)
                .radius(radius)
                .stage(stage)
                .error(error)
                .nearestProblem(nearestProblem, separation)
                .catalogsChecked(catalogsChecked)
                .nsrc(nsrc)
                .rmsBox(rmsBox)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Integer id;
        private String filename;
        private ImageHeader header;
        private Double radius;
        private ProcessingStage stage;
        private ImageError error;
        private String nearestProblem;
        private Double separation;
        private Set<String> catalogsChecked = Set.of();
        private Integer nsrc;
        private String rmsBox;

        public Builder id(Integer id) {
            this.id = id;
            return this;
        }

        public Builder filename(String filename) {
            this.filename = filename;
            return this;
        }

        public Builder header(ImageHeader header) {
            this.header = header;
            return this;
        }

        public Builder radius(Double radius) {
            this.radius = radius;
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

        public Builder nearestProblem(String nearestProblem, Double separation) {
            this.nearestProblem = nearestProblem;
            this.separation = separation;
            return this;
        }

        public Builder catalogsChecked(Set<String> catalogsChecked) {
            this.catalogsChecked = catalogsChecked;
            return this;
        }

        public Builder nsrc(Integer nsrc) {
            this.nsrc = nsrc;
            return this;
        }

        public Builder rmsBox(String rmsBox) {
            this.rmsBox = rmsBox;
            return this;
        }

        public Image build() {
            return new Image(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Image image = (Image) o;
        return Objects.equals(filename, image.filename);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filename);
    }

    @Override
    public String toString() {
        return "Image{" +
                "id=" + id +
                ", filename='" + filename + '\'' +
                ", stage=" + stage +
                ", error=" + error +
                '}';
    }
}
