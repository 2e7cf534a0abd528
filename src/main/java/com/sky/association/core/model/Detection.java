package com.sky.association.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One extractor-reported source in one image, owned by that image.
 *
 * <p>Positions and their errors are in degrees, fluxes in mJy (peak in mJy/beam),
 * shape axes in arcsec and position angles in degrees.</p>
 *
 * <p>A detection is in one of three association states: not yet associated,
 * associated to a persistent source, or orphaned because the source it pointed
 * to was deleted.</p>
 */
public class Detection {
    private final int sourceId;
    private int imageId;
    private final int islandId;
    private final double ra;
    private final double eRa;
    private final double dec;
    private final double eDec;
    private final double totalFlux;
    private final double eTotalFlux;
    private final double peakFlux;
    private final double ePeakFlux;
    private final Shape shape;
    private final Shape deconvolvedShape;
    private final String code;
    private Double distFromCenter;
    private CorrectedFlux correctedFlux;
    private Long associatedSourceId;
    private boolean orphaned;

    private Detection(Builder builder) {
        this.sourceId = builder.sourceId;
        this.imageId = builder.imageId;
        this.islandId = builder.islandId;
        this.ra = builder.ra;
        this.eRa = builder.eRa;
        this.dec = builder.dec;
        this.eDec = builder.eDec;
        this.totalFlux = builder.totalFlux;
        this.eTotalFlux = builder.eTotalFlux;
        this.peakFlux = builder.peakFlux;
        this.ePeakFlux = builder.ePeakFlux;
        this.shape = builder.shape != null ? builder.shape : Shape.POINT;
        this.deconvolvedShape = builder.deconvolvedShape != null ? builder.deconvolvedShape : Shape.POINT;
        this.code = builder.code != null ? builder.code : "S";
        this.distFromCenter = builder.distFromCenter;
        this.correctedFlux = builder.correctedFlux;
        this.associatedSourceId = builder.associatedSourceId;
        this.orphaned = builder.orphaned;
    }

    public DetectionKey getKey() {
        return new DetectionKey(sourceId, imageId);
    }

    public int getSourceId() {
        return sourceId;
    }

    public int getImageId() {
        return imageId;
    }

    public void setImageId(int imageId) {
        this.imageId = imageId;
    }

    public int getIslandId() {
        return islandId;
    }

    public double getRa() {
        return ra;
    }

    public double getERa() {
        return eRa;
    }

    public double getDec() {
        return dec;
    }

    public double getEDec() {
        return eDec;
    }

    public double getTotalFlux() {
        return totalFlux;
    }

    public double getETotalFlux() {
        return eTotalFlux;
    }

    public double getPeakFlux() {
        return peakFlux;
    }

    public double getEPeakFlux() {
        return ePeakFlux;
    }

    public Shape getShape() {
        return shape;
    }

    public Shape getDeconvolvedShape() {
        return deconvolvedShape;
    }

    public String getCode() {
        return code;
    }

    public Double getDistFromCenter() {
        return distFromCenter;
    }

    public void setDistFromCenter(Double distFromCenter) {
        this.distFromCenter = distFromCenter;
    }

    public CorrectedFlux getCorrectedFlux() {
        return correctedFlux;
    }

    public void setCorrectedFlux(CorrectedFlux correctedFlux) {
        this.correctedFlux = correctedFlux;
    }

    public Optional<Long> getAssociatedSourceId() {
        return Optional.ofNullable(associatedSourceId);
    }

    public boolean isAssociated() {
        return associatedSourceId != null;
    }

    public boolean isAssociatedTo(long assocId) {
        return associatedSourceId != null && associatedSourceId == assocId;
    }

    public boolean isOrphaned() {
        return orphaned;
    }

    public void associateTo(long assocId) {
        this.associatedSourceId = assocId;
        this.orphaned = false;
    }

    /**
     * Marks the detection as orphaned after its associated source was deleted.
     */
    public void orphan() {
        this.associatedSourceId = null;
        this.orphaned = true;
    }

    /**
     * Returns the detection to the unassociated state.
     */
    public void clearAssociation() {
        this.associatedSourceId = null;
        this.orphaned = false;
    }

    public Detection copy() {
        return toBuilder().build();
    }

    public Builder toBuilder() {
        return builder()
                .sourceId(sourceId)
                .imageId(imageId)
                .islandId(islandId)
                .position(ra, eRa, dec, eDec)
                .totalFlux(totalFlux, eTotalFlux)
                .peakFlux(peakFlux, ePeakFlux)
                .shape(shape)
                .deconvolvedShape(deconvolvedShape)
                .code(code)
                .distFromCenter(distFromCenter)
                .correctedFlux(correctedFlux)
                .associatedSourceId(associatedSourceId)
                .orphaned(orphaned);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Gaussian shape with errors: major and minor axes in arcsec, position angle in degrees.
     */
    public record Shape(double maj, double eMaj, double min, double eMin, double pa, double ePa) {
        public static final Shape POINT = new Shape(0, 0, 0, 0, 0, 0);
    }

    public static class Builder {
        private int sourceId;
        private int imageId;
        private int islandId;
        private double ra;
        private double eRa;
        private double dec;
        private double eDec;
        private double totalFlux;
        private double eTotalFlux;
        private double peakFlux;
        private double ePeakFlux;
        private Shape shape;
        private Shape deconvolvedShape;
        private String code;
        private Double distFromCenter;
        private CorrectedFlux correctedFlux;
        private Long associatedSourceId;
        private boolean orphaned;

        public Builder sourceId(int sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder imageId(int imageId) {
            this.imageId = imageId;
            return this;
        }

        public Builder islandId(int islandId) {
            this.islandId = islandId;
            return this;
        }

        public Builder position(double ra, double eRa, double dec, double eDec) {
            this.ra = ra;
            this.eRa = eRa;
            this.dec = dec;
            this.eDec = eDec;
            return this;
        }

        public Builder totalFlux(double totalFlux, double eTotalFlux) {
            this.totalFlux = totalFlux;
            this.eTotalFlux = eTotalFlux;
            return this;
        }

        public Builder peakFlux(double peakFlux, double ePeakFlux) {
            this.peakFlux = peakFlux;
            this.ePeakFlux = ePeakFlux;
            return this;
        }

        public Builder shape(Shape shape) {
            this.shape = shape;
            return this;
        }

        public Builder deconvolvedShape(Shape deconvolvedShape) {
            this.deconvolvedShape = deconvolvedShape;
            return this;
        }

        public Builder code(String code) {
            this.code = code;
            return this;
        }

        public Builder distFromCenter(Double distFromCenter) {
            this.distFromCenter = distFromCenter;
            return this;
        }

        public Builder correctedFlux(CorrectedFlux correctedFlux) {
            this.correctedFlux = correctedFlux;
            return this;
        }

        public Builder associatedSourceId(Long associatedSourceId) {
            this.associatedSourceId = associatedSourceId;
            return this;
        }

        public Builder orphaned(boolean orphaned) {
            this.orphaned = orphaned;
            return this;
        }

        public Detection build() {
            if (eRa < 0 || eDec < 0) {
                throw new IllegalArgumentException("Position errors must be >= 0");
            }
            return new Detection(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Detection that = (Detection) o;
        return sourceId == that.sourceId && imageId == that.imageId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, imageId);
    }

    @Override
    public String toString() {
        return "Detection{" +
                "sourceId=" + sourceId +
                ", imageId=" + imageId +
                ", ra=" + ra +
                ", dec=" + dec +
                ", associatedSourceId=" + associatedSourceId +
                ", orphaned=" + orphaned +
                '}';
    }
}
