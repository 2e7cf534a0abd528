package com.sky.association.core.model;

import java.util.Objects;

/**
 * Persistent, image-independent identity of one physical sky source.
 * Holds the inverse-variance weighted mean position of every detection
 * currently pointing to it.
 *
 * <p>{@code ndetect} always equals the number of live detections referencing the
 * source and {@code nmatches} the number of live catalog matches referencing it.</p>
 */
public class AssociatedSource {
    private Long id;
    private double ra;
    private double eRa;
    private double dec;
    private double eDec;
    private int ndetect;
    private int nmatches;

    private AssociatedSource(Builder builder) {
        this.id = builder.id;
        this.ra = builder.ra;
        this.eRa = builder.eRa;
        this.dec = builder.dec;
        this.eDec = builder.eDec;
        this.ndetect = builder.ndetect;
        this.nmatches = builder.nmatches;
    }

    /**
     * Seeds a new associated source from a single detection.
     */
    public static AssociatedSource seededFrom(Detection detection) {
        return builder()
                .position(detection.getRa(), detection.getERa(), detection.getDec(), detection.getEDec())
                .ndetect(1)
                .build();
    }

    public Long getId() {
        return id;
    }

    public void assignId(long id) {
        if (this.id != null && this.id != id) {
            throw new IllegalStateException("Associated source already has id " + this.id);
        }
        this.id = id;
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

    public void setPosition(double ra, double eRa, double dec, double eDec) {
        this.ra = ra;
        this.eRa = eRa;
        this.dec = dec;
        this.eDec = eDec;
    }

    public int getNdetect() {
        return ndetect;
    }

    public void setNdetect(int ndetect) {
        if (ndetect < 0) {
            throw new IllegalArgumentException("ndetect must be >= 0");
        }
        this.ndetect = ndetect;
    }

    public int getNmatches() {
        return nmatches;
    }

    public void setNmatches(int nmatches) {
        if (nmatches < 0) {
            throw new IllegalArgumentException("nmatches must be >= 0");
        }
        this.nmatches = nmatches;
    }

    public boolean isSurveyUnique() {
        return nmatches == 0;
    }

    public AssociatedSource copy() {
        return builder()
                .id(id)
                .position(ra, eRa, dec, eDec)
                .ndetect(ndetect)
                .nmatches(nmatches)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Long id;
        private double ra;
        private double eRa;
        private double dec;
        private double eDec;
        private int ndetect;
        private int nmatches;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder position(double ra, double eRa, double dec, double eDec) {
            this.ra = ra;
            this.eRa = eRa;
            this.dec = dec;
            this.eDec = eDec;
            return this;
        }

        public Builder ndetect(int ndetect) {
            this.ndetect = ndetect;
            return this;
        }

        public Builder nmatches(int nmatches) {
            this.nmatches = nmatches;
            return this;
        }

        public AssociatedSource build() {
            return new AssociatedSource(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AssociatedSource that = (AssociatedSource) o;
        return id != null && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "AssociatedSource{" +
                "id=" + id +
                ", ra=" + ra +
                ", dec=" + dec +
                ", ndetect=" + ndetect +
                ", nmatches=" + nmatches +
                '}';
    }
}
