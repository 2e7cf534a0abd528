package com.sky.association.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Header metadata of one sky image as produced by the header reader.
 * Every member is nullable; absent keywords stay null rather than defaulting.
 *
 * <p>Units: positions and pixel scale in degrees and arcsec respectively,
 * observing frequency in MHz, primary frequency in GHz, beam axes in arcsec,
 * beam position angle in degrees, noise and peak in mJy/beam,
 * integration time and duration in seconds.</p>
 */
public record ImageHeader(
        Integer naxis1,
        Integer naxis2,
        Double obsRa,
        Double obsDec,
        Double pixelScale,
        String object,
        String obsDate,
        String mapDate,
        Double obsFreq,
        Double primaryFreq,
        Double bmaj,
        Double bmin,
        Double bpa,
        Double noise,
        Double peak,
        String arrayConfig,
        Integer nvis,
        Double mjdTime,
        Double tauTime,
        Double duration
) {

    /**
     * Names of the fields required before quality checks can run, in header order.
     */
    public List<String> missingRequiredFields() {
        List<String> missing = new ArrayList<>();
        if (naxis1 == null || naxis2 == null) missing.add("imsize");
        if (obsRa == null || obsDec == null) missing.add("pointing");
        if (pixelScale == null) missing.add("pixel_scale");
        if (obsDate == null) missing.add("obs_date");
        if (obsFreq == null) missing.add("obs_freq");
        if (bmaj == null || bmin == null || bpa == null) missing.add("beam");
        if (noise == null) missing.add("noise");
        if (nvis == null) missing.add("nvis");
        if (mjdTime == null) missing.add("mjdtime");
        if (tauTime == null) missing.add("tau_time");
        if (duration == null) missing.add("duration");
        return missing;
    }

    public boolean isComplete() {
        return missingRequiredFields().isEmpty();
    }

    /**
     * Frequency in GHz: the primary frequency, else the observing frequency, else the fallback.
     */
    public double frequencyGhzOr(double fallback) {
        if (primaryFreq != null && primaryFreq > 0) {
            return primaryFreq;
        }
        if (obsFreq != null && obsFreq > 0) {
            return obsFreq / 1000.0;
        }
        return fallback;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Integer naxis1;
        private Integer naxis2;
        private Double obsRa;
        private Double obsDec;
        private Double pixelScale;
        private String object;
        private String obsDate;
        private String mapDate;
        private Double obsFreq;
        private Double primaryFreq;
        private Double bmaj;
        private Double bmin;
        private Double bpa;
        private Double noise;
        private Double peak;
        private String arrayConfig;
        private Integer nvis;
        private Double mjdTime;
        private Double tauTime;
        private Double duration;

        public Builder imageSize(Integer naxis1, Integer naxis2) {
            this.naxis1 = naxis1;
            this.naxis2 = naxis2;
            return this;
        }

        public Builder pointing(Double obsRa, Double obsDec) {
            this.obsRa = obsRa;
            this.obsDec = obsDec;
            return this;
        }

        public Builder pixelScale(Double pixelScale) {
            this.pixelScale = pixelScale;
            return this;
        }

        public Builder object(String object) {
            this.object = object;
            return this;
        }

        public Builder obsDate(String obsDate) {
            this.obsDate = obsDate;
            return this;
        }

        public Builder mapDate(String mapDate) {
            this.mapDate = mapDate;
            return this;
        }

        public Builder obsFreq(Double obsFreq) {
            this.obsFreq = obsFreq;
            return this;
        }

        public Builder primaryFreq(Double primaryFreq) {
            this.primaryFreq = primaryFreq;
            return this;
        }

        public Builder beam(Double bmaj, Double bmin, Double bpa) {
            this.bmaj = bmaj;
            this.bmin = bmin;
            this.bpa = bpa;
            return this;
        }

        public Builder noise(Double noise) {
            this.noise = noise;
            return this;
        }

        public Builder peak(Double peak) {
            this.peak = peak;
            return this;
        }

        public Builder arrayConfig(String arrayConfig) {
            this.arrayConfig = arrayConfig;
            return this;
        }

        public Builder nvis(Integer nvis) {
            this.nvis = nvis;
            return this;
        }

        public Builder mjdTime(Double mjdTime) {
            this.mjdTime = mjdTime;
            return this;
        }

        public Builder tauTime(Double tauTime) {
            this.tauTime = tauTime;
            return this;
        }

        public Builder duration(Double duration) {
            this.duration = duration;
            return this;
        }

        public ImageHeader build() {
            return new ImageHeader(naxis1, naxis2, obsRa, obsDec, pixelScale, object, obsDate, mapDate,
                    obsFreq, primaryFreq, bmaj, bmin, bpa, noise, peak, arrayConfig, nvis,
                    mjdTime, tauTime, duration);
        }
    }
}
