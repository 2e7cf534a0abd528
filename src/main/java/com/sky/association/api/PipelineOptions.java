package com.sky.association.api;

import com.sky.association.extraction.ExtractionParameters;

import java.util.List;
import java.util.Objects;

/**
 * Options for one pipeline run.
 * Selects the stages to run, the reprocessing mode and the association and matching limits.
 */
public class PipelineOptions {

    private static final double DEFAULT_ASSOCIATION_DE_RUITER_LIMIT = 5.68;
    private static final double DEFAULT_ASSOCIATION_MAX_RADIUS_ARCSEC = 60.0;
    private static final double DEFAULT_MATCH_DE_RUITER_THRESHOLD = 5.68;
    private static final double DEFAULT_CATALOG_SEARCH_RADIUS_ARCSEC = 60.0;

    private final boolean sourceFinding;
    private final boolean sourceAssociation;
    private final boolean catalogMatching;
    private final boolean saveToDatabase;
    private final boolean qualityChecks;
    private final boolean overwrite;
    private final boolean reprocess;
    private final boolean redoMatch;
    private final boolean updateMatch;
    private final double associationDeRuiterLimit;
    private final double associationMaxRadiusArcsec;
    private final double matchDeRuiterThreshold;
    private final double catalogSearchRadiusArcsec;
    private final boolean materializeUniqueOnCatalogRemoval;
    private final List<String> catalogs;
    private final ExtractionParameters extractionParameters;

    private PipelineOptions(Builder builder) {
        this.sourceFinding = builder.sourceFinding;
        this.sourceAssociation = builder.sourceAssociation;
        this.catalogMatching = builder.catalogMatching;
        this.saveToDatabase = builder.saveToDatabase;
        this.qualityChecks = builder.qualityChecks;
        this.overwrite = builder.overwrite;
        this.reprocess = builder.reprocess;
        this.redoMatch = builder.redoMatch;
        this.updateMatch = builder.updateMatch;
        this.associationDeRuiterLimit = builder.associationDeRuiterLimit;
        this.associationMaxRadiusArcsec = builder.associationMaxRadiusArcsec;
        this.matchDeRuiterThreshold = builder.matchDeRuiterThreshold;
        this.catalogSearchRadiusArcsec = builder.catalogSearchRadiusArcsec;
        this.materializeUniqueOnCatalogRemoval = builder.materializeUniqueOnCatalogRemoval;
        this.catalogs = List.copyOf(builder.catalogs);
        this.extractionParameters = builder.extractionParameters;
    }

    public boolean isSourceFinding() {
        return sourceFinding;
    }

    public boolean isSourceAssociation() {
        return sourceAssociation;
    }

    public boolean isCatalogMatching() {
        return catalogMatching;
    }

    public boolean anyStageSelected() {
        return sourceFinding || sourceAssociation || catalogMatching;
    }

    public boolean isSaveToDatabase() {
        return saveToDatabase;
    }

    public boolean isQualityChecks() {
        return qualityChecks;
    }

    public boolean isOverwrite() {
        return overwrite;
    }

    public boolean isReprocess() {
        return reprocess;
    }

    public boolean isRedoMatch() {
        return redoMatch;
    }

    public boolean isUpdateMatch() {
        return updateMatch;
    }

    public double getAssociationDeRuiterLimit() {
        return associationDeRuiterLimit;
    }

    public double getAssociationMaxRadiusArcsec() {
        return associationMaxRadiusArcsec;
    }

    public double getMatchDeRuiterThreshold() {
        return matchDeRuiterThreshold;
    }

    public double getCatalogSearchRadiusArcsec() {
        return catalogSearchRadiusArcsec;
    }

    public boolean isMaterializeUniqueOnCatalogRemoval() {
        return materializeUniqueOnCatalogRemoval;
    }

    /**
     * Catalogs to match against; empty means every registered catalog.
     */
    public List<String> getCatalogs() {
        return catalogs;
    }

    public ExtractionParameters getExtractionParameters() {
        return extractionParameters;
    }

    public Builder toBuilder() {
        return builder()
                .sourceFinding(sourceFinding)
                .sourceAssociation(sourceAssociation)
                .catalogMatching(catalogMatching)
                .saveToDatabase(saveToDatabase)
                .qualityChecks(qualityChecks)
                .overwrite(overwrite)
                .reprocess(reprocess)
                .redoMatch(redoMatch)
                .updateMatch(updateMatch)
                .associationDeRuiterLimit(associationDeRuiterLimit)
                .associationMaxRadiusArcsec(associationMaxRadiusArcsec)
                .matchDeRuiterThreshold(matchDeRuiterThreshold)
                .catalogSearchRadiusArcsec(catalogSearchRadiusArcsec)
                .materializeUniqueOnCatalogRemoval(materializeUniqueOnCatalogRemoval)
                .catalogs(catalogs)
                .extractionParameters(extractionParameters);
    }

    /**
     * All stages, saving to the store, quality checks on.
     */
    public static PipelineOptions defaults() {
        return builder().build();
    }

    /**
     * Only reads image headers: every stage off.
     */
    public static PipelineOptions readOnly() {
        return builder().sourceFinding(false).sourceAssociation(false).catalogMatching(false).build();
    }

    /**
     * Source finding only.
     */
    public static PipelineOptions sourceFindingOnly() {
        return builder().sourceAssociation(false).catalogMatching(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean sourceFinding = true;
        private boolean sourceAssociation = true;
        private boolean catalogMatching = true;
        private boolean saveToDatabase = true;
        private boolean qualityChecks = true;
        private boolean overwrite = false;
        private boolean reprocess = false;
        private boolean redoMatch = false;
        private boolean updateMatch = false;
        private double associationDeRuiterLimit = DEFAULT_ASSOCIATION_DE_RUITER_LIMIT;
        private double associationMaxRadiusArcsec = DEFAULT_ASSOCIATION_MAX_RADIUS_ARCSEC;
        private double matchDeRuiterThreshold = DEFAULT_MATCH_DE_RUITER_THRESHOLD;
        private double catalogSearchRadiusArcsec = DEFAULT_CATALOG_SEARCH_RADIUS_ARCSEC;
        private boolean materializeUniqueOnCatalogRemoval = true;
        private List<String> catalogs = List.of();
        private ExtractionParameters extractionParameters = ExtractionParameters.defaults();

        public Builder sourceFinding(boolean sourceFinding) {
            this.sourceFinding = sourceFinding;
            return this;
        }

        public Builder sourceAssociation(boolean sourceAssociation) {
            this.sourceAssociation = sourceAssociation;
            return this;
        }

        public Builder catalogMatching(boolean catalogMatching) {
            this.catalogMatching = catalogMatching;
            return this;
        }

        public Builder saveToDatabase(boolean saveToDatabase) {
            this.saveToDatabase = saveToDatabase;
            return this;
        }

        public Builder qualityChecks(boolean qualityChecks) {
            this.qualityChecks = qualityChecks;
            return this;
        }

        public Builder overwrite(boolean overwrite) {
            this.overwrite = overwrite;
            return this;
        }

        public Builder reprocess(boolean reprocess) {
            this.reprocess = reprocess;
            return this;
        }

        public Builder redoMatch(boolean redoMatch) {
            this.redoMatch = redoMatch;
            return this;
        }

        public Builder updateMatch(boolean updateMatch) {
            this.updateMatch = updateMatch;
            return this;
        }

        public Builder associationDeRuiterLimit(double associationDeRuiterLimit) {
            validatePositive(associationDeRuiterLimit, "associationDeRuiterLimit");
            this.associationDeRuiterLimit = associationDeRuiterLimit;
            return this;
        }

        public Builder associationMaxRadiusArcsec(double associationMaxRadiusArcsec) {
            validatePositive(associationMaxRadiusArcsec, "associationMaxRadiusArcsec");
            this.associationMaxRadiusArcsec = associationMaxRadiusArcsec;
            return this;
        }

        public Builder matchDeRuiterThreshold(double matchDeRuiterThreshold) {
            validatePositive(matchDeRuiterThreshold, "matchDeRuiterThreshold");
            this.matchDeRuiterThreshold = matchDeRuiterThreshold;
            return this;
        }

        public Builder catalogSearchRadiusArcsec(double catalogSearchRadiusArcsec) {
            validatePositive(catalogSearchRadiusArcsec, "catalogSearchRadiusArcsec");
            this.catalogSearchRadiusArcsec = catalogSearchRadiusArcsec;
            return this;
        }

        public Builder materializeUniqueOnCatalogRemoval(boolean materializeUniqueOnCatalogRemoval) {
            this.materializeUniqueOnCatalogRemoval = materializeUniqueOnCatalogRemoval;
            return this;
        }

        public Builder catalogs(List<String> catalogs) {
            this.catalogs = Objects.requireNonNull(catalogs, "catalogs");
            return this;
        }

        public Builder extractionParameters(ExtractionParameters extractionParameters) {
            this.extractionParameters = Objects.requireNonNull(extractionParameters, "extractionParameters");
            return this;
        }

        public PipelineOptions build() {
            if (redoMatch && updateMatch) {
                throw new IllegalArgumentException("redoMatch and updateMatch are mutually exclusive");
            }
            return new PipelineOptions(this);
        }

        private void validatePositive(double value, String name) {
            if (!(value > 0)) {
                throw new IllegalArgumentException(name + " must be > 0");
            }
        }
    }

    @Override
    public String toString() {
        return "PipelineOptions{" +
                "sourceFinding=" + sourceFinding +
                ", sourceAssociation=" + sourceAssociation +
                ", catalogMatching=" + catalogMatching +
                ", saveToDatabase=" + saveToDatabase +
                ", qualityChecks=" + qualityChecks +
                ", overwrite=" + overwrite +
                ", reprocess=" + reprocess +
                ", redoMatch=" + redoMatch +
                ", updateMatch=" + updateMatch +
                ", catalogs=" + catalogs +
                ", extraction=" + extractionParameters +
                '}';
    }
}
