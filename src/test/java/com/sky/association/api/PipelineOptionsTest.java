package com.sky.association.api;

import com.sky.association.extraction.ExtractionParameters;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PipelineOptionsTest {

    @Nested
    @DisplayName("Presets")
    class Presets {

        @Test
        @DisplayName("Defaults run every stage and save")
        void defaults() {
            PipelineOptions options = PipelineOptions.defaults();

            assertTrue(options.isSourceFinding());
            assertTrue(options.isSourceAssociation());
            assertTrue(options.isCatalogMatching());
            assertTrue(options.anyStageSelected());
            assertTrue(options.isSaveToDatabase());
            assertTrue(options.isQualityChecks());
            assertFalse(options.isOverwrite());
            assertFalse(options.isReprocess());
            assertFalse(options.isRedoMatch());
            assertFalse(options.isUpdateMatch());
            assertEquals(5.68, options.getAssociationDeRuiterLimit());
            assertEquals(60.0, options.getAssociationMaxRadiusArcsec());
            assertEquals(5.68, options.getMatchDeRuiterThreshold());
            assertEquals(60.0, options.getCatalogSearchRadiusArcsec());
            assertTrue(options.isMaterializeUniqueOnCatalogRemoval());
            assertTrue(options.getCatalogs().isEmpty());
            assertEquals(ExtractionParameters.defaults(), options.getExtractionParameters());
        }

        @Test
        @DisplayName("Read-only selects no stage")
        void readOnly() {
            PipelineOptions options = PipelineOptions.readOnly();

            assertFalse(options.anyStageSelected());
            assertTrue(options.isSaveToDatabase());
        }

        @Test
        @DisplayName("Source finding only")
        void sourceFindingOnly() {
            PipelineOptions options = PipelineOptions.sourceFindingOnly();

            assertTrue(options.isSourceFinding());
            assertFalse(options.isSourceAssociation());
            assertFalse(options.isCatalogMatching());
        }
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("toBuilder copies every setting")
        void toBuilderCopies() {
            PipelineOptions original = PipelineOptions.builder()
                    .catalogMatching(false)
                    .reprocess(true)
                    .updateMatch(true)
                    .associationDeRuiterLimit(3.0)
                    .catalogSearchRadiusArcsec(30.0)
                    .materializeUniqueOnCatalogRemoval(false)
                    .catalogs(List.of("nvss"))
                    .extractionParameters(ExtractionParameters.defaults().withScale(0.3))
                    .build();

            PipelineOptions copy = original.toBuilder().build();

            assertEquals(original.toString(), copy.toString());
            assertFalse(copy.isCatalogMatching());
            assertTrue(copy.isUpdateMatch());
            assertEquals(3.0, copy.getAssociationDeRuiterLimit());
            assertEquals(List.of("nvss"), copy.getCatalogs());
            assertEquals(0.3, copy.getExtractionParameters().scale());
        }

        @Test
        @DisplayName("Catalog list is copied")
        void catalogsCopied() {
            List<String> names = new java.util.ArrayList<>(List.of("nvss"));
            PipelineOptions options = PipelineOptions.builder().catalogs(names).build();
            names.add("first");

            assertEquals(List.of("nvss"), options.getCatalogs());
        }

        @Test
        @DisplayName("Redo and update of matches are mutually exclusive")
        void redoAndUpdate() {
            PipelineOptions.Builder builder = PipelineOptions.builder().redoMatch(true).updateMatch(true);

            assertThrows(IllegalArgumentException.class, builder::build);
        }

        @Test
        @DisplayName("Limits must be positive")
        void positiveLimits() {
            assertThrows(IllegalArgumentException.class,
                    () -> PipelineOptions.builder().associationDeRuiterLimit(0));
            assertThrows(IllegalArgumentException.class,
                    () -> PipelineOptions.builder().associationMaxRadiusArcsec(-1));
            assertThrows(IllegalArgumentException.class,
                    () -> PipelineOptions.builder().matchDeRuiterThreshold(Double.NaN));
            assertThrows(IllegalArgumentException.class,
                    () -> PipelineOptions.builder().catalogSearchRadiusArcsec(0));
        }

        @Test
        @DisplayName("Nulls are rejected")
        void nulls() {
            assertThrows(NullPointerException.class, () -> PipelineOptions.builder().catalogs(null));
            assertThrows(NullPointerException.class, () -> PipelineOptions.builder().extractionParameters(null));
        }
    }
}
