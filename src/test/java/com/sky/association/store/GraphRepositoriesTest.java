package com.sky.association.store;

import com.sky.association.core.model.AssociatedSource;
import com.sky.association.core.model.CatalogMatch;
import com.sky.association.core.model.Image;
import com.sky.association.core.model.ImageError;
import com.sky.association.core.model.Island;
import com.sky.association.core.model.ProcessingStage;
import com.sky.association.core.model.UniqueSource;
import com.sky.association.testsupport.SkyFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the graph-backed repositories against a stub connection.
 */
class GraphRepositoriesTest {

    private StubGraphConnection connection;

    @BeforeEach
    void setUp() {
        connection = new StubGraphConnection();
    }

    @Nested
    @DisplayName("Images")
    class Images {

        private GraphImageRepository repository;

        @BeforeEach
        void setUp() {
            repository = new GraphImageRepository(connection);
        }

        @Test
        @DisplayName("New image takes the next sequence value")
        void newImageUsesSequence() {
            connection.respond("Sequence", List.of(Map.of("value", 7L)));

            Image image = repository.save(Image.builder().filename("a.fits").header(SkyFixtures.header()).build());

            assertEquals(7, image.getId());
            String merge = connection.lastExecuted();
            assertTrue(merge.contains("MERGE (i:Image {id: $id})"));
            Map<String, Object> params = connection.lastParams();
            assertEquals(7, params.get("id"));
            assertEquals(ProcessingStage.READ.code(), params.get("stage"));
            assertNull(params.get("error"));
        }

        @Test
        @DisplayName("Header survives a save and reload as JSON")
        void headerRoundTrip() {
            Image image = Image.builder()
                    .id(3)
                    .filename("a.fits")
                    .header(SkyFixtures.header())
                    .stage(ProcessingStage.READ)
                    .error(ImageError.BAD_SENSITIVITY_METRIC)
                    .catalogsChecked(Set.of("nvss", "first"))
                    .build();
            repository.save(image);
            Map<String, Object> stored = new HashMap<>(connection.lastParams());
            assertEquals("first,nvss", stored.get("catalogsChecked"));

            connection.respond("MATCH (i:Image {id: $id})", List.of(stored));
            Image loaded = repository.findById(3).orElseThrow();

            assertEquals(SkyFixtures.header(), loaded.getHeader());
            assertEquals(ProcessingStage.READ, loaded.getStage());
            assertEquals(ImageError.BAD_SENSITIVITY_METRIC, loaded.getError());
            assertEquals(Set.of("nvss", "first"), loaded.getCatalogsChecked());
        }

        @Test
        @DisplayName("Unknown image is empty")
        void unknownImage() {
            assertEquals(Optional.empty(), repository.findByFilename("missing.fits"));
        }
    }

    @Nested
    @DisplayName("Associated sources")
    class Sources {

        private GraphAssociatedSourceRepository repository;

        @BeforeEach
        void setUp() {
            repository = new GraphAssociatedSourceRepository(connection);
        }

        @Test
        @DisplayName("Explicit ids raise the sequence instead of drawing from it")
        void explicitIdRaisesSequence() {
            repository.save(AssociatedSource.builder().id(12L).position(1, 1, 1, 1).ndetect(1).build());

            assertTrue(connection.executedQueries.get(0).contains("CASE WHEN s.value < $floor"));
            assertEquals(12L, connection.executedParams.get(0).get("floor"));
            assertTrue(connection.lastExecuted().contains("MERGE (a:AssocSource {id: $id})"));
        }

        @Test
        @DisplayName("Cone search filters the declination band by true separation")
        void coneSearchFilters() {
            connection.respond("a.dec >= $decMin", List.of(
                    sourceRow(2L, 150.0, 30.02),
                    sourceRow(1L, 150.0, 30.001),
                    sourceRow(3L, 160.0, 30.0)));

            List<AssociatedSource> found = repository.findWithinCone(150.0, 30.0, 0.05);

            assertEquals(List.of(1L, 2L), found.stream().map(AssociatedSource::getId).toList());
            assertEquals(29.95, (double) connection.lastQueryParams().get("decMin"), 1e-12);
        }

        private Map<String, Object> sourceRow(long id, double ra, double dec) {
            Map<String, Object> row = new HashMap<>();
            row.put("id", id);
            row.put("ra", ra);
            row.put("eRa", 1e-4);
            row.put("dec", dec);
            row.put("eDec", 1e-4);
            row.put("ndetect", 1L);
            row.put("nmatches", 0L);
            return row;
        }
    }

    @Nested
    @DisplayName("Detections and islands")
    class Detections {

        @Test
        @DisplayName("Island insert reports whether the node was created")
        void islandCreatedFlag() {
            GraphDetectionRepository repository = new GraphDetectionRepository(connection);
            connection.respond("MERGE (n:Island", List.of(Map.of("created", true)));

            assertTrue(repository.saveIsland(new Island(1, 2, 10, 1, 0.5, 0, 0.4, 0)));

            connection.respond("MERGE (n:Island", List.of(Map.of("created", false)));
            assertFalse(repository.saveIsland(new Island(1, 2, 10, 1, 0.5, 0, 0.4, 0)));
            assertEquals(2, connection.lastQueryParams().get("imageId"));
        }

        @Test
        @DisplayName("Association link is written with the detection")
        void detectionParams() {
            GraphDetectionRepository repository = new GraphDetectionRepository(connection);
            var detection = SkyFixtures.detection(4, 2, 150.0, 1e-4, 30.0, 1e-4);
            detection.associateTo(9L);

            repository.save(detection);

            Map<String, Object> params = connection.lastParams();
            assertEquals(4, params.get("sourceId"));
            assertEquals(9L, params.get("assocId"));
            assertEquals(false, params.get("orphaned"));
        }
    }

    @Nested
    @DisplayName("Matches and uniqueness records")
    class MatchesAndUniqueness {

        @Test
        @DisplayName("Match insert is a MERGE on the triple")
        void matchMerge() {
            GraphCatalogMatchRepository repository = new GraphCatalogMatchRepository(connection);
            connection.respond("MERGE (m:CatalogMatch", List.of(Map.of("created", true)));

            assertTrue(repository.add(new CatalogMatch(1, 100L, 7L, 0.3)));
            assertEquals(100L, connection.lastQueryParams().get("catalogSourceId"));
        }

        @Test
        @DisplayName("Match rows are mapped back")
        void matchRows() {
            GraphCatalogMatchRepository repository = new GraphCatalogMatchRepository(connection);
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("catalogId", 2L);
            row.put("catalogSourceId", 55L);
            row.put("assocId", 7L);
            row.put("deRuiter", 1.25);
            connection.respond("MATCH (m:CatalogMatch {assocId: $assocId})", List.of(row));

            assertEquals(List.of(new CatalogMatch(2, 55L, 7L, 1.25)), repository.findByAssociatedSource(7L));
        }

        @Test
        @DisplayName("Existence check reads the count column")
        void existsFor() {
            GraphCatalogMatchRepository repository = new GraphCatalogMatchRepository(connection);

            assertFalse(repository.existsFor(1, 7L));
            connection.respond("count(m) as cnt", List.of(Map.of("cnt", 1L)));
            assertTrue(repository.existsFor(1, 7L));
        }

        @Test
        @DisplayName("Uniqueness upsert keys on image and source")
        void uniqueUpsert() {
            GraphUniqueSourceRepository repository = new GraphUniqueSourceRepository(connection);

            repository.upsert(new UniqueSource(3, 7L, true));

            assertTrue(connection.lastExecuted().contains("MERGE (u:UniqueSource {imageId: $imageId, assocId: $assocId})"));
            assertEquals(Map.of("imageId", 3, "assocId", 7L, "detected", true), connection.lastParams());
        }
    }

    /**
     * Records statements and answers queries from canned rows keyed by a query fragment.
     */
    private static class StubGraphConnection implements GraphConnection {
        final List<String> executedQueries = new ArrayList<>();
        final List<Map<String, Object>> executedParams = new ArrayList<>();
        final Map<String, List<Map<String, Object>>> responses = new LinkedHashMap<>();
        Map<String, Object> lastQueryParams = Map.of();

        void respond(String fragment, List<Map<String, Object>> rows) {
            responses.put(fragment, rows);
        }

        String lastExecuted() {
            return executedQueries.get(executedQueries.size() - 1);
        }

        Map<String, Object> lastParams() {
            return executedParams.get(executedParams.size() - 1);
        }

        Map<String, Object> lastQueryParams() {
            return lastQueryParams;
        }

        @Override
        public void execute(String query, Map<String, Object> params) {
            executedQueries.add(query);
            executedParams.add(params);
        }

        @Override
        public List<Map<String, Object>> query(String query, Map<String, Object> params) {
            lastQueryParams = params;
            return responses.entrySet().stream()
                    .filter(e -> query.contains(e.getKey()))
                    .map(Map.Entry::getValue)
                    .findFirst()
                    .orElse(List.of());
        }

        @Override
        public boolean isConnected() {
            return true;
        }

        @Override
        public String getGraphName() {
            return "test";
        }

        @Override
        public void createIndexes() {
        }

        @Override
        public void close() {
        }
    }
}
