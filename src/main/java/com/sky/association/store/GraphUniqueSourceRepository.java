package com.sky.association.store;

import com.sky.association.core.model.UniqueSource;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * FalkorDB-backed survey-unique record store.
 */
public class GraphUniqueSourceRepository implements UniqueSourceRepository {

    private static final String RETURN_COLUMNS = """
            RETURN u.imageId as imageId, u.assocId as assocId, u.detected as detected
            """;

    private final GraphConnection connection;

    public GraphUniqueSourceRepository(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public void upsert(UniqueSource record) {
        String query = """
                MERGE (u:UniqueSource {imageId: $imageId, assocId: $assocId})
                SET u.detected = $detected
                """;
        connection.execute(query, Map.of(
                "imageId", record.imageId(),
                "assocId", record.associatedSourceId(),
                "detected", record.detected()));
    }

    @Override
    public Optional<UniqueSource> find(int imageId, long assocId) {
        String query = "MATCH (u:UniqueSource {imageId: $imageId, assocId: $assocId})\n" + RETURN_COLUMNS;
        List<UniqueSource> rows = mapRows(connection.query(query, Map.of("imageId", imageId, "assocId", assocId)));
        return rows.stream().findFirst();
    }

    @Override
    public List<UniqueSource> findByImage(int imageId) {
        String query = "MATCH (u:UniqueSource {imageId: $imageId})\n" + RETURN_COLUMNS + "ORDER BY u.assocId ASC";
        return mapRows(connection.query(query, Map.of("imageId", imageId)));
    }

    @Override
    public List<UniqueSource> findByAssociatedSource(long assocId) {
        String query = "MATCH (u:UniqueSource {assocId: $assocId})\n" + RETURN_COLUMNS + "ORDER BY u.imageId ASC";
        return mapRows(connection.query(query, Map.of("assocId", assocId)));
    }

    @Override
    public boolean delete(int imageId, long assocId) {
        String query = """
                MATCH (u:UniqueSource {imageId: $imageId, assocId: $assocId})
                DELETE u
                RETURN count(u) as deleted
                """;
        return GraphValues.firstLong(connection.query(query,
                Map.of("imageId", imageId, "assocId", assocId)), "deleted") > 0;
    }

    @Override
    public List<UniqueSource> deleteByAssociatedSource(long assocId) {
        List<UniqueSource> removed = findByAssociatedSource(assocId);
        connection.execute("MATCH (u:UniqueSource {assocId: $assocId}) DELETE u", Map.of("assocId", assocId));
        return removed;
    }

    @Override
    public List<UniqueSource> deleteByImage(int imageId) {
        List<UniqueSource> removed = findByImage(imageId);
        connection.execute("MATCH (u:UniqueSource {imageId: $imageId}) DELETE u", Map.of("imageId", imageId));
        return removed;
    }

    @Override
    public void deleteAll() {
        connection.execute("MATCH (u:UniqueSource) DELETE u");
    }

    private List<UniqueSource> mapRows(List<Map<String, Object>> rows) {
        return rows.stream()
                .map(row -> new UniqueSource(
                        GraphValues.toInt(row.get("imageId")),
                        GraphValues.toLong(row.get("assocId")),
                        GraphValues.toBool(row.get("detected"))))
                .toList();
    }
}
