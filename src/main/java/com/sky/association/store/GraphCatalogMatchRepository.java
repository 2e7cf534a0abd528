package com.sky.association.store;

import com.sky.association.core.model.CatalogMatch;

import java.util.List;
import java.util.Map;

/**
 * FalkorDB-backed catalog match store. The match triple is the MERGE key,
 * so repeating an insert never creates a second node.
 */
public class GraphCatalogMatchRepository implements CatalogMatchRepository {

    private static final String RETURN_COLUMNS = """
            RETURN m.catalogId as catalogId, m.catalogSourceId as catalogSourceId,
                   m.assocId as assocId, m.deRuiter as deRuiter
            """;

    private final GraphConnection connection;

    public GraphCatalogMatchRepository(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public boolean add(CatalogMatch match) {
        String query = """
                MERGE (m:CatalogMatch {catalogId: $catalogId, catalogSourceId: $catalogSourceId, assocId: $assocId})
                ON CREATE SET m.deRuiter = $deRuiter, m.created = true
                ON MATCH SET m.created = false
                RETURN m.created as created
                """;
        List<Map<String, Object>> rows = connection.query(query, Map.of(
                "catalogId", match.catalogId(),
                "catalogSourceId", match.catalogSourceId(),
                "assocId", match.associatedSourceId(),
                "deRuiter", match.deRuiter()));
        return !rows.isEmpty() && GraphValues.toBool(rows.get(0).get("created"));
    }

    @Override
    public boolean remove(CatalogMatch.Key key) {
        String query = """
                MATCH (m:CatalogMatch {catalogId: $catalogId, catalogSourceId: $catalogSourceId, assocId: $assocId})
                DELETE m
                RETURN count(m) as deleted
                """;
        return GraphValues.firstLong(connection.query(query, Map.of(
                "catalogId", key.catalogId(),
                "catalogSourceId", key.catalogSourceId(),
                "assocId", key.associatedSourceId())), "deleted") > 0;
    }

    @Override
    public List<CatalogMatch> findByAssociatedSource(long assocId) {
        String query = "MATCH (m:CatalogMatch {assocId: $assocId})\n" + RETURN_COLUMNS
                + "ORDER BY m.catalogId ASC, m.catalogSourceId ASC";
        return mapRows(connection.query(query, Map.of("assocId", assocId)));
    }

    @Override
    public List<CatalogMatch> findByCatalog(int catalogId) {
        String query = "MATCH (m:CatalogMatch {catalogId: $catalogId})\n" + RETURN_COLUMNS
                + "ORDER BY m.assocId ASC, m.catalogSourceId ASC";
        return mapRows(connection.query(query, Map.of("catalogId", catalogId)));
    }

    @Override
    public boolean existsFor(int catalogId, long assocId) {
        String query = """
                MATCH (m:CatalogMatch {catalogId: $catalogId, assocId: $assocId})
                RETURN count(m) as cnt
                """;
        return GraphValues.firstLong(connection.query(query,
                Map.of("catalogId", catalogId, "assocId", assocId)), "cnt") > 0;
    }

    @Override
    public List<CatalogMatch> deleteByAssociatedSource(long assocId) {
        List<CatalogMatch> removed = findByAssociatedSource(assocId);
        connection.execute("MATCH (m:CatalogMatch {assocId: $assocId}) DELETE m", Map.of("assocId", assocId));
        return removed;
    }

    @Override
    public List<CatalogMatch> deleteByCatalog(int catalogId) {
        List<CatalogMatch> removed = findByCatalog(catalogId);
        connection.execute("MATCH (m:CatalogMatch {catalogId: $catalogId}) DELETE m",
                Map.of("catalogId", catalogId));
        return removed;
    }

    @Override
    public void deleteAll() {
        connection.execute("MATCH (m:CatalogMatch) DELETE m");
    }

    private List<CatalogMatch> mapRows(List<Map<String, Object>> rows) {
        return rows.stream()
                .map(row -> new CatalogMatch(
                        GraphValues.toInt(row.get("catalogId")),
                        GraphValues.toLong(row.get("catalogSourceId")),
                        GraphValues.toLong(row.get("assocId")),
                        GraphValues.toDouble(row.get("deRuiter"))))
                .toList();
    }
}
