package com.sky.association.store;

import com.sky.association.core.model.AssociatedSource;
import com.sky.association.core.sky.SkyMath;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * FalkorDB-backed associated source store.
 * Cone searches select a declination strip through the {@code dec} index and
 * are refined by exact separation on the client.
 */
public class GraphAssociatedSourceRepository implements AssociatedSourceRepository {

    private static final String SEQUENCE = "assoc";
    private static final String RETURN_COLUMNS = """
            RETURN a.id as id, a.ra as ra, a.eRa as eRa, a.dec as dec, a.eDec as eDec,
                   a.ndetect as ndetect, a.nmatches as nmatches
            """;

    private final GraphConnection connection;

    public GraphAssociatedSourceRepository(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public AssociatedSource save(AssociatedSource source) {
        if (source.getId() == null) {
            source.assignId(GraphValues.nextSequenceValue(connection, SEQUENCE));
        } else {
            GraphValues.raiseSequence(connection, SEQUENCE, source.getId());
        }
        String query = """
                MERGE (a:AssocSource {id: $id})
                SET a.ra = $ra, a.eRa = $eRa, a.dec = $dec, a.eDec = $eDec,
                    a.ndetect = $ndetect, a.nmatches = $nmatches
                """;
        Map<String, Object> params = new HashMap<>();
        params.put("id", source.getId());
        params.put("ra", source.getRa());
        params.put("eRa", source.getERa());
        params.put("dec", source.getDec());
        params.put("eDec", source.getEDec());
        params.put("ndetect", source.getNdetect());
        params.put("nmatches", source.getNmatches());
        connection.execute(query, params);
        return source;
    }

    @Override
    public Optional<AssociatedSource> findById(long id) {
        String query = "MATCH (a:AssocSource {id: $id})\n" + RETURN_COLUMNS;
        List<Map<String, Object>> rows = connection.query(query, Map.of("id", id));
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapRow(rows.get(0)));
    }

    @Override
    public List<AssociatedSource> findWithinCone(double ra, double dec, double radius) {
        String query = """
                MATCH (a:AssocSource)
                WHERE a.dec >= $decMin AND a.dec <= $decMax
                """ + RETURN_COLUMNS;
        List<Map<String, Object>> rows = connection.query(query, Map.of(
                "decMin", dec - radius,
                "decMax", dec + radius));
        return rows.stream()
                .map(this::mapRow)
                .filter(s -> SkyMath.separation(ra, dec, s.getRa(), s.getDec()) <= radius)
                .sorted(Comparator.comparingDouble(s -> SkyMath.separation(ra, dec, s.getRa(), s.getDec())))
                .toList();
    }

    @Override
    public List<AssociatedSource> findAll() {
        String query = "MATCH (a:AssocSource)\n" + RETURN_COLUMNS + "ORDER BY a.id ASC";
        return connection.query(query).stream().map(this::mapRow).toList();
    }

    @Override
    public boolean delete(long id) {
        String query = """
                MATCH (a:AssocSource {id: $id})
                DELETE a
                RETURN count(a) as deleted
                """;
        return GraphValues.firstLong(connection.query(query, Map.of("id", id)), "deleted") > 0;
    }

    @Override
    public void deleteAll() {
        connection.execute("MATCH (a:AssocSource) DELETE a");
        connection.execute("MATCH (s:Sequence {name: $name}) DELETE s", Map.of("name", SEQUENCE));
    }

    private AssociatedSource mapRow(Map<String, Object> row) {
        return AssociatedSource.builder()
                .id(GraphValues.toLongOrNull(row.get("id")))
                .position(GraphValues.toDouble(row.get("ra")), GraphValues.toDouble(row.get("eRa")),
                        GraphValues.toDouble(row.get("dec")), GraphValues.toDouble(row.get("eDec")))
                .ndetect(GraphValues.toInt(row.get("ndetect")))
                .nmatches(GraphValues.toInt(row.get("nmatches")))
                .build();
    }
}
