package com.sky.association.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sky.association.core.model.CorrectedFlux;
import com.sky.association.core.model.Detection;
import com.sky.association.core.model.DetectionKey;
import com.sky.association.core.model.Island;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * FalkorDB-backed detection and island store.
 * Shapes and corrected photometry are kept as JSON string properties.
 */
public class GraphDetectionRepository implements DetectionRepository {

    private static final String DETECTION_COLUMNS = """
            RETURN d.sourceId as sourceId, d.imageId as imageId, d.islandId as islandId,
                   d.ra as ra, d.eRa as eRa, d.dec as dec, d.eDec as eDec,
                   d.totalFlux as totalFlux, d.eTotalFlux as eTotalFlux,
                   d.peakFlux as peakFlux, d.ePeakFlux as ePeakFlux,
                   d.shape as shape, d.dcShape as dcShape, d.code as code,
                   d.distFromCenter as distFromCenter, d.corrected as corrected,
                   d.assocId as assocId, d.orphaned as orphaned
            """;

    private final GraphConnection connection;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public GraphDetectionRepository(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public boolean saveIsland(Island island) {
        String query = """
                MERGE (n:Island {islandId: $islandId, imageId: $imageId})
                ON CREATE SET n.totalFlux = $totalFlux, n.eTotalFlux = $eTotalFlux, n.rms = $rms,
                              n.mean = $mean, n.residualRms = $residualRms,
                              n.residualMean = $residualMean, n.created = true
                ON MATCH SET n.created = false
                RETURN n.created as created
                """;
        Map<String, Object> params = new HashMap<>();
        params.put("islandId", island.islandId());
        params.put("imageId", island.imageId());
        params.put("totalFlux", island.totalFlux());
        params.put("eTotalFlux", island.eTotalFlux());
        params.put("rms", island.rms());
        params.put("mean", island.mean());
        params.put("residualRms", island.residualRms());
        params.put("residualMean", island.residualMean());
        List<Map<String, Object>> rows = connection.query(query, params);
        return !rows.isEmpty() && GraphValues.toBool(rows.get(0).get("created"));
    }

    @Override
    public List<Island> findIslandsByImage(int imageId) {
        String query = """
                MATCH (n:Island {imageId: $imageId})
                RETURN n.islandId as islandId, n.imageId as imageId, n.totalFlux as totalFlux,
                       n.eTotalFlux as eTotalFlux, n.rms as rms, n.mean as mean,
                       n.residualRms as residualRms, n.residualMean as residualMean
                ORDER BY n.islandId ASC
                """;
        return connection.query(query, Map.of("imageId", imageId)).stream()
                .map(row -> new Island(
                        GraphValues.toInt(row.get("islandId")),
                        GraphValues.toInt(row.get("imageId")),
                        GraphValues.toDouble(row.get("totalFlux")),
                        GraphValues.toDouble(row.get("eTotalFlux")),
                        GraphValues.toDouble(row.get("rms")),
                        GraphValues.toDouble(row.get("mean")),
                        GraphValues.toDouble(row.get("residualRms")),
                        GraphValues.toDouble(row.get("residualMean"))))
                .toList();
    }

    @Override
    public int deleteIslandsByImage(int imageId) {
        String query = """
                MATCH (n:Island {imageId: $imageId})
                DELETE n
                RETURN count(n) as deleted
                """;
        return (int) GraphValues.firstLong(connection.query(query, Map.of("imageId", imageId)), "deleted");
    }

    @Override
    public void save(Detection detection) {
        String query = """
                MERGE (d:Detection {sourceId: $sourceId, imageId: $imageId})
                SET d.islandId = $islandId, d.ra = $ra, d.eRa = $eRa, d.dec = $dec, d.eDec = $eDec,
                    d.totalFlux = $totalFlux, d.eTotalFlux = $eTotalFlux,
                    d.peakFlux = $peakFlux, d.ePeakFlux = $ePeakFlux,
                    d.shape = $shape, d.dcShape = $dcShape, d.code = $code,
                    d.distFromCenter = $distFromCenter, d.corrected = $corrected,
                    d.assocId = $assocId, d.orphaned = $orphaned
                """;
        Map<String, Object> params = new HashMap<>();
        params.put("sourceId", detection.getSourceId());
        params.put("imageId", detection.getImageId());
        params.put("islandId", detection.getIslandId());
        params.put("ra", detection.getRa());
        params.put("eRa", detection.getERa());
        params.put("dec", detection.getDec());
        params.put("eDec", detection.getEDec());
        params.put("totalFlux", detection.getTotalFlux());
        params.put("eTotalFlux", detection.getETotalFlux());
        params.put("peakFlux", detection.getPeakFlux());
        params.put("ePeakFlux", detection.getEPeakFlux());
        params.put("shape", toJson(detection.getShape()));
        params.put("dcShape", toJson(detection.getDeconvolvedShape()));
        params.put("code", detection.getCode());
        params.put("distFromCenter", detection.getDistFromCenter());
        params.put("corrected", detection.getCorrectedFlux() != null ? toJson(detection.getCorrectedFlux()) : null);
        params.put("assocId", detection.getAssociatedSourceId().orElse(null));
        params.put("orphaned", detection.isOrphaned());
        connection.execute(query, params);
    }

    @Override
    public Optional<Detection> findByKey(DetectionKey key) {
        String query = "MATCH (d:Detection {sourceId: $sourceId, imageId: $imageId})\n" + DETECTION_COLUMNS;
        List<Map<String, Object>> rows = connection.query(query,
                Map.of("sourceId", key.sourceId(), "imageId", key.imageId()));
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapRow(rows.get(0)));
    }

    @Override
    public List<Detection> findByImage(int imageId) {
        String query = "MATCH (d:Detection {imageId: $imageId})\n" + DETECTION_COLUMNS
                + "ORDER BY d.sourceId ASC";
        return connection.query(query, Map.of("imageId", imageId)).stream().map(this::mapRow).toList();
    }

    @Override
    public List<Detection> findByAssociatedSource(long assocId) {
        String query = "MATCH (d:Detection {assocId: $assocId})\n" + DETECTION_COLUMNS
                + "ORDER BY d.imageId ASC, d.sourceId ASC";
        return connection.query(query, Map.of("assocId", assocId)).stream().map(this::mapRow).toList();
    }

    @Override
    public boolean delete(DetectionKey key) {
        String query = """
                MATCH (d:Detection {sourceId: $sourceId, imageId: $imageId})
                DELETE d
                RETURN count(d) as deleted
                """;
        return GraphValues.firstLong(connection.query(query,
                Map.of("sourceId", key.sourceId(), "imageId", key.imageId())), "deleted") > 0;
    }

    @Override
    public void deleteAll() {
        connection.execute("MATCH (d:Detection) DELETE d");
        connection.execute("MATCH (n:Island) DELETE n");
    }

    private Detection mapRow(Map<String, Object> row) {
        String corrected = GraphValues.toStr(row.get("corrected"));
        return Detection.builder()
                .sourceId(GraphValues.toInt(row.get("sourceId")))
                .imageId(GraphValues.toInt(row.get("imageId")))
                .islandId(GraphValues.toInt(row.get("islandId")))
                .position(GraphValues.toDouble(row.get("ra")), GraphValues.toDouble(row.get("eRa")),
                        GraphValues.toDouble(row.get("dec")), GraphValues.toDouble(row.get("eDec")))
                .totalFlux(GraphValues.toDouble(row.get("totalFlux")), GraphValues.toDouble(row.get("eTotalFlux")))
                .peakFlux(GraphValues.toDouble(row.get("peakFlux")), GraphValues.toDouble(row.get("ePeakFlux")))
                .shape(fromJson(GraphValues.toStr(row.get("shape")), Detection.Shape.class))
                .deconvolvedShape(fromJson(GraphValues.toStr(row.get("dcShape")), Detection.Shape.class))
                .code(GraphValues.toStr(row.get("code")))
                .distFromCenter(GraphValues.toDoubleOrNull(row.get("distFromCenter")))
                .correctedFlux(corrected != null ? fromJson(corrected, CorrectedFlux.class) : null)
                .associatedSourceId(GraphValues.toLongOrNull(row.get("assocId")))
                .orphaned(GraphValues.toBool(row.get("orphaned")))
                .build();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
