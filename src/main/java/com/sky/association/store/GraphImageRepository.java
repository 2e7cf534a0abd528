package com.sky.association.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sky.association.core.model.Image;
import com.sky.association.core.model.ImageError;
import com.sky.association.core.model.ImageHeader;
import com.sky.association.core.model.ProcessingStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * FalkorDB-backed image store. Images are {@code :Image} nodes;
 * the header is kept as a JSON string property.
 */
public class GraphImageRepository implements ImageRepository {
    private static final Logger log = LoggerFactory.getLogger(GraphImageRepository.class);

    private static final String SEQUENCE = "image";
    private static final String RETURN_COLUMNS = """
            RETURN i.id as id, i.filename as filename, i.header as header, i.radius as radius,
                   i.stage as stage, i.error as error, i.nearestProblem as nearestProblem,
                   i.separation as separation, i.catalogsChecked as catalogsChecked,
                   i.nsrc as nsrc, i.rmsBox as rmsBox
            """;

    private final GraphConnection connection;
    private final ObjectMapper objectMapper;

    public GraphImageRepository(GraphConnection connection) {
        this.connection = connection;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public Image save(Image image) {
        if (image.getId() == null) {
            Optional<Image> existing = findByFilename(image.getFilename());
            image.assignId(existing.isPresent()
                    ? existing.get().getId()
                    : (int) GraphValues.nextSequenceValue(connection, SEQUENCE));
        } else {
            GraphValues.raiseSequence(connection, SEQUENCE, image.getId());
        }

        String query = """
                MERGE (i:Image {id: $id})
                SET i.filename = $filename, i.header = $header, i.radius = $radius,
                    i.stage = $stage, i.error = $error, i.nearestProblem = $nearestProblem,
                    i.separation = $separation, i.catalogsChecked = $catalogsChecked,
                    i.nsrc = $nsrc, i.rmsBox = $rmsBox
                """;
        Map<String, Object> params = new HashMap<>();
        params.put("id", image.getId());
        params.put("filename", image.getFilename());
        params.put("header", serializeHeader(image.getHeader()));
        params.put("radius", image.getRadius());
        params.put("stage", image.getStage().code());
        params.put("error", image.getError() != null ? image.getError().code() : null);
        params.put("nearestProblem", image.getNearestProblem());
        params.put("separation", image.getSeparation());
        params.put("catalogsChecked", String.join(",", image.getCatalogsChecked()));
        params.put("nsrc", image.getNsrc());
        params.put("rmsBox", image.getRmsBox());
        connection.execute(query, params);
        log.debug("Persisted image {} ({}) at stage {}", image.getId(), image.getFilename(), image.getStage());
        return image;
    }

    @Override
    public Optional<Image> findById(int id) {
        String query = "MATCH (i:Image {id: $id})\n" + RETURN_COLUMNS;
        return first(connection.query(query, Map.of("id", id)));
    }

    @Override
    public Optional<Image> findByFilename(String filename) {
        String query = "MATCH (i:Image {filename: $filename})\n" + RETURN_COLUMNS;
        return first(connection.query(query, Map.of("filename", filename)));
    }

    @Override
    public List<Image> findAll() {
        String query = "MATCH (i:Image)\n" + RETURN_COLUMNS + "ORDER BY i.id ASC";
        return connection.query(query).stream().map(this::mapRow).toList();
    }

    @Override
    public boolean delete(int id) {
        String query = """
                MATCH (i:Image {id: $id})
                DELETE i
                RETURN count(i) as deleted
                """;
        return GraphValues.firstLong(connection.query(query, Map.of("id", id)), "deleted") > 0;
    }

    @Override
    public void deleteAll() {
        connection.execute("MATCH (i:Image) DELETE i");
        connection.execute("MATCH (s:Sequence {name: $name}) DELETE s", Map.of("name", SEQUENCE));
    }

    private Optional<Image> first(List<Map<String, Object>> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapRow(rows.get(0)));
    }

    private Image mapRow(Map<String, Object> row) {
        Integer error = GraphValues.toInteger(row.get("error"));
        String checked = GraphValues.toStr(row.get("catalogsChecked"));
        Set<String> catalogs = new TreeSet<>();
        if (checked != null && !checked.isBlank()) {
            catalogs.addAll(Arrays.asList(checked.split(",")));
        }
        return Image.builder()
                .id(GraphValues.toInteger(row.get("id")))
                .filename(GraphValues.toStr(row.get("filename")))
                .header(deserializeHeader(GraphValues.toStr(row.get("header"))))
                .radius(GraphValues.toDoubleOrNull(row.get("radius")))
                .stage(ProcessingStage.fromCode(GraphValues.toInt(row.get("stage"))))
                .error(error != null ? ImageError.fromCode(error) : null)
                .nearestProblem(GraphValues.toStr(row.get("nearestProblem")),
                        GraphValues.toDoubleOrNull(row.get("separation")))
                .catalogsChecked(catalogs)
                .nsrc(GraphValues.toInteger(row.get("nsrc")))
                .rmsBox(GraphValues.toStr(row.get("rmsBox")))
                .build();
    }

    private String serializeHeader(ImageHeader header) {
        try {
            return objectMapper.writeValueAsString(header);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize image header", e);
        }
    }

    private ImageHeader deserializeHeader(String json) {
        if (json == null || json.isEmpty()) {
            return ImageHeader.builder().build();
        }
        try {
            return objectMapper.readValue(json, ImageHeader.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize image header", e);
        }
    }
}
