package com.sky.association.store;

import java.util.List;
import java.util.Map;

/**
 * Cypher access to the graph holding images, detections, associated sources, catalog
 * matches and uniqueness rows. Parameters are passed as {@code $name} placeholders.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Runs a write statement, discarding any rows it returns.
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Runs a read (or a write with a RETURN clause) and hands back one map per row,
     * keyed by the RETURN aliases.
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the lookup indexes of the sky repositories; existing indexes are left alone.
     */
    void createIndexes();

    @Override
    void close();
}
