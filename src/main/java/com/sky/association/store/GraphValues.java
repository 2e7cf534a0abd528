package com.sky.association.store;

import java.util.List;
import java.util.Map;

/**
 * Conversions of raw graph result values.
 */
final class GraphValues {

    private GraphValues() {
    }

    static Integer toInteger(Object value) {
        return value instanceof Number n ? n.intValue() : null;
    }

    static int toInt(Object value) {
        Integer i = toInteger(value);
        return i != null ? i : 0;
    }

    static Long toLongOrNull(Object value) {
        return value instanceof Number n ? n.longValue() : null;
    }

    static long toLong(Object value) {
        Long l = toLongOrNull(value);
        return l != null ? l : 0L;
    }

    static Double toDoubleOrNull(Object value) {
        return value instanceof Number n ? n.doubleValue() : null;
    }

    static double toDouble(Object value) {
        Double d = toDoubleOrNull(value);
        return d != null ? d : 0.0;
    }

    static String toStr(Object value) {
        return value != null ? value.toString() : null;
    }

    static boolean toBool(Object value) {
        return value instanceof Boolean b ? b : Boolean.parseBoolean(String.valueOf(value));
    }

    /**
     * Reads a single numeric column of the first row, or 0 when there is none.
     */
    static long firstLong(List<Map<String, Object>> rows, String column) {
        if (rows.isEmpty()) {
            return 0L;
        }
        return toLong(rows.get(0).get(column));
    }

    /**
     * Returns the next value of a named counter held in a {@code :Sequence} node.
     */
    static long nextSequenceValue(GraphConnection connection, String name) {
        String query = """
                MERGE (s:Sequence {name: $name})
                ON CREATE SET s.value = 0
                SET s.value = s.value + 1
                RETURN s.value as value
                """;
        return firstLong(connection.query(query, Map.of("name", name)), "value");
    }

    /**
     * Raises a named counter so it never hands out an id at or below {@code floor}.
     */
    static void raiseSequence(GraphConnection connection, String name, long floor) {
        String query = """
                MERGE (s:Sequence {name: $name})
                ON CREATE SET s.value = $floor
                SET s.value = CASE WHEN s.value < $floor THEN $floor ELSE s.value END
                """;
        connection.execute(query, Map.of("name", name, "floor", floor));
    }
}
