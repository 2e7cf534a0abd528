package com.sky.association.catalog;

import com.sky.association.catalog.CatalogFormat.Column;
import com.sky.association.catalog.CatalogFormat.Field;
import com.sky.association.core.model.CatalogSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses catalog text files into normalized {@link CatalogSource} records
 * following a {@link CatalogFormat}.
 */
public class CatalogReader {
    private static final Logger log = LoggerFactory.getLogger(CatalogReader.class);

    private static final Set<String> MISSING_TOKENS = Set.of("", "--", "nan", "NaN", "None", "null", "-");

    private final CatalogRegistry registry;

    public CatalogReader(CatalogRegistry registry) {
        this.registry = registry;
    }

    /**
     * Reads every data line. Sources without an id column are numbered from 1 in file order.
     *
     * @throws CatalogFormatException on a malformed line
     * @throws UnknownCatalogException if the format's catalog is not registered
     */
    public List<CatalogSource> read(Reader input, CatalogFormat format) throws IOException {
        int catalogId = registry.idOf(format.getName());
        Pattern delimiter = Pattern.compile(format.getDelimiter());
        List<Map<Field, Double>> rows = new ArrayList<>();
        List<String> names = new ArrayList<>();

        try (BufferedReader reader = new BufferedReader(input)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (lineNumber <= format.getHeaderLines() || line.isBlank()) {
                    continue;
                }
                if (format.getCommentPrefix() != null && line.stripLeading().startsWith(format.getCommentPrefix())) {
                    continue;
                }
                String[] tokens = delimiter.split(line.strip());
                rows.add(parseFields(tokens, format, lineNumber));
                names.add(parseName(tokens, format));
            }
        }

        fillMedians(rows, format.getMedianFilled());

        List<CatalogSource> sources = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Map<Field, Double> v = rows.get(i);
            long id = v.containsKey(Field.ID) && !Double.isNaN(v.get(Field.ID)) ? v.get(Field.ID).longValue() : i + 1L;
            sources.add(new CatalogSource(id, catalogId, names.get(i),
                    v.get(Field.RA), v.get(Field.E_RA), v.get(Field.DEC), v.get(Field.E_DEC),
                    value(v, Field.TOTAL_FLUX), value(v, Field.E_TOTAL_FLUX),
                    value(v, Field.PEAK_FLUX), value(v, Field.E_PEAK_FLUX),
                    value(v, Field.MAJ), value(v, Field.MIN), value(v, Field.PA), value(v, Field.RMS)));
        }
        log.info("catalog.read catalog={} sources={}", format.getName(), sources.size());
        return sources;
    }

    private Map<Field, Double> parseFields(String[] tokens, CatalogFormat format, int lineNumber) {
        Map<Field, Double> values = new EnumMap<>(Field.class);
        for (Field field : Field.values()) {
            Column column = format.column(field);
            if (column == null) {
                continue;
            }
            if (column.index() >= tokens.length) {
                throw new CatalogFormatException(String.format("%s line %d: expected column %d for %s, found %d tokens",
                        format.getName(), lineNumber, column.index(), field, tokens.length));
            }
            String token = tokens[column.index()];
            double parsed;
            try {
                parsed = parseValue(token, column.unit());
            } catch (NumberFormatException e) {
                throw new CatalogFormatException(String.format("%s line %d: bad value '%s' for %s",
                        format.getName(), lineNumber, token, field), e);
            }
            if (Double.isNaN(parsed) && isPositional(field) && !format.getMedianFilled().contains(field)) {
                throw new CatalogFormatException(String.format("%s line %d: missing %s",
                        format.getName(), lineNumber, field));
            }
            values.put(field, parsed);
        }
        return values;
    }

    private static boolean isPositional(Field field) {
        return field == Field.RA || field == Field.DEC || field == Field.E_RA || field == Field.E_DEC;
    }

    static double parseValue(String token, CatalogFormat.Unit unit) {
        if (MISSING_TOKENS.contains(token)) {
            return Double.NaN;
        }
        if (unit.isSexagesimal()) {
            return parseSexagesimal(token) * unit.factor();
        }
        return Double.parseDouble(token) * unit.factor();
    }

    /**
     * Parses "dd:mm:ss.s" (or with spaces) into decimal units; the sign applies to the whole value.
     */
    static double parseSexagesimal(String token) {
        String[] parts = token.trim().split("[:\\s]+");
        double value = 0;
        double scale = 1;
        for (String part : parts) {
            value += Math.abs(Double.parseDouble(part)) / scale;
            scale *= 60;
        }
        return token.trim().startsWith("-") ? -value : value;
    }

    private String parseName(String[] tokens, CatalogFormat format) {
        if (format.getNameColumns().isEmpty()) {
            return null;
        }
        return format.getNameColumns().stream()
                .filter(i -> i < tokens.length)
                .map(i -> tokens[i])
                .collect(Collectors.joining("_"));
    }

    private void fillMedians(List<Map<Field, Double>> rows, Set<Field> fields) {
        for (Field field : fields) {
            double[] present = rows.stream()
                    .map(r -> r.get(field))
                    .filter(v -> v != null && !Double.isNaN(v))
                    .mapToDouble(Double::doubleValue)
                    .sorted()
                    .toArray();
            if (present.length == 0) {
                continue;
            }
            double median = median(present);
            for (Map<Field, Double> row : rows) {
                Double v = row.get(field);
                if (v == null || Double.isNaN(v)) {
                    row.put(field, median);
                }
            }
        }
    }

    static double median(double[] sorted) {
        int n = sorted.length;
        return n % 2 == 1 ? sorted[n / 2] : (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
    }

    private static double value(Map<Field, Double> values, Field field) {
        return values.getOrDefault(field, Double.NaN);
    }
}
