package com.sky.association.catalog;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Column layout of one catalog text format.
 * A single {@link CatalogReader} handles every catalog given its format.
 */
public final class CatalogFormat {

    /**
     * Normalized fields of a catalog entry.
     */
    public enum Field {
        ID, RA, E_RA, DEC, E_DEC, TOTAL_FLUX, E_TOTAL_FLUX, PEAK_FLUX, E_PEAK_FLUX, MAJ, MIN, PA, RMS
    }

    /**
     * Conversion from the file's unit to the normalized one.
     */
    public enum Unit {
        AS_IS(1.0),
        ARCSEC_TO_DEGREES(1.0 / 3600.0),
        ARCMIN_TO_DEGREES(1.0 / 60.0),
        HOURS_TO_DEGREES(15.0),
        JY_TO_MJY(1000.0),
        /** Sexagesimal "hh:mm:ss.s" or "hh mm ss.s" hours, to degrees. */
        SEXAGESIMAL_HOURS(15.0),
        /** Sexagesimal "dd:mm:ss.s" degrees. */
        SEXAGESIMAL_DEGREES(1.0);

        private final double factor;

        Unit(double factor) {
            this.factor = factor;
        }

        public double factor() {
            return factor;
        }

        public boolean isSexagesimal() {
            return this == SEXAGESIMAL_HOURS || this == SEXAGESIMAL_DEGREES;
        }
    }

    /**
     * Location of a field: zero-based token index and its unit.
     */
    public record Column(int index, Unit unit) {
        public Column {
            if (index < 0) {
                throw new IllegalArgumentException("Column index must be >= 0");
            }
            Objects.requireNonNull(unit, "unit is required");
        }
    }

    private final String name;
    private final String fileName;
    private final String delimiter;
    private final int headerLines;
    private final String commentPrefix;
    private final List<Integer> nameColumns;
    private final Map<Field, Column> columns;
    private final Set<Field> medianFilled;

    private CatalogFormat(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.fileName = builder.fileName != null ? builder.fileName : builder.name + "_psql.txt";
        this.delimiter = builder.delimiter;
        this.headerLines = builder.headerLines;
        this.commentPrefix = builder.commentPrefix;
        this.nameColumns = List.copyOf(builder.nameColumns);
        this.columns = Collections.unmodifiableMap(new EnumMap<>(builder.columns));
        this.medianFilled = Collections.unmodifiableSet(builder.medianFilled.isEmpty()
                ? EnumSet.noneOf(Field.class) : EnumSet.copyOf(builder.medianFilled));
        for (Field required : List.of(Field.RA, Field.DEC, Field.E_RA, Field.E_DEC)) {
            if (!columns.containsKey(required)) {
                throw new IllegalArgumentException("Format " + name + " has no column for " + required);
            }
        }
    }

    /**
     * Whitespace separated normalized layout shared by every prepared catalog file:
     * {@code id name ra e_ra dec e_dec total e_total peak e_peak maj e_maj min e_min pa e_pa rms field catalog_id},
     * positions and errors in degrees, fluxes in mJy.
     */
    public static CatalogFormat normalized(String catalogName) {
        return builder(catalogName)
                .fileName(catalogName + "_psql.txt")
                .column(Field.ID, 0, Unit.AS_IS)
                .nameColumns(1)
                .column(Field.RA, 2, Unit.AS_IS)
                .column(Field.E_RA, 3, Unit.AS_IS)
                .column(Field.DEC, 4, Unit.AS_IS)
                .column(Field.E_DEC, 5, Unit.AS_IS)
                .column(Field.TOTAL_FLUX, 6, Unit.AS_IS)
                .column(Field.E_TOTAL_FLUX, 7, Unit.AS_IS)
                .column(Field.PEAK_FLUX, 8, Unit.AS_IS)
                .column(Field.E_PEAK_FLUX, 9, Unit.AS_IS)
                .column(Field.MAJ, 10, Unit.AS_IS)
                .column(Field.MIN, 12, Unit.AS_IS)
                .column(Field.PA, 14, Unit.AS_IS)
                .column(Field.RMS, 16, Unit.AS_IS)
                .build();
    }

    /**
     * TGSS ADR1 7-sigma TSV: two-token name, positions in degrees with errors in arcsec,
     * fluxes in mJy, one header line.
     */
    public static CatalogFormat tgss() {
        return builder("tgss")
                .fileName("TGSSADR1_7sigma_catalog.tsv")
                .headerLines(1)
                .nameColumns(0, 1)
                .column(Field.RA, 2, Unit.AS_IS)
                .column(Field.E_RA, 3, Unit.ARCSEC_TO_DEGREES)
                .column(Field.DEC, 4, Unit.AS_IS)
                .column(Field.E_DEC, 5, Unit.ARCSEC_TO_DEGREES)
                .column(Field.TOTAL_FLUX, 6, Unit.AS_IS)
                .column(Field.E_TOTAL_FLUX, 7, Unit.AS_IS)
                .column(Field.PEAK_FLUX, 8, Unit.AS_IS)
                .column(Field.E_PEAK_FLUX, 9, Unit.AS_IS)
                .column(Field.MAJ, 10, Unit.AS_IS)
                .column(Field.MIN, 12, Unit.AS_IS)
                .column(Field.PA, 14, Unit.AS_IS)
                .column(Field.RMS, 16, Unit.AS_IS)
                .build();
    }

    public String getName() {
        return name;
    }

    public String getFileName() {
        return fileName;
    }

    public String getDelimiter() {
        return delimiter;
    }

    public int getHeaderLines() {
        return headerLines;
    }

    public String getCommentPrefix() {
        return commentPrefix;
    }

    public List<Integer> getNameColumns() {
        return nameColumns;
    }

    public Column column(Field field) {
        return columns.get(field);
    }

    public boolean hasColumn(Field field) {
        return columns.containsKey(field);
    }

    /**
     * Fields whose missing values are replaced by the median of the catalog.
     */
    public Set<Field> getMedianFilled() {
        return medianFilled;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private String fileName;
        private String delimiter = "\\s+";
        private int headerLines = 0;
        private String commentPrefix = "#";
        private List<Integer> nameColumns = List.of();
        private final Map<Field, Column> columns = new EnumMap<>(Field.class);
        private final Set<Field> medianFilled = EnumSet.noneOf(Field.class);

        private Builder(String name) {
            this.name = name;
        }

        public Builder fileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        /**
         * Regular expression separating tokens. Defaults to whitespace.
         */
        public Builder delimiter(String delimiter) {
            this.delimiter = Objects.requireNonNull(delimiter);
            return this;
        }

        public Builder headerLines(int headerLines) {
            if (headerLines < 0) {
                throw new IllegalArgumentException("headerLines must be >= 0");
            }
            this.headerLines = headerLines;
            return this;
        }

        public Builder commentPrefix(String commentPrefix) {
            this.commentPrefix = commentPrefix;
            return this;
        }

        /**
         * Tokens joined with '_' to form the source name.
         */
        public Builder nameColumns(Integer... indexes) {
            this.nameColumns = List.of(indexes);
            return this;
        }

        public Builder column(Field field, int index, Unit unit) {
            columns.put(field, new Column(index, unit));
            return this;
        }

        public Builder medianFill(Field... fields) {
            medianFilled.addAll(List.of(fields));
            return this;
        }

        public CatalogFormat build() {
            return new CatalogFormat(this);
        }
    }
}
