package com.stellarsql.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Catalog description of one table: its schema-qualified name, its columns
 * in declaration order, the primary key and the position columns covered by
 * a q3c spatial index.
 */
public final class TableMeta {

    private final String schema;
    private final String name;
    private final List<ColumnMeta> columns;
    private final Set<String> primaryKey;
    private final List<SpatialIndex> spatialIndexes;
    private final boolean caseSensitive;

    private TableMeta(Builder builder) {
        this.schema = builder.schema;
        this.name = builder.name;
        this.columns = Collections.unmodifiableList(new ArrayList<>(builder.columns));
        Set<String> pk = new LinkedHashSet<>();
        for (ColumnMeta column : columns) {
            if (column.primaryKey()) {
                pk.add(column.name());
            }
        }
        this.primaryKey = Collections.unmodifiableSet(pk);
        this.spatialIndexes = List.copyOf(builder.spatialIndexes);
        this.caseSensitive = builder.caseSensitive;
    }

    public static Builder builder(String schema, String name) {
        return new Builder(schema, name);
    }

    /**
     * Returns the schema name.
     *
     * @return the schema, or null for tables without a schema
     */
    public String schema() {
        return schema;
    }

    public String name() {
        return name;
    }

    /**
     * Returns the name as written in SQL: {@code schema.table} or {@code table}.
     *
     * @return the qualified name
     */
    public String qualifiedName() {
        return schema == null ? name : schema + "." + name;
    }

    public List<ColumnMeta> columns() {
        return columns;
    }

    public Set<String> primaryKey() {
        return primaryKey;
    }

    public List<SpatialIndex> spatialIndexes() {
        return spatialIndexes;
    }

    public boolean caseSensitive() {
        return caseSensitive;
    }

    /**
     * Finds a column by name, ignoring case.
     *
     * @param columnName the column name
     * @return the column, if present
     */
    public Optional<ColumnMeta> column(String columnName) {
        for (ColumnMeta column : columns) {
            if (column.name().equalsIgnoreCase(columnName)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    /**
     * Finds the spatial index covering the given longitude/latitude columns.
     *
     * @param lonColumn the longitude (RA) column name
     * @param latColumn the latitude (Dec) column name
     * @return the index, if the pair is indexed
     */
    public Optional<SpatialIndex> spatialIndex(String lonColumn, String latColumn) {
        for (SpatialIndex index : spatialIndexes) {
            if (index.lonColumn().equalsIgnoreCase(lonColumn)
                    && index.latColumn().equalsIgnoreCase(latColumn)) {
                return Optional.of(index);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "TableMeta(" + qualifiedName() + ", " + columns.size() + " columns)";
    }

    /**
     * A q3c index over a pair of position columns, in degrees.
     *
     * @param lonColumn the longitude (RA) column
     * @param latColumn the latitude (Dec) column
     */
    public record SpatialIndex(String lonColumn, String latColumn) {
    }

    /**
     * Builder for {@link TableMeta}.
     */
    public static final class Builder {

        private final String schema;
        private final String name;
        private final List<ColumnMeta> columns = new ArrayList<>();
        private final List<SpatialIndex> spatialIndexes = new ArrayList<>();
        private boolean caseSensitive;

        private Builder(String schema, String name) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Table name must not be null or empty");
            }
            this.schema = schema;
            this.name = name;
        }

        public Builder column(ColumnMeta column) {
            for (ColumnMeta existing : columns) {
                if (existing.name().toLowerCase(Locale.ROOT).equals(column.name().toLowerCase(Locale.ROOT))) {
                    throw new IllegalArgumentException(
                        "Duplicate column " + column.name() + " in table " + name);
                }
            }
            columns.add(column);
            return this;
        }

        public Builder spatialIndex(String lonColumn, String latColumn) {
            spatialIndexes.add(new SpatialIndex(lonColumn, latColumn));
            return this;
        }

        public Builder caseSensitive(boolean caseSensitive) {
            this.caseSensitive = caseSensitive;
            return this;
        }

        public TableMeta build() {
            for (SpatialIndex index : spatialIndexes) {
                requireColumn(index.lonColumn());
                requireColumn(index.latColumn());
            }
            return new TableMeta(this);
        }

        private void requireColumn(String columnName) {
            for (ColumnMeta column : columns) {
                if (column.name().equalsIgnoreCase(columnName)) {
                    return;
                }
            }
            throw new IllegalArgumentException(
                "Spatial index column " + columnName + " is not a column of " + name);
        }
    }
}
