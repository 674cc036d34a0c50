package com.stellarsql.catalog;

import com.stellarsql.types.DataType;
import com.stellarsql.types.GeometryType;
import com.stellarsql.types.TypeMapper;

import java.util.Objects;

/**
 * Catalog description of one table column.
 *
 * <p>Instances are immutable and shared between concurrent compilations.
 *
 * <p>Example usage:
 * <pre>
 *   ColumnMeta ra = ColumnMeta.builder("ra", DoubleType.get())
 *       .unit("deg")
 *       .ucd("pos.eq.ra;meta.main")
 *       .indexed(true)
 *       .build();
 * </pre>
 */
public final class ColumnMeta {

    private final String name;
    private final DataType type;
    private final String unit;
    private final String ucd;
    private final String description;
    private final boolean nullable;
    private final boolean primaryKey;
    private final boolean indexed;
    private final boolean caseSensitive;
    private final String frame;

    private ColumnMeta(Builder builder) {
        this.name = builder.name;
        this.type = builder.type;
        this.unit = builder.unit;
        this.ucd = builder.ucd;
        this.description = builder.description;
        this.nullable = builder.nullable;
        this.primaryKey = builder.primaryKey;
        this.indexed = builder.indexed;
        this.caseSensitive = builder.caseSensitive;
        this.frame = builder.frame;
    }

    public static Builder builder(String name, DataType type) {
        return new Builder(name, type);
    }

    /**
     * Starts a column whose type is given as a catalog type name such as
     * {@code DOUBLE PRECISION} or {@code spoint}.
     *
     * @throws IllegalArgumentException if the type name is not recognized
     */
    public static Builder builder(String name, String catalogType) {
        return new Builder(name, TypeMapper.fromCatalogType(catalogType));
    }

    public String name() {
        return name;
    }

    public DataType type() {
        return type;
    }

    public String unit() {
        return unit;
    }

    public String ucd() {
        return ucd;
    }

    public String description() {
        return description;
    }

    public boolean nullable() {
        return nullable;
    }

    public boolean primaryKey() {
        return primaryKey;
    }

    public boolean indexed() {
        return indexed;
    }

    /**
     * Returns true if the column's database name must be quoted because it
     * is not all lower case or not a regular identifier.
     *
     * @return whether the name is case sensitive
     */
    public boolean caseSensitive() {
        return caseSensitive;
    }

    /**
     * Returns true if the column holds a pgSphere geometry.
     *
     * @return whether the column is geometry-backed
     */
    public boolean geometryBacked() {
        return type instanceof GeometryType;
    }

    /**
     * Returns the coordinate frame of positional columns.
     *
     * @return the frame (e.g. {@code ICRS}), or null if not positional
     */
    public String frame() {
        return frame;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ColumnMeta)) {
            return false;
        }
        ColumnMeta that = (ColumnMeta) obj;
        return nullable == that.nullable
            && primaryKey == that.primaryKey
            && indexed == that.indexed
            && caseSensitive == that.caseSensitive
            && name.equals(that.name)
            && type.equals(that.type)
            && unit.equals(that.unit)
            && ucd.equals(that.ucd)
            && Objects.equals(frame, that.frame);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, unit, ucd);
    }

    @Override
    public String toString() {
        return String.format("ColumnMeta(%s %s%s)", name, type, unit.isEmpty() ? "" : " [" + unit + "]");
    }

    /**
     * Builder for {@link ColumnMeta}.
     */
    public static final class Builder {

        private final String name;
        private final DataType type;
        private String unit = "";
        private String ucd = "";
        private String description = "";
        private boolean nullable = true;
        private boolean primaryKey;
        private boolean indexed;
        private boolean caseSensitive;
        private String frame;

        private Builder(String name, DataType type) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Column name must not be null or empty");
            }
            this.name = name;
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder unit(String unit) {
            this.unit = unit == null ? "" : unit;
            return this;
        }

        public Builder ucd(String ucd) {
            this.ucd = ucd == null ? "" : ucd;
            return this;
        }

        public Builder description(String description) {
            this.description = description == null ? "" : description;
            return this;
        }

        public Builder nullable(boolean nullable) {
            this.nullable = nullable;
            return this;
        }

        public Builder primaryKey(boolean primaryKey) {
            this.primaryKey = primaryKey;
            if (primaryKey) {
                this.nullable = false;
            }
            return this;
        }

        public Builder indexed(boolean indexed) {
            this.indexed = indexed;
            return this;
        }

        public Builder caseSensitive(boolean caseSensitive) {
            this.caseSensitive = caseSensitive;
            return this;
        }

        public Builder frame(String frame) {
            this.frame = frame;
            return this;
        }

        public ColumnMeta build() {
            return new ColumnMeta(this);
        }
    }
}
