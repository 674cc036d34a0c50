package com.stellarsql.types;

import java.util.Locale;

/**
 * Maps catalog type strings to {@link DataType} and back.
 *
 * <p>Catalog metadata may use ADQL/VOTable type names ({@code DOUBLE},
 * {@code VARCHAR(20)}, {@code POINT}) or PostgreSQL names ({@code float8},
 * {@code text}, {@code spoint}); both are accepted.
 *
 * <p>Examples:
 * <pre>
 *   "INTEGER"          → IntegerType
 *   "double precision" → DoubleType
 *   "VARCHAR(32)"      → StringType
 *   "spoint"           → POINT
 * </pre>
 *
 * @see DataType
 */
public class TypeMapper {

    private TypeMapper() {
    }

    /**
     * Converts a catalog type string to a DataType.
     *
     * @param typeName the type string from the catalog
     * @return the data type
     * @throws IllegalArgumentException if the type string is not recognized
     */
    public static DataType fromCatalogType(String typeName) {
        if (typeName == null || typeName.isBlank()) {
            throw new IllegalArgumentException("typeName must not be null or empty");
        }

        String normalized = typeName.trim().toUpperCase(Locale.ROOT);
        int paren = normalized.indexOf('(');
        if (paren > 0) {
            normalized = normalized.substring(0, paren).trim();
        }
        if (normalized.endsWith("[]")) {
            // arrays of numbers are opaque to ADQL and travel as strings
            return StringType.get();
        }

        switch (normalized) {
            case "SMALLINT":
            case "INT2":
                return ShortType.get();
            case "INTEGER":
            case "INT":
            case "INT4":
                return IntegerType.get();
            case "BIGINT":
            case "INT8":
                return LongType.get();
            case "REAL":
            case "FLOAT4":
            case "FLOAT":
                return FloatType.get();
            case "DOUBLE":
            case "DOUBLE PRECISION":
            case "FLOAT8":
            case "NUMERIC":
                return DoubleType.get();
            case "CHAR":
            case "CHARACTER":
            case "VARCHAR":
            case "CHARACTER VARYING":
            case "TEXT":
            case "UNICODECHAR":
            case "CLOB":
                return StringType.get();
            case "TIMESTAMP":
            case "DATE":
                return TimestampType.get();
            case "BLOB":
            case "BINARY":
            case "VARBINARY":
            case "BYTEA":
                return BinaryType.get();
            case "BOOLEAN":
            case "BOOL":
                return BooleanType.get();
            case "POINT":
            case "SPOINT":
                return GeometryType.of(GeometryType.Shape.POINT);
            case "CIRCLE":
            case "SCIRCLE":
                return GeometryType.of(GeometryType.Shape.CIRCLE);
            case "BOX":
            case "SBOX":
                return GeometryType.of(GeometryType.Shape.BOX);
            case "POLYGON":
            case "SPOLY":
                return GeometryType.of(GeometryType.Shape.POLYGON);
            case "REGION":
            case "SMOC":
                return GeometryType.of(GeometryType.Shape.REGION);
            default:
                throw new IllegalArgumentException("Unsupported catalog type: " + typeName);
        }
    }

    /**
     * Returns the ADQL (TAP_SCHEMA) name of a data type.
     *
     * @param type the data type
     * @return the ADQL type name
     */
    public static String toAdqlType(DataType type) {
        return type.adqlName();
    }

    /**
     * Returns the PostgreSQL type name used for CASTs in generated SQL.
     *
     * @param type the data type
     * @return the PostgreSQL type name
     */
    public static String toPostgresType(DataType type) {
        return type.postgresName();
    }
}
