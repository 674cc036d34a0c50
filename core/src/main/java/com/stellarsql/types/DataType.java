package com.stellarsql.types;

/**
 * Sealed interface for all data types of the ADQL type system.
 *
 * <p>Types are attached to expressions by the annotator and to output
 * columns. Scalar types are singletons ({@code IntegerType.get()});
 * geometry types are one instance per {@link GeometryType.Shape}.
 *
 * <p>Common data types include:
 * <ul>
 *   <li>Numeric types: ShortType, IntegerType, LongType, FloatType, DoubleType</li>
 *   <li>Character and binary types: StringType, BinaryType</li>
 *   <li>Geometry types: POINT, CIRCLE, BOX, POLYGON, REGION</li>
 *   <li>NullType, the type of the NULL literal</li>
 * </ul>
 */
public sealed interface DataType permits ScalarType, GeometryType {

    /**
     * Returns the lower-case name used in messages, e.g. {@code double}.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns the ADQL name reported in output metadata.
     *
     * @return the ADQL type name
     */
    String adqlName();

    /**
     * Returns the PostgreSQL type used for this type in generated SQL.
     *
     * @return the backend type name
     */
    String postgresName();

    /**
     * Returns the storage size in bytes, or -1 for variable-length types.
     *
     * @return the size in bytes
     */
    default int defaultSize() {
        return -1;
    }
}
