package com.stellarsql.types;

/**
 * Base class of the non-geometric ADQL types.
 *
 * <p>Each scalar type is a singleton carrying its ADQL (TAP_SCHEMA) name,
 * the PostgreSQL type used for it in generated SQL and, for numeric types,
 * its position in the widening order
 * {@code SMALLINT < INTEGER < BIGINT < REAL < DOUBLE}.
 */
public abstract sealed class ScalarType implements DataType
    permits BooleanType, ShortType, IntegerType, LongType, FloatType, DoubleType,
            StringType, TimestampType, BinaryType, NullType {

    /** Rank of types outside the numeric widening order. */
    static final int NOT_NUMERIC = 0;

    private final String typeName;
    private final String adqlName;
    private final String postgresName;
    private final int numericRank;
    private final int size;

    ScalarType(String typeName, String adqlName, String postgresName, int numericRank, int size) {
        this.typeName = typeName;
        this.adqlName = adqlName;
        this.postgresName = postgresName;
        this.numericRank = numericRank;
        this.size = size;
    }

    @Override
    public String typeName() {
        return typeName;
    }

    public String adqlName() {
        return adqlName;
    }

    public String postgresName() {
        return postgresName;
    }

    /**
     * Returns the position in the numeric widening order, starting at 1,
     * or {@link #NOT_NUMERIC}.
     *
     * @return the numeric rank
     */
    public int numericRank() {
        return numericRank;
    }

    public boolean isNumeric() {
        return numericRank != NOT_NUMERIC;
    }

    @Override
    public int defaultSize() {
        return size;
    }

    @Override
    public String toString() {
        return typeName;
    }
}
