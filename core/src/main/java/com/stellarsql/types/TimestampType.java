package com.stellarsql.types;

/** ADQL TIMESTAMP. Catalog DATE columns are read as timestamps too. */
public final class TimestampType extends ScalarType {

    private static final TimestampType INSTANCE = new TimestampType();

    private TimestampType() {
        super("timestamp", "TIMESTAMP", "timestamp", NOT_NUMERIC, 8);
    }

    public static TimestampType get() {
        return INSTANCE;
    }
}
