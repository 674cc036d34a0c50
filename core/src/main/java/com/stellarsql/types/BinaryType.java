package com.stellarsql.types;

/** ADQL BLOB, stored as {@code bytea}. */
public final class BinaryType extends ScalarType {

    private static final BinaryType INSTANCE = new BinaryType();

    private BinaryType() {
        super("blob", "BLOB", "bytea", NOT_NUMERIC, -1);
    }

    public static BinaryType get() {
        return INSTANCE;
    }
}
