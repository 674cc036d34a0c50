package com.stellarsql.types;

/** ADQL REAL, single precision. */
public final class FloatType extends ScalarType {

    private static final FloatType INSTANCE = new FloatType();

    private FloatType() {
        super("real", "REAL", "real", 4, 4);
    }

    public static FloatType get() {
        return INSTANCE;
    }
}
