package com.stellarsql.types;

/**
 * ADQL INTEGER, also the type of integer literals that fit in 32 bits.
 */
public final class IntegerType extends ScalarType {

    private static final IntegerType INSTANCE = new IntegerType();

    private IntegerType() {
        super("integer", "INTEGER", "integer", 2, 4);
    }

    public static IntegerType get() {
        return INSTANCE;
    }
}
