package com.stellarsql.types;

/**
 * ADQL DOUBLE. Exact numeric literals with a fraction or exponent get this
 * type, as do the results of the trigonometric and logarithmic functions.
 */
public final class DoubleType extends ScalarType {

    private static final DoubleType INSTANCE = new DoubleType();

    private DoubleType() {
        super("double", "DOUBLE", "double precision", 5, 8);
    }

    public static DoubleType get() {
        return INSTANCE;
    }
}
