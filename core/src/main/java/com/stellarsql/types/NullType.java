package com.stellarsql.types;

/**
 * Type of the NULL literal. Unifies with every other type, and is reported
 * as VARCHAR when it reaches an output column.
 */
public final class NullType extends ScalarType {

    private static final NullType INSTANCE = new NullType();

    private NullType() {
        super("null", "VARCHAR", "text", NOT_NUMERIC, -1);
    }

    public static NullType get() {
        return INSTANCE;
    }
}
