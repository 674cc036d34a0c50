package com.stellarsql.types;

/**
 * ADQL BIGINT. Integer arithmetic folded by the postprocessor is carried
 * out in this width.
 */
public final class LongType extends ScalarType {

    private static final LongType INSTANCE = new LongType();

    private LongType() {
        super("bigint", "BIGINT", "bigint", 3, 8);
    }

    public static LongType get() {
        return INSTANCE;
    }
}
