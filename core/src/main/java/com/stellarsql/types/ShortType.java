package com.stellarsql.types;

/** ADQL SMALLINT. */
public final class ShortType extends ScalarType {

    private static final ShortType INSTANCE = new ShortType();

    private ShortType() {
        super("smallint", "SMALLINT", "smallint", 1, 2);
    }

    public static ShortType get() {
        return INSTANCE;
    }
}
