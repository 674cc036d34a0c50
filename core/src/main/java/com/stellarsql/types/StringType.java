package com.stellarsql.types;

/**
 * ADQL VARCHAR and CHAR. Length limits from the catalog are not tracked;
 * PostgreSQL sees every string as {@code text}.
 */
public final class StringType extends ScalarType {

    private static final StringType INSTANCE = new StringType();

    private StringType() {
        super("varchar", "VARCHAR", "text", NOT_NUMERIC, -1);
    }

    public static StringType get() {
        return INSTANCE;
    }
}
