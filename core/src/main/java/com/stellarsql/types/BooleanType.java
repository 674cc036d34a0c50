package com.stellarsql.types;

/**
 * Type of search conditions. ADQL has no boolean columns in TAP_SCHEMA, but
 * predicates and the comparison of pseudo-boolean spatial functions need a
 * type during annotation.
 */
public final class BooleanType extends ScalarType {

    private static final BooleanType INSTANCE = new BooleanType();

    private BooleanType() {
        super("boolean", "BOOLEAN", "boolean", NOT_NUMERIC, 1);
    }

    public static BooleanType get() {
        return INSTANCE;
    }
}
