package com.stellarsql.functions;

/**
 * Broad function classes. The annotator treats {@link #AGGREGATE} specially
 * for grouping checks; the morpher rewrites {@link #GEOMETRY} functions itself.
 */
public enum FunctionCategory {
    MATH,
    TRIGONOMETRIC,
    STRING,
    CONDITIONAL,
    AGGREGATE,
    GEOMETRY,
    USER_DEFINED;

    public boolean isAggregate() {
        return this == AGGREGATE;
    }
}
