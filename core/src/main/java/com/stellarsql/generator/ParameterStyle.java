package com.stellarsql.generator;

/**
 * Placeholder syntax for bound parameters in generated SQL.
 */
public enum ParameterStyle {

    /** JDBC style: every parameter is {@code ?}. */
    POSITIONAL,

    /** PostgreSQL protocol style: {@code $1}, {@code $2}, ... */
    NUMBERED;

    /**
     * Returns the placeholder for a parameter.
     *
     * @param index the 1-based parameter index
     * @return the placeholder text
     */
    public String placeholder(int index) {
        return this == POSITIONAL ? "?" : "$" + index;
    }
}
