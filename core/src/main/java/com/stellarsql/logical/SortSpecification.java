package com.stellarsql.logical;

import com.stellarsql.expression.Expression;
import com.stellarsql.parser.SourcePosition;

import java.util.Objects;

/**
 * One ORDER BY key: an expression or a 1-based select-list ordinal, plus
 * the direction.
 */
public final class SortSpecification {

    private final Expression key;
    private final int ordinal;
    private final boolean descending;
    private final SourcePosition position;

    private SortSpecification(Expression key, int ordinal, boolean descending, SourcePosition position) {
        this.key = key;
        this.ordinal = ordinal;
        this.descending = descending;
        this.position = position != null ? position : SourcePosition.UNKNOWN;
    }

    public static SortSpecification byExpression(Expression key, boolean descending) {
        Objects.requireNonNull(key, "key");
        return new SortSpecification(key, 0, descending, key.position());
    }

    public static SortSpecification byOrdinal(int ordinal, boolean descending) {
        return byOrdinal(ordinal, descending, SourcePosition.UNKNOWN);
    }

    public static SortSpecification byOrdinal(int ordinal, boolean descending, SourcePosition position) {
        if (ordinal < 1) {
            throw new IllegalArgumentException("Sort ordinal must be positive: " + ordinal);
        }
        return new SortSpecification(null, ordinal, descending, position);
    }

    /**
     * Returns the sort expression.
     *
     * @return the expression, or null for an ordinal key
     */
    public Expression key() {
        return key;
    }

    /**
     * Returns the 1-based select-list position.
     *
     * @return the ordinal, or 0 for an expression key
     */
    public int ordinal() {
        return ordinal;
    }

    public boolean isOrdinal() {
        return key == null;
    }

    public boolean descending() {
        return descending;
    }

    /** Where the key was written. */
    public SourcePosition position() {
        return position;
    }

    public SortSpecification withKey(Expression newKey) {
        return newKey == key ? this : byExpression(newKey, descending);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SortSpecification)) {
            return false;
        }
        SortSpecification that = (SortSpecification) obj;
        return ordinal == that.ordinal && descending == that.descending && Objects.equals(key, that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, ordinal, descending);
    }

    @Override
    public String toString() {
        return (isOrdinal() ? String.valueOf(ordinal) : key.toString()) + (descending ? " DESC" : " ASC");
    }
}
