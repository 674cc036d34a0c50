package com.stellarsql.logical;

import com.stellarsql.parser.SourcePosition;

import java.util.Objects;

/**
 * {@code *} or {@code qualifier.*} in a select list. The annotator replaces
 * it with explicit column references.
 */
public final class AllColumns implements SelectItem {

    private final String qualifier;
    private final SourcePosition position;

    public AllColumns(String qualifier, SourcePosition position) {
        this.qualifier = qualifier;
        this.position = position != null ? position : SourcePosition.UNKNOWN;
    }

    /**
     * Returns the qualifier of {@code t.*}.
     *
     * @return the qualifier, or null for a bare {@code *}
     */
    public String qualifier() {
        return qualifier;
    }

    @Override
    public SourcePosition position() {
        return position;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof AllColumns && Objects.equals(qualifier, ((AllColumns) obj).qualifier);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(qualifier);
    }

    @Override
    public String toString() {
        return qualifier == null ? "*" : qualifier + ".*";
    }
}
