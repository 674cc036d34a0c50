package com.stellarsql.expression;

import com.stellarsql.parser.SourcePosition;
import com.stellarsql.types.FieldInfo;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A reference to a column, optionally qualified ({@code t.ra},
 * {@code schema.table.ra}).
 *
 * <p>Before annotation the reference is purely syntactic. The annotator
 * attaches a {@link ColumnBinding}; equality of bound references compares
 * the bindings, so {@code ra} and {@code t.ra} are equal when they resolve
 * to the same column.
 */
public final class ColumnReference implements Expression {

    private final String qualifier;
    private final String name;
    private final boolean delimited;
    private final ColumnBinding binding;
    private final FieldInfo info;
    private final SourcePosition position;

    public ColumnReference(String qualifier, String name, boolean delimited, SourcePosition position) {
        this(qualifier, name, delimited, null, null, position);
    }

    private ColumnReference(String qualifier, String name, boolean delimited,
                            ColumnBinding binding, FieldInfo info, SourcePosition position) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Column name must not be null or empty");
        }
        this.qualifier = qualifier;
        this.name = name;
        this.delimited = delimited;
        this.binding = binding;
        this.info = info;
        this.position = position != null ? position : SourcePosition.UNKNOWN;
    }

    public static ColumnReference of(String name) {
        return new ColumnReference(null, name, false, SourcePosition.UNKNOWN);
    }

    public static ColumnReference of(String qualifier, String name) {
        return new ColumnReference(qualifier, name, false, SourcePosition.UNKNOWN);
    }

    /**
     * Returns the qualifier as written.
     *
     * @return the qualifier, or null for unqualified references
     */
    public String qualifier() {
        return qualifier;
    }

    public String name() {
        return name;
    }

    /**
     * Returns true if the name was written as a delimited ("quoted") identifier.
     *
     * @return whether the name is delimited
     */
    public boolean delimited() {
        return delimited;
    }

    /**
     * Returns the resolution attached by the annotator.
     *
     * @return the binding, or null before annotation
     */
    public ColumnBinding binding() {
        return binding;
    }

    public ColumnReference withBinding(ColumnBinding newBinding, FieldInfo newInfo) {
        return new ColumnReference(qualifier, name, delimited, newBinding, newInfo, position);
    }

    @Override
    public SourcePosition position() {
        return position;
    }

    @Override
    public FieldInfo info() {
        return info;
    }

    @Override
    public ColumnReference withInfo(FieldInfo newInfo) {
        return new ColumnReference(qualifier, name, delimited, binding, newInfo, position);
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitColumnReference(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ColumnReference)) {
            return false;
        }
        ColumnReference that = (ColumnReference) obj;
        if (binding != null && that.binding != null) {
            return Objects.equals(binding.rangeName(), that.binding.rangeName())
                && binding.columnName().equals(that.binding.columnName())
                && binding.scopeDepth() == that.binding.scopeDepth();
        }
        return binding == null && that.binding == null
            && Objects.equals(normalize(qualifier, delimited), normalize(that.qualifier, that.delimited))
            && normalize(name, delimited).equals(normalize(that.name, that.delimited));
    }

    @Override
    public int hashCode() {
        if (binding != null) {
            return binding.columnName().toLowerCase(Locale.ROOT).hashCode();
        }
        return normalize(name, delimited).hashCode();
    }

    private static String normalize(String identifier, boolean delimited) {
        if (identifier == null) {
            return null;
        }
        return delimited ? identifier : identifier.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return qualifier == null ? name : qualifier + "." + name;
    }
}
