package com.stellarsql.logical;

import com.stellarsql.expression.Expression;
import com.stellarsql.parser.SourcePosition;

import java.util.Objects;

/**
 * A select-list value with an optional {@code AS alias}.
 */
public final class DerivedColumn implements SelectItem {

    private final Expression expression;
    private final String alias;
    private final boolean aliasDelimited;

    public DerivedColumn(Expression expression, String alias, boolean aliasDelimited) {
        this.expression = Objects.requireNonNull(expression, "expression");
        this.alias = alias;
        this.aliasDelimited = aliasDelimited;
    }

    public static DerivedColumn of(Expression expression) {
        return new DerivedColumn(expression, null, false);
    }

    public Expression expression() {
        return expression;
    }

    /**
     * Returns the alias as written.
     *
     * @return the alias, or null if none
     */
    public String alias() {
        return alias;
    }

    public boolean aliasDelimited() {
        return aliasDelimited;
    }

    public DerivedColumn withExpression(Expression newExpression) {
        return newExpression == expression ? this : new DerivedColumn(newExpression, alias, aliasDelimited);
    }

    public DerivedColumn withAlias(String newAlias, boolean delimited) {
        return new DerivedColumn(expression, newAlias, delimited);
    }

    @Override
    public SourcePosition position() {
        return expression.position();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof DerivedColumn)) {
            return false;
        }
        DerivedColumn that = (DerivedColumn) obj;
        return aliasDelimited == that.aliasDelimited && expression.equals(that.expression)
            && Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, alias);
    }

    @Override
    public String toString() {
        return alias == null ? expression.toString() : expression + " AS " + alias;
    }
}
