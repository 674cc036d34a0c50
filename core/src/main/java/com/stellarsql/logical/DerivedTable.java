package com.stellarsql.logical;

import com.stellarsql.parser.SourcePosition;

import java.util.Locale;
import java.util.Objects;

/**
 * A parenthesized query in a FROM clause. ADQL requires the alias.
 */
public final class DerivedTable implements TableReference {

    private final QueryExpression query;
    private final String alias;
    private final boolean aliasDelimited;
    private final SourcePosition position;

    public DerivedTable(QueryExpression query, String alias, boolean aliasDelimited, SourcePosition position) {
        if (alias == null || alias.isEmpty()) {
            throw new IllegalArgumentException("Derived table needs an alias");
        }
        this.query = Objects.requireNonNull(query, "query");
        this.alias = alias;
        this.aliasDelimited = aliasDelimited;
        this.position = position != null ? position : SourcePosition.UNKNOWN;
    }

    public QueryExpression query() {
        return query;
    }

    public String alias() {
        return alias;
    }

    public boolean aliasDelimited() {
        return aliasDelimited;
    }

    public String rangeName() {
        return aliasDelimited ? alias : alias.toLowerCase(Locale.ROOT);
    }

    public DerivedTable withQuery(QueryExpression newQuery) {
        return new DerivedTable(newQuery, alias, aliasDelimited, position);
    }

    @Override
    public SourcePosition position() {
        return position;
    }

    @Override
    public <R, C> R accept(TableReferenceVisitor<R, C> visitor, C context) {
        return visitor.visitDerivedTable(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof DerivedTable)) {
            return false;
        }
        DerivedTable that = (DerivedTable) obj;
        return alias.equals(that.alias) && query.equals(that.query);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, alias);
    }

    @Override
    public String toString() {
        return "(" + query + ") AS " + alias;
    }
}
