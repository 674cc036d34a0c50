package com.stellarsql.expression;

import com.stellarsql.logical.QueryExpression;
import com.stellarsql.parser.SourcePosition;
import com.stellarsql.types.FieldInfo;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code EXISTS (subquery)}. {@code NOT EXISTS} is a NOT over this node.
 */
public final class ExistsSubquery implements Expression {

    private final QueryExpression query;
    private final FieldInfo info;
    private final SourcePosition position;

    public ExistsSubquery(QueryExpression query, SourcePosition position) {
        this(query, null, position);
    }

    private ExistsSubquery(QueryExpression query, FieldInfo info, SourcePosition position) {
        this.query = Objects.requireNonNull(query, "query");
        this.info = info;
        this.position = position != null ? position : SourcePosition.UNKNOWN;
    }

    public QueryExpression query() {
        return query;
    }

    public ExistsSubquery withQuery(QueryExpression newQuery) {
        return new ExistsSubquery(newQuery, info, position);
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
    public ExistsSubquery withInfo(FieldInfo newInfo) {
        return new ExistsSubquery(query, newInfo, position);
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitExists(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof ExistsSubquery && query.equals(((ExistsSubquery) obj).query);
    }

    @Override
    public int hashCode() {
        return query.hashCode();
    }

    @Override
    public String toString() {
        return "EXISTS (" + query + ")";
    }
}
