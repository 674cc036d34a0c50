package com.stellarsql.expression;

import com.stellarsql.logical.QueryExpression;
import com.stellarsql.parser.SourcePosition;
import com.stellarsql.types.FieldInfo;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A parenthesized query used as a value. It must produce one column.
 */
public final class ScalarSubquery implements Expression {

    private final QueryExpression query;
    private final FieldInfo info;
    private final SourcePosition position;

    public ScalarSubquery(QueryExpression query, SourcePosition position) {
        this(query, null, position);
    }

    private ScalarSubquery(QueryExpression query, FieldInfo info, SourcePosition position) {
        this.query = Objects.requireNonNull(query, "query");
        this.info = info;
        this.position = position != null ? position : SourcePosition.UNKNOWN;
    }

    public QueryExpression query() {
        return query;
    }

    public ScalarSubquery withQuery(QueryExpression newQuery) {
        return new ScalarSubquery(newQuery, info, position);
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
    public ScalarSubquery withInfo(FieldInfo newInfo) {
        return new ScalarSubquery(query, newInfo, position);
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitScalarSubquery(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof ScalarSubquery && query.equals(((ScalarSubquery) obj).query);
    }

    @Override
    public int hashCode() {
        return query.hashCode();
    }

    @Override
    public String toString() {
        return "(" + query + ")";
    }
}
