package com.stellarsql.expression;

import com.stellarsql.logical.QueryExpression;
import com.stellarsql.parser.SourcePosition;
import com.stellarsql.types.FieldInfo;

import java.util.List;
import java.util.Objects;

/**
 * {@code value [NOT] IN (subquery)}.
 */
public final class InSubquery implements Expression {

    private final Expression value;
    private final QueryExpression query;
    private final boolean negated;
    private final FieldInfo info;
    private final SourcePosition position;

    public InSubquery(Expression value, QueryExpression query, boolean negated, SourcePosition position) {
        this(value, query, negated, null, position);
    }

    private InSubquery(Expression value, QueryExpression query, boolean negated,
                       FieldInfo info, SourcePosition position) {
        this.value = Objects.requireNonNull(value, "value");
        this.query = Objects.requireNonNull(query, "query");
        this.negated = negated;
        this.info = info;
        this.position = position != null ? position : value.position();
    }

    public Expression value() {
        return value;
    }

    public QueryExpression query() {
        return query;
    }

    public boolean negated() {
        return negated;
    }

    public InSubquery withValue(Expression newValue) {
        return new InSubquery(newValue, query, negated, info, position);
    }

    public InSubquery withQuery(QueryExpression newQuery) {
        return new InSubquery(value, newQuery, negated, info, position);
    }

    public InSubquery negate() {
        return new InSubquery(value, query, !negated, info, position);
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
    public InSubquery withInfo(FieldInfo newInfo) {
        return new InSubquery(value, query, negated, newInfo, position);
    }

    @Override
    public List<Expression> children() {
        return List.of(value);
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitInSubquery(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof InSubquery)) {
            return false;
        }
        InSubquery that = (InSubquery) obj;
        return negated == that.negated && value.equals(that.value) && query.equals(that.query);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, query, negated);
    }

    @Override
    public String toString() {
        return value + (negated ? " NOT IN " : " IN ") + "(" + query + ")";
    }
}
