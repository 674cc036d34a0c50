package com.stellarsql.logical;

import com.stellarsql.expression.Expression;
import com.stellarsql.parser.SourcePosition;
import com.stellarsql.schema.OutputColumn;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A single {@code SELECT ... FROM ...} block.
 *
 * <p>Optional clauses are null (WHERE, HAVING, TOP, OFFSET, LIMIT) or empty
 * lists (GROUP BY, ORDER BY). {@code TOP} is the ADQL row limit as written;
 * the morpher moves it to {@link #limit()}.
 *
 * <p>Instances are immutable; use {@link #toBuilder()} to derive modified
 * copies.
 */
public final class QuerySpecification implements QueryExpression {

    private final boolean distinct;
    private final Long top;
    private final SelectList selectList;
    private final List<TableReference> from;
    private final Expression where;
    private final List<Expression> groupBy;
    private final Expression having;
    private final List<SortSpecification> orderBy;
    private final Long offset;
    private final Long limit;
    private final List<OutputColumn> outputColumns;
    private final SourcePosition position;

    private QuerySpecification(Builder builder) {
        this.distinct = builder.distinct;
        this.top = builder.top;
        this.selectList = Objects.requireNonNull(builder.selectList, "selectList");
        if (builder.from.isEmpty()) {
            throw new IllegalArgumentException("FROM clause must not be empty");
        }
        this.from = List.copyOf(builder.from);
        this.where = builder.where;
        this.groupBy = List.copyOf(builder.groupBy);
        this.having = builder.having;
        this.orderBy = List.copyOf(builder.orderBy);
        this.offset = builder.offset;
        this.limit = builder.limit;
        this.outputColumns = List.copyOf(builder.outputColumns);
        this.position = builder.position != null ? builder.position : SourcePosition.UNKNOWN;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.distinct = distinct;
        builder.top = top;
        builder.selectList = selectList;
        builder.from = new ArrayList<>(from);
        builder.where = where;
        builder.groupBy = new ArrayList<>(groupBy);
        builder.having = having;
        builder.orderBy = new ArrayList<>(orderBy);
        builder.offset = offset;
        builder.limit = limit;
        builder.outputColumns = new ArrayList<>(outputColumns);
        builder.position = position;
        return builder;
    }

    public boolean distinct() {
        return distinct;
    }

    /**
     * Returns the ADQL {@code TOP n} value.
     *
     * @return the TOP count, or null if absent
     */
    public Long top() {
        return top;
    }

    public SelectList selectList() {
        return selectList;
    }

    public List<TableReference> from() {
        return from;
    }

    public Expression where() {
        return where;
    }

    public List<Expression> groupBy() {
        return groupBy;
    }

    public Expression having() {
        return having;
    }

    public List<SortSpecification> orderBy() {
        return orderBy;
    }

    @Override
    public Long offset() {
        return offset;
    }

    @Override
    public Long limit() {
        return limit;
    }

    @Override
    public List<OutputColumn> outputColumns() {
        return outputColumns;
    }

    @Override
    public SourcePosition position() {
        return position;
    }

    @Override
    public <R, C> R accept(QueryVisitor<R, C> visitor, C context) {
        return visitor.visitQuerySpecification(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof QuerySpecification)) {
            return false;
        }
        QuerySpecification that = (QuerySpecification) obj;
        return distinct == that.distinct
            && Objects.equals(top, that.top)
            && selectList.equals(that.selectList)
            && from.equals(that.from)
            && Objects.equals(where, that.where)
            && groupBy.equals(that.groupBy)
            && Objects.equals(having, that.having)
            && orderBy.equals(that.orderBy)
            && Objects.equals(offset, that.offset)
            && Objects.equals(limit, that.limit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(distinct, top, selectList, from, where, groupBy, having, orderBy, offset, limit);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SELECT ");
        if (distinct) {
            sb.append("DISTINCT ");
        }
        if (top != null) {
            sb.append("TOP ").append(top).append(' ');
        }
        sb.append(selectList).append(" FROM ").append(from);
        if (where != null) {
            sb.append(" WHERE ").append(where);
        }
        if (!groupBy.isEmpty()) {
            sb.append(" GROUP BY ").append(groupBy);
        }
        if (having != null) {
            sb.append(" HAVING ").append(having);
        }
        if (!orderBy.isEmpty()) {
            sb.append(" ORDER BY ").append(orderBy);
        }
        if (limit != null) {
            sb.append(" LIMIT ").append(limit);
        }
        if (offset != null) {
            sb.append(" OFFSET ").append(offset);
        }
        return sb.toString();
    }

    /**
     * Builder for {@link QuerySpecification}.
     */
    public static final class Builder {

        private boolean distinct;
        private Long top;
        private SelectList selectList;
        private List<TableReference> from = new ArrayList<>();
        private Expression where;
        private List<Expression> groupBy = new ArrayList<>();
        private Expression having;
        private List<SortSpecification> orderBy = new ArrayList<>();
        private Long offset;
        private Long limit;
        private List<OutputColumn> outputColumns = new ArrayList<>();
        private SourcePosition position;

        private Builder() {
        }

        public Builder distinct(boolean distinct) {
            this.distinct = distinct;
            return this;
        }

        public Builder top(Long top) {
            this.top = top;
            return this;
        }

        public Builder selectList(SelectList selectList) {
            this.selectList = selectList;
            return this;
        }

        public Builder from(List<TableReference> from) {
            this.from = new ArrayList<>(from);
            return this;
        }

        public Builder where(Expression where) {
            this.where = where;
            return this;
        }

        public Builder groupBy(List<Expression> groupBy) {
            this.groupBy = new ArrayList<>(groupBy);
            return this;
        }

        public Builder having(Expression having) {
            this.having = having;
            return this;
        }

        public Builder orderBy(List<SortSpecification> orderBy) {
            this.orderBy = new ArrayList<>(orderBy);
            return this;
        }

        public Builder offset(Long offset) {
            this.offset = offset;
            return this;
        }

        public Builder limit(Long limit) {
            this.limit = limit;
            return this;
        }

        public Builder outputColumns(List<OutputColumn> outputColumns) {
            this.outputColumns = new ArrayList<>(outputColumns);
            return this;
        }

        public Builder position(SourcePosition position) {
            this.position = position;
            return this;
        }

        public QuerySpecification build() {
            return new QuerySpecification(this);
        }
    }
}
