package com.stellarsql.logical;

import com.stellarsql.parser.SourcePosition;
import com.stellarsql.schema.OutputColumn;

import java.util.List;
import java.util.Objects;

/**
 * {@code left UNION|INTERSECT|EXCEPT [ALL] right}.
 *
 * <p>Both operands must produce the same number of columns; the result
 * takes its column names from the left operand.
 *
 * <p>ORDER BY, LIMIT and OFFSET of a set operation apply to its whole
 * result. Sort keys are always select-list ordinals.
 */
public final class SetOperation implements QueryExpression {

    /** Set operators. */
    public enum Kind {
        UNION,
        INTERSECT,
        EXCEPT
    }

    private final Kind kind;
    private final boolean all;
    private final QueryExpression left;
    private final QueryExpression right;
    private final List<SortSpecification> orderBy;
    private final Long limit;
    private final Long offset;
    private final List<OutputColumn> outputColumns;
    private final SourcePosition position;

    public SetOperation(Kind kind, boolean all, QueryExpression left, QueryExpression right,
                        SourcePosition position) {
        this(kind, all, left, right, List.of(), null, null, List.of(), position);
    }

    private SetOperation(Kind kind, boolean all, QueryExpression left, QueryExpression right,
                         List<SortSpecification> orderBy, Long limit, Long offset,
                         List<OutputColumn> outputColumns, SourcePosition position) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.all = all;
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        this.orderBy = List.copyOf(orderBy);
        this.limit = limit;
        this.offset = offset;
        this.outputColumns = List.copyOf(outputColumns);
        this.position = position != null ? position : left.position();
    }

    public Kind kind() {
        return kind;
    }

    public boolean all() {
        return all;
    }

    public QueryExpression left() {
        return left;
    }

    public QueryExpression right() {
        return right;
    }

    public List<SortSpecification> orderBy() {
        return orderBy;
    }

    @Override
    public Long limit() {
        return limit;
    }

    @Override
    public Long offset() {
        return offset;
    }

    @Override
    public List<OutputColumn> outputColumns() {
        return outputColumns;
    }

    public SetOperation withOperands(QueryExpression newLeft, QueryExpression newRight) {
        return new SetOperation(kind, all, newLeft, newRight, orderBy, limit, offset, outputColumns, position);
    }

    public SetOperation withOutputColumns(List<OutputColumn> columns) {
        return new SetOperation(kind, all, left, right, orderBy, limit, offset, columns, position);
    }

    public SetOperation withLimit(Long newLimit) {
        return new SetOperation(kind, all, left, right, orderBy, newLimit, offset, outputColumns, position);
    }

    public SetOperation withOrderBy(List<SortSpecification> newOrderBy, Long newOffset) {
        for (SortSpecification sort : newOrderBy) {
            if (!sort.isOrdinal()) {
                throw new IllegalArgumentException("Set operations sort by ordinal only: " + sort);
            }
        }
        return new SetOperation(kind, all, left, right, newOrderBy, limit, newOffset, outputColumns, position);
    }

    @Override
    public SourcePosition position() {
        return position;
    }

    @Override
    public <R, C> R accept(QueryVisitor<R, C> visitor, C context) {
        return visitor.visitSetOperation(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SetOperation)) {
            return false;
        }
        SetOperation that = (SetOperation) obj;
        return kind == that.kind && all == that.all
            && left.equals(that.left) && right.equals(that.right)
            && orderBy.equals(that.orderBy) && Objects.equals(limit, that.limit) && Objects.equals(offset, that.offset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, all, left, right, orderBy, limit, offset);
    }

    @Override
    public String toString() {
        return "(" + left + ") " + kind + (all ? " ALL" : "") + " (" + right + ")"
            + (orderBy.isEmpty() ? "" : " ORDER BY " + orderBy)
            + (limit != null ? " LIMIT " + limit : "")
            + (offset != null ? " OFFSET " + offset : "");
    }
}
