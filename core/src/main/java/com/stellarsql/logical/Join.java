package com.stellarsql.logical;

import com.stellarsql.expression.Expression;
import com.stellarsql.parser.SourcePosition;

import java.util.List;
import java.util.Objects;

/**
 * An explicit join of two FROM items.
 *
 * <p>Supported join types:
 * <ul>
 *   <li>INNER - Standard inner join</li>
 *   <li>LEFT, RIGHT, FULL - Outer joins</li>
 *   <li>CROSS - Cartesian product (no condition)</li>
 * </ul>
 *
 * <p>A join is NATURAL, has an ON condition, has a USING column list, or
 * (CROSS only) has none of these.
 */
public final class Join implements TableReference {

    /** Join types. */
    public enum JoinType {
        INNER("INNER JOIN"),
        LEFT("LEFT OUTER JOIN"),
        RIGHT("RIGHT OUTER JOIN"),
        FULL("FULL OUTER JOIN"),
        CROSS("CROSS JOIN");

        private final String sql;

        JoinType(String sql) {
            this.sql = sql;
        }

        public String sql() {
            return sql;
        }
    }

    private final JoinType joinType;
    private final boolean natural;
    private final TableReference left;
    private final TableReference right;
    private final Expression condition;
    private final List<String> usingColumns;
    private final SourcePosition position;

    public Join(JoinType joinType, boolean natural, TableReference left, TableReference right,
                Expression condition, List<String> usingColumns, SourcePosition position) {
        this.joinType = Objects.requireNonNull(joinType, "joinType must not be null");
        this.natural = natural;
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
        this.condition = condition;
        this.usingColumns = usingColumns == null ? List.of() : List.copyOf(usingColumns);
        this.position = position != null ? position : left.position();

        int specs = (natural ? 1 : 0) + (condition != null ? 1 : 0) + (this.usingColumns.isEmpty() ? 0 : 1);
        if (specs > 1) {
            throw new IllegalArgumentException("A join has at most one of NATURAL, ON and USING");
        }
        if (joinType == JoinType.CROSS && specs != 0) {
            throw new IllegalArgumentException("CROSS JOIN takes no join condition");
        }
        if (joinType != JoinType.CROSS && specs == 0) {
            throw new IllegalArgumentException(joinType + " requires NATURAL, ON or USING");
        }
    }

    public JoinType joinType() {
        return joinType;
    }

    public boolean natural() {
        return natural;
    }

    public TableReference left() {
        return left;
    }

    public TableReference right() {
        return right;
    }

    /**
     * Returns the ON condition.
     *
     * @return the condition, or null for NATURAL, USING and CROSS joins
     */
    public Expression condition() {
        return condition;
    }

    public List<String> usingColumns() {
        return usingColumns;
    }

    public Join withChildren(TableReference newLeft, TableReference newRight, Expression newCondition) {
        return new Join(joinType, natural, newLeft, newRight, newCondition, usingColumns, position);
    }

    @Override
    public SourcePosition position() {
        return position;
    }

    @Override
    public <R, C> R accept(TableReferenceVisitor<R, C> visitor, C context) {
        return visitor.visitJoin(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Join)) {
            return false;
        }
        Join that = (Join) obj;
        return joinType == that.joinType && natural == that.natural
            && left.equals(that.left) && right.equals(that.right)
            && Objects.equals(condition, that.condition)
            && usingColumns.equals(that.usingColumns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(joinType, natural, left, right, condition, usingColumns);
    }

    @Override
    public String toString() {
        return left + (natural ? " NATURAL " : " ") + joinType.sql() + " " + right
            + (condition != null ? " ON " + condition : "")
            + (usingColumns.isEmpty() ? "" : " USING " + usingColumns);
    }
}
