package com.stellarsql.expression;

import com.stellarsql.parser.SourcePosition;
import com.stellarsql.types.FieldInfo;

import java.util.List;
import java.util.Objects;

/**
 * A comparison predicate {@code left op right}.
 */
public final class Comparison implements Expression {

    /** Comparison operators. */
    public enum Operator {
        EQ("="),
        NE("<>"),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        /**
         * Returns the operator that yields the logical complement.
         *
         * @return the negated operator
         */
        public Operator negate() {
            switch (this) {
                case EQ:
                    return NE;
                case NE:
                    return EQ;
                case LT:
                    return GE;
                case LE:
                    return GT;
                case GT:
                    return LE;
                default:
                    return LT;
            }
        }

        /**
         * Returns the operator to use when the operands are swapped.
         *
         * @return the mirrored operator
         */
        public Operator flip() {
            switch (this) {
                case LT:
                    return GT;
                case LE:
                    return GE;
                case GT:
                    return LT;
                case GE:
                    return LE;
                default:
                    return this;
            }
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;
    private final FieldInfo info;
    private final SourcePosition position;

    public Comparison(Expression left, Operator operator, Expression right, SourcePosition position) {
        this(left, operator, right, null, position);
    }

    private Comparison(Expression left, Operator operator, Expression right,
                       FieldInfo info, SourcePosition position) {
        this.left = Objects.requireNonNull(left, "left");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.right = Objects.requireNonNull(right, "right");
        this.info = info;
        this.position = position != null ? position : left.position();
    }

    public Expression left() {
        return left;
    }

    public Operator operator() {
        return operator;
    }

    public Expression right() {
        return right;
    }

    public Comparison withOperands(Expression newLeft, Expression newRight) {
        return new Comparison(newLeft, operator, newRight, info, position);
    }

    public Comparison withOperator(Operator newOperator) {
        return new Comparison(left, newOperator, right, info, position);
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
    public Comparison withInfo(FieldInfo newInfo) {
        return new Comparison(left, operator, right, newInfo, position);
    }

    @Override
    public List<Expression> children() {
        return List.of(left, right);
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitComparison(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Comparison)) {
            return false;
        }
        Comparison that = (Comparison) obj;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }

    @Override
    public String toString() {
        return left + " " + operator.symbol() + " " + right;
    }
}
