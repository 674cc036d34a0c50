package com.stellarsql.expression;

import com.stellarsql.parser.SourcePosition;
import com.stellarsql.types.FieldInfo;

import java.util.List;
import java.util.Objects;

/**
 * A binary arithmetic, string concatenation or boolean connective
 * expression.
 */
public final class BinaryExpression implements Expression {

    /** Binary operators. */
    public enum Operator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        CONCAT("||"),
        AND("AND"),
        OR("OR");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isArithmetic() {
            return this == ADD || this == SUBTRACT || this == MULTIPLY || this == DIVIDE;
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;
    private final FieldInfo info;
    private final SourcePosition position;

    public BinaryExpression(Expression left, Operator operator, Expression right, SourcePosition position) {
        this(left, operator, right, null, position);
    }

    private BinaryExpression(Expression left, Operator operator, Expression right,
                             FieldInfo info, SourcePosition position) {
        this.left = Objects.requireNonNull(left, "left");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.right = Objects.requireNonNull(right, "right");
        this.info = info;
        this.position = position != null ? position : left.position();
    }

    public static BinaryExpression and(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.AND, right, left.position());
    }

    public static BinaryExpression or(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.OR, right, left.position());
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

    public BinaryExpression withOperands(Expression newLeft, Expression newRight) {
        return new BinaryExpression(newLeft, operator, newRight, info, position);
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
    public BinaryExpression withInfo(FieldInfo newInfo) {
        return new BinaryExpression(left, operator, right, newInfo, position);
    }

    @Override
    public List<Expression> children() {
        return List.of(left, right);
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpression(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof BinaryExpression)) {
            return false;
        }
        BinaryExpression that = (BinaryExpression) obj;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
