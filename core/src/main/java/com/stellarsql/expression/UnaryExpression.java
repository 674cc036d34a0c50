package com.stellarsql.expression;

import com.stellarsql.parser.SourcePosition;
import com.stellarsql.types.FieldInfo;

import java.util.List;
import java.util.Objects;

/**
 * A prefix operator applied to one operand: {@code NOT}, unary minus or
 * unary plus.
 */
public final class UnaryExpression implements Expression {

    /** Prefix operators. */
    public enum Operator {
        NOT("NOT "),
        NEGATE("-"),
        PLUS("+");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    private final Operator operator;
    private final Expression operand;
    private final FieldInfo info;
    private final SourcePosition position;

    public UnaryExpression(Operator operator, Expression operand, SourcePosition position) {
        this(operator, operand, null, position);
    }

    private UnaryExpression(Operator operator, Expression operand, FieldInfo info, SourcePosition position) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.operand = Objects.requireNonNull(operand, "operand");
        this.info = info;
        this.position = position != null ? position : operand.position();
    }

    public static UnaryExpression not(Expression operand) {
        return new UnaryExpression(Operator.NOT, operand, operand.position());
    }

    public Operator operator() {
        return operator;
    }

    public Expression operand() {
        return operand;
    }

    public UnaryExpression withOperand(Expression newOperand) {
        return new UnaryExpression(operator, newOperand, info, position);
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
    public UnaryExpression withInfo(FieldInfo newInfo) {
        return new UnaryExpression(operator, operand, newInfo, position);
    }

    @Override
    public List<Expression> children() {
        return List.of(operand);
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryExpression(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof UnaryExpression)) {
            return false;
        }
        UnaryExpression that = (UnaryExpression) obj;
        return operator == that.operator && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    @Override
    public String toString() {
        return operator.symbol() + operand;
    }
}
