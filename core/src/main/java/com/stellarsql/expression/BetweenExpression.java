package com.stellarsql.expression;

import com.stellarsql.parser.SourcePosition;
import com.stellarsql.types.FieldInfo;

import java.util.List;
import java.util.Objects;

/**
 * {@code value [NOT] BETWEEN low AND high}.
 */
public final class BetweenExpression implements Expression {

    private final Expression value;
    private final Expression low;
    private final Expression high;
    private final boolean negated;
    private final FieldInfo info;
    private final SourcePosition position;

    public BetweenExpression(Expression value, Expression low, Expression high,
                             boolean negated, SourcePosition position) {
        this(value, low, high, negated, null, position);
    }

    private BetweenExpression(Expression value, Expression low, Expression high, boolean negated,
                              FieldInfo info, SourcePosition position) {
        this.value = Objects.requireNonNull(value, "value");
        this.low = Objects.requireNonNull(low, "low");
        this.high = Objects.requireNonNull(high, "high");
        this.negated = negated;
        this.info = info;
        this.position = position != null ? position : value.position();
    }

    public Expression value() {
        return value;
    }

    public Expression low() {
        return low;
    }

    public Expression high() {
        return high;
    }

    public boolean negated() {
        return negated;
    }

    public BetweenExpression withOperands(Expression newValue, Expression newLow, Expression newHigh) {
        return new BetweenExpression(newValue, newLow, newHigh, negated, info, position);
    }

    public BetweenExpression negate() {
        return new BetweenExpression(value, low, high, !negated, info, position);
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
    public BetweenExpression withInfo(FieldInfo newInfo) {
        return new BetweenExpression(value, low, high, negated, newInfo, position);
    }

    @Override
    public List<Expression> children() {
        return List.of(value, low, high);
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitBetween(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof BetweenExpression)) {
            return false;
        }
        BetweenExpression that = (BetweenExpression) obj;
        return negated == that.negated && value.equals(that.value)
            && low.equals(that.low) && high.equals(that.high);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, low, high, negated);
    }

    @Override
    public String toString() {
        return value + (negated ? " NOT" : "") + " BETWEEN " + low + " AND " + high;
    }
}
