package com.stellarsql.expression;

import com.stellarsql.parser.SourcePosition;
import com.stellarsql.types.FieldInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@code value [NOT] IN (v1, v2, ...)} with an explicit value list.
 *
 * @see InSubquery
 */
public final class InExpression implements Expression {

    private final Expression value;
    private final List<Expression> values;
    private final boolean negated;
    private final FieldInfo info;
    private final SourcePosition position;

    public InExpression(Expression value, List<Expression> values, boolean negated, SourcePosition position) {
        this(value, values, negated, null, position);
    }

    private InExpression(Expression value, List<Expression> values, boolean negated,
                         FieldInfo info, SourcePosition position) {
        this.value = Objects.requireNonNull(value, "value");
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("IN list must not be empty");
        }
        this.values = List.copyOf(values);
        this.negated = negated;
        this.info = info;
        this.position = position != null ? position : value.position();
    }

    public Expression value() {
        return value;
    }

    public List<Expression> values() {
        return values;
    }

    public boolean negated() {
        return negated;
    }

    public InExpression withOperands(Expression newValue, List<Expression> newValues) {
        return new InExpression(newValue, newValues, negated, info, position);
    }

    public InExpression negate() {
        return new InExpression(value, values, !negated, info, position);
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
    public InExpression withInfo(FieldInfo newInfo) {
        return new InExpression(value, values, negated, newInfo, position);
    }

    @Override
    public List<Expression> children() {
        List<Expression> children = new ArrayList<>(values.size() + 1);
        children.add(value);
        children.addAll(values);
        return children;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitIn(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof InExpression)) {
            return false;
        }
        InExpression that = (InExpression) obj;
        return negated == that.negated && value.equals(that.value) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, values, negated);
    }

    @Override
    public String toString() {
        return value + (negated ? " NOT IN " : " IN ") + values;
    }
}
