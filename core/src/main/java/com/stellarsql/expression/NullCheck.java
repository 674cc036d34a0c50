package com.stellarsql.expression;

import com.stellarsql.parser.SourcePosition;
import com.stellarsql.types.FieldInfo;

import java.util.List;
import java.util.Objects;

/**
 * {@code value IS [NOT] NULL}.
 */
public final class NullCheck implements Expression {

    private final Expression value;
    private final boolean negated;
    private final FieldInfo info;
    private final SourcePosition position;

    public NullCheck(Expression value, boolean negated, SourcePosition position) {
        this(value, negated, null, position);
    }

    private NullCheck(Expression value, boolean negated, FieldInfo info, SourcePosition position) {
        this.value = Objects.requireNonNull(value, "value");
        this.negated = negated;
        this.info = info;
        this.position = position != null ? position : value.position();
    }

    public Expression value() {
        return value;
    }

    /**
     * Returns true for {@code IS NOT NULL}.
     *
     * @return whether the check is negated
     */
    public boolean negated() {
        return negated;
    }

    public NullCheck withValue(Expression newValue) {
        return new NullCheck(newValue, negated, info, position);
    }

    public NullCheck negate() {
        return new NullCheck(value, !negated, info, position);
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
    public NullCheck withInfo(FieldInfo newInfo) {
        return new NullCheck(value, negated, newInfo, position);
    }

    @Override
    public List<Expression> children() {
        return List.of(value);
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitNullCheck(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof NullCheck)) {
            return false;
        }
        NullCheck that = (NullCheck) obj;
        return negated == that.negated && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, negated);
    }

    @Override
    public String toString() {
        return value + (negated ? " IS NOT NULL" : " IS NULL");
    }
}
