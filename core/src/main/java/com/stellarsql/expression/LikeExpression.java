package com.stellarsql.expression;

import com.stellarsql.parser.SourcePosition;
import com.stellarsql.types.FieldInfo;

import java.util.List;
import java.util.Objects;

/**
 * {@code value [NOT] LIKE pattern}, or {@code ILIKE} for case-insensitive
 * matching.
 */
public final class LikeExpression implements Expression {

    private final Expression value;
    private final Expression pattern;
    private final boolean negated;
    private final boolean caseInsensitive;
    private final FieldInfo info;
    private final SourcePosition position;

    public LikeExpression(Expression value, Expression pattern, boolean negated,
                          boolean caseInsensitive, SourcePosition position) {
        this(value, pattern, negated, caseInsensitive, null, position);
    }

    private LikeExpression(Expression value, Expression pattern, boolean negated,
                           boolean caseInsensitive, FieldInfo info, SourcePosition position) {
        this.value = Objects.requireNonNull(value, "value");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.negated = negated;
        this.caseInsensitive = caseInsensitive;
        this.info = info;
        this.position = position != null ? position : value.position();
    }

    public Expression value() {
        return value;
    }

    public Expression pattern() {
        return pattern;
    }

    public boolean negated() {
        return negated;
    }

    public boolean caseInsensitive() {
        return caseInsensitive;
    }

    public LikeExpression withOperands(Expression newValue, Expression newPattern) {
        return new LikeExpression(newValue, newPattern, negated, caseInsensitive, info, position);
    }

    public LikeExpression negate() {
        return new LikeExpression(value, pattern, !negated, caseInsensitive, info, position);
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
    public LikeExpression withInfo(FieldInfo newInfo) {
        return new LikeExpression(value, pattern, negated, caseInsensitive, newInfo, position);
    }

    @Override
    public List<Expression> children() {
        return List.of(value, pattern);
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitLike(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof LikeExpression)) {
            return false;
        }
        LikeExpression that = (LikeExpression) obj;
        return negated == that.negated && caseInsensitive == that.caseInsensitive
            && value.equals(that.value) && pattern.equals(that.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, pattern, negated, caseInsensitive);
    }

    @Override
    public String toString() {
        return value + (negated ? " NOT" : "") + (caseInsensitive ? " ILIKE " : " LIKE ") + pattern;
    }
}
