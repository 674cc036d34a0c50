package com.stellarsql.expression;

import com.stellarsql.parser.SourcePosition;
import com.stellarsql.types.FieldInfo;

import java.util.List;
import java.util.Objects;

/**
 * A backend SQL fragment with {@code {0}}, {@code {1}}, ... placeholders for
 * rendered sub-expressions.
 *
 * <p>Used for constructs that have no dedicated node, for example
 * {@code (CASE WHEN {0} THEN 1 ELSE 0 END)} or
 * {@code ROUND(CAST({0} AS numeric), {1})}. Sub-expressions are rendered by
 * the generator, so their literals are still bound as parameters unless
 * {@link #inlineLiterals()} is set.
 */
public final class RawSQLExpression implements Expression {

    private final String template;
    private final List<Expression> arguments;
    private final boolean inlineLiterals;
    private final FieldInfo info;
    private final SourcePosition position;

    public RawSQLExpression(String template, List<Expression> arguments, boolean inlineLiterals,
                            FieldInfo info, SourcePosition position) {
        this.template = Objects.requireNonNull(template, "template");
        this.arguments = List.copyOf(arguments);
        this.inlineLiterals = inlineLiterals;
        this.info = info;
        this.position = position != null ? position : SourcePosition.UNKNOWN;
    }

    public static RawSQLExpression of(String template, Expression... arguments) {
        return new RawSQLExpression(template, List.of(arguments), false, null, SourcePosition.UNKNOWN);
    }

    public String template() {
        return template;
    }

    public List<Expression> arguments() {
        return arguments;
    }

    /**
     * Returns true if literals below this node are written into the SQL text
     * instead of being bound. Needed where PostgreSQL requires constants,
     * e.g. inside a {@code VALUES} list that builds a polygon.
     *
     * @return whether literals are inlined
     */
    public boolean inlineLiterals() {
        return inlineLiterals;
    }

    public RawSQLExpression withArguments(List<Expression> newArguments) {
        return new RawSQLExpression(template, newArguments, inlineLiterals, info, position);
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
    public RawSQLExpression withInfo(FieldInfo newInfo) {
        return new RawSQLExpression(template, arguments, inlineLiterals, newInfo, position);
    }

    @Override
    public List<Expression> children() {
        return arguments;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitRawSQL(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof RawSQLExpression)) {
            return false;
        }
        RawSQLExpression that = (RawSQLExpression) obj;
        return inlineLiterals == that.inlineLiterals && template.equals(that.template)
            && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(template, arguments, inlineLiterals);
    }

    @Override
    public String toString() {
        return "RAW[" + template + "]" + arguments;
    }
}
