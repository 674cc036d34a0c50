package com.stellarsql.expression;

import com.stellarsql.parser.SourcePosition;
import com.stellarsql.types.FieldInfo;

import java.util.List;
import java.util.Objects;

/**
 * A PostgreSQL/pgSphere operator with no ADQL counterpart, such as
 * {@code @} (containment), {@code &&} (overlap), {@code <->} (distance) or
 * the prefix {@code @@} (center). A single operand means a prefix operator.
 */
public final class BackendOperator implements Expression {

    private final String symbol;
    private final List<Expression> operands;
    private final FieldInfo info;
    private final SourcePosition position;

    public BackendOperator(String symbol, List<Expression> operands, FieldInfo info, SourcePosition position) {
        if (operands.isEmpty() || operands.size() > 2) {
            throw new IllegalArgumentException("Backend operators take one or two operands");
        }
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.operands = List.copyOf(operands);
        this.info = info;
        this.position = position != null ? position : SourcePosition.UNKNOWN;
    }

    public static BackendOperator infix(Expression left, String symbol, Expression right) {
        return new BackendOperator(symbol, List.of(left, right), null, left.position());
    }

    public static BackendOperator prefix(String symbol, Expression operand) {
        return new BackendOperator(symbol, List.of(operand), null, operand.position());
    }

    public String symbol() {
        return symbol;
    }

    public List<Expression> operands() {
        return operands;
    }

    public boolean isPrefix() {
        return operands.size() == 1;
    }

    public BackendOperator withOperands(List<Expression> newOperands) {
        return new BackendOperator(symbol, newOperands, info, position);
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
    public BackendOperator withInfo(FieldInfo newInfo) {
        return new BackendOperator(symbol, operands, newInfo, position);
    }

    @Override
    public List<Expression> children() {
        return operands;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitBackendOperator(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof BackendOperator)) {
            return false;
        }
        BackendOperator that = (BackendOperator) obj;
        return symbol.equals(that.symbol) && operands.equals(that.operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, operands);
    }

    @Override
    public String toString() {
        if (isPrefix()) {
            return "(" + symbol + " " + operands.get(0) + ")";
        }
        return "(" + operands.get(0) + " " + symbol + " " + operands.get(1) + ")";
    }
}
