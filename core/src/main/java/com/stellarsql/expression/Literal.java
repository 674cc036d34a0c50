package com.stellarsql.expression;

import com.stellarsql.parser.SourcePosition;
import com.stellarsql.types.FieldInfo;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A constant scalar value: an exact or approximate number, a character
 * string, or NULL.
 *
 * <p>Integer values are held as {@link Long}, approximate and decimal values
 * as {@link Double}, strings as {@link String}; NULL holds no value.
 */
public final class Literal implements Expression {

    /** Kind of literal value. */
    public enum Kind {
        INTEGER,
        DOUBLE,
        STRING,
        NULL
    }

    private final Kind kind;
    private final Object value;
    private final FieldInfo info;
    private final SourcePosition position;

    private Literal(Kind kind, Object value, FieldInfo info, SourcePosition position) {
        this.kind = kind;
        this.value = value;
        this.info = info;
        this.position = position != null ? position : SourcePosition.UNKNOWN;
    }

    public static Literal ofLong(long value, SourcePosition position) {
        return new Literal(Kind.INTEGER, value, null, position);
    }

    public static Literal ofDouble(double value, SourcePosition position) {
        return new Literal(Kind.DOUBLE, value, null, position);
    }

    public static Literal ofString(String value, SourcePosition position) {
        if (value == null) {
            throw new IllegalArgumentException("String literal value must not be null");
        }
        return new Literal(Kind.STRING, value, null, position);
    }

    public static Literal ofNull(SourcePosition position) {
        return new Literal(Kind.NULL, null, null, position);
    }

    public static Literal of(long value) {
        return ofLong(value, SourcePosition.UNKNOWN);
    }

    public static Literal of(double value) {
        return ofDouble(value, SourcePosition.UNKNOWN);
    }

    public static Literal of(String value) {
        return ofString(value, SourcePosition.UNKNOWN);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Returns the literal value.
     *
     * @return a Long, Double or String, or null for NULL
     */
    public Object value() {
        return value;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public boolean isNumeric() {
        return kind == Kind.INTEGER || kind == Kind.DOUBLE;
    }

    /**
     * Returns the numeric value as a double.
     *
     * @return the value
     * @throws IllegalStateException if the literal is not numeric
     */
    public double doubleValue() {
        if (!isNumeric()) {
            throw new IllegalStateException("Not a numeric literal: " + this);
        }
        return ((Number) value).doubleValue();
    }

    /**
     * Returns true if this is the integer literal {@code n}.
     *
     * @param n the value to test
     * @return whether the literal is exactly that integer
     */
    public boolean isInteger(long n) {
        return kind == Kind.INTEGER && ((Long) value) == n;
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
    public Literal withInfo(FieldInfo newInfo) {
        return new Literal(kind, value, newInfo, position);
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Literal)) {
            return false;
        }
        Literal that = (Literal) obj;
        return kind == that.kind && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        switch (kind) {
            case STRING:
                return "'" + ((String) value).replace("'", "''") + "'";
            case NULL:
                return "NULL";
            default:
                return String.valueOf(value);
        }
    }
}
