package com.stellarsql.expression;

import com.stellarsql.functions.FunctionSignature;
import com.stellarsql.parser.SourcePosition;
import com.stellarsql.types.FieldInfo;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A call of a scalar, aggregate or user-defined function, including the
 * ADQL geometry predicates and functions ({@code CONTAINS}, {@code DISTANCE}, ...).
 *
 * <p>The name is stored upper-cased. {@code COUNT(*)} is represented with
 * {@link #star()} set and no arguments. The annotator attaches the matching
 * {@link FunctionSignature}.
 */
public final class FunctionCall implements Expression {

    private final String name;
    private final List<Expression> arguments;
    private final boolean distinct;
    private final boolean star;
    private final FunctionSignature signature;
    private final FieldInfo info;
    private final SourcePosition position;

    public FunctionCall(String name, List<Expression> arguments, boolean distinct,
                        boolean star, SourcePosition position) {
        this(name, arguments, distinct, star, null, null, position);
    }

    private FunctionCall(String name, List<Expression> arguments, boolean distinct, boolean star,
                         FunctionSignature signature, FieldInfo info, SourcePosition position) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Function name must not be null or empty");
        }
        this.name = name.toUpperCase(Locale.ROOT);
        this.arguments = List.copyOf(arguments);
        this.distinct = distinct;
        this.star = star;
        this.signature = signature;
        this.info = info;
        this.position = position != null ? position : SourcePosition.UNKNOWN;
    }

    public static FunctionCall of(String name, Expression... arguments) {
        return new FunctionCall(name, List.of(arguments), false, false, SourcePosition.UNKNOWN);
    }

    public String name() {
        return name;
    }

    public List<Expression> arguments() {
        return arguments;
    }

    public Expression argument(int index) {
        return arguments.get(index);
    }

    public boolean distinct() {
        return distinct;
    }

    public boolean star() {
        return star;
    }

    /**
     * Returns the signature resolved by the annotator.
     *
     * @return the signature, or null before annotation
     */
    public FunctionSignature signature() {
        return signature;
    }

    public FunctionCall withArguments(List<Expression> newArguments) {
        return new FunctionCall(name, newArguments, distinct, star, signature, info, position);
    }

    public FunctionCall withSignature(FunctionSignature newSignature, FieldInfo newInfo) {
        return new FunctionCall(name, arguments, distinct, star, newSignature, newInfo, position);
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
    public FunctionCall withInfo(FieldInfo newInfo) {
        return new FunctionCall(name, arguments, distinct, star, signature, newInfo, position);
    }

    @Override
    public List<Expression> children() {
        return arguments;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionCall(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FunctionCall)) {
            return false;
        }
        FunctionCall that = (FunctionCall) obj;
        return distinct == that.distinct
            && star == that.star
            && name.equals(that.name)
            && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments, distinct, star);
    }

    @Override
    public String toString() {
        if (star) {
            return name + "(*)";
        }
        return name + "(" + (distinct ? "DISTINCT " : "")
            + arguments.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
    }
}
