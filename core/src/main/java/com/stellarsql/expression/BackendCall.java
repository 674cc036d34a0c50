package com.stellarsql.expression;

import com.stellarsql.parser.SourcePosition;
import com.stellarsql.types.FieldInfo;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A call of a PostgreSQL or pgSphere function, emitted verbatim as
 * {@code name(arg, ...)}.
 */
public final class BackendCall implements Expression {

    private final String name;
    private final List<Expression> arguments;
    private final FieldInfo info;
    private final SourcePosition position;

    public BackendCall(String name, List<Expression> arguments, FieldInfo info, SourcePosition position) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Function name must not be null or empty");
        }
        this.name = name;
        this.arguments = List.copyOf(arguments);
        this.info = info;
        this.position = position != null ? position : SourcePosition.UNKNOWN;
    }

    public static BackendCall of(String name, Expression... arguments) {
        return new BackendCall(name, List.of(arguments), null, SourcePosition.UNKNOWN);
    }

    public String name() {
        return name;
    }

    public List<Expression> arguments() {
        return arguments;
    }

    public BackendCall withArguments(List<Expression> newArguments) {
        return new BackendCall(name, newArguments, info, position);
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
    public BackendCall withInfo(FieldInfo newInfo) {
        return new BackendCall(name, arguments, newInfo, position);
    }

    @Override
    public List<Expression> children() {
        return arguments;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitBackendCall(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof BackendCall)) {
            return false;
        }
        BackendCall that = (BackendCall) obj;
        return name.equals(that.name) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments);
    }

    @Override
    public String toString() {
        return name + "(" + arguments.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
    }
}
