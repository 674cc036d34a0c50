package com.stellarsql.expression;

import com.stellarsql.parser.SourcePosition;
import com.stellarsql.types.FieldInfo;
import com.stellarsql.types.GeometryType;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An ADQL geometry constructor: {@code POINT}, {@code CIRCLE}, {@code BOX},
 * {@code POLYGON} or {@code REGION}.
 *
 * <p>The optional leading coordinate-system string (e.g. {@code 'ICRS'}) is
 * kept verbatim in {@link #coordSys()} and is not part of the argument list.
 * Arguments are coordinates in degrees, or POINT-valued expressions where
 * ADQL allows them (the center of a CIRCLE or BOX, the vertices of a POLYGON).
 * REGION takes a single STC-S string.
 */
public final class GeometryLiteral implements Expression {

    private final GeometryType.Shape shape;
    private final String coordSys;
    private final List<Expression> arguments;
    private final FieldInfo info;
    private final SourcePosition position;

    public GeometryLiteral(GeometryType.Shape shape, String coordSys, List<Expression> arguments,
                           SourcePosition position) {
        this(shape, coordSys, arguments, null, position);
    }

    private GeometryLiteral(GeometryType.Shape shape, String coordSys, List<Expression> arguments,
                            FieldInfo info, SourcePosition position) {
        this.shape = Objects.requireNonNull(shape, "shape");
        this.coordSys = coordSys;
        this.arguments = List.copyOf(arguments);
        this.info = info;
        this.position = position != null ? position : SourcePosition.UNKNOWN;
    }

    public GeometryType.Shape shape() {
        return shape;
    }

    /**
     * Returns the coordinate-system tag as written.
     *
     * @return the tag, or null if none was given
     */
    public String coordSys() {
        return coordSys;
    }

    public List<Expression> arguments() {
        return arguments;
    }

    public Expression argument(int index) {
        return arguments.get(index);
    }

    public GeometryLiteral withArguments(List<Expression> newArguments) {
        return new GeometryLiteral(shape, coordSys, newArguments, info, position);
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
    public GeometryLiteral withInfo(FieldInfo newInfo) {
        return new GeometryLiteral(shape, coordSys, arguments, newInfo, position);
    }

    @Override
    public List<Expression> children() {
        return arguments;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitGeometryLiteral(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof GeometryLiteral)) {
            return false;
        }
        GeometryLiteral that = (GeometryLiteral) obj;
        return shape == that.shape && Objects.equals(coordSys, that.coordSys)
            && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shape, coordSys, arguments);
    }

    @Override
    public String toString() {
        String args = arguments.stream().map(Object::toString).collect(Collectors.joining(", "));
        return shape + "(" + (coordSys != null ? "'" + coordSys + "', " : "") + args + ")";
    }
}
