package com.stellarsql.expression;

import com.stellarsql.parser.SourcePosition;
import com.stellarsql.types.FieldInfo;
import com.stellarsql.types.GeometryType;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A geometry whose coordinates are all known at compile time.
 *
 * <p>Values are in degrees: POINT {@code [lon, lat]}, CIRCLE
 * {@code [lon, lat, radius]}, BOX {@code [lon, lat, width, height]},
 * POLYGON {@code [lon1, lat1, lon2, lat2, ...]}.
 */
public final class GeometryConstant implements Expression {

    private final GeometryType.Shape shape;
    private final String frame;
    private final List<Double> values;
    private final FieldInfo info;
    private final SourcePosition position;

    public GeometryConstant(GeometryType.Shape shape, String frame, List<Double> values,
                            SourcePosition position) {
        this(shape, frame, values, null, position);
    }

    private GeometryConstant(GeometryType.Shape shape, String frame, List<Double> values,
                             FieldInfo info, SourcePosition position) {
        if (shape == GeometryType.Shape.REGION) {
            throw new IllegalArgumentException("A geometry constant must have a concrete shape");
        }
        this.shape = Objects.requireNonNull(shape, "shape");
        this.frame = frame;
        this.values = List.copyOf(values);
        this.info = info;
        this.position = position != null ? position : SourcePosition.UNKNOWN;
    }

    public GeometryType.Shape shape() {
        return shape;
    }

    /**
     * Returns the normalized coordinate frame.
     *
     * @return the frame, or null if unspecified
     */
    public String frame() {
        return frame;
    }

    public List<Double> values() {
        return values;
    }

    public double value(int index) {
        return values.get(index);
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
    public GeometryConstant withInfo(FieldInfo newInfo) {
        return new GeometryConstant(shape, frame, values, newInfo, position);
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitGeometryConstant(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof GeometryConstant)) {
            return false;
        }
        GeometryConstant that = (GeometryConstant) obj;
        return shape == that.shape && Objects.equals(frame, that.frame) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shape, frame, values);
    }

    @Override
    public String toString() {
        return shape + "[" + (frame != null ? frame + " " : "") + values + "]";
    }
}
