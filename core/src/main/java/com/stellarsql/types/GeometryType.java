package com.stellarsql.types;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Data type of ADQL geometry values.
 *
 * <p>In the PostgreSQL backend POINT maps to {@code spoint}, CIRCLE to
 * {@code scircle}, BOX and POLYGON to {@code spoly}. REGION is the result of
 * the {@code REGION} constructor and is whatever the STC-S string describes.
 */
public final class GeometryType implements DataType {

    /** Geometry shapes known to ADQL. */
    public enum Shape {
        POINT,
        CIRCLE,
        BOX,
        POLYGON,
        REGION
    }

    private static final Map<Shape, GeometryType> INSTANCES = new EnumMap<>(Shape.class);

    static {
        for (Shape shape : Shape.values()) {
            INSTANCES.put(shape, new GeometryType(shape));
        }
    }

    private final Shape shape;

    private GeometryType(Shape shape) {
        this.shape = shape;
    }

    public static GeometryType of(Shape shape) {
        return INSTANCES.get(shape);
    }

    public static GeometryType point() {
        return of(Shape.POINT);
    }

    public Shape shape() {
        return shape;
    }

    public boolean isPoint() {
        return shape == Shape.POINT;
    }

    @Override
    public String typeName() {
        return shape.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String adqlName() {
        return shape.name();
    }

    /**
     * BOX travels as a four-vertex polygon and REGION as whatever pgSphere
     * area it was built from, so both map to {@code spoly}.
     */
    @Override
    public String postgresName() {
        switch (shape) {
            case POINT:
                return "spoint";
            case CIRCLE:
                return "scircle";
            default:
                return "spoly";
        }
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof GeometryType && ((GeometryType) obj).shape == shape;
    }

    @Override
    public int hashCode() {
        return shape.hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
