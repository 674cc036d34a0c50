package com.stellarsql.types;

import java.util.Objects;

/**
 * Resolved metadata of a value: its type plus the physical unit, UCD and
 * coordinate frame it carries.
 *
 * <p>Unit and UCD are empty strings when unknown or dimensionless; the frame
 * is null when the value is not positional. Instances are immutable.
 *
 * @param type the resolved data type
 * @param unit the VOUnit string, empty if none
 * @param ucd the UCD string, empty if none
 * @param frame the coordinate frame (e.g. {@code ICRS}), null if none
 */
public record FieldInfo(DataType type, String unit, String ucd, String frame) {

    public FieldInfo {
        Objects.requireNonNull(type, "type must not be null");
        unit = unit == null ? "" : unit;
        ucd = ucd == null ? "" : ucd;
    }

    /**
     * Creates a field info with a type and no unit, UCD or frame.
     *
     * @param type the data type
     * @return the field info
     */
    public static FieldInfo of(DataType type) {
        return new FieldInfo(type, "", "", null);
    }

    public FieldInfo withType(DataType newType) {
        return new FieldInfo(newType, unit, ucd, frame);
    }

    public FieldInfo withUnit(String newUnit) {
        return new FieldInfo(type, newUnit, ucd, frame);
    }

    public FieldInfo withUcd(String newUcd) {
        return new FieldInfo(type, unit, newUcd, frame);
    }

    public FieldInfo withFrame(String newFrame) {
        return new FieldInfo(type, unit, ucd, newFrame);
    }
}
