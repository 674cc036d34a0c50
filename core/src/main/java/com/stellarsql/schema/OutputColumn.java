package com.stellarsql.schema;

import com.stellarsql.types.DataType;
import com.stellarsql.types.FieldInfo;
import com.stellarsql.types.TypeMapper;

import java.util.Objects;

/**
 * One column of a query result as described to clients: the final name
 * plus type, unit, UCD and coordinate frame.
 *
 * @param name the output column name
 * @param type the data type
 * @param unit the VOUnit string, empty if none
 * @param ucd the UCD string, empty if none
 * @param frame the coordinate frame, empty if none
 * @param nullable whether the column may contain NULL
 * @param description the catalog description, empty for computed columns
 */
public record OutputColumn(String name, DataType type, String unit, String ucd, String frame,
                           boolean nullable, String description) {

    public OutputColumn {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        unit = unit == null ? "" : unit;
        ucd = ucd == null ? "" : ucd;
        frame = frame == null ? "" : frame;
        description = description == null ? "" : description;
    }

    public static OutputColumn of(String name, FieldInfo info, boolean nullable, String description) {
        return new OutputColumn(name, info.type(), info.unit(), info.ucd(), info.frame(), nullable, description);
    }

    /**
     * Returns the field info equivalent of this column, for references to a
     * derived table or a scalar subquery.
     */
    public FieldInfo toFieldInfo() {
        return new FieldInfo(type, unit, ucd, frame.isEmpty() ? null : frame);
    }

    /**
     * Returns the ADQL type name to publish for this column, e.g.
     * {@code DOUBLE} or {@code POINT}.
     */
    public String adqlType() {
        return TypeMapper.toAdqlType(type);
    }
}
