package com.stellarsql.annotation;

import com.stellarsql.catalog.ColumnMeta;
import com.stellarsql.schema.OutputColumn;
import com.stellarsql.types.FieldInfo;

import java.util.Locale;

/**
 * A column reachable through a FROM item.
 *
 * @param name the column name as the catalog (or the derived table) spells it
 * @param info the column's type, unit, UCD and frame
 * @param meta the catalog column, null for derived-table outputs
 * @param nullable whether the column may hold NULL
 * @param description the catalog description
 * @param caseSensitive whether the name must be emitted quoted
 */
record FrameColumn(String name, FieldInfo info, ColumnMeta meta, boolean nullable,
                   String description, boolean caseSensitive) {

    static FrameColumn of(ColumnMeta meta) {
        FieldInfo info = new FieldInfo(meta.type(), meta.unit(), meta.ucd(), meta.frame());
        return new FrameColumn(meta.name(), info, meta, meta.nullable(), meta.description(),
            meta.caseSensitive());
    }

    static FrameColumn of(OutputColumn output) {
        String name = output.name();
        return new FrameColumn(name, output.toFieldInfo(), null, output.nullable(),
            output.description(), !name.equals(name.toLowerCase(Locale.ROOT)));
    }

    /**
     * Tests whether an identifier as written refers to this column. Regular
     * identifiers match ignoring case, delimited ones exactly.
     */
    boolean matches(String written, boolean delimited) {
        return delimited ? name.equals(written) : name.equalsIgnoreCase(written);
    }

    FrameColumn withNullable(boolean newNullable) {
        return new FrameColumn(name, info, meta, newNullable, description, caseSensitive);
    }
}
