package com.stellarsql.annotation;

import com.stellarsql.catalog.TableMeta;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * One FROM item's correlation name and columns: a catalog table or a
 * derived table.
 */
final class Frame {

    private final String rangeName;
    private final String alias;
    private final boolean aliasDelimited;
    private final String writtenName;
    private final TableMeta table;
    private final List<FrameColumn> columns;

    private Frame(String rangeName, String alias, boolean aliasDelimited, String writtenName,
                  TableMeta table, List<FrameColumn> columns) {
        this.rangeName = rangeName;
        this.alias = alias;
        this.aliasDelimited = aliasDelimited;
        this.writtenName = writtenName;
        this.table = table;
        this.columns = List.copyOf(columns);
    }

    static Frame forTable(String rangeName, String alias, boolean aliasDelimited, String writtenName,
                          TableMeta table, List<FrameColumn> columns) {
        return new Frame(rangeName, alias, aliasDelimited, writtenName, table, columns);
    }

    static Frame forDerivedTable(String rangeName, String alias, boolean aliasDelimited,
                                 List<FrameColumn> columns) {
        return new Frame(rangeName, alias, aliasDelimited, null, null, columns);
    }

    String rangeName() {
        return rangeName;
    }

    List<FrameColumn> columns() {
        return columns;
    }

    /**
     * Tests whether a column qualifier names this frame. An aliased frame
     * answers only to its alias; a table answers to its simple and its
     * schema-qualified name.
     */
    boolean matchesQualifier(String qualifier) {
        if (alias != null) {
            return aliasDelimited ? alias.equals(qualifier) : alias.equalsIgnoreCase(qualifier);
        }
        if (table != null) {
            return qualifier.equalsIgnoreCase(table.name())
                || qualifier.equalsIgnoreCase(table.qualifiedName())
                || qualifier.equalsIgnoreCase(writtenName);
        }
        return false;
    }

    Optional<FrameColumn> column(String name, boolean delimited) {
        for (FrameColumn column : columns) {
            if (column.matches(name, delimited)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    Frame withNullableColumns() {
        List<FrameColumn> nullable = columns.stream()
            .map(c -> c.withNullable(true))
            .collect(Collectors.toList());
        return new Frame(rangeName, alias, aliasDelimited, writtenName, table, nullable);
    }

    @Override
    public String toString() {
        return rangeName;
    }
}
