package com.stellarsql.logical;

import com.stellarsql.catalog.TableMeta;
import com.stellarsql.parser.SourcePosition;

import java.util.Locale;
import java.util.Objects;

/**
 * A catalog table in a FROM clause, optionally aliased
 * ({@code ivoa.obscore AS o}).
 *
 * <p>The annotator attaches the resolved {@link TableMeta}.
 */
public final class TableRef implements TableReference {

    private final String name;
    private final String alias;
    private final boolean aliasDelimited;
    private final TableMeta table;
    private final SourcePosition position;

    public TableRef(String name, String alias, boolean aliasDelimited, SourcePosition position) {
        this(name, alias, aliasDelimited, null, position);
    }

    private TableRef(String name, String alias, boolean aliasDelimited, TableMeta table,
                     SourcePosition position) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Table name must not be null or empty");
        }
        this.name = name;
        this.alias = alias;
        this.aliasDelimited = aliasDelimited;
        this.table = table;
        this.position = position != null ? position : SourcePosition.UNKNOWN;
    }

    public static TableRef of(String name) {
        return new TableRef(name, null, false, SourcePosition.UNKNOWN);
    }

    /**
     * Returns the table name as written, possibly schema-qualified.
     *
     * @return the name
     */
    public String name() {
        return name;
    }

    /**
     * Returns the correlation name.
     *
     * @return the alias, or null if none
     */
    public String alias() {
        return alias;
    }

    public boolean aliasDelimited() {
        return aliasDelimited;
    }

    /**
     * Returns the name columns of this table are qualified with: the alias
     * if present, else the table name without schema. Regular identifiers
     * are lower-cased.
     *
     * @return the range name
     */
    public String rangeName() {
        if (alias != null) {
            return aliasDelimited ? alias : alias.toLowerCase(Locale.ROOT);
        }
        String simple = name.substring(name.lastIndexOf('.') + 1);
        return simple.toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the catalog table resolved by the annotator.
     *
     * @return the table, or null before annotation
     */
    public TableMeta table() {
        return table;
    }

    public TableRef withTable(TableMeta resolved) {
        return new TableRef(name, alias, aliasDelimited, resolved, position);
    }

    @Override
    public SourcePosition position() {
        return position;
    }

    @Override
    public <R, C> R accept(TableReferenceVisitor<R, C> visitor, C context) {
        return visitor.visitTable(this, context);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof TableRef)) {
            return false;
        }
        TableRef that = (TableRef) obj;
        return name.equalsIgnoreCase(that.name) && Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name.toLowerCase(Locale.ROOT), alias);
    }

    @Override
    public String toString() {
        return alias == null ? name : name + " AS " + alias;
    }
}
