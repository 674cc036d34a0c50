package com.stellarsql.morph;

import com.stellarsql.catalog.TableMeta;
import com.stellarsql.logical.TableRef;

import java.util.Locale;

/**
 * Backend spelling of catalog identifiers.
 *
 * <p>PostgreSQL folds unquoted names to lower case. Names the catalog does
 * not mark case-sensitive are therefore emitted in lower case; case-sensitive
 * names keep their exact spelling and end up quoted by the generator.
 */
final class IdentifierNormalizer {

    private IdentifierNormalizer() {
        // Utility class - prevent instantiation
    }

    static String normalize(String name, boolean caseSensitive) {
        return caseSensitive ? name : name.toLowerCase(Locale.ROOT);
    }

    static String tableName(TableMeta table) {
        String name = normalize(table.name(), table.caseSensitive());
        if (table.schema() == null || table.schema().isEmpty()) {
            return name;
        }
        return normalize(table.schema(), table.caseSensitive()) + "." + name;
    }

    static String alias(TableRef ref) {
        if (ref.alias() == null) {
            return null;
        }
        return normalize(ref.alias(), ref.aliasDelimited());
    }

    /**
     * Returns the name the backend knows a FROM table under: its alias, else
     * its unqualified table name.
     */
    static String rangeName(TableRef ref, TableMeta table) {
        String alias = alias(ref);
        return alias != null ? alias : normalize(table.name(), table.caseSensitive());
    }
}
