package com.stellarsql.expression;

import com.stellarsql.catalog.ColumnMeta;

/**
 * What an annotated column reference resolved to.
 *
 * <p>{@code rangeName} is the name the column is reachable under in its
 * FROM scope: the table alias, else the table name. It is null for columns
 * merged by NATURAL or USING joins, which are referenced unqualified.
 *
 * @param rangeName the correlation name of the owning FROM item, or null
 * @param columnName the column's catalog (or derived-table output) name
 * @param column the catalog column, null for derived-table outputs
 * @param caseSensitive whether the column name must be emitted quoted
 * @param scopeDepth 0 for the innermost scope, 1 and up for outer (correlated) scopes
 */
public record ColumnBinding(String rangeName, String columnName, ColumnMeta column,
                            boolean caseSensitive, int scopeDepth) {
}
