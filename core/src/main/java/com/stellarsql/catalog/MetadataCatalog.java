package com.stellarsql.catalog;

import java.util.Collection;
import java.util.Optional;

/**
 * Read-only, versioned view of the table metadata a query is compiled
 * against.
 *
 * <p>Implementations must be immutable: a compilation holds one snapshot
 * for its whole duration and may share it with other threads without
 * locking. A catalog refresh produces a new snapshot with a higher version.
 */
public interface MetadataCatalog {

    /**
     * Returns the snapshot version; strictly increasing across refreshes.
     *
     * @return the version
     */
    long version();

    /**
     * Looks up a table by simple or schema-qualified name, ignoring case.
     *
     * @param name the table name as written in the query
     * @return the table, or empty if unknown or not unique
     */
    Optional<TableMeta> lookupTable(String name);

    /**
     * Returns all tables of the snapshot.
     *
     * @return the tables
     */
    Collection<TableMeta> tables();
}
