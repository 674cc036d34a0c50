package com.stellarsql.catalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable in-memory {@link MetadataCatalog}.
 *
 * <p>A schema-qualified name matches that table only. An unqualified name
 * matches a table of that name if exactly one schema has one.
 */
public final class CatalogSnapshot implements MetadataCatalog {

    private final long version;
    private final Map<String, TableMeta> byQualifiedName;
    private final Map<String, List<TableMeta>> bySimpleName;

    private CatalogSnapshot(long version, Collection<TableMeta> tables) {
        this.version = version;
        Map<String, TableMeta> qualified = new LinkedHashMap<>();
        Map<String, List<TableMeta>> simple = new HashMap<>();
        for (TableMeta table : tables) {
            String key = key(table.qualifiedName());
            if (qualified.putIfAbsent(key, table) != null) {
                throw new IllegalArgumentException("Duplicate table " + table.qualifiedName());
            }
            simple.computeIfAbsent(key(table.name()), k -> new ArrayList<>()).add(table);
        }
        this.byQualifiedName = Collections.unmodifiableMap(qualified);
        this.bySimpleName = simple;
    }

    public static Builder builder(long version) {
        return new Builder(version);
    }

    @Override
    public long version() {
        return version;
    }

    @Override
    public Optional<TableMeta> lookupTable(String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        String key = key(name);
        TableMeta table = byQualifiedName.get(key);
        if (table != null) {
            return Optional.of(table);
        }
        if (key.indexOf('.') >= 0) {
            return Optional.empty();
        }
        List<TableMeta> candidates = bySimpleName.get(key);
        if (candidates != null && candidates.size() == 1) {
            return Optional.of(candidates.get(0));
        }
        return Optional.empty();
    }

    @Override
    public Collection<TableMeta> tables() {
        return byQualifiedName.values();
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "CatalogSnapshot(version=" + version + ", tables=" + byQualifiedName.size() + ")";
    }

    /**
     * Builder for {@link CatalogSnapshot}.
     */
    public static final class Builder {

        private final long version;
        private final List<TableMeta> tables = new ArrayList<>();

        private Builder(long version) {
            this.version = version;
        }

        public Builder table(TableMeta table) {
            tables.add(table);
            return this;
        }

        public CatalogSnapshot build() {
            return new CatalogSnapshot(version, tables);
        }
    }
}
