package com.stellarsql.morph;

import com.stellarsql.catalog.TableMeta;
import com.stellarsql.exception.InternalMorphException;
import com.stellarsql.parser.SourcePosition;

import java.util.HashMap;
import java.util.Map;

/**
 * The FROM items of one query level during morphing, keyed by the range
 * name the annotator bound column references to. Linked to the enclosing
 * level for correlated references.
 */
final class RangeContext {

    /**
     * A FROM item as the backend sees it.
     *
     * @param emittedName the qualifier to emit for its columns
     * @param table the catalog table, null for derived tables
     */
    record Range(String emittedName, TableMeta table) {
    }

    private final RangeContext parent;
    private final Map<String, Range> ranges = new HashMap<>();

    RangeContext(RangeContext parent) {
        this.parent = parent;
    }

    void register(String rangeName, String emittedName, TableMeta table) {
        ranges.put(rangeName, new Range(emittedName, table));
    }

    Range lookup(String rangeName, int scopeDepth, SourcePosition position) {
        RangeContext level = this;
        for (int i = 0; i < scopeDepth && level != null; i++) {
            level = level.parent;
        }
        Range range = level == null ? null : level.ranges.get(rangeName);
        if (range == null) {
            throw new InternalMorphException(
                "Column bound to '" + rangeName + "' at depth " + scopeDepth + " has no FROM item", position);
        }
        return range;
    }
}
