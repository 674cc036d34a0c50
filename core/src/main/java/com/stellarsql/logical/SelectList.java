package com.stellarsql.logical;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The ordered items of a SELECT clause.
 */
public final class SelectList {

    private final List<SelectItem> items;

    public SelectList(List<SelectItem> items) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("Select list must not be empty");
        }
        this.items = List.copyOf(items);
    }

    public List<SelectItem> items() {
        return items;
    }

    public int size() {
        return items.size();
    }

    /**
     * Returns true if no wildcard is left, i.e. after star expansion.
     *
     * @return whether every item is a derived column
     */
    public boolean isExpanded() {
        for (SelectItem item : items) {
            if (item instanceof AllColumns) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof SelectList && items.equals(((SelectList) obj).items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return items.stream().map(Object::toString).collect(Collectors.joining(", "));
    }
}
