package com.stellarsql.annotation;

import com.stellarsql.expression.ColumnReference;
import com.stellarsql.expression.Expression;
import com.stellarsql.logical.DerivedColumn;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Output column naming.
 *
 * <ol>
 *   <li>an explicit alias: delimited aliases keep their case, regular ones
 *       are lower-cased;</li>
 *   <li>else the column name, for a plain column reference;</li>
 *   <li>else {@code expr_N}, N being the 1-based select-list position.</li>
 * </ol>
 * A name already taken by an earlier column gets {@code _2}, {@code _3}, ...
 * appended.
 */
final class OutputNaming {

    private OutputNaming() {
        // Utility class - prevent instantiation
    }

    static List<String> assign(List<DerivedColumn> items) {
        List<String> names = new ArrayList<>(items.size());
        Set<String> taken = new HashSet<>();
        for (int i = 0; i < items.size(); i++) {
            String base = baseName(items.get(i), i + 1);
            String name = base;
            for (int suffix = 2; taken.contains(name); suffix++) {
                name = base + "_" + suffix;
            }
            taken.add(name);
            names.add(name);
        }
        return names;
    }

    private static String baseName(DerivedColumn item, int position) {
        if (item.alias() != null) {
            return item.aliasDelimited() ? item.alias() : item.alias().toLowerCase(Locale.ROOT);
        }
        Expression expression = item.expression();
        if (expression instanceof ColumnReference) {
            ColumnReference ref = (ColumnReference) expression;
            return ref.binding() != null ? ref.binding().columnName() : ref.name();
        }
        return "expr_" + position;
    }

    /**
     * Tests whether a select item would come out under this name without an
     * {@code AS} clause.
     */
    static boolean isNaturalName(Expression expression, String name) {
        if (!(expression instanceof ColumnReference)) {
            return false;
        }
        ColumnReference ref = (ColumnReference) expression;
        String columnName = ref.binding() != null ? ref.binding().columnName() : ref.name();
        return columnName.equals(name);
    }

    static int indexOf(List<String> names, String written, boolean delimited) {
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            if (delimited ? name.equals(written) : name.equalsIgnoreCase(written)) {
                return i;
            }
        }
        return -1;
    }
}
