package com.stellarsql.generator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * SQL text with its bound parameter values.
 *
 * @param sql the statement, with placeholders in {@code style}
 * @param parameters the parameter values (Long, Double or String), in placeholder order
 * @param style the placeholder syntax used in {@code sql}
 */
public record GeneratedSQL(String sql, List<Object> parameters, ParameterStyle style) {

    public GeneratedSQL {
        Objects.requireNonNull(sql, "sql");
        Objects.requireNonNull(style, "style");
        parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    /**
     * Returns the statement with every placeholder replaced by its value as
     * an SQL literal. Meant for logs and debugging; execute {@link #sql()}
     * with the parameters instead.
     *
     * @return the inlined statement
     */
    public String inlinedSql() {
        StringBuilder result = new StringBuilder(sql.length() + parameters.size() * 8);
        int next = 0;
        int i = 0;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                int end = closingQuote(c, i);
                result.append(sql, i, end);
                i = end;
            } else if (style == ParameterStyle.POSITIONAL && c == '?') {
                result.append(SQLQuoting.formatValue(parameters.get(next++)));
                i++;
            } else if (style == ParameterStyle.NUMBERED && c == '$' && i + 1 < sql.length()
                    && Character.isDigit(sql.charAt(i + 1))) {
                int end = i + 1;
                while (end < sql.length() && Character.isDigit(sql.charAt(end))) {
                    end++;
                }
                int index = Integer.parseInt(sql.substring(i + 1, end));
                result.append(SQLQuoting.formatValue(parameters.get(index - 1)));
                i = end;
            } else {
                result.append(c);
                i++;
            }
        }
        return result.toString();
    }

    /** Returns the index just past the quoted section starting at {@code start}. */
    private int closingQuote(char quote, int start) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }
}
