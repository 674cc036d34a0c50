package com.stellarsql.generator;

import java.util.Locale;
import java.util.Set;

/**
 * Utilities for quoting PostgreSQL identifiers and literals.
 *
 * <p>Example usage:
 * <pre>
 *   String column = SQLQuoting.quoteIdentifierIfNeeded("Flux");
 *   // Result: "Flux"
 *
 *   String text = SQLQuoting.quoteLiteral("O'Reilly");
 *   // Result: 'O''Reilly'
 * </pre>
 *
 * @see SQLGenerator
 */
public final class SQLQuoting {

    /** PostgreSQL reserved key words that cannot be used as bare identifiers. */
    private static final Set<String> RESERVED_WORDS = Set.of(
        "all", "analyse", "analyze", "and", "any", "array", "as", "asc", "asymmetric",
        "both", "case", "cast", "check", "collate", "column", "constraint", "create",
        "current_catalog", "current_date", "current_role", "current_time",
        "current_timestamp", "current_user", "default", "deferrable", "desc", "distinct",
        "do", "else", "end", "except", "false", "fetch", "for", "foreign", "from", "grant",
        "group", "having", "in", "initially", "intersect", "into", "lateral", "leading",
        "limit", "localtime", "localtimestamp", "not", "null", "offset", "on", "only", "or",
        "order", "placing", "primary", "references", "returning", "select", "session_user",
        "some", "symmetric", "table", "then", "to", "trailing", "true", "union", "unique",
        "user", "using", "variadic", "when", "where", "window", "with");

    private SQLQuoting() {
    }

    /**
     * Wraps a name in double quotes, doubling any quote inside it. Used for
     * ADQL delimited identifiers, which keep their exact spelling.
     *
     * @param identifier the name
     * @return the delimited name
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Quotes an identifier only if PostgreSQL would not read it back
     * unchanged: upper-case letters, special characters, a leading digit or
     * a reserved word.
     *
     * @param identifier the identifier to conditionally quote
     * @return the identifier, quoted if necessary
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifierIfNeeded(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return needsQuoting(identifier) ? quoteIdentifier(identifier) : identifier;
    }

    private static boolean needsQuoting(String identifier) {
        char first = identifier.charAt(0);
        if (!(first >= 'a' && first <= 'z') && first != '_') {
            return true;
        }
        for (int i = 1; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            boolean plain = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '$';
            if (!plain) {
                return true;
            }
        }
        return RESERVED_WORDS.contains(identifier);
    }

    /**
     * Quotes a possibly schema-qualified name part by part.
     *
     * @param qualifiedName a name such as {@code gaia.dr3}
     * @return the quoted name
     */
    public static String quoteQualifiedName(String qualifiedName) {
        String[] parts = qualifiedName.split("\\.");
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append(quoteIdentifierIfNeeded(parts[i]));
        }
        return sb.toString();
    }

    /**
     * Renders a character string literal; {@code null} becomes the keyword NULL.
     *
     * @param value the string
     * @return the literal text
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "NULL";
        }
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Renders a parameter value as an SQL literal.
     *
     * @param value a Long, Double or String, or null
     * @return the literal text
     */
    public static String formatValue(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof String) {
            return quoteLiteral((String) value);
        }
        if (value instanceof Double) {
            double d = (Double) value;
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return quoteLiteral(Double.toString(d)) + "::double precision";
            }
            return Double.toString(d);
        }
        return value.toString().toLowerCase(Locale.ROOT);
    }
}
