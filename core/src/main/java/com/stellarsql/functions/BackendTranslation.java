package com.stellarsql.functions;

import java.util.Objects;

/**
 * How a function call is expressed in PostgreSQL.
 *
 * <ul>
 *   <li>{@link Kind#RENAME}: a call of the backend function {@link #target()}
 *       with the same arguments</li>
 *   <li>{@link Kind#TEMPLATE}: a SQL fragment with {@code {0}}, {@code {1}}, ...
 *       argument placeholders</li>
 *   <li>{@link Kind#MORPHER}: rewritten by the morpher itself (geometry)</li>
 *   <li>{@link Kind#UNSUPPORTED}: known to ADQL but rejected; {@link #target()}
 *       holds the reason</li>
 * </ul>
 */
public final class BackendTranslation {

    public enum Kind {
        RENAME,
        TEMPLATE,
        MORPHER,
        UNSUPPORTED
    }

    private static final BackendTranslation MORPHER = new BackendTranslation(Kind.MORPHER, "");

    private final Kind kind;
    private final String target;

    private BackendTranslation(Kind kind, String target) {
        this.kind = kind;
        this.target = Objects.requireNonNull(target, "target");
    }

    public static BackendTranslation rename(String backendName) {
        return new BackendTranslation(Kind.RENAME, backendName);
    }

    public static BackendTranslation template(String template) {
        return new BackendTranslation(Kind.TEMPLATE, template);
    }

    public static BackendTranslation morpher() {
        return MORPHER;
    }

    public static BackendTranslation unsupported(String reason) {
        return new BackendTranslation(Kind.UNSUPPORTED, reason);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Returns the backend name, template or rejection reason, depending on
     * {@link #kind()}.
     *
     * @return the target text
     */
    public String target() {
        return target;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof BackendTranslation)) {
            return false;
        }
        BackendTranslation that = (BackendTranslation) obj;
        return kind == that.kind && target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, target);
    }

    @Override
    public String toString() {
        return kind + (target.isEmpty() ? "" : "[" + target + "]");
    }
}
