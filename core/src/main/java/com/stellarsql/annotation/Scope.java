package com.stellarsql.annotation;

import com.stellarsql.exception.AmbiguousColumnException;
import com.stellarsql.exception.UnknownColumnException;
import com.stellarsql.exception.UnknownTableException;
import com.stellarsql.expression.ColumnBinding;
import com.stellarsql.expression.ColumnReference;

import java.util.ArrayList;
import java.util.List;

/**
 * The FROM items visible to the expressions of one query level, linked to
 * the scope of the enclosing query for correlated references.
 */
final class Scope {

    private final Scope parent;
    private final List<Frame> frames;
    private final List<VisibleColumn> visible;

    Scope(Scope parent, List<Frame> frames, List<VisibleColumn> visible) {
        this.parent = parent;
        this.frames = List.copyOf(frames);
        this.visible = List.copyOf(visible);
    }

    static Scope empty(Scope parent) {
        return new Scope(parent, List.of(), List.of());
    }

    Scope parent() {
        return parent;
    }

    List<Frame> frames() {
        return frames;
    }

    /**
     * Returns the columns of {@code SELECT *}, in FROM order with join-merged
     * columns first within their join.
     */
    List<VisibleColumn> visible() {
        return visible;
    }

    /**
     * Resolves a column reference, innermost scope first.
     *
     * @param ref the reference as parsed
     * @return the resolution
     * @throws UnknownTableException if a qualifier names no FROM item
     * @throws UnknownColumnException if no column matches
     * @throws AmbiguousColumnException if more than one column matches
     */
    Resolution resolve(ColumnReference ref) {
        return ref.qualifier() == null ? resolveUnqualified(ref) : resolveQualified(ref);
    }

    private Resolution resolveQualified(ColumnReference ref) {
        int depth = 0;
        for (Scope scope = this; scope != null; scope = scope.parent, depth++) {
            List<Frame> named = new ArrayList<>();
            for (Frame frame : scope.frames) {
                if (frame.matchesQualifier(ref.qualifier())) {
                    named.add(frame);
                }
            }
            if (named.size() > 1) {
                throw new AmbiguousColumnException(
                    "Table reference '" + ref.qualifier() + "' is ambiguous",
                    ref.position(), ref.toString());
            }
            if (named.size() == 1) {
                Frame frame = named.get(0);
                FrameColumn column = frame.column(ref.name(), ref.delimited())
                    .orElseThrow(() -> new UnknownColumnException(
                        "Column '" + ref.name() + "' does not exist in '" + ref.qualifier() + "'",
                        ref.position(), ref.name()));
                return new Resolution(binding(frame.rangeName(), column, depth), column);
            }
        }
        throw new UnknownTableException(
            "Unknown table or alias '" + ref.qualifier() + "'", ref.position(), ref.qualifier());
    }

    private Resolution resolveUnqualified(ColumnReference ref) {
        int depth = 0;
        for (Scope scope = this; scope != null; scope = scope.parent, depth++) {
            List<VisibleColumn> matches = new ArrayList<>();
            for (VisibleColumn candidate : scope.visible) {
                if (candidate.column().matches(ref.name(), ref.delimited())) {
                    matches.add(candidate);
                }
            }
            if (matches.size() > 1) {
                List<String> owners = new ArrayList<>();
                for (VisibleColumn match : matches) {
                    owners.add(match.rangeName() + "." + match.column().name());
                }
                throw new AmbiguousColumnException(
                    "Column reference '" + ref.name() + "' is ambiguous; it could refer to "
                        + String.join(" or ", owners),
                    ref.position(), ref.name());
            }
            if (matches.size() == 1) {
                VisibleColumn match = matches.get(0);
                return new Resolution(binding(match.rangeName(), match.column(), depth), match.column());
            }
        }
        throw new UnknownColumnException(
            "Column '" + ref.name() + "' does not exist", ref.position(), ref.name());
    }

    static ColumnBinding binding(String rangeName, FrameColumn column, int depth) {
        return new ColumnBinding(rangeName, column.name(), column.meta(), column.caseSensitive(), depth);
    }

    /**
     * The outcome of resolving a column reference.
     */
    record Resolution(ColumnBinding binding, FrameColumn column) {
    }
}
