package com.stellarsql.annotation;

import com.stellarsql.catalog.MetadataCatalog;
import com.stellarsql.catalog.TableMeta;
import com.stellarsql.exception.AmbiguousColumnException;
import com.stellarsql.exception.RecursionLimitException;
import com.stellarsql.exception.TypeMismatchException;
import com.stellarsql.exception.UnknownColumnException;
import com.stellarsql.exception.UnknownTableException;
import com.stellarsql.expression.ColumnBinding;
import com.stellarsql.expression.ColumnReference;
import com.stellarsql.expression.Expression;
import com.stellarsql.expression.Literal;
import com.stellarsql.functions.FunctionRegistry;
import com.stellarsql.logical.AllColumns;
import com.stellarsql.logical.DerivedColumn;
import com.stellarsql.logical.DerivedTable;
import com.stellarsql.logical.Join;
import com.stellarsql.logical.QueryExpression;
import com.stellarsql.logical.QuerySpecification;
import com.stellarsql.logical.QueryVisitor;
import com.stellarsql.logical.SelectItem;
import com.stellarsql.logical.SelectList;
import com.stellarsql.logical.SetOperation;
import com.stellarsql.logical.SortSpecification;
import com.stellarsql.logical.TableRef;
import com.stellarsql.logical.TableReference;
import com.stellarsql.schema.OutputColumn;
import com.stellarsql.types.DataType;
import com.stellarsql.types.TypeInferenceEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * Annotates one query tree against a catalog snapshot. Holds the nesting
 * depth of the walk, so a fresh instance is used per compilation.
 */
final class QueryAnnotator implements QueryVisitor<QueryExpression, Scope> {

    private final MetadataCatalog catalog;
    private final int maxDepth;
    private final ExpressionAnnotator expressions;
    private int depth;

    QueryAnnotator(MetadataCatalog catalog, FunctionRegistry registry, int maxDepth) {
        this.catalog = catalog;
        this.maxDepth = maxDepth;
        this.expressions = new ExpressionAnnotator(this, registry, maxDepth);
    }

    /**
     * Annotates a query nested in the given scope.
     *
     * @param query the query
     * @param parent the enclosing query's scope, null at top level
     * @return the annotated query, with output columns set
     */
    QueryExpression annotate(QueryExpression query, Scope parent) {
        if (++depth > maxDepth) {
            throw new RecursionLimitException(maxDepth, query.position());
        }
        try {
            return query.accept(this, parent);
        } finally {
            depth--;
        }
    }

    // ==================== SELECT blocks ====================

    @Override
    public QueryExpression visitQuerySpecification(QuerySpecification spec, Scope parent) {
        List<TableReference> from = new ArrayList<>();
        List<Frame> frames = new ArrayList<>();
        List<VisibleColumn> visible = new ArrayList<>();
        for (TableReference table : spec.from()) {
            FromItem item = annotateTable(table, parent);
            from.add(item.table());
            frames.addAll(item.frames());
            visible.addAll(item.visible());
        }
        Scope scope = new Scope(parent, frames, visible);

        Expression where = expressions.annotateCondition(spec.where(), scope, "WHERE");

        List<DerivedColumn> items = expandSelectList(spec.selectList(), scope);
        List<String> names = OutputNaming.assign(items);

        List<Expression> groupBy = new ArrayList<>();
        for (Expression key : spec.groupBy()) {
            groupBy.add(annotateGroupingKey(key, scope, items, names));
        }
        Expression having = expressions.annotateCondition(spec.having(), scope, "HAVING");

        List<SortSpecification> orderBy = new ArrayList<>();
        for (SortSpecification sort : spec.orderBy()) {
            orderBy.add(annotateSortKey(sort, scope, names));
        }

        List<SelectItem> namedItems = new ArrayList<>();
        List<OutputColumn> outputs = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            DerivedColumn item = items.get(i);
            String name = names.get(i);
            namedItems.add(OutputNaming.isNaturalName(item.expression(), name)
                ? item.withAlias(null, false)
                : item.withAlias(name, true));
            outputs.add(outputColumn(item.expression(), name));
        }

        QuerySpecification annotated = spec.toBuilder()
            .from(from)
            .where(where)
            .selectList(new SelectList(namedItems))
            .groupBy(groupBy)
            .having(having)
            .orderBy(orderBy)
            .outputColumns(outputs)
            .build();
        GroupingValidator.validate(annotated);
        return annotated;
    }

    private List<DerivedColumn> expandSelectList(SelectList selectList, Scope scope) {
        List<DerivedColumn> items = new ArrayList<>();
        for (SelectItem item : selectList.items()) {
            if (item instanceof AllColumns) {
                AllColumns star = (AllColumns) item;
                for (VisibleColumn column : starColumns(star, scope)) {
                    items.add(DerivedColumn.of(columnReference(column, star)));
                }
            } else {
                DerivedColumn column = (DerivedColumn) item;
                items.add(column.withExpression(expressions.transform(column.expression(), scope)));
            }
        }
        return items;
    }

    private static List<VisibleColumn> starColumns(AllColumns star, Scope scope) {
        if (star.qualifier() == null) {
            return scope.visible();
        }
        Frame match = null;
        for (Frame frame : scope.frames()) {
            if (frame.matchesQualifier(star.qualifier())) {
                if (match != null) {
                    throw new AmbiguousColumnException(
                        "Table reference '" + star.qualifier() + "' is ambiguous",
                        star.position(), star.qualifier());
                }
                match = frame;
            }
        }
        if (match == null) {
            throw new UnknownTableException(
                "Unknown table or alias '" + star.qualifier() + "'", star.position(), star.qualifier());
        }
        List<VisibleColumn> columns = new ArrayList<>();
        for (FrameColumn column : match.columns()) {
            columns.add(new VisibleColumn(match, column));
        }
        return columns;
    }

    private static ColumnReference columnReference(VisibleColumn column, AllColumns star) {
        FrameColumn frameColumn = column.column();
        ColumnBinding binding = Scope.binding(column.rangeName(), frameColumn, 0);
        return new ColumnReference(column.rangeName(), frameColumn.name(), frameColumn.caseSensitive(),
                star.position())
            .withBinding(binding, frameColumn.info());
    }

    /**
     * Annotates a GROUP BY key. A bare name that is no column of the FROM
     * items may name a select-list alias; an integer literal is a 1-based
     * select-list position.
     */
    private Expression annotateGroupingKey(Expression key, Scope scope, List<DerivedColumn> items,
                                           List<String> names) {
        if (key instanceof Literal && ((Literal) key).kind() == Literal.Kind.INTEGER) {
            long position = (Long) ((Literal) key).value();
            if (position < 1 || position > items.size()) {
                throw new UnknownColumnException(
                    "GROUP BY position " + position + " is not in select list", key.position(), key.toString());
            }
            return items.get((int) position - 1).expression();
        }
        if (key instanceof ColumnReference && ((ColumnReference) key).qualifier() == null) {
            ColumnReference ref = (ColumnReference) key;
            try {
                return expressions.transform(key, scope);
            } catch (UnknownColumnException e) {
                int index = OutputNaming.indexOf(names, ref.name(), ref.delimited());
                if (index < 0) {
                    throw e;
                }
                return items.get(index).expression();
            }
        }
        return expressions.transform(key, scope);
    }

    /**
     * Annotates an ORDER BY key. A bare name that equals an output column
     * name becomes that column's ordinal.
     */
    private SortSpecification annotateSortKey(SortSpecification sort, Scope scope, List<String> names) {
        if (sort.isOrdinal()) {
            if (sort.ordinal() > names.size()) {
                throw new UnknownColumnException(
                    "ORDER BY position " + sort.ordinal() + " is not in select list",
                    sort.position(), String.valueOf(sort.ordinal()));
            }
            return sort;
        }
        Expression key = sort.key();
        if (key instanceof ColumnReference && ((ColumnReference) key).qualifier() == null) {
            ColumnReference ref = (ColumnReference) key;
            int index = OutputNaming.indexOf(names, ref.name(), ref.delimited());
            if (index >= 0) {
                return SortSpecification.byOrdinal(index + 1, sort.descending(), sort.position());
            }
        }
        return sort.withKey(expressions.transform(key, scope));
    }

    private static OutputColumn outputColumn(Expression expression, String name) {
        if (expression instanceof ColumnReference) {
            ColumnBinding binding = ((ColumnReference) expression).binding();
            if (binding != null && binding.column() != null) {
                return OutputColumn.of(name, expression.info(), binding.column().nullable(),
                    binding.column().description());
            }
        }
        return OutputColumn.of(name, expression.info(), true, "");
    }

    // ==================== FROM ====================

    private FromItem annotateTable(TableReference table, Scope parent) {
        if (table instanceof TableRef) {
            return annotateTableRef((TableRef) table);
        }
        if (table instanceof DerivedTable) {
            DerivedTable derived = (DerivedTable) table;
            // derived tables see the enclosing query's scope, not their FROM siblings
            QueryExpression inner = annotate(derived.query(), parent);
            List<FrameColumn> columns = new ArrayList<>();
            for (OutputColumn output : inner.outputColumns()) {
                columns.add(FrameColumn.of(output));
            }
            Frame frame = Frame.forDerivedTable(derived.rangeName(), derived.alias(),
                derived.aliasDelimited(), columns);
            return FromItem.of(derived.withQuery(inner), frame);
        }
        return annotateJoin((Join) table, parent);
    }

    private FromItem annotateTableRef(TableRef ref) {
        TableMeta meta = catalog.lookupTable(ref.name())
            .orElseThrow(() -> new UnknownTableException(
                "Table '" + ref.name() + "' does not exist", ref.position(), ref.name()));
        List<FrameColumn> columns = new ArrayList<>();
        meta.columns().forEach(column -> columns.add(FrameColumn.of(column)));
        Frame frame = Frame.forTable(ref.rangeName(), ref.alias(), ref.aliasDelimited(), ref.name(),
            meta, columns);
        return FromItem.of(ref.withTable(meta), frame);
    }

    private FromItem annotateJoin(Join join, Scope parent) {
        FromItem left = annotateTable(join.left(), parent);
        FromItem right = annotateTable(join.right(), parent);
        switch (join.joinType()) {
            case LEFT:
                right = right.nullable();
                break;
            case RIGHT:
                left = left.nullable();
                break;
            case FULL:
                left = left.nullable();
                right = right.nullable();
                break;
            default:
                break;
        }

        List<String> mergedNames = new ArrayList<>();
        if (join.natural()) {
            for (VisibleColumn column : left.visible()) {
                if (find(right.visible(), column.column().name()) != null) {
                    mergedNames.add(column.column().name());
                }
            }
        } else {
            for (String name : join.usingColumns()) {
                if (find(left.visible(), name) == null || find(right.visible(), name) == null) {
                    throw new UnknownColumnException(
                        "USING column '" + name + "' does not exist on both sides of the join",
                        join.position(), name);
                }
                mergedNames.add(name);
            }
        }

        List<Frame> frames = new ArrayList<>(left.frames());
        frames.addAll(right.frames());

        List<VisibleColumn> visible = new ArrayList<>();
        List<VisibleColumn> mergedAway = new ArrayList<>();
        for (String name : mergedNames) {
            VisibleColumn l = find(left.visible(), name);
            VisibleColumn r = find(right.visible(), name);
            DataType type = TypeInferenceEngine.unifyTypes(l.column().info().type(), r.column().info().type());
            if (type == null) {
                throw new TypeMismatchException(
                    "Join column '" + name + "' has incompatible types "
                        + l.column().info().type().typeName() + " and " + r.column().info().type().typeName(),
                    join.position(), name);
            }
            FrameColumn kept = join.joinType() == Join.JoinType.RIGHT ? r.column() : l.column();
            FrameColumn merged = new FrameColumn(kept.name(), kept.info().withType(type), kept.meta(),
                join.joinType() == Join.JoinType.FULL || kept.nullable(), kept.description(),
                kept.caseSensitive());
            visible.add(new VisibleColumn(null, merged));
            mergedAway.add(l);
            mergedAway.add(r);
        }
        for (VisibleColumn column : left.visible()) {
            if (!mergedAway.contains(column)) {
                visible.add(column);
            }
        }
        for (VisibleColumn column : right.visible()) {
            if (!mergedAway.contains(column)) {
                visible.add(column);
            }
        }

        Expression condition = null;
        if (join.condition() != null) {
            Scope joinScope = new Scope(parent, frames, visible);
            condition = expressions.annotateCondition(join.condition(), joinScope, "JOIN");
        }
        Join annotated = join.withChildren(left.table(), right.table(), condition);
        return new FromItem(annotated, frames, visible);
    }

    private static VisibleColumn find(List<VisibleColumn> columns, String name) {
        VisibleColumn found = null;
        for (VisibleColumn column : columns) {
            if (column.column().matches(name, false)) {
                if (found != null) {
                    throw new AmbiguousColumnException(
                        "Join column '" + name + "' is ambiguous", null, name);
                }
                found = column;
            }
        }
        return found;
    }

    // ==================== Set operations ====================

    @Override
    public QueryExpression visitSetOperation(SetOperation op, Scope parent) {
        QueryExpression left = annotate(op.left(), parent);
        QueryExpression right = annotate(op.right(), parent);
        List<OutputColumn> leftColumns = left.outputColumns();
        List<OutputColumn> rightColumns = right.outputColumns();
        if (leftColumns.size() != rightColumns.size()) {
            throw new TypeMismatchException(
                op.kind() + " operands have different numbers of columns ("
                    + leftColumns.size() + " and " + rightColumns.size() + ")",
                op.position(), op.kind().name());
        }

        List<OutputColumn> outputs = new ArrayList<>();
        for (int i = 0; i < leftColumns.size(); i++) {
            OutputColumn l = leftColumns.get(i);
            OutputColumn r = rightColumns.get(i);
            DataType type = TypeInferenceEngine.unifyTypes(l.type(), r.type());
            if (type == null) {
                throw new TypeMismatchException(
                    op.kind() + " column " + (i + 1) + " has incompatible types "
                        + l.type().typeName() + " and " + r.type().typeName(),
                    op.position(), l.name());
            }
            String frame = l.frame().equals(r.frame()) ? l.frame() : "";
            outputs.add(new OutputColumn(l.name(), type, l.unit(), l.ucd(), frame,
                l.nullable() || r.nullable(), l.description()));
        }
        return op.withOperands(left, right).withOutputColumns(outputs);
    }

    /**
     * An annotated FROM item with the frames it contributes and the columns
     * it exposes to unqualified references.
     */
    private record FromItem(TableReference table, List<Frame> frames, List<VisibleColumn> visible) {

        static FromItem of(TableReference table, Frame frame) {
            List<VisibleColumn> visible = new ArrayList<>();
            for (FrameColumn column : frame.columns()) {
                visible.add(new VisibleColumn(frame, column));
            }
            return new FromItem(table, List.of(frame), visible);
        }

        /** The outer side of an outer join: every column may be NULL. */
        FromItem nullable() {
            List<Frame> newFrames = new ArrayList<>();
            for (Frame frame : frames) {
                newFrames.add(frame.withNullableColumns());
            }
            List<VisibleColumn> newVisible = new ArrayList<>();
            for (VisibleColumn column : visible) {
                if (column.frame() == null) {
                    newVisible.add(new VisibleColumn(null, column.column().withNullable(true)));
                } else {
                    Frame replaced = newFrames.get(frames.indexOf(column.frame()));
                    FrameColumn replacedColumn = replaced.columns().get(column.frame().columns().indexOf(column.column()));
                    newVisible.add(new VisibleColumn(replaced, replacedColumn));
                }
            }
            return new FromItem(table, newFrames, newVisible);
        }
    }
}
