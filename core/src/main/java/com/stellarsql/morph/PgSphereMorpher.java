package com.stellarsql.morph;

import com.stellarsql.catalog.TableMeta;
import com.stellarsql.exception.InternalMorphException;
import com.stellarsql.exception.UnsupportedFeatureException;
import com.stellarsql.expression.ColumnReference;
import com.stellarsql.expression.Expression;
import com.stellarsql.functions.FunctionRegistry;
import com.stellarsql.logical.DerivedColumn;
import com.stellarsql.logical.DerivedTable;
import com.stellarsql.logical.Join;
import com.stellarsql.logical.QueryExpression;
import com.stellarsql.logical.QuerySpecification;
import com.stellarsql.logical.SelectItem;
import com.stellarsql.logical.SelectList;
import com.stellarsql.logical.SetOperation;
import com.stellarsql.logical.SortSpecification;
import com.stellarsql.logical.TableRef;
import com.stellarsql.logical.TableReference;
import com.stellarsql.optimizer.Postprocessor;
import com.stellarsql.schema.OutputColumn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Morpher for PostgreSQL with the pgSphere extension (and q3c indexes
 * where the catalog declares them).
 *
 * <p>The query is first run through the {@link Postprocessor}. Then each
 * SELECT block is rewritten on its own, subqueries and set-operation
 * operands included:
 * <ul>
 *   <li>expressions are rewritten by {@link ExpressionMorpher}</li>
 *   <li>table and column names get their backend spelling</li>
 *   <li>{@code TOP n} becomes {@code LIMIT n}; for a set operation the TOP
 *       of its leftmost operand limits the whole result, and a trailing
 *       ORDER BY or OFFSET sorts or skips the whole result</li>
 *   <li>the configured maximum row limit caps the outermost LIMIT, or
 *       supplies one where the query has none</li>
 *   <li>select items whose backend column name differs from the output
 *       name get an explicit alias</li>
 * </ul>
 *
 * <p>Instances are immutable and thread-safe.
 */
public class PgSphereMorpher implements Morpher {

    private static final Logger logger = LoggerFactory.getLogger(PgSphereMorpher.class);

    private final Postprocessor postprocessor;
    private final boolean q3cEnabled;
    private final long maxRowLimit;
    private final CoordinateConversionRegistry conversions;

    private PgSphereMorpher(Builder builder) {
        this.postprocessor = new Postprocessor(builder.registry);
        this.q3cEnabled = builder.q3cEnabled;
        this.maxRowLimit = builder.maxRowLimit;
        this.conversions = builder.conversions;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public QueryExpression morph(QueryExpression annotated) {
        Objects.requireNonNull(annotated, "annotated");
        QueryExpression processed = postprocessor.process(annotated);
        QueryExpression morphed = morphQuery(processed, null, true);
        logger.debug("Morphed query: {}", morphed);
        return morphed;
    }

    QueryExpression morphQuery(QueryExpression query, RangeContext parent, boolean outermost) {
        if (query.outputColumns().isEmpty()) {
            throw new InternalMorphException("Query reached the morpher without annotation", query.position());
        }
        if (query instanceof SetOperation) {
            SetOperation setOp = morphSetOperation((SetOperation) query, parent);
            return outermost ? setOp.withLimit(capLimit(setOp.limit())) : setOp;
        }
        QuerySpecification spec = morphSpecification((QuerySpecification) query, parent);
        if (!outermost) {
            return spec;
        }
        Long limit = capLimit(spec.limit());
        return Objects.equals(limit, spec.limit()) ? spec : spec.toBuilder().limit(limit).build();
    }

    private SetOperation morphSetOperation(SetOperation setOp, RangeContext parent) {
        SetOperation morphed = setOp.withOperands(
            morphQuery(setOp.left(), parent, false), morphQuery(setOp.right(), parent, false));
        return hoistTrailingOrder(hoistLeftmostLimit(morphed));
    }

    private QuerySpecification morphSpecification(QuerySpecification spec, RangeContext parent) {
        RangeContext context = new RangeContext(parent);
        ExpressionMorpher expressions = new ExpressionMorpher(this, q3cEnabled, conversions);

        List<TableReference> from = new ArrayList<>();
        for (TableReference table : spec.from()) {
            from.add(morphTable(table, parent, context, expressions));
        }

        List<OutputColumn> outputs = spec.outputColumns();
        List<SelectItem> items = spec.selectList().items();
        if (items.size() != outputs.size()) {
            throw new InternalMorphException(
                "Select list has " + items.size() + " items but " + outputs.size() + " output columns",
                spec.position());
        }
        List<SelectItem> morphedItems = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            if (!(items.get(i) instanceof DerivedColumn)) {
                throw new InternalMorphException("Unexpanded wildcard in select list", items.get(i).position());
            }
            DerivedColumn item = (DerivedColumn) items.get(i);
            Expression expression = expressions.transform(item.expression(), context);
            morphedItems.add(named(item.withExpression(expression), outputs.get(i).name()));
        }

        List<Expression> groupBy = new ArrayList<>();
        for (Expression key : spec.groupBy()) {
            groupBy.add(expressions.transform(key, context));
        }
        List<SortSpecification> orderBy = new ArrayList<>();
        for (SortSpecification sort : spec.orderBy()) {
            orderBy.add(sort.isOrdinal() ? sort : sort.withKey(expressions.transform(sort.key(), context)));
        }

        return spec.toBuilder()
            .from(from)
            .selectList(new SelectList(morphedItems))
            .where(expressions.transform(spec.where(), context))
            .groupBy(groupBy)
            .having(expressions.transform(spec.having(), context))
            .orderBy(orderBy)
            .top(null)
            .limit(spec.top())
            .build();
    }

    /**
     * Makes sure the backend names the column as the output column says.
     */
    private static DerivedColumn named(DerivedColumn item, String outputName) {
        Expression expression = item.expression();
        if (item.alias() == null && expression instanceof ColumnReference
                && ((ColumnReference) expression).name().equals(outputName)) {
            return item;
        }
        return item.withAlias(outputName, true);
    }

    private TableReference morphTable(TableReference table, RangeContext parent, RangeContext context,
                                      ExpressionMorpher expressions) {
        if (table instanceof TableRef) {
            TableRef ref = (TableRef) table;
            TableMeta meta = ref.table();
            if (meta == null) {
                throw new InternalMorphException("Unresolved table '" + ref.name() + "'", ref.position());
            }
            context.register(ref.rangeName(), IdentifierNormalizer.rangeName(ref, meta), meta);
            return new TableRef(IdentifierNormalizer.tableName(meta), IdentifierNormalizer.alias(ref),
                ref.aliasDelimited(), ref.position()).withTable(meta);
        }
        if (table instanceof DerivedTable) {
            DerivedTable derived = (DerivedTable) table;
            QueryExpression query = morphQuery(derived.query(), parent, false);
            context.register(derived.rangeName(), derived.rangeName(), null);
            return new DerivedTable(query, derived.rangeName(), derived.aliasDelimited(), derived.position());
        }
        Join join = (Join) table;
        TableReference left = morphTable(join.left(), parent, context, expressions);
        TableReference right = morphTable(join.right(), parent, context, expressions);
        return join.withChildren(left, right, expressions.transform(join.condition(), context));
    }

    // ==================== Row limits ====================

    /**
     * Moves the LIMIT of the left operand onto the set operation. Applied
     * bottom-up, this hands the TOP of the leftmost SELECT block to the
     * set operation that encloses it.
     */
    private static SetOperation hoistLeftmostLimit(SetOperation setOp) {
        QueryExpression left = setOp.left();
        if (left.limit() == null || setOp.limit() != null) {
            return setOp;
        }
        return setOp.withOperands(withoutLimit(left), setOp.right()).withLimit(left.limit());
    }

    private static QueryExpression withoutLimit(QueryExpression query) {
        if (query instanceof SetOperation) {
            return ((SetOperation) query).withLimit(null);
        }
        return ((QuerySpecification) query).toBuilder().limit(null).build();
    }

    /**
     * Moves a trailing ORDER BY and OFFSET from the right operand onto the
     * set operation, with sort keys turned into select-list ordinals. A
     * right operand with its own TOP keeps them.
     */
    private static SetOperation hoistTrailingOrder(SetOperation setOp) {
        QueryExpression right = setOp.right();
        if (right.limit() != null || !setOp.orderBy().isEmpty() || setOp.offset() != null) {
            return setOp;
        }
        if (right instanceof SetOperation) {
            SetOperation nested = (SetOperation) right;
            if (nested.orderBy().isEmpty() && nested.offset() == null) {
                return setOp;
            }
            return setOp.withOperands(setOp.left(), nested.withOrderBy(List.of(), null))
                .withOrderBy(nested.orderBy(), nested.offset());
        }
        QuerySpecification spec = (QuerySpecification) right;
        if (spec.orderBy().isEmpty() && spec.offset() == null) {
            return setOp;
        }
        List<Expression> selected = new ArrayList<>();
        for (SelectItem item : spec.selectList().items()) {
            selected.add(((DerivedColumn) item).expression());
        }
        List<SortSpecification> ordinals = new ArrayList<>();
        for (SortSpecification sort : spec.orderBy()) {
            if (sort.isOrdinal()) {
                ordinals.add(sort);
                continue;
            }
            int index = selected.indexOf(sort.key());
            if (index < 0) {
                throw new UnsupportedFeatureException(
                    "ORDER BY of a " + setOp.kind() + " must name one of its result columns",
                    sort.key().position(), sort.key().toString());
            }
            ordinals.add(SortSpecification.byOrdinal(index + 1, sort.descending(), sort.position()));
        }
        QuerySpecification stripped = spec.toBuilder().orderBy(List.of()).offset(null).build();
        return setOp.withOperands(setOp.left(), stripped).withOrderBy(ordinals, spec.offset());
    }

    private Long capLimit(Long limit) {
        if (maxRowLimit <= 0) {
            return limit;
        }
        return limit == null ? Long.valueOf(maxRowLimit) : Long.valueOf(Math.min(limit, maxRowLimit));
    }

    /**
     * Builder for {@link PgSphereMorpher}.
     */
    public static final class Builder {
        private FunctionRegistry registry = FunctionRegistry.builtins();
        private boolean q3cEnabled = true;
        private long maxRowLimit;
        private CoordinateConversionRegistry conversions = CoordinateConversionRegistry.defaults();

        private Builder() {
        }

        public Builder registry(FunctionRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry");
            return this;
        }

        public Builder q3cEnabled(boolean q3cEnabled) {
            this.q3cEnabled = q3cEnabled;
            return this;
        }

        /**
         * Sets the maximum number of rows the outermost query may return.
         *
         * @param maxRowLimit the cap, 0 for none
         * @return this builder
         */
        public Builder maxRowLimit(long maxRowLimit) {
            if (maxRowLimit < 0) {
                throw new IllegalArgumentException("maxRowLimit must not be negative: " + maxRowLimit);
            }
            this.maxRowLimit = maxRowLimit;
            return this;
        }

        public Builder conversions(CoordinateConversionRegistry conversions) {
            this.conversions = Objects.requireNonNull(conversions, "conversions");
            return this;
        }

        public PgSphereMorpher build() {
            return new PgSphereMorpher(this);
        }
    }
}
