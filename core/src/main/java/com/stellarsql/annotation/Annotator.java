package com.stellarsql.annotation;

import com.stellarsql.catalog.MetadataCatalog;
import com.stellarsql.exception.AmbiguousColumnException;
import com.stellarsql.exception.UnknownColumnException;
import com.stellarsql.exception.UnknownTableException;
import com.stellarsql.functions.FunctionRegistry;
import com.stellarsql.logical.QueryExpression;
import com.stellarsql.parser.AdqlQueryParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Resolves a parsed query against a catalog snapshot.
 *
 * <p>Annotation binds every column reference to exactly one catalog column
 * (or derived-table output), matches every function call to one signature,
 * types every expression, expands {@code *} and computes the output
 * columns. The first violation aborts with an
 * {@link com.stellarsql.exception.AdqlCompilationException}:
 * <ul>
 *   <li>{@link UnknownTableException} for an unknown table or qualifier</li>
 *   <li>{@link UnknownColumnException} for an unknown column</li>
 *   <li>{@link AmbiguousColumnException} for an unqualified name matching
 *       several columns</li>
 *   <li>{@code TypeMismatchException}, {@code UnsupportedFunctionException},
 *       {@code ArityMismatchException}, {@code GroupingException} and
 *       {@code RecursionLimitException} for the remaining checks</li>
 * </ul>
 *
 * <p>Instances are immutable and thread-safe.
 */
public class Annotator {

    private static final Logger logger = LoggerFactory.getLogger(Annotator.class);

    private final FunctionRegistry registry;
    private final int maxDepth;

    public Annotator() {
        this(FunctionRegistry.builtins(), AdqlQueryParser.DEFAULT_MAX_DEPTH);
    }

    public Annotator(FunctionRegistry registry, int maxDepth) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.maxDepth = maxDepth;
    }

    /**
     * Annotates a parsed query.
     *
     * @param query the parser's output
     * @param catalog the snapshot to resolve tables and columns against
     * @return the annotated query with its output columns
     */
    public AnnotatedQuery annotate(QueryExpression query, MetadataCatalog catalog) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(catalog, "catalog");
        logger.debug("Annotating query against catalog version {}", catalog.version());

        QueryExpression annotated = new QueryAnnotator(catalog, registry, maxDepth).annotate(query, null);

        logger.debug("Annotated query has {} output column(s)", annotated.outputColumns().size());
        return new AnnotatedQuery(annotated, annotated.outputColumns(), catalog.version());
    }
}
