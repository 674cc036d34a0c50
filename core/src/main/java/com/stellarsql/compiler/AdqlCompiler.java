package com.stellarsql.compiler;

import com.stellarsql.annotation.AnnotatedQuery;
import com.stellarsql.annotation.Annotator;
import com.stellarsql.catalog.CatalogRegistry;
import com.stellarsql.catalog.MetadataCatalog;
import com.stellarsql.exception.AdqlCompilationException;
import com.stellarsql.functions.FunctionRegistry;
import com.stellarsql.generator.GeneratedSQL;
import com.stellarsql.generator.SQLGenerator;
import com.stellarsql.logical.QueryExpression;
import com.stellarsql.morph.Morpher;
import com.stellarsql.morph.PgSphereMorpher;
import com.stellarsql.parser.AdqlQueryParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Compiles ADQL queries into parameterized PostgreSQL/pgSphere statements.
 *
 * <p>A compilation runs parse, annotate, morph (with the postprocessor
 * first) and generate, in that order, and stops at the first error. Every
 * stage is pure, so one compiler may be shared by any number of threads;
 * the catalog snapshot is the only input besides the query text.
 *
 * <p>Example usage:
 * <pre>
 *   AdqlCompiler compiler = new AdqlCompiler(CompilerConfig.defaults());
 *   CompiledQuery compiled = compiler.compile("SELECT TOP 10 ra, dec FROM gaia.dr3", catalog);
 *   PreparedStatement ps = connection.prepareStatement(compiled.sql());
 * </pre>
 */
public class AdqlCompiler {

    private static final Logger logger = LoggerFactory.getLogger(AdqlCompiler.class);

    private final CompilerConfig config;
    private final AdqlQueryParser parser;
    private final Annotator annotator;
    private final Morpher morpher;
    private final SQLGenerator generator;

    public AdqlCompiler() {
        this(CompilerConfig.defaults());
    }

    public AdqlCompiler(CompilerConfig config) {
        this(config, FunctionRegistry.builtins());
    }

    public AdqlCompiler(CompilerConfig config, FunctionRegistry registry) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(registry, "registry must not be null");
        this.parser = new AdqlQueryParser(config.maxNestingDepth());
        this.annotator = new Annotator(registry, config.maxNestingDepth());
        this.morpher = PgSphereMorpher.builder()
            .registry(registry)
            .q3cEnabled(config.q3cEnabled())
            .maxRowLimit(config.maxRowLimit())
            .conversions(config.coordinateConversions())
            .build();
        this.generator = new SQLGenerator(config.parameterStyle());
    }

    public CompilerConfig config() {
        return config;
    }

    /**
     * Compiles a query against a catalog snapshot.
     *
     * @param adql the query text
     * @param catalog the snapshot to resolve tables and columns against
     * @return the statement, its parameters and its result schema
     * @throws AdqlCompilationException if the query is invalid or unsupported
     */
    public CompiledQuery compile(String adql, MetadataCatalog catalog) {
        Objects.requireNonNull(adql, "adql must not be null");
        Objects.requireNonNull(catalog, "catalog must not be null");
        long start = System.nanoTime();

        try {
            QueryExpression parsed = parser.parse(adql);
            AnnotatedQuery annotated = annotator.annotate(parsed, catalog);
            QueryExpression morphed = morpher.morph(annotated.query());
            GeneratedSQL generated = generator.generate(morphed);

            CompiledQuery compiled = new CompiledQuery(generated, annotated.outputColumns(),
                annotated.catalogVersion());
            if (logger.isDebugEnabled()) {
                logger.debug("Compiled in {} us: {}", (System.nanoTime() - start) / 1000, compiled.inlinedSql());
            }
            return compiled;
        } catch (AdqlCompilationException e) {
            logger.debug("Compilation failed: {}", e.getTechnicalMessage());
            throw e;
        }
    }

    /**
     * Compiles a query against the registry's current snapshot. The snapshot
     * is taken once, so a concurrent refresh never affects this compilation.
     */
    public CompiledQuery compile(String adql, CatalogRegistry registry) {
        Objects.requireNonNull(registry, "registry must not be null");
        return compile(adql, registry.current());
    }
}
