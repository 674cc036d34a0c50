package com.stellarsql.optimizer;

import com.stellarsql.functions.FunctionRegistry;
import com.stellarsql.logical.QueryExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Applies the postprocessing rules to an annotated query.
 *
 * <p>The rules are applied in order, repeatedly, until an iteration changes
 * nothing or the iteration limit is reached. This lets rules enable each
 * other (constant folding turning {@code POINT(-1 + 2, 3)} into a literal
 * point, which then lets INTERSECTS become CONTAINS).
 *
 * <p>Example usage:
 * <pre>
 *   Postprocessor postprocessor = new Postprocessor(FunctionRegistry.builtins());
 *   QueryExpression simplified = postprocessor.process(annotated);
 * </pre>
 *
 * <p>The default rules are:
 * <ul>
 *   <li>{@link ConstantFoldingRule}</li>
 *   <li>{@link PredicateSimplificationRule}</li>
 *   <li>{@link GeometryFoldingRule}</li>
 *   <li>{@link IntersectsToContainsRule}</li>
 * </ul>
 */
public class Postprocessor {

    private static final Logger logger = LoggerFactory.getLogger(Postprocessor.class);

    public static final int DEFAULT_MAX_ITERATIONS = 10;

    private final List<OptimizationRule> rules;
    private final int maxIterations;

    public Postprocessor(FunctionRegistry registry) {
        this(createDefaultRules(registry), DEFAULT_MAX_ITERATIONS);
    }

    /**
     * Creates a postprocessor with custom rules.
     *
     * @param rules the rules, applied in order
     * @param maxIterations the maximum number of passes over all rules
     */
    public Postprocessor(List<OptimizationRule> rules, int maxIterations) {
        this.rules = new ArrayList<>(rules);
        this.maxIterations = maxIterations;
    }

    /**
     * Applies the rules until the query stops changing.
     *
     * @param query the annotated query
     * @return the rewritten query
     */
    public QueryExpression process(QueryExpression query) {
        if (query == null) {
            return null;
        }

        QueryExpression current = query;
        for (int iteration = 0; iteration < maxIterations; iteration++) {
            QueryExpression previous = current;
            for (OptimizationRule rule : rules) {
                QueryExpression rewritten = rule.apply(current);
                if (rewritten != current) {
                    logger.debug("Iteration {}: {} rewrote the query", iteration + 1, rule.name());
                }
                current = rewritten;
            }
            if (current == previous || current.equals(previous)) {
                break;
            }
        }
        return current;
    }

    private static List<OptimizationRule> createDefaultRules(FunctionRegistry registry) {
        return Arrays.asList(
            new ConstantFoldingRule(),
            new PredicateSimplificationRule(),
            new GeometryFoldingRule(),
            new IntersectsToContainsRule(registry)
        );
    }

    public List<OptimizationRule> rules() {
        return new ArrayList<>(rules);
    }

    public int maxIterations() {
        return maxIterations;
    }
}
