package com.stellarsql.optimizer;

import com.stellarsql.expression.Expression;
import com.stellarsql.expression.FunctionCall;
import com.stellarsql.functions.FunctionRegistry;
import com.stellarsql.functions.FunctionSignature;
import com.stellarsql.types.DataType;
import com.stellarsql.types.GeometryType;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rewrites {@code INTERSECTS} with a POINT argument as {@code CONTAINS}
 * with the point first, as ADQL requires. Later stages only have to
 * recognize the point-in-shape case in one form.
 */
public class IntersectsToContainsRule extends ExpressionRewriteRule {

    private final FunctionRegistry registry;

    public IntersectsToContainsRule(FunctionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public Expression visitFunctionCall(FunctionCall expr, Void context) {
        FunctionCall rebuilt = (FunctionCall) super.visitFunctionCall(expr, context);
        if (!"INTERSECTS".equals(rebuilt.name()) || rebuilt.arguments().size() != 2) {
            return rebuilt;
        }
        Expression first = rebuilt.argument(0);
        Expression second = rebuilt.argument(1);
        List<Expression> arguments;
        if (isPoint(first)) {
            arguments = List.of(first, second);
        } else if (isPoint(second)) {
            arguments = List.of(second, first);
        } else {
            return rebuilt;
        }

        Optional<FunctionSignature> contains =
            registry.lookup("CONTAINS", List.of(arguments.get(0).dataType(), arguments.get(1).dataType()));
        if (contains.isEmpty()) {
            return rebuilt;
        }
        return new FunctionCall("CONTAINS", arguments, false, false, rebuilt.position())
            .withSignature(contains.get(), rebuilt.info());
    }

    private static boolean isPoint(Expression expr) {
        DataType type = expr.dataType();
        return type instanceof GeometryType && ((GeometryType) type).isPoint();
    }
}
