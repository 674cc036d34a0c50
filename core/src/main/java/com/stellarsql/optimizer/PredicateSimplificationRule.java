package com.stellarsql.optimizer;

import com.stellarsql.expression.BetweenExpression;
import com.stellarsql.expression.Comparison;
import com.stellarsql.expression.Expression;
import com.stellarsql.expression.InExpression;
import com.stellarsql.expression.InSubquery;
import com.stellarsql.expression.LikeExpression;
import com.stellarsql.expression.NullCheck;
import com.stellarsql.expression.UnaryExpression;

/**
 * Removes {@code NOT} where the negated predicate has a negated form.
 *
 * <p>{@code NOT NOT p} becomes {@code p}; {@code NOT a < b} becomes
 * {@code a >= b}; NOT over IS NULL, IN, BETWEEN and LIKE flips their
 * negation flag. All of these are exact under three-valued logic.
 */
public class PredicateSimplificationRule extends ExpressionRewriteRule {

    @Override
    public Expression visitUnaryExpression(UnaryExpression expr, Void context) {
        UnaryExpression rebuilt = (UnaryExpression) super.visitUnaryExpression(expr, context);
        if (rebuilt.operator() != UnaryExpression.Operator.NOT) {
            return rebuilt;
        }
        Expression operand = rebuilt.operand();
        if (operand instanceof UnaryExpression
                && ((UnaryExpression) operand).operator() == UnaryExpression.Operator.NOT) {
            return ((UnaryExpression) operand).operand();
        }
        if (operand instanceof Comparison) {
            Comparison comparison = (Comparison) operand;
            return comparison.withOperator(comparison.operator().negate());
        }
        if (operand instanceof NullCheck) {
            return ((NullCheck) operand).negate();
        }
        if (operand instanceof InExpression) {
            return ((InExpression) operand).negate();
        }
        if (operand instanceof InSubquery) {
            return ((InSubquery) operand).negate();
        }
        if (operand instanceof BetweenExpression) {
            return ((BetweenExpression) operand).negate();
        }
        if (operand instanceof LikeExpression) {
            return ((LikeExpression) operand).negate();
        }
        return rebuilt;
    }
}
