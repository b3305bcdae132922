package com.quarry.expression;

/**
 * Utility methods for classifying and inspecting expressions.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /**
     * Returns true if the expression tree contains an aggregate function call
     * anywhere, e.g. {@code MIN(b) + 1} or {@code COUNT(a) AS n}.
     *
     * @param expr the expression to check
     * @return true if the expression contains an aggregate function
     */
    public static boolean containsAggregateFunction(Expression expr) {
        if (expr instanceof AggregateFunction) {
            return true;
        }
        for (Expression child : expr.children()) {
            if (containsAggregateFunction(child)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns true if the expression is an aggregate function call, looking
     * through any aliases wrapped around it. Nested aggregates inside the
     * argument ({@code SUM(MAX(x))}) do not count.
     *
     * @param expr the expression to check
     * @return true for {@code MIN(b)} and {@code MIN(b) AS lo}, false for {@code MIN(b) + 1}
     */
    public static boolean isAggregate(Expression expr) {
        Expression unwrapped = unwrapAlias(expr);
        return unwrapped instanceof AggregateFunction agg &&
               !containsAggregateFunction(agg.argument());
    }

    /**
     * Returns true if a sort expression occurs anywhere in the tree.
     *
     * @param expr the expression to check
     * @return true if the tree contains a {@link SortExpression}
     */
    public static boolean containsSortExpression(Expression expr) {
        if (expr instanceof SortExpression) {
            return true;
        }
        for (Expression child : expr.children()) {
            if (containsSortExpression(child)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Strips any number of aliases from the top of an expression.
     *
     * @param expr the expression
     * @return the first non-alias expression
     */
    public static Expression unwrapAlias(Expression expr) {
        Expression current = expr;
        while (current instanceof AliasExpression alias) {
            current = alias.expression();
        }
        return current;
    }
}
