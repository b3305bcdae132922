package com.quarry.expression;

import java.util.List;
import java.util.Objects;

/**
 * Wraps an expression with a sort direction and null placement.
 *
 * <p>Sort expressions are only valid in the list passed to
 * {@code DataFrame.sort}. The flags have no effect on the resolved field:
 * the output name, type and nullability are those of the inner expression.
 *
 * <p>Examples:
 * <pre>
 *   col("a").sort(true, true)    -- a ASC NULLS FIRST
 *   col("b").sort(false, false)  -- b DESC NULLS LAST
 * </pre>
 */
public final class SortExpression implements Expression {

    private final Expression expression;
    private final boolean ascending;
    private final boolean nullsFirst;

    /**
     * Creates a sort expression.
     *
     * @param expression the expression to order by
     * @param ascending true for ascending order
     * @param nullsFirst true to place nulls first
     */
    public SortExpression(Expression expression, boolean ascending, boolean nullsFirst) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.ascending = ascending;
        this.nullsFirst = nullsFirst;
    }

    public Expression expression() {
        return expression;
    }

    public boolean ascending() {
        return ascending;
    }

    public boolean nullsFirst() {
        return nullsFirst;
    }

    @Override
    public List<Expression> children() {
        return List.of(expression);
    }

    @Override
    public String toString() {
        return String.format("%s %s %s", expression,
            ascending ? "ASC" : "DESC",
            nullsFirst ? "NULLS FIRST" : "NULLS LAST");
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SortExpression)) return false;
        SortExpression that = (SortExpression) obj;
        return ascending == that.ascending &&
               nullsFirst == that.nullsFirst &&
               expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, ascending, nullsFirst);
    }
}
