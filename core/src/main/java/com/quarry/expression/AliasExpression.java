package com.quarry.expression;

import java.util.List;
import java.util.Objects;

/**
 * Expression that gives an output name to another expression.
 *
 * <p>Examples:
 * <pre>
 *   col("price").multiply(col("quantity")).alias("total")
 *   sum(col("amount")).alias("total_amount")
 * </pre>
 */
public final class AliasExpression implements Expression {

    private final Expression expression;
    private final String alias;

    /**
     * Creates an alias expression.
     *
     * @param expression the expression to alias
     * @param alias the alias name
     */
    public AliasExpression(Expression expression, String alias) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
    }

    /**
     * Returns the underlying expression.
     *
     * @return the expression
     */
    public Expression expression() {
        return expression;
    }

    /**
     * Returns the alias name.
     *
     * @return the alias
     */
    public String alias() {
        return alias;
    }

    @Override
    public List<Expression> children() {
        return List.of(expression);
    }

    @Override
    public String toString() {
        return expression + " AS " + alias;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AliasExpression)) return false;
        AliasExpression that = (AliasExpression) obj;
        return alias.equals(that.alias) && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, alias);
    }
}
