package com.quarry.expression;

import com.quarry.types.DataType;
import java.util.List;
import java.util.Objects;

/**
 * Expression converting a value to a different data type.
 *
 * <p>Examples:
 * <pre>
 *   CAST(price AS int64)
 *   CAST(id AS utf8)
 * </pre>
 *
 * <p>Whether a conversion is allowed is checked by
 * {@link com.quarry.schema.TypeCoercion#canCast}; failed conversions of
 * individual values are an execution-time concern.
 */
public final class CastExpression implements Expression {

    private final Expression expression;
    private final DataType targetType;

    /**
     * Creates a cast expression.
     *
     * @param expression the expression to convert
     * @param targetType the type to convert to
     */
    public CastExpression(Expression expression, DataType targetType) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.targetType = Objects.requireNonNull(targetType, "targetType must not be null");
    }

    public Expression expression() {
        return expression;
    }

    public DataType targetType() {
        return targetType;
    }

    @Override
    public List<Expression> children() {
        return List.of(expression);
    }

    @Override
    public String toString() {
        return String.format("CAST(%s AS %s)", expression, targetType.typeName());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CastExpression)) return false;
        CastExpression that = (CastExpression) obj;
        return expression.equals(that.expression) && targetType.equals(that.targetType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, targetType);
    }
}
