package com.quarry.expression;

import com.quarry.types.DataType;
import java.util.List;

/**
 * Base interface for all expressions in a quarry logical plan.
 *
 * <p>Expressions represent computations that produce values, such as:
 * <ul>
 *   <li>Literals (constants)</li>
 *   <li>Column references</li>
 *   <li>Arithmetic operations (a + b, a * b)</li>
 *   <li>Comparison operations (a &gt; b, a = b)</li>
 *   <li>Aggregate functions (MIN(b), COUNT(a))</li>
 * </ul>
 *
 * <p>Expressions are plain immutable value trees. They carry no type
 * information of their own: the data type, nullability and output name of an
 * expression only exist relative to an input schema and are computed by
 * {@link com.quarry.schema.SchemaResolver}. Consequently building an expression
 * never fails because of a schema; {@code col("x").ltEq(lit(5))} succeeds whether
 * or not {@code x} exists, and the error surfaces when the expression is attached
 * to a plan.
 *
 * <p>The fluent methods below never modify {@code this}; each returns a new node
 * with {@code this} as a child. Subtrees can therefore be shared freely between
 * expressions and plans.
 */
public sealed interface Expression
    permits ColumnReference, Literal, BinaryExpression, UnaryExpression,
            AggregateFunction, SortExpression, AliasExpression, CastExpression {

    /**
     * Returns the direct sub-expressions of this expression.
     *
     * @return an unmodifiable list, empty for leaves
     */
    List<Expression> children();

    // ==================== Comparison ====================

    default BinaryExpression eq(Expression other) {
        return new BinaryExpression(this, BinaryExpression.Operator.EQUAL, other);
    }

    default BinaryExpression notEq(Expression other) {
        return new BinaryExpression(this, BinaryExpression.Operator.NOT_EQUAL, other);
    }

    default BinaryExpression lt(Expression other) {
        return new BinaryExpression(this, BinaryExpression.Operator.LESS_THAN, other);
    }

    default BinaryExpression ltEq(Expression other) {
        return new BinaryExpression(this, BinaryExpression.Operator.LESS_THAN_OR_EQUAL, other);
    }

    default BinaryExpression gt(Expression other) {
        return new BinaryExpression(this, BinaryExpression.Operator.GREATER_THAN, other);
    }

    default BinaryExpression gtEq(Expression other) {
        return new BinaryExpression(this, BinaryExpression.Operator.GREATER_THAN_OR_EQUAL, other);
    }

    // ==================== Arithmetic ====================

    default BinaryExpression plus(Expression other) {
        return new BinaryExpression(this, BinaryExpression.Operator.ADD, other);
    }

    default BinaryExpression minus(Expression other) {
        return new BinaryExpression(this, BinaryExpression.Operator.SUBTRACT, other);
    }

    default BinaryExpression multiply(Expression other) {
        return new BinaryExpression(this, BinaryExpression.Operator.MULTIPLY, other);
    }

    default BinaryExpression divide(Expression other) {
        return new BinaryExpression(this, BinaryExpression.Operator.DIVIDE, other);
    }

    default BinaryExpression modulus(Expression other) {
        return new BinaryExpression(this, BinaryExpression.Operator.MODULO, other);
    }

    default UnaryExpression negate() {
        return new UnaryExpression(UnaryExpression.Operator.NEGATE, this);
    }

    // ==================== Logical ====================

    default BinaryExpression and(Expression other) {
        return new BinaryExpression(this, BinaryExpression.Operator.AND, other);
    }

    default BinaryExpression or(Expression other) {
        return new BinaryExpression(this, BinaryExpression.Operator.OR, other);
    }

    default UnaryExpression not() {
        return new UnaryExpression(UnaryExpression.Operator.NOT, this);
    }

    // ==================== String ====================

    default BinaryExpression like(Expression pattern) {
        return new BinaryExpression(this, BinaryExpression.Operator.LIKE, pattern);
    }

    default BinaryExpression notLike(Expression pattern) {
        return new BinaryExpression(this, BinaryExpression.Operator.NOT_LIKE, pattern);
    }

    // ==================== Null checks ====================

    default UnaryExpression isNull() {
        return new UnaryExpression(UnaryExpression.Operator.IS_NULL, this);
    }

    default UnaryExpression isNotNull() {
        return new UnaryExpression(UnaryExpression.Operator.IS_NOT_NULL, this);
    }

    // ==================== Naming, casting, ordering ====================

    /**
     * Names the output field of this expression.
     *
     * @param name the output column name
     * @return the aliased expression
     */
    default AliasExpression alias(String name) {
        return new AliasExpression(this, name);
    }

    /**
     * Converts the value of this expression to another type.
     *
     * @param targetType the type to convert to
     * @return the cast expression
     */
    default CastExpression cast(DataType targetType) {
        return new CastExpression(this, targetType);
    }

    /**
     * Wraps this expression with an ordering, for use with {@code DataFrame.sort}.
     *
     * @param ascending true for ascending order
     * @param nullsFirst true to place nulls before non-null values
     * @return the sort expression
     */
    default SortExpression sort(boolean ascending, boolean nullsFirst) {
        return new SortExpression(this, ascending, nullsFirst);
    }
}
