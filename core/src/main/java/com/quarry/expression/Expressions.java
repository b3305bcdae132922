package com.quarry.expression;

import com.quarry.types.DataType;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Static factories for building expressions, meant to be statically imported.
 *
 * <pre>
 *   import static com.quarry.expression.Expressions.*;
 *
 *   df.filter(col("a").ltEq(col("b")))
 *     .aggregate(List.of(col("a")), List.of(min(col("b"))));
 * </pre>
 *
 * <p>None of these methods look at a schema.
 */
public final class Expressions {

    private Expressions() {}

    public static ColumnReference col(String name) {
        return new ColumnReference(name);
    }

    public static Literal lit(int value) {
        return Literal.of(value);
    }

    public static Literal lit(long value) {
        return Literal.of(value);
    }

    public static Literal lit(float value) {
        return Literal.of(value);
    }

    public static Literal lit(double value) {
        return Literal.of(value);
    }

    public static Literal lit(boolean value) {
        return Literal.of(value);
    }

    public static Literal lit(String value) {
        return Literal.of(value);
    }

    public static Literal lit(BigDecimal value) {
        return Literal.of(value);
    }

    public static Literal lit(LocalDate value) {
        return Literal.of(value);
    }

    /**
     * Creates a literal with an explicit type.
     *
     * @param value the value (may be null)
     * @param type the literal type
     * @return the literal
     */
    public static Literal lit(Object value, DataType type) {
        return new Literal(value, type);
    }

    public static Literal nullLiteral(DataType type) {
        return Literal.nullValue(type);
    }

    // ==================== Aggregates ====================

    public static AggregateFunction min(Expression expr) {
        return new AggregateFunction(AggregateFunction.Kind.MIN, expr);
    }

    public static AggregateFunction max(Expression expr) {
        return new AggregateFunction(AggregateFunction.Kind.MAX, expr);
    }

    public static AggregateFunction sum(Expression expr) {
        return new AggregateFunction(AggregateFunction.Kind.SUM, expr);
    }

    public static AggregateFunction avg(Expression expr) {
        return new AggregateFunction(AggregateFunction.Kind.AVG, expr);
    }

    public static AggregateFunction count(Expression expr) {
        return new AggregateFunction(AggregateFunction.Kind.COUNT, expr);
    }
}
