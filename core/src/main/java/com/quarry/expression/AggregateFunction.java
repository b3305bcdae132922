package com.quarry.expression;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Represents an aggregate function call (e.g., SUM(amount), MIN(price)).
 *
 * <p>An aggregate reduces all rows of a group to one value. Aggregates are only
 * meaningful in the aggregate list of {@code DataFrame.aggregate}; the builder
 * rejects them inside filter predicates and grouping keys.
 *
 * <p>Result types (see {@link com.quarry.schema.SchemaResolver}):
 * <ul>
 *   <li>COUNT: int64, never null (0 for empty groups)</li>
 *   <li>MIN / MAX: argument type and nullability</li>
 *   <li>SUM / AVG: numeric type derived from the argument, nullable</li>
 * </ul>
 */
public final class AggregateFunction implements Expression {

    /**
     * Supported aggregate functions.
     */
    public enum Kind {
        MIN,
        MAX,
        SUM,
        AVG,
        COUNT;

        /**
         * Returns the lower-case function name used in output column names.
         *
         * @return the name, e.g. "min"
         */
        public String functionName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Kind kind;
    private final Expression argument;

    /**
     * Creates an aggregate function call.
     *
     * @param kind the aggregate function
     * @param argument the expression to aggregate
     */
    public AggregateFunction(Kind kind, Expression argument) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.argument = Objects.requireNonNull(argument, "argument must not be null");
    }

    public Kind kind() {
        return kind;
    }

    public Expression argument() {
        return argument;
    }

    @Override
    public List<Expression> children() {
        return List.of(argument);
    }

    @Override
    public String toString() {
        return kind.name() + "(" + argument + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AggregateFunction)) return false;
        AggregateFunction that = (AggregateFunction) obj;
        return kind == that.kind && argument.equals(that.argument);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, argument);
    }
}
