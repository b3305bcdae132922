package com.quarry.logical;

import com.quarry.exception.InvalidAggregateException;
import com.quarry.exception.TypeMismatchException;
import com.quarry.expression.Expression;
import com.quarry.schema.SchemaResolver;
import com.quarry.types.BooleanType;
import com.quarry.types.DataType;
import com.quarry.types.StructType;
import java.util.Objects;

/**
 * Logical plan node representing a filter (WHERE clause).
 *
 * <p>This node filters rows from its child based on a boolean condition.
 * Aggregates are not allowed in the condition.
 *
 * <p>Examples:
 * <pre>
 *   df.filter(col("a").ltEq(col("b")))
 *   df.filter(col("price").gt(lit(100)).and(col("category").eq(lit("books"))))
 * </pre>
 */
public final class Filter extends LogicalPlan {

    private final Expression condition;

    /**
     * Creates a filter node.
     *
     * @param child the child node
     * @param condition the filter condition (must evaluate to boolean)
     * @throws InvalidAggregateException if the condition contains an aggregate
     * @throws TypeMismatchException if the condition is not boolean
     */
    public Filter(LogicalPlan child, Expression condition) {
        super(child, validateCondition(child, condition));
        this.condition = condition;
    }

    private static StructType validateCondition(LogicalPlan child, Expression condition) {
        Objects.requireNonNull(child, "child must not be null");
        Objects.requireNonNull(condition, "condition must not be null");

        if (SchemaResolver.containsAggregate(condition)) {
            throw new InvalidAggregateException("Aggregate functions are not allowed in a filter: " + condition);
        }
        DataType type = SchemaResolver.resolveType(child.schema(), condition);
        if (!(type instanceof BooleanType)) {
            throw new TypeMismatchException(String.format(
                "Filter condition must be boolean, got %s: %s", type, condition));
        }
        // Filter doesn't change the schema
        return child.schema();
    }

    /**
     * Returns the filter condition.
     *
     * @return the condition expression
     */
    public Expression condition() {
        return condition;
    }

    /**
     * Returns the child node.
     *
     * @return the child
     */
    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public String describe() {
        return "Filter: " + condition;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Filter)) return false;
        Filter that = (Filter) obj;
        return condition.equals(that.condition) && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, child());
    }

    @Override
    public String toString() {
        return String.format("Filter(%s)", condition);
    }
}
