package com.quarry.logical;

import com.quarry.exception.InvalidAggregateException;
import com.quarry.exception.InvalidArgumentException;
import com.quarry.expression.SortExpression;
import com.quarry.schema.SchemaResolver;
import com.quarry.types.StructType;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Logical plan node representing a sort (ORDER BY clause).
 *
 * <p>This node sorts rows from its child by one or more sort keys, compared in
 * order. The schema is unchanged.
 *
 * <p>Examples:
 * <pre>
 *   df.sort(List.of(col("a").sort(true, true), col("b").sort(false, false)))
 * </pre>
 */
public final class Sort extends LogicalPlan {

    private final List<SortExpression> sortExpressions;

    /**
     * Creates a sort node.
     *
     * @param child the child node
     * @param sortExpressions the sort keys, most significant first
     * @throws InvalidArgumentException if the list is empty
     * @throws InvalidAggregateException if a key contains an aggregate call
     */
    public Sort(LogicalPlan child, List<SortExpression> sortExpressions) {
        super(child, validateKeys(child, sortExpressions));
        this.sortExpressions = List.copyOf(sortExpressions);
    }

    private static StructType validateKeys(LogicalPlan child, List<SortExpression> sortExpressions) {
        Objects.requireNonNull(child, "child must not be null");
        Objects.requireNonNull(sortExpressions, "sortExpressions must not be null");

        if (sortExpressions.isEmpty()) {
            throw new InvalidArgumentException("sortExpressions must not be empty");
        }
        for (SortExpression key : sortExpressions) {
            Objects.requireNonNull(key, "sort expression must not be null");
            if (SchemaResolver.containsAggregate(key)) {
                throw new InvalidAggregateException("Aggregate functions are not allowed in a sort key: " + key);
            }
            // Keys must resolve; their fields are not part of the output
            SchemaResolver.resolve(child.schema(), key);
        }
        return child.schema();
    }

    /**
     * Returns the sort keys.
     *
     * @return an unmodifiable list of sort expressions
     */
    public List<SortExpression> sortExpressions() {
        return sortExpressions;
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
        return "Sort: " + sortExpressions.stream()
            .map(SortExpression::toString)
            .collect(Collectors.joining(", "));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Sort)) return false;
        Sort that = (Sort) obj;
        return sortExpressions.equals(that.sortExpressions) && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(sortExpressions, child());
    }

    @Override
    public String toString() {
        return String.format("Sort(%s)", sortExpressions);
    }
}
