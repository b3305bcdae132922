package com.quarry.logical;

import com.quarry.exception.InvalidAggregateException;
import com.quarry.exception.InvalidArgumentException;
import com.quarry.expression.Expression;
import com.quarry.expression.ExpressionUtils;
import com.quarry.schema.SchemaResolver;
import com.quarry.types.StructType;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Logical plan node representing a projection (SELECT clause).
 *
 * <p>This node selects and potentially transforms columns from its child node.
 * The output schema holds one field per projection, in order. Duplicate output
 * names are allowed here. Aggregate calls belong in {@link Aggregate}, not here.
 *
 * <p>Examples:
 * <pre>
 *   df.selectColumns("name", "age")
 *   df.select(List.of(col("price").multiply(lit(2)), col("qty").alias("quantity")))
 * </pre>
 */
public final class Project extends LogicalPlan {

    private final List<Expression> projections;

    /**
     * Creates a projection node.
     *
     * @param child the child node
     * @param projections the projection expressions
     * @throws InvalidArgumentException if the list is empty or contains a sort expression
     * @throws InvalidAggregateException if a projection contains an aggregate call
     */
    public Project(LogicalPlan child, List<Expression> projections) {
        super(child, deriveSchema(child, projections));
        this.projections = List.copyOf(projections);
    }

    private static StructType deriveSchema(LogicalPlan child, List<Expression> projections) {
        Objects.requireNonNull(child, "child must not be null");
        Objects.requireNonNull(projections, "projections must not be null");

        if (projections.isEmpty()) {
            throw new InvalidArgumentException("projections must not be empty");
        }
        for (Expression expr : projections) {
            Objects.requireNonNull(expr, "projection must not be null");
            if (ExpressionUtils.containsSortExpression(expr)) {
                throw new InvalidArgumentException("Sort expression not allowed in projection: " + expr);
            }
            if (SchemaResolver.containsAggregate(expr)) {
                throw new InvalidAggregateException("Aggregate functions are not allowed in a projection: " + expr);
            }
        }
        return new StructType(SchemaResolver.resolveAll(child.schema(), projections));
    }

    /**
     * Returns the projection expressions.
     *
     * @return an unmodifiable list of projections
     */
    public List<Expression> projections() {
        return projections;
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
        return "Projection: " + projections.stream()
            .map(Expression::toString)
            .collect(Collectors.joining(", "));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Project)) return false;
        Project that = (Project) obj;
        return projections.equals(that.projections) && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(projections, child());
    }

    @Override
    public String toString() {
        return String.format("Project(%s)", projections);
    }
}
