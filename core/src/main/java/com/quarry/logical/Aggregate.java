package com.quarry.logical;

import com.quarry.exception.InvalidAggregateException;
import com.quarry.exception.InvalidArgumentException;
import com.quarry.expression.Expression;
import com.quarry.expression.ExpressionUtils;
import com.quarry.schema.SchemaResolver;
import com.quarry.types.StructField;
import com.quarry.types.StructType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logical plan node representing an aggregation (GROUP BY with aggregates).
 *
 * <p>This node groups rows from its child by the grouping expressions and
 * computes one value per aggregate expression for each group. An empty
 * grouping list means a single global group.
 *
 * <p>Output schema: the grouping fields in order, followed by the aggregate
 * fields in order.
 *
 * <p>Examples:
 * <pre>
 *   df.aggregate(List.of(col("a")), List.of(min(col("b"))))      -&gt; {a, min_b}
 *   df.aggregate(List.of(), List.of(count(col("b")).alias("n"))) -&gt; {n}
 * </pre>
 */
public final class Aggregate extends LogicalPlan {

    private static final Logger logger = LoggerFactory.getLogger(Aggregate.class);

    private final List<Expression> groupingExpressions;
    private final List<Expression> aggregateExpressions;

    /**
     * Creates an aggregate node.
     *
     * @param child the child node
     * @param groupingExpressions the grouping expressions (empty for global aggregation)
     * @param aggregateExpressions the aggregate calls, each optionally aliased
     * @throws InvalidArgumentException if both lists are empty
     * @throws InvalidAggregateException if a grouping expression contains an
     *         aggregate or an aggregate expression is not an aggregate call
     */
    public Aggregate(LogicalPlan child,
                     List<Expression> groupingExpressions,
                     List<Expression> aggregateExpressions) {
        super(child, deriveSchema(child, groupingExpressions, aggregateExpressions));
        this.groupingExpressions = List.copyOf(groupingExpressions);
        this.aggregateExpressions = List.copyOf(aggregateExpressions);
    }

    private static StructType deriveSchema(LogicalPlan child,
                                           List<Expression> groupingExpressions,
                                           List<Expression> aggregateExpressions) {
        Objects.requireNonNull(child, "child must not be null");
        Objects.requireNonNull(groupingExpressions, "groupingExpressions must not be null");
        Objects.requireNonNull(aggregateExpressions, "aggregateExpressions must not be null");

        if (groupingExpressions.isEmpty() && aggregateExpressions.isEmpty()) {
            throw new InvalidArgumentException(
                "Aggregation requires at least one grouping or aggregate expression");
        }

        for (Expression expr : groupingExpressions) {
            Objects.requireNonNull(expr, "grouping expression must not be null");
            if (SchemaResolver.containsAggregate(expr)) {
                throw new InvalidAggregateException("Aggregate functions are not allowed in GROUP BY: " + expr);
            }
            if (ExpressionUtils.containsSortExpression(expr)) {
                throw new InvalidArgumentException("Sort expression not allowed in GROUP BY: " + expr);
            }
        }
        for (Expression expr : aggregateExpressions) {
            Objects.requireNonNull(expr, "aggregate expression must not be null");
            if (!SchemaResolver.isAggregate(expr)) {
                throw new InvalidAggregateException(
                    "Expected an aggregate function call, got: " + expr);
            }
        }

        StructType input = child.schema();
        List<StructField> fields = new ArrayList<>(groupingExpressions.size() + aggregateExpressions.size());
        fields.addAll(SchemaResolver.resolveAll(input, groupingExpressions));
        fields.addAll(SchemaResolver.resolveAll(input, aggregateExpressions));

        StructType schema = new StructType(fields);
        logger.debug("Aggregate output schema: {}", schema);
        return schema;
    }

    /**
     * Returns the grouping expressions.
     *
     * @return an unmodifiable list of grouping expressions
     */
    public List<Expression> groupingExpressions() {
        return groupingExpressions;
    }

    /**
     * Returns the aggregate expressions.
     *
     * @return an unmodifiable list of aggregate expressions
     */
    public List<Expression> aggregateExpressions() {
        return aggregateExpressions;
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
        List<String> names = schema().fieldNames();
        int groups = groupingExpressions.size();
        return String.format("Aggregate: groupBy=[%s], aggr=[%s]",
            String.join(", ", names.subList(0, groups)),
            String.join(", ", names.subList(groups, names.size())));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Aggregate)) return false;
        Aggregate that = (Aggregate) obj;
        return groupingExpressions.equals(that.groupingExpressions) &&
               aggregateExpressions.equals(that.aggregateExpressions) &&
               child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(groupingExpressions, aggregateExpressions, child());
    }

    @Override
    public String toString() {
        String groups = groupingExpressions.stream()
            .map(Expression::toString)
            .collect(Collectors.joining(", "));
        return String.format("Aggregate(groupBy=[%s], aggregates=%s)", groups, aggregateExpressions);
    }
}
