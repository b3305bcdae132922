package com.quarry.dataframe;

import com.quarry.exception.InvalidArgumentException;
import com.quarry.exception.InvalidAggregateException;
import com.quarry.exception.TypeMismatchException;
import com.quarry.exception.UnknownColumnException;
import com.quarry.expression.AggregateFunction;
import com.quarry.expression.ColumnReference;
import com.quarry.expression.Expression;
import com.quarry.expression.Expressions;
import com.quarry.expression.SortExpression;
import com.quarry.logical.Aggregate;
import com.quarry.logical.Filter;
import com.quarry.logical.Limit;
import com.quarry.logical.LogicalPlan;
import com.quarry.logical.Project;
import com.quarry.logical.Sort;
import com.quarry.runtime.PlanExecutor;
import com.quarry.types.StructType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable, chainable builder over a logical plan.
 *
 * <p>Each transformation validates its arguments against the current schema,
 * wraps the current plan in a new node and returns a new DataFrame; the
 * receiver is never modified, so DataFrames may be shared and extended
 * independently from any thread.
 *
 * <p>Example usage:
 * <pre>
 *   DataFrame df = context.scan("example.csv", schema)
 *       .filter(col("a").ltEq(col("b")))
 *       .aggregate(List.of(col("a")), List.of(min(col("b"))))
 *       .limit(100);
 *
 *   List&lt;VectorSchemaRoot&gt; batches = df.collect();
 * </pre>
 *
 * <p>Invalid calls fail immediately with a
 * {@link com.quarry.exception.PlanningException} subclass.
 */
public final class DataFrame {

    private static final Logger logger = LoggerFactory.getLogger(DataFrame.class);

    private final LogicalPlan plan;
    private final PlanExecutor executor;
    private final PlannerOptions options;

    private DataFrame(LogicalPlan plan, PlanExecutor executor, PlannerOptions options) {
        this.plan = plan;
        this.executor = executor;
        this.options = options;
    }

    /**
     * Creates a DataFrame over an existing plan.
     *
     * @param plan the root plan node
     * @param executor the executor used by {@link #collect()}
     * @param options the planner options
     * @return the DataFrame
     */
    public static DataFrame fromPlan(LogicalPlan plan, PlanExecutor executor, PlannerOptions options) {
        return new DataFrame(
            Objects.requireNonNull(plan, "plan must not be null"),
            Objects.requireNonNull(executor, "executor must not be null"),
            Objects.requireNonNull(options, "options must not be null"));
    }

    /**
     * Creates a DataFrame over an existing plan with default options.
     *
     * @param plan the root plan node
     * @param executor the executor used by {@link #collect()}
     * @return the DataFrame
     */
    public static DataFrame fromPlan(LogicalPlan plan, PlanExecutor executor) {
        return fromPlan(plan, executor, PlannerOptions.defaults());
    }

    // ==================== Transformations ====================

    /**
     * Projects the named columns, in the given order.
     *
     * @param columnNames the column names
     * @return the projected DataFrame
     * @throws UnknownColumnException if a name is not in the schema
     */
    public DataFrame selectColumns(String... columnNames) {
        Objects.requireNonNull(columnNames, "columnNames must not be null");
        return selectColumns(Arrays.asList(columnNames));
    }

    /**
     * Projects the named columns, in the given order.
     *
     * @param columnNames the column names
     * @return the projected DataFrame
     * @throws UnknownColumnException if a name is not in the schema
     */
    public DataFrame selectColumns(List<String> columnNames) {
        Objects.requireNonNull(columnNames, "columnNames must not be null");
        List<Expression> columns = new ArrayList<>(columnNames.size());
        for (String name : columnNames) {
            columns.add(new ColumnReference(name));
        }
        return select(columns);
    }

    /**
     * Projects arbitrary expressions. The output has one column per expression,
     * named as the schema resolver names it.
     *
     * @param expressions the projection expressions
     * @return the projected DataFrame
     * @throws InvalidArgumentException if the list is empty or holds a sort expression
     */
    public DataFrame select(List<Expression> expressions) {
        Objects.requireNonNull(expressions, "expressions must not be null");
        logger.debug("Adding projection of {} expressions: {}", expressions.size(), expressions);
        return withPlan(new Project(plan, expressions));
    }

    /**
     * Keeps the rows for which the predicate is true.
     *
     * @param predicate a boolean expression
     * @return the filtered DataFrame
     * @throws TypeMismatchException if the predicate is not boolean
     * @throws InvalidAggregateException if the predicate contains an aggregate
     */
    public DataFrame filter(Expression predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        logger.debug("Adding filter: {}", predicate);
        return withPlan(new Filter(plan, predicate));
    }

    /**
     * Groups by {@code groupExpressions} and computes {@code aggregateExpressions}
     * per group. An empty grouping list aggregates the whole input into one row.
     *
     * @param groupExpressions the grouping expressions
     * @param aggregateExpressions aggregate calls, optionally aliased
     * @return the aggregated DataFrame
     * @throws InvalidAggregateException if an element is misplaced
     * @throws InvalidArgumentException if both lists are empty
     */
    public DataFrame aggregate(List<Expression> groupExpressions, List<Expression> aggregateExpressions) {
        Objects.requireNonNull(groupExpressions, "groupExpressions must not be null");
        Objects.requireNonNull(aggregateExpressions, "aggregateExpressions must not be null");
        logger.debug("Adding aggregate: groupBy={}, aggregates={}", groupExpressions, aggregateExpressions);
        return withPlan(new Aggregate(plan, groupExpressions, aggregateExpressions));
    }

    /**
     * Orders rows by the given sort expressions, most significant first.
     *
     * @param sortExpressions sort expressions built with {@link Expression#sort(boolean, boolean)}
     * @return the sorted DataFrame
     * @throws InvalidArgumentException if the list is empty or an element is not a sort expression
     */
    public DataFrame sort(List<Expression> sortExpressions) {
        Objects.requireNonNull(sortExpressions, "sortExpressions must not be null");
        List<SortExpression> keys = new ArrayList<>(sortExpressions.size());
        for (Expression expr : sortExpressions) {
            Objects.requireNonNull(expr, "sort expression must not be null");
            if (!(expr instanceof SortExpression)) {
                throw new InvalidArgumentException(
                    "Expected a sort expression (use expr.sort(ascending, nullsFirst)), got: " + expr);
            }
            keys.add((SortExpression) expr);
        }
        logger.debug("Adding sort: {}", keys);
        return withPlan(new Sort(plan, keys));
    }

    /**
     * Returns at most {@code n} rows.
     *
     * @param n the maximum row count
     * @return the limited DataFrame
     * @throws InvalidArgumentException if n is negative or above the configured maximum
     */
    public DataFrame limit(long n) {
        OptionalLong maxLimit = options.maxLimit();
        if (maxLimit.isPresent() && n > maxLimit.getAsLong()) {
            throw new InvalidArgumentException(String.format(
                "limit %d exceeds the configured maximum of %d", n, maxLimit.getAsLong()));
        }
        logger.debug("Adding limit: {}", n);
        return withPlan(new Limit(plan, n));
    }

    private DataFrame withPlan(LogicalPlan newPlan) {
        return new DataFrame(newPlan, executor, options);
    }

    // ==================== Aggregate factories ====================

    public AggregateFunction min(Expression expr) {
        return Expressions.min(expr);
    }

    public AggregateFunction max(Expression expr) {
        return Expressions.max(expr);
    }

    public AggregateFunction sum(Expression expr) {
        return Expressions.sum(expr);
    }

    public AggregateFunction avg(Expression expr) {
        return Expressions.avg(expr);
    }

    public AggregateFunction count(Expression expr) {
        return Expressions.count(expr);
    }

    // ==================== Accessors & actions ====================

    /**
     * Returns the output schema.
     *
     * @return the schema of the current plan
     */
    public StructType schema() {
        return plan.schema();
    }

    /**
     * Returns the root of the built plan.
     *
     * @return the plan
     */
    public LogicalPlan toLogicalPlan() {
        return plan;
    }

    public PlannerOptions options() {
        return options;
    }

    /**
     * Returns the indented plan tree, one node per line.
     *
     * @return the plan rendering
     */
    public String explain() {
        return plan.treeString();
    }

    /**
     * Executes the plan and returns the result batches. Executor failures
     * propagate unchanged.
     *
     * @return the result batches, owned (and to be closed) by the caller
     */
    public List<VectorSchemaRoot> collect() {
        if (logger.isDebugEnabled()) {
            logger.debug("Executing plan:\n{}", plan.treeString());
        }
        return executor.execute(plan);
    }

    @Override
    public String toString() {
        return "DataFrame(" + plan.schema().fields() + ")";
    }
}
