package com.quarry.dataframe;

import com.quarry.logical.TableScan;
import com.quarry.runtime.PlanExecutor;
import com.quarry.types.StructType;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point that creates DataFrames over data sources.
 *
 * <p>A context binds an executor and planner options; every DataFrame it
 * creates, and every DataFrame derived from those, uses them.
 *
 * <pre>
 *   QueryContext context = new QueryContext(executor, PlannerOptions.fromSystemProperties());
 *   DataFrame df = context.scan("example.csv", schema);
 * </pre>
 */
public final class QueryContext {

    private static final Logger logger = LoggerFactory.getLogger(QueryContext.class);

    private final PlanExecutor executor;
    private final PlannerOptions options;

    /**
     * Creates a context.
     *
     * @param executor the executor for collected plans
     * @param options the planner options
     */
    public QueryContext(PlanExecutor executor, PlannerOptions options) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Creates a context with default options.
     *
     * @param executor the executor for collected plans
     */
    public QueryContext(PlanExecutor executor) {
        this(executor, PlannerOptions.defaults());
    }

    /**
     * Creates a DataFrame reading the given source.
     *
     * @param source the source identifier, interpreted by the executor
     * @param schema the source schema (non-empty, unique names)
     * @return a DataFrame over a {@link TableScan}
     */
    public DataFrame scan(String source, StructType schema) {
        logger.debug("Scanning '{}' with schema {}", source, schema);
        return DataFrame.fromPlan(new TableScan(source, schema), executor, options);
    }

    public PlannerOptions options() {
        return options;
    }
}
