package com.quarry.exception;

import com.quarry.logical.LogicalPlan;

/**
 * Exception thrown by an execution collaborator when running a plan fails.
 *
 * <p>This is the executor-side counterpart of {@link PlanningException}: planning
 * errors are detected while the plan is built, execution errors only surface
 * from {@code DataFrame.collect()}. The DataFrame passes these through unchanged.
 *
 * <p>Common causes:
 * <ul>
 *   <li>The scanned source no longer exists</li>
 *   <li>A value could not be converted at runtime</li>
 *   <li>Memory limit exceeded</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       List&lt;VectorSchemaRoot&gt; batches = df.collect();
 *   } catch (QueryExecutionException e) {
 *       System.err.println(e.getMessage());
 *       System.err.println(e.failedPlan().treeString());
 *   }
 * </pre>
 *
 * @see com.quarry.runtime.PlanExecutor
 */
public class QueryExecutionException extends RuntimeException {

    private final LogicalPlan failedPlan;

    /**
     * Creates a query execution exception.
     *
     * @param message the error message
     * @param plan the plan that failed to execute (may be null)
     */
    public QueryExecutionException(String message, LogicalPlan plan) {
        super(message);
        this.failedPlan = plan;
    }

    /**
     * Creates a query execution exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param plan the plan that failed to execute (may be null)
     */
    public QueryExecutionException(String message, Throwable cause, LogicalPlan plan) {
        super(message, cause);
        this.failedPlan = plan;
    }

    /**
     * Returns the plan that failed to execute.
     *
     * @return the failed plan, or null if not available
     */
    public LogicalPlan failedPlan() {
        return failedPlan;
    }
}
