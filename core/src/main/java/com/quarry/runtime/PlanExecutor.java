package com.quarry.runtime;

import com.quarry.exception.QueryExecutionException;
import com.quarry.logical.LogicalPlan;
import java.util.List;
import org.apache.arrow.vector.VectorSchemaRoot;

/**
 * Executes a finished logical plan and returns its result as Arrow record batches.
 *
 * <p>Implementations own the physical side: reading sources named by
 * {@link com.quarry.logical.TableScan}, evaluating expressions, and allocating
 * vectors. The batches returned belong to the caller, who must close them.
 *
 * <p>Example usage:
 * <pre>
 *   List&lt;VectorSchemaRoot&gt; batches = executor.execute(df.toLogicalPlan());
 *   try {
 *       for (VectorSchemaRoot batch : batches) {
 *           // read batch
 *       }
 *   } finally {
 *       batches.forEach(VectorSchemaRoot::close);
 *   }
 * </pre>
 *
 * @see com.quarry.types.ArrowTypeMapper#toArrowSchema
 */
@FunctionalInterface
public interface PlanExecutor {

    /**
     * Executes the plan.
     *
     * @param plan the root of the plan to execute
     * @return the result batches, in order; the schema of each matches
     *         {@code ArrowTypeMapper.toArrowSchema(plan.schema())}
     * @throws QueryExecutionException if execution fails
     */
    List<VectorSchemaRoot> execute(LogicalPlan plan);
}
