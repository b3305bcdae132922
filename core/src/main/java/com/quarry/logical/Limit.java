package com.quarry.logical;

import com.quarry.exception.InvalidArgumentException;
import com.quarry.types.StructType;
import java.util.Objects;

/**
 * Logical plan node representing a limit operation.
 *
 * <p>This node returns at most N rows from its child. The schema is unchanged.
 * Upper bounds configured by the caller are enforced by the builder, not here.
 */
public final class Limit extends LogicalPlan {

    private final long limit;

    /**
     * Creates a limit node.
     *
     * @param child the child node
     * @param limit the maximum number of rows to return
     * @throws InvalidArgumentException if the limit is negative
     */
    public Limit(LogicalPlan child, long limit) {
        super(child, validateLimit(child, limit));
        this.limit = limit;
    }

    private static StructType validateLimit(LogicalPlan child, long limit) {
        Objects.requireNonNull(child, "child must not be null");
        if (limit < 0) {
            throw new InvalidArgumentException("limit must be non-negative, got " + limit);
        }
        return child.schema();
    }

    /**
     * Returns the limit.
     *
     * @return the maximum row count
     */
    public long limit() {
        return limit;
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
        return "Limit: " + limit;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Limit)) return false;
        Limit that = (Limit) obj;
        return limit == that.limit && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(limit, child());
    }

    @Override
    public String toString() {
        return String.format("Limit(%d)", limit);
    }
}
