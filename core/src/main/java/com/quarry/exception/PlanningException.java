package com.quarry.exception;

import java.util.Objects;

/**
 * Base class for failures detected while building a logical plan.
 *
 * <p>Every planning error is raised synchronously by the builder call that
 * introduces the offending expression, never later at execution time. A plan
 * that was built without one of these exceptions is schema-valid.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       df = df.filter(col("age").gt(lit(21)));
 *   } catch (PlanningException e) {
 *       if (e.kind() == ErrorKind.UNKNOWN_COLUMN) {
 *           // retry with a corrected column name
 *       }
 *   }
 * </pre>
 */
public abstract class PlanningException extends RuntimeException {

    private final ErrorKind kind;

    protected PlanningException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    protected PlanningException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * Returns the category of this failure.
     *
     * @return the error kind
     */
    public ErrorKind kind() {
        return kind;
    }
}
