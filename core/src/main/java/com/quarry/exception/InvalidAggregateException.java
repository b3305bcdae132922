package com.quarry.exception;

/**
 * Thrown when an aggregate list holds a non-aggregate expression, or when an
 * aggregate function appears where only row-level expressions are allowed
 * (a filter predicate or a grouping key).
 */
public class InvalidAggregateException extends PlanningException {

    public InvalidAggregateException(String message) {
        super(ErrorKind.INVALID_AGGREGATE, message);
    }
}
