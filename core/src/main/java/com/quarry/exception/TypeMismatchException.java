package com.quarry.exception;

/**
 * Thrown when an operator, cast or predicate is applied to types it is not defined for.
 *
 * <p>Examples: {@code 'abc' + 1}, {@code a AND 5}, or a filter whose condition is not boolean.
 */
public class TypeMismatchException extends PlanningException {

    public TypeMismatchException(String message) {
        super(ErrorKind.TYPE_MISMATCH, message);
    }
}
