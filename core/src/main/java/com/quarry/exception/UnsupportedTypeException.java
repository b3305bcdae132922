package com.quarry.exception;

/**
 * Thrown when SUM or AVG is applied to a non-numeric argument.
 */
public class UnsupportedTypeException extends PlanningException {

    public UnsupportedTypeException(String message) {
        super(ErrorKind.UNSUPPORTED_TYPE, message);
    }
}
