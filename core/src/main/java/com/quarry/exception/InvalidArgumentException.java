package com.quarry.exception;

/**
 * Thrown when a builder argument is out of range or malformed.
 *
 * <p>Common causes:
 * <ul>
 *   <li>A negative limit, or a limit above the configured maximum</li>
 *   <li>An empty projection or sort list</li>
 *   <li>A sort list element that is not a sort expression</li>
 *   <li>A scan schema with duplicate field names</li>
 * </ul>
 */
public class InvalidArgumentException extends PlanningException {

    public InvalidArgumentException(String message) {
        super(ErrorKind.INVALID_ARGUMENT, message);
    }
}
