package com.quarry.exception;

/**
 * Categories of planning failure.
 *
 * <p>Each {@link PlanningException} subclass reports exactly one kind, so callers
 * can switch on {@link PlanningException#kind()} instead of catching every subclass.
 */
public enum ErrorKind {
    /** A column name is not present in the input schema. */
    UNKNOWN_COLUMN,
    /** An operator or predicate was applied to incompatible types. */
    TYPE_MISMATCH,
    /** An aggregate that requires numeric input received another type. */
    UNSUPPORTED_TYPE,
    /** A non-aggregate expression appeared where an aggregate is required, or vice versa. */
    INVALID_AGGREGATE,
    /** A plain argument was out of range or malformed (e.g. a negative limit). */
    INVALID_ARGUMENT
}
