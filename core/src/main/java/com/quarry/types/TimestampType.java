package com.quarry.types;

/**
 * Timestamp type with microsecond precision and no time zone.
 *
 * <p>Values are microseconds since 1970-01-01 00:00:00 (Arrow Timestamp(MICROSECOND, null)).
 */
public final class TimestampType implements DataType {

    private static final TimestampType INSTANCE = new TimestampType();

    private TimestampType() {}

    public static TimestampType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "timestamp[us]";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TimestampType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
