package com.quarry.types;

/**
 * Sealed interface for all data types in the quarry type system.
 *
 * <p>This represents the data type of a column or expression. The type system
 * mirrors the Arrow logical types that execution collaborators produce, so every
 * type here has a direct Arrow counterpart (see {@link ArrowTypeMapper}).
 *
 * <p>Common data types include:
 * <ul>
 *   <li>Numeric types: ByteType, ShortType, IntegerType, LongType, FloatType, DoubleType, DecimalType</li>
 *   <li>Temporal types: DateType, TimestampType</li>
 *   <li>Other: BooleanType, StringType, BinaryType, StructType</li>
 * </ul>
 */
public sealed interface DataType
    permits BooleanType, ByteType, ShortType, IntegerType, LongType,
            FloatType, DoubleType, DecimalType, StringType,
            DateType, TimestampType, BinaryType, StructType {

    /**
     * Returns a human-readable name for this data type.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns true for the integral types (int8 through int64).
     */
    default boolean isIntegral() {
        return this instanceof ByteType || this instanceof ShortType ||
               this instanceof IntegerType || this instanceof LongType;
    }

    /**
     * Returns true for float32 and float64.
     */
    default boolean isFloatingPoint() {
        return this instanceof FloatType || this instanceof DoubleType;
    }

    /**
     * Returns true for every type arithmetic is defined on.
     */
    default boolean isNumeric() {
        return isIntegral() || isFloatingPoint() || this instanceof DecimalType;
    }
}
