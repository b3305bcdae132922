package com.quarry.schema;

import com.quarry.expression.BinaryExpression;
import com.quarry.types.BinaryType;
import com.quarry.types.BooleanType;
import com.quarry.types.ByteType;
import com.quarry.types.DataType;
import com.quarry.types.DateType;
import com.quarry.types.DecimalType;
import com.quarry.types.DoubleType;
import com.quarry.types.FloatType;
import com.quarry.types.IntegerType;
import com.quarry.types.LongType;
import com.quarry.types.ShortType;
import com.quarry.types.StringType;
import com.quarry.types.StructType;
import com.quarry.types.TimestampType;

/**
 * The fixed type-promotion table used by the schema resolver.
 *
 * <h2>Binary operators</h2>
 * <ul>
 *   <li>Arithmetic: both operands numeric; result is the promoted type</li>
 *   <li>Comparison: both numeric, or both the same non-struct type; result boolean</li>
 *   <li>AND / OR: both boolean; result boolean</li>
 *   <li>LIKE / NOT LIKE: both utf8; result boolean</li>
 * </ul>
 *
 * <h2>Numeric promotion</h2>
 * <p>float64 &gt; float32 &gt; decimal &gt; int64 &gt; int32 &gt; int16 &gt; int8. Integral
 * operands meeting a decimal are widened to decimal(3|5|10|20, 0) first.
 * Integer division stays integral.
 *
 * <h2>Decimal arithmetic</h2>
 * <ul>
 *   <li>+, -: scale = max(s1, s2), precision = max(p1-s1, p2-s2) + scale + 1</li>
 *   <li>*: precision = p1 + p2 + 1, scale = s1 + s2</li>
 *   <li>/: scale = max(6, s1 + p2 + 1), precision = p1 - s1 + s2 + scale</li>
 *   <li>%: scale = max(s1, s2), precision = max(p1-s1, p2-s2) + scale</li>
 * </ul>
 * All capped at 38 digits.
 */
public final class TypeCoercion {

    private TypeCoercion() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the result type of applying {@code op} to operands of the given
     * types, or null if the operator is not defined for them.
     *
     * @param op the operator
     * @param left the resolved left operand type
     * @param right the resolved right operand type
     * @return the result type, or null when the combination is invalid
     */
    public static DataType binaryResultType(BinaryExpression.Operator op, DataType left, DataType right) {
        if (op.isComparison()) {
            return isComparable(left, right) ? BooleanType.get() : null;
        }
        if (op.isLogical()) {
            return left instanceof BooleanType && right instanceof BooleanType ? BooleanType.get() : null;
        }
        if (op.isPatternMatch()) {
            return left instanceof StringType && right instanceof StringType ? BooleanType.get() : null;
        }
        if (!left.isNumeric() || !right.isNumeric()) {
            return null;
        }
        if ((left instanceof DecimalType || right instanceof DecimalType) &&
            !left.isFloatingPoint() && !right.isFloatingPoint()) {
            return decimalArithmetic(op, toDecimal(left), toDecimal(right));
        }
        return promoteNumericTypes(left, right);
    }

    /**
     * Returns true if values of the two types can be compared with =, &lt; etc.
     *
     * @param left the left type
     * @param right the right type
     * @return true if comparable
     */
    public static boolean isComparable(DataType left, DataType right) {
        if (left.isNumeric() && right.isNumeric()) {
            return true;
        }
        if (left instanceof StructType || right instanceof StructType) {
            return false;
        }
        return left.equals(right);
    }

    /**
     * Promotes two numeric types to the wider of the two.
     *
     * @param left the left operand type
     * @param right the right operand type
     * @return the promoted type
     */
    public static DataType promoteNumericTypes(DataType left, DataType right) {
        if (left instanceof DoubleType || right instanceof DoubleType) {
            return DoubleType.get();
        }
        if (left instanceof FloatType || right instanceof FloatType) {
            return FloatType.get();
        }
        if (left instanceof DecimalType || right instanceof DecimalType) {
            return unifyDecimalTypes(toDecimal(left), toDecimal(right));
        }
        if (left instanceof LongType || right instanceof LongType) {
            return LongType.get();
        }
        if (left instanceof IntegerType || right instanceof IntegerType) {
            return IntegerType.get();
        }
        if (left instanceof ShortType || right instanceof ShortType) {
            return ShortType.get();
        }
        return ByteType.get();
    }

    /**
     * Result type of SUM over an argument of the given type.
     *
     * @param argType the argument type
     * @return the sum type, or null if the argument is not numeric
     */
    public static DataType sumResultType(DataType argType) {
        if (argType.isIntegral()) {
            return LongType.get();
        }
        if (argType.isFloatingPoint()) {
            return DoubleType.get();
        }
        if (argType instanceof DecimalType) {
            DecimalType decimal = (DecimalType) argType;
            return new DecimalType(Math.min(decimal.precision() + 10, DecimalType.MAX_PRECISION), decimal.scale());
        }
        return null;
    }

    /**
     * Result type of AVG over an argument of the given type.
     *
     * @param argType the argument type
     * @return the average type, or null if the argument is not numeric
     */
    public static DataType avgResultType(DataType argType) {
        if (argType instanceof DecimalType) {
            DecimalType decimal = (DecimalType) argType;
            int precision = Math.min(decimal.precision() + 4, DecimalType.MAX_PRECISION);
            int scale = Math.min(decimal.scale() + 4, precision);
            return new DecimalType(precision, scale);
        }
        return argType.isNumeric() ? DoubleType.get() : null;
    }

    /**
     * Returns true if a value of type {@code from} may be cast to {@code to}.
     *
     * <p>Numeric, boolean, utf8 and temporal types convert among each other the
     * usual way; struct types and binary-to-non-string conversions are rejected.
     *
     * @param from the source type
     * @param to the target type
     * @return true if the cast is allowed
     */
    public static boolean canCast(DataType from, DataType to) {
        if (from.equals(to)) {
            return true;
        }
        if (from instanceof StructType || to instanceof StructType) {
            return false;
        }
        if (from instanceof StringType || to instanceof StringType) {
            return true;
        }
        if (from instanceof BinaryType || to instanceof BinaryType) {
            return false;
        }
        boolean fromNumeric = from.isNumeric() || from instanceof BooleanType;
        boolean toNumeric = to.isNumeric() || to instanceof BooleanType;
        if (fromNumeric && toNumeric) {
            return true;
        }
        boolean fromTemporal = from instanceof DateType || from instanceof TimestampType;
        boolean toTemporal = to instanceof DateType || to instanceof TimestampType;
        if (fromTemporal && toTemporal) {
            return true;
        }
        // Timestamps are stored as int64 microseconds
        return (from instanceof TimestampType && to instanceof LongType) ||
               (from instanceof LongType && to instanceof TimestampType);
    }

    // ========================================================================
    // Decimal arithmetic
    // ========================================================================

    private static DecimalType decimalArithmetic(BinaryExpression.Operator op, DecimalType left, DecimalType right) {
        switch (op) {
            case ADD:
            case SUBTRACT: {
                int scale = Math.max(left.scale(), right.scale());
                int intDigits = Math.max(left.precision() - left.scale(), right.precision() - right.scale());
                return capped(intDigits + scale + 1, scale);
            }
            case MULTIPLY:
                return capped(left.precision() + right.precision() + 1, left.scale() + right.scale());
            case DIVIDE:
                return promoteDecimalDivision(left, right);
            default:
                return unifyDecimalTypes(left, right);
        }
    }

    /**
     * Calculates the result type of dividing two decimals.
     *
     * <p>scale = max(6, s1 + p2 + 1), precision = p1 - s1 + s2 + scale. When the
     * precision exceeds 38 the integral digits are kept and the scale is reduced,
     * but never below 6.
     *
     * @param dividend the dividend type
     * @param divisor the divisor type
     * @return the quotient type
     */
    public static DecimalType promoteDecimalDivision(DecimalType dividend, DecimalType divisor) {
        int scale = Math.max(6, dividend.scale() + divisor.precision() + 1);
        int precision = dividend.precision() - dividend.scale() + divisor.scale() + scale;

        if (precision > DecimalType.MAX_PRECISION) {
            int intDigits = precision - scale;
            scale = Math.max(DecimalType.MAX_PRECISION - intDigits, Math.min(scale, 6));
            precision = DecimalType.MAX_PRECISION;
        }
        return capped(precision, scale);
    }

    private static DecimalType unifyDecimalTypes(DecimalType left, DecimalType right) {
        int scale = Math.max(left.scale(), right.scale());
        int intDigits = Math.max(left.precision() - left.scale(), right.precision() - right.scale());
        return capped(intDigits + scale, scale);
    }

    private static DecimalType capped(int precision, int scale) {
        int p = Math.min(precision, DecimalType.MAX_PRECISION);
        return new DecimalType(p, Math.min(scale, p));
    }

    private static DecimalType toDecimal(DataType type) {
        if (type instanceof DecimalType) {
            return (DecimalType) type;
        }
        if (type instanceof ByteType) {
            return new DecimalType(3, 0);
        }
        if (type instanceof ShortType) {
            return new DecimalType(5, 0);
        }
        if (type instanceof IntegerType) {
            return new DecimalType(10, 0);
        }
        return new DecimalType(20, 0);
    }
}
