package com.quarry.expression;

import com.quarry.exception.InvalidArgumentException;
import com.quarry.types.BooleanType;
import com.quarry.types.DataType;
import com.quarry.types.DateType;
import com.quarry.types.DecimalType;
import com.quarry.types.DoubleType;
import com.quarry.types.FloatType;
import com.quarry.types.IntegerType;
import com.quarry.types.LongType;
import com.quarry.types.StringType;
import com.quarry.types.TimestampType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a typed constant value.
 *
 * <p>Literals are fixed values that don't change, such as:
 * <ul>
 *   <li>Numeric literals: 42, 3.14, 100L</li>
 *   <li>String literals: 'hello'</li>
 *   <li>Boolean literals: true, false</li>
 *   <li>Typed null: NULL of a given type</li>
 * </ul>
 *
 * <p>The textual form returned by {@link #toString()} doubles as the output
 * column name when a literal is projected, e.g. {@code select(lit(5))} yields a
 * column named {@code 5}.
 */
public final class Literal implements Expression {

    private final Object value;
    private final DataType dataType;

    /**
     * Creates a literal expression.
     *
     * @param value the literal value (may be null)
     * @param dataType the data type of the literal
     */
    public Literal(Object value, DataType dataType) {
        this.value = value;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    /**
     * Returns the literal value.
     *
     * @return the value, or null for NULL literals
     */
    public Object value() {
        return value;
    }

    /**
     * Returns the declared type of the literal.
     *
     * @return the data type
     */
    public DataType dataType() {
        return dataType;
    }

    /**
     * Returns whether this is a NULL literal.
     *
     * @return true if value is null, false otherwise
     */
    public boolean isNullValue() {
        return value == null;
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        if (value == null) {
            return "NULL";
        }
        if (dataType instanceof StringType) {
            return "'" + value.toString().replace("'", "''") + "'";
        }
        if (dataType instanceof DateType) {
            return "DATE '" + value + "'";
        }
        if (dataType instanceof TimestampType) {
            return "TIMESTAMP '" + value + "'";
        }
        return value.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal that = (Literal) obj;
        return Objects.equals(value, that.value) &&
               Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, dataType);
    }

    // ==================== Factory Methods ====================

    public static Literal of(int value) {
        return new Literal(value, IntegerType.get());
    }

    public static Literal of(long value) {
        return new Literal(value, LongType.get());
    }

    public static Literal of(float value) {
        return new Literal(value, FloatType.get());
    }

    public static Literal of(double value) {
        return new Literal(value, DoubleType.get());
    }

    public static Literal of(String value) {
        return new Literal(Objects.requireNonNull(value, "value must not be null"), StringType.get());
    }

    public static Literal of(boolean value) {
        return new Literal(value, BooleanType.get());
    }

    /**
     * Creates a decimal literal whose precision and scale follow the value.
     *
     * @param value the decimal value
     * @return the literal expression
     * @throws InvalidArgumentException if the value needs more than 38 digits
     */
    public static Literal of(BigDecimal value) {
        Objects.requireNonNull(value, "value must not be null");
        BigDecimal normalized = value.scale() < 0 ? value.setScale(0) : value;
        int scale = normalized.scale();
        int precision = Math.max(normalized.precision(), scale);
        if (precision > DecimalType.MAX_PRECISION) {
            throw new InvalidArgumentException(String.format(
                "decimal literal needs %d digits, at most %d are supported: %s",
                precision, DecimalType.MAX_PRECISION, value));
        }
        return new Literal(normalized, new DecimalType(precision, scale));
    }

    public static Literal of(LocalDate value) {
        return new Literal(Objects.requireNonNull(value, "value must not be null"), DateType.get());
    }

    /**
     * Creates a NULL literal of the given type.
     *
     * @param dataType the data type
     * @return the NULL literal expression
     */
    public static Literal nullValue(DataType dataType) {
        return new Literal(null, dataType);
    }
}
