package com.quarry.types;

import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps quarry data types and schemas to their Arrow equivalents.
 *
 * <p>Execution collaborators use this to allocate result batches whose Arrow
 * schema matches the logical plan's output schema exactly, including nullability.
 *
 * <p>Examples:
 * <pre>
 *   IntegerType        → Int(32, signed)
 *   StringType         → Utf8
 *   DecimalType(10, 2) → Decimal(10, 2, 128)
 *   TimestampType      → Timestamp(MICROSECOND, null)
 *   StructType         → Struct, with one child field per member
 * </pre>
 */
public final class ArrowTypeMapper {

    private ArrowTypeMapper() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts a quarry data type to an Arrow type.
     *
     * @param type the quarry data type
     * @return the Arrow type
     */
    public static ArrowType toArrowType(DataType type) {
        Objects.requireNonNull(type, "type must not be null");

        if (type instanceof BooleanType) {
            return ArrowType.Bool.INSTANCE;
        }
        if (type instanceof ByteType) {
            return new ArrowType.Int(8, true);
        }
        if (type instanceof ShortType) {
            return new ArrowType.Int(16, true);
        }
        if (type instanceof IntegerType) {
            return new ArrowType.Int(32, true);
        }
        if (type instanceof LongType) {
            return new ArrowType.Int(64, true);
        }
        if (type instanceof FloatType) {
            return new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE);
        }
        if (type instanceof DoubleType) {
            return new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);
        }
        if (type instanceof DecimalType) {
            DecimalType decimal = (DecimalType) type;
            return new ArrowType.Decimal(decimal.precision(), decimal.scale(), 128);
        }
        if (type instanceof StringType) {
            return ArrowType.Utf8.INSTANCE;
        }
        if (type instanceof BinaryType) {
            return ArrowType.Binary.INSTANCE;
        }
        if (type instanceof DateType) {
            return new ArrowType.Date(DateUnit.DAY);
        }
        if (type instanceof TimestampType) {
            return new ArrowType.Timestamp(TimeUnit.MICROSECOND, null);
        }
        if (type instanceof StructType) {
            return ArrowType.Struct.INSTANCE;
        }
        throw new IllegalStateException("No Arrow mapping for type: " + type);
    }

    /**
     * Converts a single field to an Arrow field.
     *
     * @param field the quarry field
     * @return the Arrow field with matching name, type and nullability
     */
    public static Field toArrowField(StructField field) {
        FieldType fieldType = new FieldType(field.nullable(), toArrowType(field.dataType()), null);
        List<Field> children = null;
        if (field.dataType() instanceof StructType) {
            StructType nested = (StructType) field.dataType();
            children = new ArrayList<>(nested.size());
            for (StructField member : nested.fields()) {
                children.add(toArrowField(member));
            }
        }
        return new Field(field.name(), fieldType, children);
    }

    /**
     * Converts a schema to an Arrow schema, preserving field order.
     *
     * @param schema the quarry schema
     * @return the Arrow schema
     */
    public static Schema toArrowSchema(StructType schema) {
        Objects.requireNonNull(schema, "schema must not be null");
        List<Field> fields = new ArrayList<>(schema.size());
        for (StructField field : schema.fields()) {
            fields.add(toArrowField(field));
        }
        return new Schema(fields);
    }
}
