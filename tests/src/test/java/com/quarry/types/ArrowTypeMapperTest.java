package com.quarry.types;

import com.quarry.logical.TableScan;
import com.quarry.test.TestBase;
import com.quarry.test.TestCategories;

import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ArrowTypeMapper: every scalar type maps to its Arrow
 * counterpart and schemas keep order and nullability.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ArrowTypeMapper Tests")
public class ArrowTypeMapperTest extends TestBase {

    @Test
    @DisplayName("Scalar types map to Arrow types")
    void testScalarMappings() {
        assertThat(ArrowTypeMapper.toArrowType(BooleanType.get())).isEqualTo(ArrowType.Bool.INSTANCE);
        assertThat(ArrowTypeMapper.toArrowType(ByteType.get())).isEqualTo(new ArrowType.Int(8, true));
        assertThat(ArrowTypeMapper.toArrowType(ShortType.get())).isEqualTo(new ArrowType.Int(16, true));
        assertThat(ArrowTypeMapper.toArrowType(IntegerType.get())).isEqualTo(new ArrowType.Int(32, true));
        assertThat(ArrowTypeMapper.toArrowType(LongType.get())).isEqualTo(new ArrowType.Int(64, true));
        assertThat(ArrowTypeMapper.toArrowType(FloatType.get()))
            .isEqualTo(new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE));
        assertThat(ArrowTypeMapper.toArrowType(DoubleType.get()))
            .isEqualTo(new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE));
        assertThat(ArrowTypeMapper.toArrowType(StringType.get())).isEqualTo(ArrowType.Utf8.INSTANCE);
        assertThat(ArrowTypeMapper.toArrowType(BinaryType.get())).isEqualTo(ArrowType.Binary.INSTANCE);
        assertThat(ArrowTypeMapper.toArrowType(DateType.get())).isEqualTo(new ArrowType.Date(DateUnit.DAY));
        assertThat(ArrowTypeMapper.toArrowType(TimestampType.get()))
            .isEqualTo(new ArrowType.Timestamp(TimeUnit.MICROSECOND, null));
    }

    @Test
    @DisplayName("Decimal keeps precision and scale as a 128-bit decimal")
    void testDecimalMapping() {
        ArrowType arrow = ArrowTypeMapper.toArrowType(new DecimalType(12, 3));

        assertThat(arrow).isEqualTo(new ArrowType.Decimal(12, 3, 128));
    }

    @Test
    @DisplayName("Schema conversion keeps order, names and nullability")
    void testSchemaConversion() {
        StructType schema = new StructType(
            new StructField("id", LongType.get(), false),
            new StructField("name", StringType.get(), true));

        Schema arrow = ArrowTypeMapper.toArrowSchema(schema);
        logData("Arrow schema", arrow);

        assertThat(arrow.getFields()).extracting(Field::getName).containsExactly("id", "name");
        assertThat(arrow.getFields().get(0).isNullable()).isFalse();
        assertThat(arrow.getFields().get(1).isNullable()).isTrue();
    }

    @Test
    @DisplayName("Struct columns map to Arrow structs with child fields")
    void testStructMapping() {
        StructType nested = new StructType(
            new StructField("x", IntegerType.get(), false),
            new StructField("y", StringType.get(), true));
        StructType schema = new StructType(
            new StructField("id", LongType.get(), false),
            new StructField("s", nested, true));

        Schema arrow = ArrowTypeMapper.toArrowSchema(schema);
        logData("Arrow schema", arrow);

        Field struct = arrow.getFields().get(1);
        assertThat(struct.getType()).isEqualTo(ArrowType.Struct.INSTANCE);
        assertThat(struct.isNullable()).isTrue();
        assertThat(struct.getChildren()).extracting(Field::getName).containsExactly("x", "y");
        assertThat(struct.getChildren().get(0).getType()).isEqualTo(new ArrowType.Int(32, true));
        assertThat(struct.getChildren().get(0).isNullable()).isFalse();
        assertThat(struct.getChildren().get(1).getType()).isEqualTo(ArrowType.Utf8.INSTANCE);
    }

    @Test
    @DisplayName("A scan over a struct column maps to an Arrow schema")
    void testStructScanSchema() {
        StructType schema = new StructType(
            new StructField("s", new StructType(new StructField("x", IntegerType.get())), true));
        TableScan scan = new TableScan("nested.parquet", schema);

        Schema arrow = ArrowTypeMapper.toArrowSchema(scan.schema());

        assertThat(arrow.getFields()).hasSize(1);
        assertThat(arrow.getFields().get(0).getChildren()).extracting(Field::getName).containsExactly("x");
    }
}
