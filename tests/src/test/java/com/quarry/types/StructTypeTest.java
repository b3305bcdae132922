package com.quarry.types;

import com.quarry.test.TestBase;
import com.quarry.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("StructType Tests")
public class StructTypeTest extends TestBase {

    @Test
    @DisplayName("Lookup by name is exact and returns the first match")
    void testFieldLookup() {
        StructType schema = new StructType(
            new StructField("a", IntegerType.get(), false),
            new StructField("B", StringType.get(), true),
            new StructField("a", LongType.get(), true));

        assertThat(schema.fieldByName("a").dataType()).isEqualTo(IntegerType.get());
        assertThat(schema.fieldByName("b")).isNull();
        assertThat(schema.fieldIndex("B")).isEqualTo(1);
        assertThat(schema.fieldIndex("missing")).isEqualTo(-1);
        assertThat(schema.duplicateNames()).containsExactly("a");
    }

    @Test
    @DisplayName("Schema is a snapshot of the field list")
    void testImmutable() {
        List<StructField> fields = new ArrayList<>();
        fields.add(new StructField("a", IntegerType.get()));
        StructType schema = new StructType(fields);

        fields.add(new StructField("b", IntegerType.get()));

        assertThat(schema.size()).isEqualTo(1);
        assertThatThrownBy(() -> schema.fields().add(new StructField("c", IntegerType.get())))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Field copies change one attribute")
    void testFieldCopies() {
        StructField field = new StructField("a", IntegerType.get(), false);

        assertThat(field.withName("x")).isEqualTo(new StructField("x", IntegerType.get(), false));
        assertThat(field.withNullable(true).nullable()).isTrue();
        assertThat(field.toString()).isEqualTo("a: int32 NOT NULL");
    }

    @Test
    @DisplayName("Decimal precision and scale are bounded")
    void testDecimalBounds() {
        assertThat(new DecimalType(38, 38).typeName()).isEqualTo("decimal128(38, 38)");
        assertThatThrownBy(() -> new DecimalType(39, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DecimalType(5, 6)).isInstanceOf(IllegalArgumentException.class);
    }
}
