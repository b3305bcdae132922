package com.quarry.types;

import java.util.Objects;

/**
 * A single column of a schema: name, data type and nullability.
 *
 * <p>The schema resolver produces one of these for every expression it resolves.
 */
public record StructField(String name, DataType dataType, boolean nullable) {

    /**
     * Creates a field.
     *
     * @param name the field name
     * @param dataType the field data type
     * @param nullable whether the field can contain null values
     */
    public StructField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
    }

    /**
     * Creates a nullable field.
     *
     * @param name the field name
     * @param dataType the field data type
     */
    public StructField(String name, DataType dataType) {
        this(name, dataType, true);
    }

    /**
     * Returns a copy of this field under a different name.
     *
     * @param newName the new field name
     * @return the renamed field
     */
    public StructField withName(String newName) {
        return new StructField(newName, dataType, nullable);
    }

    /**
     * Returns a copy of this field with the given nullability.
     *
     * @param isNullable the nullability of the copy
     * @return the field
     */
    public StructField withNullable(boolean isNullable) {
        return nullable == isNullable ? this : new StructField(name, dataType, isNullable);
    }

    @Override
    public String toString() {
        return name + ": " + dataType + (nullable ? "" : " NOT NULL");
    }
}
