package com.quarry.types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Represents a row schema: an ordered list of named, typed fields.
 *
 * <p>Every logical plan node carries one of these as its output schema. Field
 * lookups are exact (case-sensitive) and return the first match; schemas built
 * by a projection may legitimately contain the same name twice.
 *
 * <p>Instances are immutable.
 */
public final class StructType implements DataType {

    /** Empty struct type with no fields. */
    public static final StructType EMPTY = new StructType(Collections.emptyList());

    private final List<StructField> fields;

    /**
     * Creates a StructType with the given fields.
     *
     * @param fields the fields in this struct
     */
    public StructType(List<StructField> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    /**
     * Creates a StructType with the given fields.
     *
     * @param fields the fields in this struct
     */
    public StructType(StructField... fields) {
        this(Arrays.asList(fields));
    }

    /**
     * Returns the fields in this struct.
     *
     * @return an unmodifiable list of fields
     */
    public List<StructField> fields() {
        return fields;
    }

    /**
     * Returns the number of fields in this struct.
     *
     * @return the field count
     */
    public int size() {
        return fields.size();
    }

    /**
     * Returns the field at the given index.
     *
     * @param index the field index
     * @return the field
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public StructField fieldAt(int index) {
        return fields.get(index);
    }

    /**
     * Returns the field with the given name, or null if not found.
     *
     * @param name the field name
     * @return the field, or null if not found
     */
    public StructField fieldByName(String name) {
        int index = fieldIndex(name);
        return index >= 0 ? fields.get(index) : null;
    }

    /**
     * Returns the index of the field with the given name, or -1 if not found.
     *
     * @param name the field name
     * @return the field index, or -1 if not found
     */
    public int fieldIndex(String name) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns the field names in order.
     *
     * @return the names
     */
    public List<String> fieldNames() {
        return fields.stream().map(StructField::name).collect(Collectors.toList());
    }

    /**
     * Returns the names that occur more than once in this schema, in order of
     * their second occurrence.
     *
     * @return duplicate names, empty when all names are unique
     */
    public List<String> duplicateNames() {
        Set<String> seen = new HashSet<>();
        List<String> duplicates = new ArrayList<>();
        for (StructField field : fields) {
            if (!seen.add(field.name()) && !duplicates.contains(field.name())) {
                duplicates.add(field.name());
            }
        }
        return duplicates;
    }

    @Override
    public String typeName() {
        return "struct";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StructType that = (StructType) o;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "StructType(" + fields + ")";
    }
}
