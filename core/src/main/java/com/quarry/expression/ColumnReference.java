package com.quarry.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a reference to an input column by name.
 *
 * <p>Column references appear in:
 * <ul>
 *   <li>Projections: select(col("name"), col("age"))</li>
 *   <li>Filters: filter(col("age").gt(lit(25)))</li>
 *   <li>Grouping keys: aggregate(List.of(col("category")), ...)</li>
 *   <li>Sort keys: sort(col("name").sort(true, false))</li>
 * </ul>
 *
 * <p>The reference is unresolved: it holds only the name. Matching against a
 * schema is exact and case-sensitive and happens in the schema resolver.
 */
public final class ColumnReference implements Expression {

    private final String columnName;

    /**
     * Creates a column reference.
     *
     * @param columnName the column name
     */
    public ColumnReference(String columnName) {
        this.columnName = Objects.requireNonNull(columnName, "columnName must not be null");
    }

    /**
     * Returns the column name.
     *
     * @return the column name
     */
    public String columnName() {
        return columnName;
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return columnName;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnReference)) return false;
        ColumnReference that = (ColumnReference) obj;
        return columnName.equals(that.columnName);
    }

    @Override
    public int hashCode() {
        return columnName.hashCode();
    }
}
