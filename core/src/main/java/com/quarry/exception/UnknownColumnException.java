package com.quarry.exception;

import java.util.List;

/**
 * Thrown when an expression references a column the input schema does not have.
 */
public class UnknownColumnException extends PlanningException {

    private final String columnName;
    private final List<String> availableColumns;

    /**
     * Creates the exception.
     *
     * @param columnName the name that could not be resolved
     * @param availableColumns the names present in the schema, in order
     */
    public UnknownColumnException(String columnName, List<String> availableColumns) {
        super(ErrorKind.UNKNOWN_COLUMN,
            String.format("No column named '%s'. Valid columns: %s", columnName, availableColumns));
        this.columnName = columnName;
        this.availableColumns = List.copyOf(availableColumns);
    }

    /**
     * Returns the name that could not be resolved.
     *
     * @return the column name
     */
    public String columnName() {
        return columnName;
    }

    /**
     * Returns the names the schema did contain.
     *
     * @return the available column names
     */
    public List<String> availableColumns() {
        return availableColumns;
    }
}
