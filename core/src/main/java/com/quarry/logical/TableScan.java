package com.quarry.logical;

import com.quarry.exception.InvalidArgumentException;
import com.quarry.types.StructField;
import com.quarry.types.StructType;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logical plan node representing a table scan (reading from a data source).
 *
 * <p>The source is an opaque identifier (file path, table name) interpreted by
 * the executor. The schema is supplied by the caller and becomes the node's
 * output schema; it must be non-empty and its field names must be unique.
 *
 * <p>Example:
 * <pre>
 *   TableScan("example.csv", {a: int32, b: int32, c: int32})
 *     -&gt; TableScan: example.csv [a, b, c]
 * </pre>
 */
public final class TableScan extends LogicalPlan {

    private static final Logger logger = LoggerFactory.getLogger(TableScan.class);

    private final String source;

    /**
     * Creates a table scan node.
     *
     * @param source the source identifier
     * @param schema the table schema
     * @throws InvalidArgumentException if the schema is empty or has duplicate names
     */
    public TableScan(String source, StructType schema) {
        super(validateSchema(source, schema));
        this.source = source;
        logger.debug("Created scan of '{}' with {} columns", source, schema.size());
    }

    private static StructType validateSchema(String source, StructType schema) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(schema, "schema must not be null");

        if (schema.size() == 0) {
            throw new InvalidArgumentException("Scan of '" + source + "' has an empty schema");
        }
        List<String> duplicates = schema.duplicateNames();
        if (!duplicates.isEmpty()) {
            throw new InvalidArgumentException(String.format(
                "Scan of '%s' has duplicate column names: %s", source, duplicates));
        }
        return schema;
    }

    /**
     * Returns the source identifier.
     *
     * @return the source
     */
    public String source() {
        return source;
    }

    @Override
    public String describe() {
        String columns = schema().fields().stream()
            .map(StructField::name)
            .collect(Collectors.joining(", "));
        return String.format("TableScan: %s [%s]", source, columns);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TableScan)) return false;
        TableScan that = (TableScan) obj;
        return source.equals(that.source) && schema().equals(that.schema());
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, schema());
    }

    @Override
    public String toString() {
        return String.format("TableScan(%s)", source);
    }
}
