package com.quarry.logical;

import com.quarry.types.StructType;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class for all logical plan nodes.
 *
 * <p>This represents a node in the logical query plan tree. Each node has zero
 * or more children and an output schema (columns, types and nullability).
 *
 * <p>Nodes are immutable. The output schema is derived and validated when the
 * node is constructed, so a plan that exists is a plan whose every expression
 * resolved against its input. Subtrees may be shared by reference between
 * plans.
 *
 * @see #treeString()
 */
public abstract class LogicalPlan {

    /** Child nodes in the plan tree */
    protected final List<LogicalPlan> children;

    /** Output schema of this node */
    private final StructType schema;

    /**
     * Creates a leaf node.
     *
     * @param schema the output schema
     */
    protected LogicalPlan(StructType schema) {
        this.children = Collections.emptyList();
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
    }

    /**
     * Creates a node with a single child.
     *
     * @param child the child node
     * @param schema the output schema derived from the child
     */
    protected LogicalPlan(LogicalPlan child, StructType schema) {
        this.children = Collections.singletonList(Objects.requireNonNull(child, "child must not be null"));
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
    }

    /**
     * Returns the child nodes of this plan.
     *
     * @return an unmodifiable list of children
     */
    public List<LogicalPlan> children() {
        return children;
    }

    /**
     * Returns the output schema of this plan node.
     *
     * @return the output schema
     */
    public StructType schema() {
        return schema;
    }

    /**
     * Returns the one-line description of this node used by {@link #treeString()},
     * e.g. {@code Filter: a <= b}.
     *
     * @return the node description, without children
     */
    public abstract String describe();

    /**
     * Renders the plan as an indented tree, one node per line, root first.
     *
     * <pre>
     * Limit: 100
     *   Aggregate: groupBy=[a], aggr=[min_b]
     *     Filter: a &lt;= b
     *       TableScan: example.csv [a, b, c]
     * </pre>
     *
     * @return the tree rendering, lines separated by {@code \n}
     */
    public String treeString() {
        StringBuilder sb = new StringBuilder();
        appendTree(sb, 0);
        return sb.toString();
    }

    private void appendTree(StringBuilder sb, int depth) {
        if (depth > 0) {
            sb.append('\n');
        }
        sb.append("  ".repeat(depth)).append(describe());
        for (LogicalPlan child : children) {
            child.appendTree(sb, depth + 1);
        }
    }

    /**
     * Returns a human-readable string representation of this plan node.
     *
     * @return a string representation
     */
    @Override
    public abstract String toString();
}
