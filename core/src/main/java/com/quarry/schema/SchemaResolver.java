package com.quarry.schema;

import com.quarry.exception.TypeMismatchException;
import com.quarry.exception.UnknownColumnException;
import com.quarry.exception.UnsupportedTypeException;
import com.quarry.expression.AggregateFunction;
import com.quarry.expression.AliasExpression;
import com.quarry.expression.BinaryExpression;
import com.quarry.expression.CastExpression;
import com.quarry.expression.ColumnReference;
import com.quarry.expression.Expression;
import com.quarry.expression.ExpressionUtils;
import com.quarry.expression.Literal;
import com.quarry.expression.SortExpression;
import com.quarry.expression.UnaryExpression;
import com.quarry.types.BooleanType;
import com.quarry.types.DataType;
import com.quarry.types.LongType;
import com.quarry.types.StructField;
import com.quarry.types.StructType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Computes the output field (name, data type, nullability) of an expression
 * evaluated against an input schema.
 *
 * <h2>Resolution Rules</h2>
 * <ul>
 *   <li>Column reference: the matching input field, unchanged</li>
 *   <li>Literal: named after its text, literal type, nullable only for NULL</li>
 *   <li>Binary expression: result type from {@link TypeCoercion}, nullable if either side is</li>
 *   <li>COUNT: int64, never null</li>
 *   <li>MIN / MAX: argument type and nullability</li>
 *   <li>SUM / AVG: numeric type derived from the argument, always nullable</li>
 *   <li>Sort expression: the inner field; direction flags have no effect</li>
 *   <li>Alias: the inner field under the alias name</li>
 * </ul>
 *
 * <h2>Naming</h2>
 * <p>Aggregates are named {@code <function>_<argument name>}, e.g. {@code min_b};
 * operators render their operands, e.g. {@code a * b}, {@code NOT flag},
 * {@code x IS NULL}.
 *
 * <p>The resolver is stateless and side-effect free: resolving the same
 * expression against the same schema always yields an equal field, so callers
 * may cache results.
 */
public final class SchemaResolver {

    private SchemaResolver() {
        // Utility class - prevent instantiation
    }

    /**
     * Resolves an expression against a schema.
     *
     * @param schema the input schema
     * @param expr the expression to resolve
     * @return the output field of the expression
     * @throws UnknownColumnException if a referenced column is not in the schema
     * @throws TypeMismatchException if an operator or cast is undefined for its operand types
     * @throws UnsupportedTypeException if SUM or AVG receives a non-numeric argument
     */
    public static StructField resolve(StructType schema, Expression expr) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(expr, "expr must not be null");

        if (expr instanceof ColumnReference column) {
            return resolveColumn(schema, column);
        }
        if (expr instanceof Literal literal) {
            return new StructField(literal.toString(), literal.dataType(), literal.isNullValue());
        }
        if (expr instanceof BinaryExpression binary) {
            return resolveBinary(schema, binary);
        }
        if (expr instanceof UnaryExpression unary) {
            return resolveUnary(schema, unary);
        }
        if (expr instanceof AggregateFunction aggregate) {
            return resolveAggregate(schema, aggregate);
        }
        if (expr instanceof SortExpression sort) {
            return resolve(schema, sort.expression());
        }
        if (expr instanceof AliasExpression alias) {
            return resolve(schema, alias.expression()).withName(alias.alias());
        }
        if (expr instanceof CastExpression cast) {
            return resolveCast(schema, cast);
        }
        throw new IllegalStateException("Unhandled expression type: " + expr.getClass().getName());
    }

    /**
     * Resolves each expression in order.
     *
     * @param schema the input schema
     * @param exprs the expressions
     * @return the output fields, one per expression
     */
    public static List<StructField> resolveAll(StructType schema, List<? extends Expression> exprs) {
        List<StructField> fields = new ArrayList<>(exprs.size());
        for (Expression expr : exprs) {
            fields.add(resolve(schema, expr));
        }
        return fields;
    }

    /**
     * Resolves an expression and returns only its data type.
     *
     * @param schema the input schema
     * @param expr the expression
     * @return the data type
     */
    public static DataType resolveType(StructType schema, Expression expr) {
        return resolve(schema, expr).dataType();
    }

    /**
     * Returns true if the expression tree contains an aggregate function.
     *
     * @param expr the expression
     * @return true if any node of the tree is an aggregate
     */
    public static boolean containsAggregate(Expression expr) {
        return ExpressionUtils.containsAggregateFunction(expr);
    }

    /**
     * Returns true if the expression is a single aggregate call, possibly aliased.
     *
     * @param expr the expression
     * @return true for {@code MIN(b)} or {@code MIN(b) AS lo}
     */
    public static boolean isAggregate(Expression expr) {
        return ExpressionUtils.isAggregate(expr);
    }

    // ========================================================================
    // Per-variant rules
    // ========================================================================

    private static StructField resolveColumn(StructType schema, ColumnReference column) {
        StructField field = schema.fieldByName(column.columnName());
        if (field == null) {
            throw new UnknownColumnException(column.columnName(), schema.fieldNames());
        }
        return field;
    }

    private static StructField resolveBinary(StructType schema, BinaryExpression binary) {
        StructField left = resolve(schema, binary.left());
        StructField right = resolve(schema, binary.right());

        DataType resultType = TypeCoercion.binaryResultType(
            binary.operator(), left.dataType(), right.dataType());
        if (resultType == null) {
            throw new TypeMismatchException(String.format(
                "Operator %s is not defined for %s and %s in '%s'",
                binary.operator().symbol(), left.dataType(), right.dataType(), binary));
        }

        String name = String.format("%s %s %s",
            operandName(binary.left(), left), binary.operator().symbol(), operandName(binary.right(), right));
        return new StructField(name, resultType, left.nullable() || right.nullable());
    }

    private static StructField resolveUnary(StructType schema, UnaryExpression unary) {
        StructField operand = resolve(schema, unary.operand());
        String operandName = operandName(unary.operand(), operand);

        switch (unary.operator()) {
            case NOT:
                if (!(operand.dataType() instanceof BooleanType)) {
                    throw new TypeMismatchException(String.format(
                        "NOT requires a boolean operand, got %s in '%s'", operand.dataType(), unary));
                }
                return new StructField("NOT " + operandName, BooleanType.get(), operand.nullable());
            case NEGATE:
                if (!operand.dataType().isNumeric()) {
                    throw new TypeMismatchException(String.format(
                        "Negation requires a numeric operand, got %s in '%s'", operand.dataType(), unary));
                }
                return new StructField("-" + operandName, operand.dataType(), operand.nullable());
            default:
                // IS NULL / IS NOT NULL never produce null themselves
                return new StructField(operandName + " " + unary.operator().symbol(), BooleanType.get(), false);
        }
    }

    private static StructField resolveAggregate(StructType schema, AggregateFunction aggregate) {
        StructField argument = resolve(schema, aggregate.argument());
        String name = aggregate.kind().functionName() + "_" + argument.name();
        DataType argType = argument.dataType();

        switch (aggregate.kind()) {
            case COUNT:
                return new StructField(name, LongType.get(), false);
            case MIN:
            case MAX:
                return new StructField(name, argType, argument.nullable());
            case SUM:
                return new StructField(name, requireNumeric(aggregate, TypeCoercion.sumResultType(argType), argType), true);
            case AVG:
                return new StructField(name, requireNumeric(aggregate, TypeCoercion.avgResultType(argType), argType), true);
            default:
                throw new IllegalStateException("Unhandled aggregate: " + aggregate.kind());
        }
    }

    private static DataType requireNumeric(AggregateFunction aggregate, DataType resultType, DataType argType) {
        if (resultType == null) {
            throw new UnsupportedTypeException(String.format(
                "%s requires a numeric argument, got %s in '%s'", aggregate.kind(), argType, aggregate));
        }
        return resultType;
    }

    private static StructField resolveCast(StructType schema, CastExpression cast) {
        StructField inner = resolve(schema, cast.expression());
        if (!TypeCoercion.canCast(inner.dataType(), cast.targetType())) {
            throw new TypeMismatchException(String.format(
                "Cannot cast %s to %s in '%s'", inner.dataType(), cast.targetType(), cast));
        }
        String name = String.format("CAST(%s AS %s)", inner.name(), cast.targetType().typeName());
        return new StructField(name, cast.targetType(), inner.nullable());
    }

    // Nested operators are parenthesized in generated names, matching Expression.toString()
    private static String operandName(Expression expr, StructField resolved) {
        if (expr instanceof BinaryExpression) {
            return "(" + resolved.name() + ")";
        }
        return resolved.name();
    }
}
