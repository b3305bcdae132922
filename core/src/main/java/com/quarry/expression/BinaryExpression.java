package com.quarry.expression;

import java.util.List;
import java.util.Objects;

/**
 * Expression representing a binary operation (operation with two operands).
 *
 * <p>Binary expressions include:
 * <ul>
 *   <li>Arithmetic: a + b, a - b, a * b, a / b, a % b</li>
 *   <li>Comparison: a &gt; b, a &gt;= b, a &lt; b, a &lt;= b, a = b, a != b</li>
 *   <li>Logical: a AND b, a OR b</li>
 *   <li>Pattern matching: a LIKE b, a NOT LIKE b</li>
 * </ul>
 *
 * <p>Examples:
 * <pre>
 *   price * quantity           -- arithmetic
 *   age &gt; 25                   -- comparison
 *   active AND verified        -- logical
 *   name LIKE 'A%'             -- pattern matching
 * </pre>
 *
 * <p>Whether an operator is defined for its operand types, and the result
 * type, is decided by {@link com.quarry.schema.TypeCoercion}.
 */
public final class BinaryExpression implements Expression {

    /**
     * Binary operators.
     */
    public enum Operator {
        // Arithmetic operators
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        MODULO("%"),

        // Comparison operators
        EQUAL("="),
        NOT_EQUAL("!="),
        LESS_THAN("<"),
        LESS_THAN_OR_EQUAL("<="),
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUAL(">="),

        // Logical operators
        AND("AND"),
        OR("OR"),

        // String operators
        LIKE("LIKE"),
        NOT_LIKE("NOT LIKE");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isArithmetic() {
            return this == ADD || this == SUBTRACT || this == MULTIPLY ||
                   this == DIVIDE || this == MODULO;
        }

        public boolean isComparison() {
            return this == EQUAL || this == NOT_EQUAL || this == LESS_THAN ||
                   this == LESS_THAN_OR_EQUAL || this == GREATER_THAN ||
                   this == GREATER_THAN_OR_EQUAL;
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }

        public boolean isPatternMatch() {
            return this == LIKE || this == NOT_LIKE;
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;

    /**
     * Creates a binary expression.
     *
     * @param left the left operand
     * @param operator the operator
     * @param right the right operand
     */
    public BinaryExpression(Expression left, Operator operator, Expression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public Expression left() {
        return left;
    }

    public Operator operator() {
        return operator;
    }

    public Expression right() {
        return right;
    }

    @Override
    public List<Expression> children() {
        return List.of(left, right);
    }

    @Override
    public String toString() {
        return String.format("%s %s %s", operand(left), operator.symbol(), operand(right));
    }

    // Nested binary operands are parenthesized so the rendering stays unambiguous.
    private static String operand(Expression expr) {
        if (expr instanceof BinaryExpression) {
            return "(" + expr + ")";
        }
        return expr.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BinaryExpression)) return false;
        BinaryExpression that = (BinaryExpression) obj;
        return Objects.equals(left, that.left) &&
               operator == that.operator &&
               Objects.equals(right, that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }
}
