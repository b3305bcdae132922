package com.quarry.expression;

import com.quarry.exception.InvalidArgumentException;
import com.quarry.test.TestBase;
import com.quarry.test.TestCategories;
import com.quarry.types.DateType;
import com.quarry.types.DecimalType;
import com.quarry.types.DoubleType;
import com.quarry.types.FloatType;
import com.quarry.types.IntegerType;
import com.quarry.types.LongType;
import com.quarry.types.StringType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static com.quarry.expression.Expressions.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Test suite for the expression classes and their fluent operators.
 *
 * <p>Covers:
 * <ul>
 *   <li>Literal typing and textual form</li>
 *   <li>Operator composition and rendering</li>
 *   <li>Immutability and structural equality</li>
 *   <li>Aggregate classification helpers</li>
 * </ul>
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Expression
@DisplayName("Expression Tests")
public class ExpressionTest extends TestBase {

    // ==================== Literal Expression Tests ====================

    @Nested
    @DisplayName("Literal Expression Tests")
    class LiteralExpressionTests {

        @Test
        @DisplayName("Integer literal is int32")
        void testIntegerLiteral() {
            Literal literal = Literal.of(42);

            assertThat(literal.value()).isEqualTo(42);
            assertThat(literal.dataType()).isInstanceOf(IntegerType.class);
            assertThat(literal.isNullValue()).isFalse();
            assertThat(literal.toString()).isEqualTo("42");
        }

        @Test
        @DisplayName("Long, float and double literals carry their widths")
        void testNumericLiterals() {
            assertThat(Literal.of(9999999999L).dataType()).isEqualTo(LongType.get());
            assertThat(Literal.of(3.14f).dataType()).isEqualTo(FloatType.get());
            assertThat(Literal.of(2.718281828).dataType()).isEqualTo(DoubleType.get());
        }

        @Test
        @DisplayName("String literal is quoted with embedded quotes doubled")
        void testStringLiteral() {
            assertThat(lit("hello").toString()).isEqualTo("'hello'");
            assertThat(lit("it's").toString()).isEqualTo("'it''s'");
            assertThat(lit("hello").dataType()).isEqualTo(StringType.get());
        }

        @ParameterizedTest(name = "{0} -> decimal128({1}, {2})")
        @CsvSource({
            "1.50, 3, 2",
            "0.05, 2, 2",
            "12345, 5, 0",
            "1E+3, 4, 0"
        })
        @DisplayName("Decimal literal precision and scale follow the value")
        void testDecimalLiteral(String value, int precision, int scale) {
            Literal literal = lit(new BigDecimal(value));

            assertThat(literal.dataType()).isEqualTo(new DecimalType(precision, scale));
        }

        @Test
        @DisplayName("Decimal literal wider than 38 digits is rejected")
        void testDecimalLiteralTooWide() {
            BigDecimal wide = new BigDecimal("1" + "0".repeat(38));

            assertThatThrownBy(() -> lit(wide))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("39 digits");
            assertThatThrownBy(() -> lit(new BigDecimal("0." + "0".repeat(38) + "1")))
                .isInstanceOf(InvalidArgumentException.class);
        }

        @Test
        @DisplayName("Date literal is rendered with its keyword")
        void testDateLiteral() {
            Literal literal = lit(LocalDate.of(2024, 3, 15));

            assertThat(literal.dataType()).isEqualTo(DateType.get());
            assertThat(literal.toString()).isEqualTo("DATE '2024-03-15'");
        }

        @Test
        @DisplayName("Typed NULL literal")
        void testNullLiteral() {
            Literal literal = nullLiteral(IntegerType.get());

            assertThat(literal.isNullValue()).isTrue();
            assertThat(literal.toString()).isEqualTo("NULL");
            assertThat(literal).isEqualTo(Literal.nullValue(IntegerType.get()));
            assertThat(literal).isNotEqualTo(Literal.nullValue(LongType.get()));
        }
    }

    // ==================== Operator Tests ====================

    @Nested
    @DisplayName("Operator Tests")
    class OperatorTests {

        @Test
        @DisplayName("Comparison operators render with their symbols")
        void testComparisons() {
            assertThat(col("a").eq(col("b")).toString()).isEqualTo("a = b");
            assertThat(col("a").notEq(col("b")).toString()).isEqualTo("a != b");
            assertThat(col("a").lt(col("b")).toString()).isEqualTo("a < b");
            assertThat(col("a").ltEq(col("b")).toString()).isEqualTo("a <= b");
            assertThat(col("a").gt(col("b")).toString()).isEqualTo("a > b");
            assertThat(col("a").gtEq(col("b")).toString()).isEqualTo("a >= b");
        }

        @Test
        @DisplayName("Arithmetic operators")
        void testArithmetic() {
            assertThat(col("a").plus(lit(1)).toString()).isEqualTo("a + 1");
            assertThat(col("a").minus(lit(1)).toString()).isEqualTo("a - 1");
            assertThat(col("a").multiply(lit(2)).toString()).isEqualTo("a * 2");
            assertThat(col("a").divide(lit(2)).toString()).isEqualTo("a / 2");
            assertThat(col("a").modulus(lit(3)).toString()).isEqualTo("a % 3");
        }

        @Test
        @DisplayName("Nested binary operands are parenthesized")
        void testNested() {
            Expression expr = col("a").gt(lit(1)).and(col("b").lt(lit(10)));

            assertThat(expr.toString()).isEqualTo("(a > 1) AND (b < 10)");
        }

        @Test
        @DisplayName("Unary operators")
        void testUnary() {
            assertThat(col("flag").not().toString()).isEqualTo("NOT flag");
            assertThat(col("a").negate().toString()).isEqualTo("-a");
            assertThat(col("a").isNull().toString()).isEqualTo("a IS NULL");
            assertThat(col("a").isNotNull().toString()).isEqualTo("a IS NOT NULL");
            assertThat(col("a").plus(col("b")).negate().toString()).isEqualTo("-(a + b)");
        }

        @Test
        @DisplayName("isNull on a literal builds an IS NULL check")
        void testLiteralIsNull() {
            UnaryExpression check = lit(5).isNull();

            assertThat(check.operator()).isEqualTo(UnaryExpression.Operator.IS_NULL);
            assertThat(check.operand()).isEqualTo(lit(5));
            assertThat(check.toString()).isEqualTo("5 IS NULL");
            assertThat(lit(5).isNullValue()).isFalse();
        }

        @Test
        @DisplayName("Pattern, alias, cast and sort wrappers")
        void testWrappers() {
            assertThat(col("name").like(lit("a%")).toString()).isEqualTo("name LIKE 'a%'");
            assertThat(col("name").notLike(lit("a%")).toString()).isEqualTo("name NOT LIKE 'a%'");
            assertThat(min(col("b")).alias("lo").toString()).isEqualTo("MIN(b) AS lo");
            assertThat(col("a").cast(LongType.get()).toString()).isEqualTo("CAST(a AS int64)");
            assertThat(col("a").sort(true, true).toString()).isEqualTo("a ASC NULLS FIRST");
            assertThat(col("b").sort(false, false).toString()).isEqualTo("b DESC NULLS LAST");
        }

        @Test
        @DisplayName("Operator classification")
        void testOperatorKinds() {
            assertThat(BinaryExpression.Operator.ADD.isArithmetic()).isTrue();
            assertThat(BinaryExpression.Operator.LESS_THAN_OR_EQUAL.isComparison()).isTrue();
            assertThat(BinaryExpression.Operator.OR.isLogical()).isTrue();
            assertThat(BinaryExpression.Operator.NOT_LIKE.isPatternMatch()).isTrue();
            assertThat(BinaryExpression.Operator.AND.isArithmetic()).isFalse();
        }
    }

    // ==================== Immutability & Equality ====================

    @Nested
    @DisplayName("Immutability and Equality")
    class ImmutabilityTests {

        @Test
        @DisplayName("Composing operators leaves the operands untouched")
        void testComposeDoesNotMutate() {
            ColumnReference a = col("a");
            ColumnReference b = col("b");

            BinaryExpression cmp = a.ltEq(b);
            a.plus(lit(1));

            assertThat(a).isEqualTo(col("a"));
            assertThat(b).isEqualTo(col("b"));
            assertThat(cmp.left()).isSameAs(a);
            assertThat(cmp.right()).isSameAs(b);
            assertThat(cmp.operator()).isEqualTo(BinaryExpression.Operator.LESS_THAN_OR_EQUAL);
        }

        @Test
        @DisplayName("Structurally equal trees are equal with equal hash codes")
        void testStructuralEquality() {
            Expression first = col("a").plus(lit(1)).gt(col("b"));
            Expression second = col("a").plus(lit(1)).gt(col("b"));

            assertThat(first).isEqualTo(second);
            assertThat(first.hashCode()).isEqualTo(second.hashCode());
            assertThat(first).isNotEqualTo(col("a").plus(lit(2)).gt(col("b")));
            assertThat(col("a").sort(true, true)).isNotEqualTo(col("a").sort(true, false));
        }

        @Test
        @DisplayName("Children expose the direct operands")
        void testChildren() {
            assertThat(col("a").children()).isEmpty();
            assertThat(col("a").plus(col("b")).children()).containsExactly(col("a"), col("b"));
            assertThat(count(col("c")).children()).containsExactly(col("c"));
        }

        @Test
        @DisplayName("Null operands are rejected")
        void testNullRejected() {
            assertThatThrownBy(() -> col("a").eq(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("right must not be null");
            assertThatThrownBy(() -> new ColumnReference(null))
                .isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> new AggregateFunction(null, col("a")))
                .isInstanceOf(NullPointerException.class);
        }
    }

    // ==================== Aggregate Helpers ====================

    @Nested
    @DisplayName("Aggregate Classification")
    class AggregateClassification {

        @Test
        @DisplayName("Factories build the matching aggregate kinds")
        void testFactories() {
            List<AggregateFunction> aggs = List.of(
                min(col("x")), max(col("x")), sum(col("x")), avg(col("x")), count(col("x")));

            assertThat(aggs).extracting(AggregateFunction::kind).containsExactly(
                AggregateFunction.Kind.MIN, AggregateFunction.Kind.MAX, AggregateFunction.Kind.SUM,
                AggregateFunction.Kind.AVG, AggregateFunction.Kind.COUNT);
            assertThat(aggs).extracting(Object::toString).containsExactly(
                "MIN(x)", "MAX(x)", "SUM(x)", "AVG(x)", "COUNT(x)");
        }

        @Test
        @DisplayName("Aliases are looked through, nesting is not an aggregate call")
        void testIsAggregate() {
            assertThat(ExpressionUtils.isAggregate(sum(col("x")).alias("total"))).isTrue();
            assertThat(ExpressionUtils.isAggregate(sum(max(col("x"))))).isFalse();
            assertThat(ExpressionUtils.isAggregate(col("x"))).isFalse();
        }

        @Test
        @DisplayName("Sort expressions are found anywhere in a tree")
        void testContainsSort() {
            assertThat(ExpressionUtils.containsSortExpression(col("a").sort(true, true).alias("s"))).isTrue();
            assertThat(ExpressionUtils.containsSortExpression(col("a").plus(lit(1)))).isFalse();
        }

        @Test
        @DisplayName("unwrapAlias strips stacked aliases")
        void testUnwrapAlias() {
            Expression inner = min(col("b"));

            assertThat(ExpressionUtils.unwrapAlias(inner.alias("x").alias("y"))).isSameAs(inner);
        }
    }
}
