package com.exprfold.expression;

import com.exprfold.exception.InvalidExpressionException;
import com.exprfold.test.TestBase;
import com.exprfold.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static com.exprfold.expression.Expressions.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Test suite for the expression node classes.
 *
 * <p>Covers:
 * <ul>
 *   <li>Construction and its validation rules</li>
 *   <li>Evaluation, including IEEE-754 edge cases</li>
 *   <li>Printing</li>
 *   <li>Structural equality</li>
 * </ul>
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Expression
@DisplayName("Expression Tests")
public class ExpressionTest extends TestBase {

    /** abs(var*sqrt(32-16)) */
    static Expression sampleTree() {
        return abs(multiply(variable("var"), sqrt(subtract(number(32.0), number(16.0)))));
    }

    // ==================== Construction Tests ====================

    @Nested
    @DisplayName("Construction Tests")
    class ConstructionTests {

        @Test
        @DisplayName("FunctionCall rejects unsupported name 'log'")
        void testFunctionCallRejectsLog() {
            assertThatThrownBy(() -> new FunctionCall("log", number(1.0)))
                .isInstanceOf(InvalidExpressionException.class)
                .hasMessageContaining("log")
                .hasMessageContaining("sqrt, abs");
        }

        @ParameterizedTest
        @ValueSource(strings = {"SQRT", "Abs", "sin", "", " sqrt"})
        @DisplayName("FunctionCall name must match exactly")
        void testFunctionCallNameIsCaseSensitive(String name) {
            assertThatThrownBy(() -> new FunctionCall(name, number(1.0)))
                .isInstanceOf(InvalidExpressionException.class);
        }

        @Test
        @DisplayName("FunctionCall rejects null name and null argument")
        void testFunctionCallRejectsNulls() {
            assertThatThrownBy(() -> new FunctionCall((String) null, number(1.0)))
                .isInstanceOf(InvalidExpressionException.class);
            assertThatThrownBy(() -> new FunctionCall("sqrt", null))
                .isInstanceOf(InvalidExpressionException.class)
                .hasMessageContaining("argument");
            assertThatThrownBy(() -> new FunctionCall((MathFunction) null, number(1.0)))
                .isInstanceOf(InvalidExpressionException.class);
        }

        @Test
        @DisplayName("BinaryOperation rejects missing right operand")
        void testBinaryOperationRejectsMissingRight() {
            assertThatThrownBy(() -> new BinaryOperation(number(1.0), BinaryOperation.Operator.ADD, null))
                .isInstanceOf(InvalidExpressionException.class)
                .hasMessageContaining("right operand");
        }

        @Test
        @DisplayName("BinaryOperation rejects missing left operand and operator")
        void testBinaryOperationRejectsMissingLeftAndOperator() {
            assertThatThrownBy(() -> new BinaryOperation(null, '+', number(1.0)))
                .isInstanceOf(InvalidExpressionException.class)
                .hasMessageContaining("left operand");
            assertThatThrownBy(() -> new BinaryOperation(number(1.0), (BinaryOperation.Operator) null, number(2.0)))
                .isInstanceOf(InvalidExpressionException.class)
                .hasMessageContaining("operator");
        }

        @ParameterizedTest
        @ValueSource(chars = {'%', '^', 'x', ' '})
        @DisplayName("BinaryOperation rejects unknown operator symbols")
        void testUnknownOperatorSymbol(char symbol) {
            assertThatThrownBy(() -> new BinaryOperation(number(1.0), symbol, number(2.0)))
                .isInstanceOf(InvalidExpressionException.class)
                .hasMessageContaining("Unknown operator");
        }

        @ParameterizedTest
        @CsvSource({"+, ADD", "-, SUBTRACT", "*, MULTIPLY", "/, DIVIDE"})
        @DisplayName("Operator symbols map to operators")
        void testOperatorFromSymbol(char symbol, BinaryOperation.Operator expected) {
            BinaryOperation operation = new BinaryOperation(number(1.0), symbol, number(2.0));

            assertThat(operation.operator()).isEqualTo(expected);
            assertThat(operation.operator().symbol()).isEqualTo(symbol);
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   "})
        @DisplayName("Variable rejects blank names")
        void testVariableRejectsBlankName(String name) {
            assertThatThrownBy(() -> new Variable(name))
                .isInstanceOfSatisfying(InvalidExpressionException.class,
                    e -> assertThat(e.getNodeKind()).isEqualTo("Variable"));
        }

        @Test
        @DisplayName("Accessors return constructor arguments")
        void testAccessors() {
            Number left = number(1.5);
            Variable right = variable("x");
            BinaryOperation operation = divide(left, right);
            FunctionCall call = sqrt(operation);

            assertThat(left.value()).isEqualTo(1.5);
            assertThat(right.name()).isEqualTo("x");
            assertThat(operation.left()).isSameAs(left);
            assertThat(operation.right()).isSameAs(right);
            assertThat(operation.operator()).isEqualTo(BinaryOperation.Operator.DIVIDE);
            assertThat(call.name()).isEqualTo("sqrt");
            assertThat(call.function()).isEqualTo(MathFunction.SQRT);
            assertThat(call.argument()).isSameAs(operation);
        }
    }

    // ==================== Evaluation Tests ====================

    @Nested
    @DisplayName("Evaluation Tests")
    class EvaluationTests {

        @Test
        @DisplayName("Number evaluates to its value")
        void testNumberEvaluation() {
            assertThat(number(1.234).evaluate()).isEqualTo(1.234);
        }

        @Test
        @DisplayName("Variable evaluates to 0.0")
        void testVariableEvaluation() {
            assertThat(variable("x").evaluate()).isEqualTo(0.0);
            assertThat(Evaluator.UNBOUND_VARIABLE_VALUE).isEqualTo(0.0);
        }

        @ParameterizedTest
        @CsvSource({
            "+, 6.0, 3.0, 9.0",
            "-, 6.0, 3.0, 3.0",
            "*, 6.0, 3.0, 18.0",
            "/, 6.0, 3.0, 2.0",
            "/, 1.234, -1.234, -1.0"
        })
        @DisplayName("Binary operators combine operands")
        void testBinaryEvaluation(char symbol, double left, double right, double expected) {
            BinaryOperation operation = new BinaryOperation(number(left), symbol, number(right));

            assertThat(operation.evaluate()).isEqualTo(expected);
        }

        @Test
        @DisplayName("Division by zero follows IEEE-754")
        void testDivisionByZero() {
            assertThat(divide(number(1.0), number(0.0)).evaluate()).isEqualTo(Double.POSITIVE_INFINITY);
            assertThat(divide(number(-1.0), number(0.0)).evaluate()).isEqualTo(Double.NEGATIVE_INFINITY);
            assertThat(divide(number(0.0), number(0.0)).evaluate()).isNaN();
            assertThat(divide(number(1.0), variable("x")).evaluate()).isEqualTo(Double.POSITIVE_INFINITY);
        }

        @Test
        @DisplayName("Functions apply sqrt and abs")
        void testFunctionEvaluation() {
            assertThat(sqrt(number(16.0)).evaluate()).isEqualTo(4.0);
            assertThat(abs(number(-2.5)).evaluate()).isEqualTo(2.5);
            assertThat(sqrt(number(-4.0)).evaluate()).isNaN();
        }

        @Test
        @DisplayName("Nested tree evaluates recursively")
        void testNestedEvaluation() {
            Expression constant = abs(multiply(number(2.0), sqrt(subtract(number(32.0), number(16.0)))));

            assertThat(constant.evaluate()).isEqualTo(8.0);
            assertThat(sampleTree().evaluate()).isEqualTo(0.0);
        }

        @Test
        @DisplayName("Null expression is rejected by evaluator and printer")
        void testNullExpressionRejected() {
            assertThatThrownBy(() -> Evaluator.evaluate(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("expression must not be null");
            assertThatThrownBy(() -> Printer.print(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("expression must not be null");
        }
    }

    // ==================== Printing Tests ====================

    @Nested
    @DisplayName("Printing Tests")
    class PrintingTests {

        @ParameterizedTest
        @CsvSource({
            "32.0, 32.000000",
            "-1.234, -1.234000",
            "0.1234567, 0.123457",
            "1e10, 10000000000.000000",
            "0.0, 0.000000"
        })
        @DisplayName("Numbers print with six fractional digits")
        void testNumberPrinting(double value, String expected) {
            assertThat(number(value).print()).isEqualTo(expected);
        }

        @ParameterizedTest
        @CsvSource({
            "0.0078125, 0.007812",
            "0.0234375, 0.023438",
            "5e-7, 0.000000",
            "1e23, 99999999999999991611392.000000",
            "-0.0078125, -0.007812"
        })
        @DisplayName("Numbers round the exact binary value half-to-even")
        void testNumberRounding(double value, String expected) {
            assertThat(number(value).print()).isEqualTo(expected);
        }

        @Test
        @DisplayName("Negative zero and tiny negatives keep their sign")
        void testNegativeZeroPrinting() {
            assertThat(number(-0.0).print()).isEqualTo("-0.000000");
            assertThat(number(-1e-9).print()).isEqualTo("-0.000000");
            assertThat(Printer.formatNumber(0.0)).isEqualTo("0.000000");
        }

        @Test
        @DisplayName("Non-finite numbers print as nan and inf")
        void testNonFinitePrinting() {
            assertThat(number(Double.NaN).print()).isEqualTo("nan");
            assertThat(number(Double.POSITIVE_INFINITY).print()).isEqualTo("inf");
            assertThat(number(Double.NEGATIVE_INFINITY).print()).isEqualTo("-inf");
        }

        @Test
        @DisplayName("Sample tree prints without spaces or parentheses")
        void testSampleTreePrinting() {
            logStep("Given: abs(var*sqrt(32-16))");
            Expression tree = sampleTree();

            logStep("Then: printed form is exact concatenation");
            assertThat(tree.print()).isEqualTo("abs(var*sqrt(32.000000-16.000000))");
            assertThat(tree.toString()).isEqualTo(tree.print());
        }

        @Test
        @DisplayName("Printer ignores precedence")
        void testPrecedenceUnaware() {
            Expression grouped = multiply(add(number(1.0), number(2.0)), number(3.0));
            Expression ungrouped = add(number(1.0), multiply(number(2.0), number(3.0)));

            assertThat(grouped.print()).isEqualTo("1.000000+2.000000*3.000000");
            assertThat(ungrouped.print()).isEqualTo(grouped.print());
        }
    }

    // ==================== Equality Tests ====================

    @Nested
    @DisplayName("Equality Tests")
    class EqualityTests {

        @Test
        @DisplayName("Separately built trees with the same shape are equal")
        void testStructuralEquality() {
            assertThat(sampleTree()).isEqualTo(sampleTree());
            assertThat(sampleTree().hashCode()).isEqualTo(sampleTree().hashCode());
        }

        @Test
        @DisplayName("Trees differing in one leaf or operator are not equal")
        void testStructuralInequality() {
            assertThat(add(number(1.0), number(2.0))).isNotEqualTo(add(number(1.0), number(3.0)));
            assertThat(add(number(1.0), number(2.0))).isNotEqualTo(subtract(number(1.0), number(2.0)));
            assertThat(sqrt(variable("x"))).isNotEqualTo(abs(variable("x")));
            assertThat(variable("x")).isNotEqualTo(variable("y"));
            assertThat(number(0.0)).isNotEqualTo(variable("x"));
        }

        @Test
        @DisplayName("NaN numbers are equal to each other")
        void testNaNEquality() {
            assertThat(number(Double.NaN)).isEqualTo(number(Double.NaN));
        }
    }
}
