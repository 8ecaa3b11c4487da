package com.exprfold.expression;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Renders expression trees as infix text.
 *
 * <p>The printer is precedence-unaware: operands are concatenated with the
 * operator symbol, with no parentheses and no spaces. {@code (1+2)*3} and
 * {@code 1+(2*3)} both print as {@code 1.000000+2.000000*3.000000}.
 */
public final class Printer {

    private Printer() {}

    /**
     * Prints an expression.
     *
     * @param expression the expression
     * @return the infix text
     */
    public static String print(Expression expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        StringBuilder sb = new StringBuilder();
        append(sb, expression);
        return sb.toString();
    }

    private static void append(StringBuilder sb, Expression expression) {
        if (expression instanceof Number number) {
            sb.append(formatNumber(number.value()));
        } else if (expression instanceof Variable variable) {
            sb.append(variable.name());
        } else if (expression instanceof BinaryOperation binary) {
            append(sb, binary.left());
            sb.append(binary.operator().symbol());
            append(sb, binary.right());
        } else if (expression instanceof FunctionCall call) {
            sb.append(call.name()).append('(');
            append(sb, call.argument());
            sb.append(')');
        } else {
            throw new IllegalStateException("Unknown expression kind: " + expression.getClass().getName());
        }
    }

    /**
     * Formats a number in fixed-point notation with six fractional digits.
     *
     * <p>The exact binary value is rounded half-to-even, as C's {@code %f}
     * does: {@code 0.0078125} prints {@code 0.007812} and {@code 1e23} prints
     * {@code 99999999999999991611392.000000}. Negative values that round to
     * zero keep their sign. Non-finite values print as {@code nan},
     * {@code inf} and {@code -inf}.
     *
     * @param value the value
     * @return the formatted value, e.g. {@code 32.000000}
     */
    public static String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        BigDecimal rounded = new BigDecimal(value).setScale(6, RoundingMode.HALF_EVEN);
        String text = rounded.toPlainString();
        if (rounded.signum() == 0 && Math.copySign(1.0, value) < 0) {
            return "-" + text;
        }
        return text;
    }
}
