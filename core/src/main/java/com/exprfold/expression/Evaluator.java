package com.exprfold.expression;

import java.util.Objects;

/**
 * Computes the numeric value of an expression tree.
 *
 * <p>Evaluation is a recursive walk over the closed set of node kinds. All
 * arithmetic is IEEE-754 double arithmetic: {@code 1/0} is infinity,
 * {@code 0/0} and {@code sqrt(-1)} are NaN.
 */
public final class Evaluator {

    /** Value of every variable, since no environment exists to bind them */
    public static final double UNBOUND_VARIABLE_VALUE = 0.0;

    private Evaluator() {}

    /**
     * Evaluates an expression.
     *
     * @param expression the expression
     * @return the value
     */
    public static double evaluate(Expression expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        if (expression instanceof Number number) {
            return number.value();
        }
        if (expression instanceof Variable) {
            return UNBOUND_VARIABLE_VALUE;
        }
        if (expression instanceof BinaryOperation binary) {
            double left = evaluate(binary.left());
            double right = evaluate(binary.right());
            return binary.operator().apply(left, right);
        }
        if (expression instanceof FunctionCall call) {
            return call.function().apply(evaluate(call.argument()));
        }
        throw new IllegalStateException("Unknown expression kind: " + expression.getClass().getName());
    }
}
