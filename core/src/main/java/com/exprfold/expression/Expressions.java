package com.exprfold.expression;

/**
 * Factory methods for building expression trees.
 *
 * <p>Example:
 * <pre>
 *   // abs(var*sqrt(32-16))
 *   Expression e = abs(multiply(variable("var"), sqrt(subtract(number(32), number(16)))));
 * </pre>
 */
public final class Expressions {

    private Expressions() {}

    public static Number number(double value) {
        return new Number(value);
    }

    public static Variable variable(String name) {
        return new Variable(name);
    }

    public static BinaryOperation add(Expression left, Expression right) {
        return new BinaryOperation(left, BinaryOperation.Operator.ADD, right);
    }

    public static BinaryOperation subtract(Expression left, Expression right) {
        return new BinaryOperation(left, BinaryOperation.Operator.SUBTRACT, right);
    }

    public static BinaryOperation multiply(Expression left, Expression right) {
        return new BinaryOperation(left, BinaryOperation.Operator.MULTIPLY, right);
    }

    public static BinaryOperation divide(Expression left, Expression right) {
        return new BinaryOperation(left, BinaryOperation.Operator.DIVIDE, right);
    }

    public static FunctionCall sqrt(Expression argument) {
        return new FunctionCall(MathFunction.SQRT, argument);
    }

    public static FunctionCall abs(Expression argument) {
        return new FunctionCall(MathFunction.ABS, argument);
    }
}
