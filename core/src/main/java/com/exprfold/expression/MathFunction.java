package com.exprfold.expression;

import com.exprfold.exception.InvalidExpressionException;

/**
 * Functions that may appear in a {@link FunctionCall}.
 */
public enum MathFunction {
    SQRT("sqrt") {
        @Override
        public double apply(double argument) {
            return Math.sqrt(argument);
        }
    },
    ABS("abs") {
        @Override
        public double apply(double argument) {
            return Math.abs(argument);
        }
    };

    private final String functionName;

    MathFunction(String functionName) {
        this.functionName = functionName;
    }

    /**
     * Returns the name used when the call is printed.
     *
     * @return the lowercase function name
     */
    public String functionName() {
        return functionName;
    }

    /**
     * Applies the function. {@code sqrt} of a negative number is NaN.
     *
     * @param argument the evaluated argument
     * @return the result
     */
    public abstract double apply(double argument);

    /**
     * Looks up a function by its exact (case-sensitive) name.
     *
     * @param name {@code "sqrt"} or {@code "abs"}
     * @return the function
     * @throws InvalidExpressionException for any other name
     */
    public static MathFunction fromName(String name) {
        for (MathFunction function : values()) {
            if (function.functionName.equals(name)) {
                return function;
            }
        }
        throw new InvalidExpressionException("FunctionCall",
            "Unsupported function '" + name + "'. Supported functions: sqrt, abs");
    }
}
