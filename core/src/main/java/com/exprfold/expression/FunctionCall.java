package com.exprfold.expression;

import com.exprfold.exception.InvalidExpressionException;
import com.exprfold.transform.ExpressionTransformer;
import java.util.Objects;

/**
 * Expression representing a call to a single-argument math function.
 *
 * <p>Only {@code sqrt} and {@code abs} are supported; see {@link MathFunction}.
 *
 * <p>Examples:
 * <pre>
 *   sqrt(32.000000-16.000000)
 *   abs(var)
 * </pre>
 */
public final class FunctionCall implements Expression {

    private final MathFunction function;
    private final Expression argument;

    /**
     * Creates a function call by name.
     *
     * @param name the function name, exactly {@code "sqrt"} or {@code "abs"}
     * @param argument the argument
     * @throws InvalidExpressionException if the name is unsupported or the argument is null
     */
    public FunctionCall(String name, Expression argument) {
        this(MathFunction.fromName(name), argument);
    }

    /**
     * Creates a function call.
     *
     * @param function the function
     * @param argument the argument
     * @throws InvalidExpressionException if either argument is null
     */
    public FunctionCall(MathFunction function, Expression argument) {
        if (function == null) {
            throw new InvalidExpressionException("FunctionCall", "function must not be null");
        }
        if (argument == null) {
            throw new InvalidExpressionException("FunctionCall", "argument must not be null");
        }
        this.function = function;
        this.argument = argument;
    }

    /**
     * Returns the function name.
     *
     * @return the function name
     */
    public String name() {
        return function.functionName();
    }

    public MathFunction function() {
        return function;
    }

    /**
     * Returns the function argument.
     *
     * @return the argument expression
     */
    public Expression argument() {
        return argument;
    }

    @Override
    public Expression transform(ExpressionTransformer transformer) {
        TransformResults.requireTransformer(transformer);
        return TransformResults.require(transformer.transformFunctionCall(this), transformer, this);
    }

    @Override
    public String toString() {
        return print();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) obj;
        return function == that.function &&
               argument.equals(that.argument);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, argument);
    }
}
