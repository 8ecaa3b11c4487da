package com.exprfold.expression;

import com.exprfold.exception.InvalidExpressionException;
import com.exprfold.transform.ExpressionTransformer;

/**
 * Expression representing a named variable.
 *
 * <p>There is no environment to bind variables against, so every variable
 * evaluates to {@link Evaluator#UNBOUND_VARIABLE_VALUE}. Constant folding
 * never removes a variable.
 */
public final class Variable implements Expression {

    private final String name;

    /**
     * Creates a variable reference.
     *
     * @param name the variable name
     * @throws InvalidExpressionException if the name is null or blank
     */
    public Variable(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidExpressionException("Variable", "name must not be null or blank");
        }
        this.name = name;
    }

    /**
     * Returns the variable name.
     *
     * @return the name
     */
    public String name() {
        return name;
    }

    @Override
    public Expression transform(ExpressionTransformer transformer) {
        TransformResults.requireTransformer(transformer);
        return TransformResults.require(transformer.transformVariable(this), transformer, this);
    }

    @Override
    public String toString() {
        return print();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Variable)) return false;
        Variable that = (Variable) obj;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
