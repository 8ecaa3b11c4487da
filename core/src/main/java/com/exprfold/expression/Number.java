package com.exprfold.expression;

import com.exprfold.transform.ExpressionTransformer;

/**
 * Expression representing a floating point constant.
 *
 * <p>Examples:
 * <pre>
 *   32.000000
 *   -1.234000
 * </pre>
 */
public final class Number implements Expression {

    private final double value;

    /**
     * Creates a numeric constant.
     *
     * @param value the value
     */
    public Number(double value) {
        this.value = value;
    }

    /**
     * Returns the constant value.
     *
     * @return the value
     */
    public double value() {
        return value;
    }

    @Override
    public Expression transform(ExpressionTransformer transformer) {
        TransformResults.requireTransformer(transformer);
        return TransformResults.require(transformer.transformNumber(this), transformer, this);
    }

    @Override
    public String toString() {
        return print();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Number)) return false;
        Number that = (Number) obj;
        return Double.compare(value, that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }
}
