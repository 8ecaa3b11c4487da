package com.exprfold.expression;

import com.exprfold.exception.InvalidExpressionException;
import com.exprfold.transform.ExpressionTransformer;
import java.util.Objects;

/**
 * Expression representing an arithmetic operation with two operands.
 *
 * <p>Examples:
 * <pre>
 *   32.000000-16.000000
 *   var*sqrt(16.000000)
 * </pre>
 *
 * <p>The operator is validated when the node is built, so evaluation never
 * sees an unknown operator.
 */
public final class BinaryOperation implements Expression {

    /**
     * Arithmetic operators.
     */
    public enum Operator {
        ADD('+', "addition"),
        SUBTRACT('-', "subtraction"),
        MULTIPLY('*', "multiplication"),
        DIVIDE('/', "division");

        private final char symbol;
        private final String description;

        Operator(char symbol, String description) {
            this.symbol = symbol;
            this.description = description;
        }

        public char symbol() {
            return symbol;
        }

        public String description() {
            return description;
        }

        /**
         * Applies this operator with IEEE-754 double semantics.
         *
         * @param left the left operand
         * @param right the right operand
         * @return the result; division by zero yields an infinity or NaN
         */
        public double apply(double left, double right) {
            return switch (this) {
                case ADD -> left + right;
                case SUBTRACT -> left - right;
                case MULTIPLY -> left * right;
                case DIVIDE -> left / right;
            };
        }

        /**
         * Looks up the operator for a symbol.
         *
         * @param symbol one of {@code + - * /}
         * @return the operator
         * @throws InvalidExpressionException if the symbol is not an operator
         */
        public static Operator fromSymbol(char symbol) {
            for (Operator operator : values()) {
                if (operator.symbol == symbol) {
                    return operator;
                }
            }
            throw new InvalidExpressionException("BinaryOperation",
                "Unknown operator '" + symbol + "'. Valid operators: + - * /");
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;

    /**
     * Creates a binary operation.
     *
     * @param left the left operand
     * @param operator the operator
     * @param right the right operand
     * @throws InvalidExpressionException if any argument is null
     */
    public BinaryOperation(Expression left, Operator operator, Expression right) {
        this.left = requireOperand(left, "left");
        if (operator == null) {
            throw new InvalidExpressionException("BinaryOperation", "operator must not be null");
        }
        this.operator = operator;
        this.right = requireOperand(right, "right");
    }

    /**
     * Creates a binary operation from an operator symbol.
     *
     * @param left the left operand
     * @param symbol one of {@code + - * /}
     * @param right the right operand
     * @throws InvalidExpressionException if an operand is null or the symbol is unknown
     */
    public BinaryOperation(Expression left, char symbol, Expression right) {
        this(left, Operator.fromSymbol(symbol), right);
    }

    private static Expression requireOperand(Expression operand, String side) {
        if (operand == null) {
            throw new InvalidExpressionException("BinaryOperation", side + " operand must not be null");
        }
        return operand;
    }

    /**
     * Returns the left operand.
     *
     * @return the left expression
     */
    public Expression left() {
        return left;
    }

    /**
     * Returns the operator.
     *
     * @return the operator
     */
    public Operator operator() {
        return operator;
    }

    /**
     * Returns the right operand.
     *
     * @return the right expression
     */
    public Expression right() {
        return right;
    }

    @Override
    public Expression transform(ExpressionTransformer transformer) {
        TransformResults.requireTransformer(transformer);
        return TransformResults.require(transformer.transformBinaryOperation(this), transformer, this);
    }

    @Override
    public String toString() {
        return print();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BinaryOperation)) return false;
        BinaryOperation that = (BinaryOperation) obj;
        return left.equals(that.left) &&
               operator == that.operator &&
               right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }
}
