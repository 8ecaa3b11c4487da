package com.exprfold.expression;

import com.exprfold.transform.ExpressionTransformer;

/**
 * Base interface for all nodes of an arithmetic expression tree.
 *
 * <p>The set of node kinds is closed:
 * <ul>
 *   <li>{@link Number} - a floating point constant</li>
 *   <li>{@link Variable} - a named, unbound value</li>
 *   <li>{@link BinaryOperation} - {@code left op right} for {@code + - * /}</li>
 *   <li>{@link FunctionCall} - {@code sqrt(arg)} or {@code abs(arg)}</li>
 * </ul>
 *
 * <p>Nodes are immutable and own their children; a tree is never modified
 * after construction. New trees are derived through
 * {@link #transform(ExpressionTransformer)}, which is the extension point for
 * passes such as copying and constant folding.
 */
public sealed interface Expression permits Number, Variable, BinaryOperation, FunctionCall {

    /**
     * Computes the numeric value of this expression.
     *
     * <p>Variables evaluate to {@link Evaluator#UNBOUND_VARIABLE_VALUE}.
     * Division by zero and square roots of negative numbers follow IEEE-754
     * semantics and are not errors.
     *
     * @return the value
     */
    default double evaluate() {
        return Evaluator.evaluate(this);
    }

    /**
     * Renders this expression in infix form without parentheses or spaces.
     *
     * @return the printed expression, e.g. {@code abs(var*4.000000)}
     */
    default String print() {
        return Printer.print(this);
    }

    /**
     * Derives a new tree by handing this node to the transformer method for
     * its own kind.
     *
     * @param transformer the transformation to apply
     * @return the tree produced by the transformer, never {@code null}
     * @throws com.exprfold.exception.TransformException if the transformer returns {@code null}
     */
    Expression transform(ExpressionTransformer transformer);
}
