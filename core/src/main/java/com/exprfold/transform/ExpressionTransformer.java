package com.exprfold.transform;

import com.exprfold.expression.BinaryOperation;
import com.exprfold.expression.Expression;
import com.exprfold.expression.FunctionCall;
import com.exprfold.expression.Number;
import com.exprfold.expression.Variable;

/**
 * Interface for tree-to-tree transformations of expressions.
 *
 * <p>A transformer has one method per node kind. {@link Expression#transform}
 * calls the method matching the node's own kind, so new passes are added by
 * implementing this interface without touching the node classes.
 *
 * <p>Implementations must return a freshly built tree and must not hand back
 * any node of the input, including unchanged leaves. The input tree is never
 * modified.
 *
 * <p>Shipped transformations:
 * <ul>
 *   <li>{@link CopyTransformer} - deep structural copy</li>
 *   <li>{@link ConstantFoldingTransformer} - collapses constant sub-trees</li>
 * </ul>
 */
public interface ExpressionTransformer {

    /**
     * Transforms a numeric constant.
     *
     * @param number the node
     * @return a new tree
     */
    Expression transformNumber(Number number);

    /**
     * Transforms a variable.
     *
     * @param variable the node
     * @return a new tree
     */
    Expression transformVariable(Variable variable);

    /**
     * Transforms a binary operation. Implementations typically transform the
     * operands first by calling {@code left().transform(this)}.
     *
     * @param operation the node
     * @return a new tree
     */
    Expression transformBinaryOperation(BinaryOperation operation);

    /**
     * Transforms a function call.
     *
     * @param call the node
     * @return a new tree
     */
    Expression transformFunctionCall(FunctionCall call);

    /**
     * Returns the name of this transformer.
     *
     * <p>Used for logging and error messages.
     *
     * @return the transformer name
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
