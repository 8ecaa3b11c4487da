package com.exprfold.transform;

import com.exprfold.expression.BinaryOperation;
import com.exprfold.expression.Expression;
import com.exprfold.expression.FunctionCall;
import com.exprfold.expression.Number;
import com.exprfold.expression.Variable;

/**
 * Transformer producing a deep structural copy of a tree.
 *
 * <p>The copy {@code equals} the source and prints identically, but shares no
 * node with it.
 */
public class CopyTransformer implements ExpressionTransformer {

    @Override
    public Expression transformNumber(Number number) {
        return new Number(number.value());
    }

    @Override
    public Expression transformVariable(Variable variable) {
        return new Variable(variable.name());
    }

    @Override
    public Expression transformBinaryOperation(BinaryOperation operation) {
        return new BinaryOperation(
            operation.left().transform(this),
            operation.operator(),
            operation.right().transform(this));
    }

    @Override
    public Expression transformFunctionCall(FunctionCall call) {
        return new FunctionCall(call.function(), call.argument().transform(this));
    }
}
