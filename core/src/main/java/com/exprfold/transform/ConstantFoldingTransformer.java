package com.exprfold.transform;

import com.exprfold.expression.BinaryOperation;
import com.exprfold.expression.Expression;
import com.exprfold.expression.FunctionCall;
import com.exprfold.expression.Number;
import com.exprfold.expression.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transformer that collapses constant sub-trees into single numbers.
 *
 * <p>Children are folded first (bottom-up). A node whose folded children are
 * all {@link Number}s is replaced by a {@link Number} holding its value;
 * anything else is rebuilt over its folded children. Variables are never
 * folded, so every sub-tree that contains one keeps its shape.
 *
 * <p>Examples of transformations:
 * <pre>
 *   2.000000+3.000000               -> 5.000000
 *   abs(var*sqrt(32.000000-16.000000)) -> abs(var*4.000000)
 *   var+1.000000                    -> var+1.000000
 * </pre>
 *
 * <p>The transformation is idempotent: folding an already folded tree yields
 * an equal tree.
 */
public class ConstantFoldingTransformer implements ExpressionTransformer {

    private static final Logger logger = LoggerFactory.getLogger(ConstantFoldingTransformer.class);

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
        Expression left = operation.left().transform(this);
        Expression right = operation.right().transform(this);

        if (left instanceof Number leftNumber && right instanceof Number rightNumber) {
            double value = operation.operator().apply(leftNumber.value(), rightNumber.value());
            Number folded = new Number(value);
            logger.debug("Folded {} into {}", operation, folded);
            return folded;
        }
        return new BinaryOperation(left, operation.operator(), right);
    }

    @Override
    public Expression transformFunctionCall(FunctionCall call) {
        Expression argument = call.argument().transform(this);

        if (argument instanceof Number number) {
            Number folded = new Number(call.function().apply(number.value()));
            logger.debug("Folded {} into {}", call, folded);
            return folded;
        }
        return new FunctionCall(call.function(), argument);
    }
}
