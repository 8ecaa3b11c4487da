package com.exprfold.expression;

import com.exprfold.exception.TransformException;
import com.exprfold.transform.ExpressionTransformer;
import java.util.Objects;

/**
 * Checks applied to every value handed back by a transformer.
 */
final class TransformResults {

    private TransformResults() {}

    static ExpressionTransformer requireTransformer(ExpressionTransformer transformer) {
        return Objects.requireNonNull(transformer, "transformer must not be null");
    }

    static Expression require(Expression result, ExpressionTransformer transformer, Expression source) {
        if (result == null) {
            throw new TransformException(
                "Transformer returned null for " + source.getClass().getSimpleName() + " '" + source.print() + "'",
                transformer.name());
        }
        return result;
    }
}
