package com.exprfold.transform;

import com.exprfold.config.TransformConfig;
import com.exprfold.exception.InvalidExpressionException;
import com.exprfold.expression.Expression;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a sequence of transformers to an expression tree.
 *
 * <p>Transformers are applied iteratively until an iteration no longer
 * changes the tree or the iteration limit is reached. This allows passes
 * to enable each other.
 *
 * <p>Example usage:
 * <pre>
 *   TransformPipeline pipeline = TransformPipeline.defaultPipeline();
 *   Expression folded = pipeline.run(tree);
 * </pre>
 *
 * <p>With transformers that build fresh trees, such as the shipped
 * {@link CopyTransformer} and {@link ConstantFoldingTransformer}, the result
 * shares no nodes with the input tree. An empty pipeline returns a deep copy.
 */
public class TransformPipeline {

    private static final Logger logger = LoggerFactory.getLogger(TransformPipeline.class);

    private final List<ExpressionTransformer> transformers;
    private final int maxIterations;

    /**
     * Creates a pipeline with the configured default iteration limit.
     *
     * @param transformers the transformers, applied in order
     * @see TransformConfig#configuredMaxIterations()
     */
    public TransformPipeline(List<ExpressionTransformer> transformers) {
        this(transformers, TransformConfig.configuredMaxIterations());
    }

    /**
     * Creates a pipeline.
     *
     * @param transformers the transformers, applied in order
     * @param maxIterations the maximum number of iterations, normalized by
     *                      {@link TransformConfig#normalizeMaxIterations(int)}
     */
    public TransformPipeline(List<ExpressionTransformer> transformers, int maxIterations) {
        Objects.requireNonNull(transformers, "transformers must not be null");
        for (ExpressionTransformer transformer : transformers) {
            Objects.requireNonNull(transformer, "transformers must not contain null");
        }
        this.transformers = new ArrayList<>(transformers);
        this.maxIterations = TransformConfig.normalizeMaxIterations(maxIterations);
    }

    public static TransformPipeline of(ExpressionTransformer... transformers) {
        return new TransformPipeline(Arrays.asList(transformers));
    }

    /**
     * Creates the default pipeline, which folds constants.
     *
     * @return the default pipeline
     */
    public static TransformPipeline defaultPipeline() {
        return of(new ConstantFoldingTransformer());
    }

    /**
     * Runs the pipeline.
     *
     * @param expression the input tree, left unchanged
     * @return the transformed tree
     * @throws InvalidExpressionException if the tree is null
     */
    public Expression run(Expression expression) {
        if (expression == null) {
            throw new InvalidExpressionException("Expression", "cannot transform a null tree");
        }
        if (transformers.isEmpty()) {
            return expression.transform(new CopyTransformer());
        }

        Expression current = expression;
        for (int iteration = 0; iteration < maxIterations; iteration++) {
            Expression previous = current;

            for (ExpressionTransformer transformer : transformers) {
                current = current.transform(transformer);
                logger.debug("Iteration {}: {} produced {}", iteration + 1, transformer.name(), current);
            }

            if (current.equals(previous)) {
                logger.debug("Pipeline reached a fixed point after {} iteration(s)", iteration + 1);
                break;
            }
        }
        return current;
    }

    /**
     * Returns the transformers of this pipeline.
     *
     * @return an unmodifiable list of transformers
     */
    public List<ExpressionTransformer> transformers() {
        return Collections.unmodifiableList(transformers);
    }

    /**
     * Returns the maximum number of iterations.
     *
     * @return the max iterations
     */
    public int maxIterations() {
        return maxIterations;
    }
}
