package com.exprfold.exception;

/**
 * Exception thrown when a transformer breaks the transformation protocol,
 * for example by returning {@code null} instead of a new tree.
 */
public class TransformException extends ExpressionException {

    private final String transformerName;

    public TransformException(String message, String transformerName) {
        super(message + " (transformer: " + transformerName + ")");
        this.transformerName = transformerName;
    }

    public String getTransformerName() {
        return transformerName;
    }
}
