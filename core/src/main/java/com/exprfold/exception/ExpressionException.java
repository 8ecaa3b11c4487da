package com.exprfold.exception;

/**
 * Base class for all failures raised by the expression library.
 *
 * <p>Every failure is unchecked and thrown synchronously to the caller that
 * built or transformed the tree; nothing is logged in its place.
 */
public class ExpressionException extends RuntimeException {

    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
