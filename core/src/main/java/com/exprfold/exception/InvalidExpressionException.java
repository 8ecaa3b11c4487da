package com.exprfold.exception;

/**
 * Exception thrown when an expression node cannot be constructed.
 *
 * <p>Common causes:
 * <ul>
 *   <li>A binary operation with a missing operand</li>
 *   <li>An operator symbol outside {@code + - * /}</li>
 *   <li>A function call to anything other than {@code sqrt} or {@code abs}</li>
 *   <li>A function call without an argument</li>
 *   <li>A variable with a blank name</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       new FunctionCall("log", argument);
 *   } catch (InvalidExpressionException e) {
 *       System.err.println(e.getNodeKind() + ": " + e.getMessage());
 *   }
 * </pre>
 */
public class InvalidExpressionException extends ExpressionException {

    private final String nodeKind;

    /**
     * Creates an invalid expression exception.
     *
     * @param nodeKind the kind of node being constructed (e.g. "FunctionCall")
     * @param message the error message
     */
    public InvalidExpressionException(String nodeKind, String message) {
        super(message + " (node kind: " + nodeKind + ")");
        this.nodeKind = nodeKind;
    }

    /**
     * Returns the kind of node whose construction was rejected.
     *
     * @return the node kind
     */
    public String getNodeKind() {
        return nodeKind;
    }
}
