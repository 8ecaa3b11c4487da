package com.exprfold.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Utility methods for inspecting expression trees.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /**
     * Returns the direct children of a node, left to right.
     *
     * @param expr the node
     * @return an unmodifiable list, empty for leaves
     */
    public static List<Expression> children(Expression expr) {
        if (expr instanceof BinaryOperation bin) {
            return List.of(bin.left(), bin.right());
        }
        if (expr instanceof FunctionCall call) {
            return List.of(call.argument());
        }
        return Collections.emptyList();
    }

    /**
     * Returns every node of the tree in pre-order.
     *
     * @param expr the root
     * @return the nodes, root first
     */
    public static List<Expression> nodes(Expression expr) {
        List<Expression> result = new ArrayList<>();
        collectNodes(expr, result);
        return result;
    }

    private static void collectNodes(Expression expr, List<Expression> result) {
        result.add(expr);
        for (Expression child : children(expr)) {
            collectNodes(child, result);
        }
    }

    /**
     * Returns true if any node of the tree is a {@link Variable}.
     *
     * @param expr the expression to check
     * @return true if the expression references a variable
     */
    public static boolean containsVariable(Expression expr) {
        if (expr instanceof Variable) {
            return true;
        }
        for (Expression child : children(expr)) {
            if (containsVariable(child)) return true;
        }
        return false;
    }

    /**
     * Returns true if the tree has no variables, i.e. constant folding
     * reduces it to a single {@link Number}.
     *
     * @param expr the expression to check
     * @return true if the expression is constant
     */
    public static boolean isConstant(Expression expr) {
        return !containsVariable(expr);
    }

    public static int nodeCount(Expression expr) {
        int count = 1;
        for (Expression child : children(expr)) {
            count += nodeCount(child);
        }
        return count;
    }

    /**
     * Returns the height of the tree; a single leaf has depth 1.
     *
     * @param expr the root
     * @return the depth
     */
    public static int depth(Expression expr) {
        int deepest = 0;
        for (Expression child : children(expr)) {
            deepest = Math.max(deepest, depth(child));
        }
        return deepest + 1;
    }

    /**
     * Returns the distinct variable names in order of first appearance,
     * reading left to right.
     *
     * @param expr the expression
     * @return the variable names
     */
    public static Set<String> variableNames(Expression expr) {
        Set<String> names = new LinkedHashSet<>();
        for (Expression node : nodes(expr)) {
            if (node instanceof Variable variable) {
                names.add(variable.name());
            }
        }
        return Collections.unmodifiableSet(names);
    }
}
