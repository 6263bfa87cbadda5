package norswap.symex.transform;

import norswap.symex.ast.*;

/**
 * Path-addressed edits: replaces a subtree by a function applied to it.
 *
 * <p>The edit rebuilds the spine from the root to the addressed node and copies everything
 * else, so the result shares no node with the input.
 */
public final class Wrapping
{
    private Wrapping () {}

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns the node addressed by {@code path}.
     *
     * @throws CompositionException if the expression is empty
     * ({@link CompositionException.Kind#EMPTY_OPERAND}) or the path leaves the tree
     * ({@link CompositionException.Kind#INVALID_PATH})
     */
    public static ExpressionNode subtree (Expression expression, NodePath path)
    {
        if (expression.isEmpty())
            throw CompositionException.emptyOperand();
        ExpressionNode node = path.resolve(expression.root);
        if (node == null)
            throw CompositionException.invalidPath(path);
        return node;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns a copy of {@code expression} where the node addressed by {@code path} is replaced
     * by {@code function} applied to it.
     *
     * @throws CompositionException as {@link #subtree}
     */
    public static Expression wrapInFunction
            (Expression expression, NodePath path, UnaryFunction function)
    {
        subtree(expression, path);
        return Expression.of(wrap(expression.root, path, function));
    }

    // ---------------------------------------------------------------------------------------------

    private static ExpressionNode wrap (ExpressionNode node, NodePath path, UnaryFunction function)
    {
        if (path.isRoot())
            return new FunctionNode(function, node.copy());

        NodePath rest = path.tail();

        if (node instanceof FunctionNode) {
            FunctionNode call = (FunctionNode) node;
            return new FunctionNode(call.function, wrap(call.operand, rest, function));
        }

        BinaryExpressionNode binary = (BinaryExpressionNode) node;
        return path.head() == NodePath.Step.LEFT
            ? new BinaryExpressionNode(wrap(binary.left, rest, function), binary.operator, binary.right.copy())
            : new BinaryExpressionNode(binary.left.copy(), binary.operator, wrap(binary.right, rest, function));
    }
}
